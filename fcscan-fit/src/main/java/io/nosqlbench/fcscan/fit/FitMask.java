package io.nosqlbench.fcscan.fit;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.fcscan.model.Parameter;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;

/**
 * Selects which parameters a fit holds fixed at their initial-guess values.
 *
 * <p>The global fit and the profile fit are the same minimization with different masks:
 * {@link #global()} frees all six parameters, {@link #pointOfInterest()} pins m and Δ.
 */
public final class FitMask {

    private static final FitMask GLOBAL = new FitMask(EnumSet.noneOf(Parameter.class));
    private static final FitMask POINT_OF_INTEREST = new FitMask(EnumSet.of(Parameter.MASS, Parameter.DELTA));

    private final EnumSet<Parameter> fixed;
    private final Parameter[] free;

    private FitMask(EnumSet<Parameter> fixed) {
        this.fixed = fixed;
        this.free = EnumSet.complementOf(fixed).toArray(new Parameter[0]);
    }

    /** @return a mask with every parameter free */
    public static FitMask global() {
        return GLOBAL;
    }

    /** @return a mask pinning m and Δ, leaving the four nuisance parameters free */
    public static FitMask pointOfInterest() {
        return POINT_OF_INTEREST;
    }

    /**
     * @param parameters the parameters to hold fixed
     * @return a mask fixing exactly those parameters
     */
    public static FitMask fixing(Parameter... parameters) {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        EnumSet<Parameter> fixed = EnumSet.noneOf(Parameter.class);
        fixed.addAll(Arrays.asList(parameters));
        return new FitMask(fixed);
    }

    public boolean isFixed(Parameter parameter) {
        return fixed.contains(parameter);
    }

    /** @return the free parameters in {@link Parameter} order */
    public Parameter[] freeParameters() {
        return free.clone();
    }

    public int freeCount() {
        return free.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FitMask && ((FitMask) o).fixed.equals(fixed);
    }

    @Override
    public int hashCode() {
        return fixed.hashCode();
    }

    @Override
    public String toString() {
        return "FitMask{fixed=" + fixed + "}";
    }
}
