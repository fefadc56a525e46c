package io.nosqlbench.fcscan.model;

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

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable point in the six-dimensional parameter space {A, B, C, D, m, Δ}.
 *
 * <p>Vectors are never modified in place; the {@code with*} methods return new instances.
 */
public final class ParameterVector {

    private final double[] values;

    private ParameterVector(double[] values) {
        this.values = values;
    }

    /**
     * Creates a parameter vector from explicit values.
     */
    public static ParameterVector of(double a, double b, double c, double d, double mass, double delta) {
        return new ParameterVector(new double[]{a, b, c, d, mass, delta});
    }

    /**
     * Creates a parameter vector from an array ordered like {@link Parameter#values()}.
     *
     * @param values six parameter values, copied
     * @return the vector
     * @throws IllegalArgumentException if the array does not hold exactly six values
     */
    public static ParameterVector fromArray(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length != Parameter.COUNT) {
            throw new IllegalArgumentException(
                "Expected " + Parameter.COUNT + " parameter values, got " + values.length);
        }
        return new ParameterVector(values.clone());
    }

    public double get(Parameter parameter) {
        return values[parameter.ordinal()];
    }

    public double a() {
        return values[Parameter.A.ordinal()];
    }

    public double b() {
        return values[Parameter.B.ordinal()];
    }

    public double c() {
        return values[Parameter.C.ordinal()];
    }

    public double d() {
        return values[Parameter.D.ordinal()];
    }

    public double mass() {
        return values[Parameter.MASS.ordinal()];
    }

    public double delta() {
        return values[Parameter.DELTA.ordinal()];
    }

    /**
     * Returns a copy of this vector with one parameter replaced.
     */
    public ParameterVector with(Parameter parameter, double value) {
        double[] copy = values.clone();
        copy[parameter.ordinal()] = value;
        return new ParameterVector(copy);
    }

    /**
     * Returns a copy of this vector with m and Δ replaced, nuisance values kept.
     */
    public ParameterVector withPointOfInterest(double mass, double delta) {
        double[] copy = values.clone();
        copy[Parameter.MASS.ordinal()] = mass;
        copy[Parameter.DELTA.ordinal()] = delta;
        return new ParameterVector(copy);
    }

    /** @return true when every value is finite */
    public boolean isFinite() {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    /** @return a copy of the values, ordered like {@link Parameter#values()} */
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterVector)) return false;
        return Arrays.equals(values, ((ParameterVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Parameter parameter : Parameter.values()) {
            if (parameter.ordinal() > 0) {
                sb.append(", ");
            }
            sb.append(parameter.label()).append('=').append(String.format(Locale.ROOT, "%.6g", get(parameter)));
        }
        return sb.append('}').toString();
    }
}
