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

/**
 * The six parameters of the background-plus-peak spectrum model.
 *
 * <p>{@link #A}, {@link #B}, {@link #C} and {@link #D} are nuisance parameters;
 * {@link #MASS} (m) and {@link #DELTA} (Δ) are the parameters of interest over
 * which confidence regions are computed. The ordinal of each constant is its
 * position in a {@link ParameterVector}.
 *
 * <p>The default bounds are only consulted by bounded minimizers. They keep
 * {@code B} and {@code Δ} strictly positive, since both appear as denominators.
 */
public enum Parameter {

    /** Amplitude of the exponential background. */
    A("A", false, 0.0, 1.0e4),
    /** Decay length of the exponential background, in bins. */
    B("B", false, 1.0e-6, 1.0e4),
    /** Integrated strength of the Gaussian peak. */
    C("C", false, 0.0, 1.0e4),
    /** Flat background level. */
    D("D", false, 0.0, 1.0e4),
    /** Peak position (m). */
    MASS("m", true, -1.0e4, 1.0e4),
    /** Peak width (Δ). */
    DELTA("delta", true, 1.0e-6, 1.0e4);

    /** Number of model parameters. */
    public static final int COUNT = values().length;

    private final String label;
    private final boolean ofInterest;
    private final double defaultLowerBound;
    private final double defaultUpperBound;

    Parameter(String label, boolean ofInterest, double defaultLowerBound, double defaultUpperBound) {
        this.label = label;
        this.ofInterest = ofInterest;
        this.defaultLowerBound = defaultLowerBound;
        this.defaultUpperBound = defaultUpperBound;
    }

    /** @return the short name used in configuration and log output */
    public String label() {
        return label;
    }

    /** @return true for m and Δ, false for the nuisance parameters */
    public boolean isOfInterest() {
        return ofInterest;
    }

    /** @return true for A, B, C and D */
    public boolean isNuisance() {
        return !ofInterest;
    }

    public double defaultLowerBound() {
        return defaultLowerBound;
    }

    public double defaultUpperBound() {
        return defaultUpperBound;
    }

    /**
     * Resolves a parameter from its label or constant name, ignoring case.
     *
     * @param name a label such as {@code "m"} or a constant name such as {@code "MASS"}
     * @return the matching parameter
     * @throws IllegalArgumentException if nothing matches
     */
    public static Parameter fromName(String name) {
        for (Parameter parameter : values()) {
            if (parameter.label.equalsIgnoreCase(name) || parameter.name().equalsIgnoreCase(name)) {
                return parameter;
            }
        }
        throw new IllegalArgumentException("Unknown parameter: " + name);
    }
}
