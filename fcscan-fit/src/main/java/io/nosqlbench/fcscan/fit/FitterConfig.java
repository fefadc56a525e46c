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

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable minimizer settings: budgets, tolerances, constraint policy and bounds.
 *
 * <p>Stopping tolerances and budgets are analysis-specific tuning values, so all of
 * them are exposed here rather than fixed in the fitters.
 */
public final class FitterConfig {

    public static final int DEFAULT_MAX_EVALUATIONS = 20_000;
    public static final double DEFAULT_RELATIVE_TOLERANCE = 1e-10;
    public static final double DEFAULT_ABSOLUTE_TOLERANCE = 1e-10;
    public static final int DEFAULT_RESTARTS = 5;
    public static final double DEFAULT_RESTART_TOLERANCE = 1e-6;

    private final ConstraintPolicy constraintPolicy;
    private final PriorMode priorMode;
    private final int maxEvaluations;
    private final double relativeTolerance;
    private final double absoluteTolerance;
    private final int restarts;
    private final double restartTolerance;
    private final double simplexStepFraction;
    private final double minimumSimplexStep;
    private final double initialTrustRegionRadius;
    private final double stoppingTrustRegionRadius;
    private final double boundaryTolerance;
    private final int multiStarts;
    private final double multiStartScale;
    private final long multiStartSeed;
    private final EnumMap<Parameter, Double> lowerBounds;
    private final EnumMap<Parameter, Double> upperBounds;

    private FitterConfig(Builder builder) {
        this.constraintPolicy = builder.constraintPolicy;
        this.priorMode = builder.priorMode;
        this.maxEvaluations = builder.maxEvaluations;
        this.relativeTolerance = builder.relativeTolerance;
        this.absoluteTolerance = builder.absoluteTolerance;
        this.restarts = builder.restarts;
        this.restartTolerance = builder.restartTolerance;
        this.simplexStepFraction = builder.simplexStepFraction;
        this.minimumSimplexStep = builder.minimumSimplexStep;
        this.initialTrustRegionRadius = builder.initialTrustRegionRadius;
        this.stoppingTrustRegionRadius = builder.stoppingTrustRegionRadius;
        this.boundaryTolerance = builder.boundaryTolerance;
        this.multiStarts = builder.multiStarts;
        this.multiStartScale = builder.multiStartScale;
        this.multiStartSeed = builder.multiStartSeed;
        this.lowerBounds = new EnumMap<>(builder.lowerBounds);
        this.upperBounds = new EnumMap<>(builder.upperBounds);
    }

    /** @return a configuration with every default */
    public static FitterConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ConstraintPolicy constraintPolicy() {
        return constraintPolicy;
    }

    public PriorMode priorMode() {
        return priorMode;
    }

    /** @return objective evaluation budget of one fit, across restarts */
    public int maxEvaluations() {
        return maxEvaluations;
    }

    public double relativeTolerance() {
        return relativeTolerance;
    }

    public double absoluteTolerance() {
        return absoluteTolerance;
    }

    /** @return how many times a converged simplex search is restarted from its own optimum */
    public int restarts() {
        return restarts;
    }

    /** @return λ change below which a restart counts as confirming the previous optimum */
    public double restartTolerance() {
        return restartTolerance;
    }

    public double simplexStepFraction() {
        return simplexStepFraction;
    }

    public double minimumSimplexStep() {
        return minimumSimplexStep;
    }

    public double initialTrustRegionRadius() {
        return initialTrustRegionRadius;
    }

    public double stoppingTrustRegionRadius() {
        return stoppingTrustRegionRadius;
    }

    /** @return distance from a bound under which a converged fit is flagged as at the boundary */
    public double boundaryTolerance() {
        return boundaryTolerance;
    }

    /** @return number of additional perturbed starts, zero to disable multi-start */
    public int multiStarts() {
        return multiStarts;
    }

    public double multiStartScale() {
        return multiStartScale;
    }

    public long multiStartSeed() {
        return multiStartSeed;
    }

    public double lowerBound(Parameter parameter) {
        return lowerBounds.get(parameter);
    }

    public double upperBound(Parameter parameter) {
        return upperBounds.get(parameter);
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.constraintPolicy = constraintPolicy;
        builder.priorMode = priorMode;
        builder.maxEvaluations = maxEvaluations;
        builder.relativeTolerance = relativeTolerance;
        builder.absoluteTolerance = absoluteTolerance;
        builder.restarts = restarts;
        builder.restartTolerance = restartTolerance;
        builder.simplexStepFraction = simplexStepFraction;
        builder.minimumSimplexStep = minimumSimplexStep;
        builder.initialTrustRegionRadius = initialTrustRegionRadius;
        builder.stoppingTrustRegionRadius = stoppingTrustRegionRadius;
        builder.boundaryTolerance = boundaryTolerance;
        builder.multiStarts = multiStarts;
        builder.multiStartScale = multiStartScale;
        builder.multiStartSeed = multiStartSeed;
        builder.lowerBounds.putAll(lowerBounds);
        builder.upperBounds.putAll(upperBounds);
        return builder;
    }

    @Override
    public String toString() {
        return "FitterConfig{" +
            "policy=" + constraintPolicy +
            ", prior=" + priorMode +
            ", maxEvaluations=" + maxEvaluations +
            ", relTol=" + relativeTolerance +
            ", absTol=" + absoluteTolerance +
            ", restarts=" + restarts +
            ", multiStarts=" + multiStarts +
            '}';
    }

    /** Builder for {@link FitterConfig}. */
    public static final class Builder {

        private ConstraintPolicy constraintPolicy = ConstraintPolicy.ABSOLUTE_VALUE;
        private PriorMode priorMode = PriorMode.NONE;
        private int maxEvaluations = DEFAULT_MAX_EVALUATIONS;
        private double relativeTolerance = DEFAULT_RELATIVE_TOLERANCE;
        private double absoluteTolerance = DEFAULT_ABSOLUTE_TOLERANCE;
        private int restarts = DEFAULT_RESTARTS;
        private double restartTolerance = DEFAULT_RESTART_TOLERANCE;
        private double simplexStepFraction = 0.1;
        private double minimumSimplexStep = 0.01;
        private double initialTrustRegionRadius = 0.5;
        private double stoppingTrustRegionRadius = 1e-8;
        private double boundaryTolerance = 1e-6;
        private int multiStarts = 0;
        private double multiStartScale = 0.2;
        private long multiStartSeed = 1L;
        private final EnumMap<Parameter, Double> lowerBounds = new EnumMap<>(Parameter.class);
        private final EnumMap<Parameter, Double> upperBounds = new EnumMap<>(Parameter.class);

        private Builder() {
            for (Parameter parameter : Parameter.values()) {
                lowerBounds.put(parameter, parameter.defaultLowerBound());
                upperBounds.put(parameter, parameter.defaultUpperBound());
            }
        }

        public Builder constraintPolicy(ConstraintPolicy constraintPolicy) {
            this.constraintPolicy = Objects.requireNonNull(constraintPolicy, "constraintPolicy cannot be null");
            return this;
        }

        public Builder priorMode(PriorMode priorMode) {
            this.priorMode = Objects.requireNonNull(priorMode, "priorMode cannot be null");
            return this;
        }

        public Builder maxEvaluations(int maxEvaluations) {
            if (maxEvaluations < 1) {
                throw new IllegalArgumentException("maxEvaluations must be positive, got " + maxEvaluations);
            }
            this.maxEvaluations = maxEvaluations;
            return this;
        }

        public Builder relativeTolerance(double relativeTolerance) {
            this.relativeTolerance = requirePositive("relativeTolerance", relativeTolerance);
            return this;
        }

        public Builder absoluteTolerance(double absoluteTolerance) {
            this.absoluteTolerance = requirePositive("absoluteTolerance", absoluteTolerance);
            return this;
        }

        public Builder restarts(int restarts) {
            if (restarts < 0) {
                throw new IllegalArgumentException("restarts cannot be negative, got " + restarts);
            }
            this.restarts = restarts;
            return this;
        }

        public Builder restartTolerance(double restartTolerance) {
            this.restartTolerance = requirePositive("restartTolerance", restartTolerance);
            return this;
        }

        public Builder simplexStepFraction(double simplexStepFraction) {
            this.simplexStepFraction = requirePositive("simplexStepFraction", simplexStepFraction);
            return this;
        }

        public Builder minimumSimplexStep(double minimumSimplexStep) {
            this.minimumSimplexStep = requirePositive("minimumSimplexStep", minimumSimplexStep);
            return this;
        }

        public Builder initialTrustRegionRadius(double initialTrustRegionRadius) {
            this.initialTrustRegionRadius = requirePositive("initialTrustRegionRadius", initialTrustRegionRadius);
            return this;
        }

        public Builder stoppingTrustRegionRadius(double stoppingTrustRegionRadius) {
            this.stoppingTrustRegionRadius = requirePositive("stoppingTrustRegionRadius", stoppingTrustRegionRadius);
            return this;
        }

        public Builder boundaryTolerance(double boundaryTolerance) {
            this.boundaryTolerance = requirePositive("boundaryTolerance", boundaryTolerance);
            return this;
        }

        public Builder multiStarts(int multiStarts) {
            if (multiStarts < 0) {
                throw new IllegalArgumentException("multiStarts cannot be negative, got " + multiStarts);
            }
            this.multiStarts = multiStarts;
            return this;
        }

        public Builder multiStartScale(double multiStartScale) {
            this.multiStartScale = requirePositive("multiStartScale", multiStartScale);
            return this;
        }

        public Builder multiStartSeed(long multiStartSeed) {
            this.multiStartSeed = multiStartSeed;
            return this;
        }

        public Builder bounds(Parameter parameter, double lower, double upper) {
            Objects.requireNonNull(parameter, "parameter cannot be null");
            if (!(lower < upper)) {
                throw new IllegalArgumentException(
                    "lower bound must be below upper bound for " + parameter.label() + ": " + lower + " >= " + upper);
            }
            lowerBounds.put(parameter, lower);
            upperBounds.put(parameter, upper);
            return this;
        }

        public Builder bounds(Map<Parameter, double[]> bounds) {
            bounds.forEach((parameter, range) -> bounds(parameter, range[0], range[1]));
            return this;
        }

        public FitterConfig build() {
            if (stoppingTrustRegionRadius >= initialTrustRegionRadius) {
                throw new IllegalArgumentException(
                    "stoppingTrustRegionRadius must be below initialTrustRegionRadius");
            }
            return new FitterConfig(this);
        }

        private static double requirePositive(String name, double value) {
            if (!(value > 0.0) || !Double.isFinite(value)) {
                throw new IllegalArgumentException(name + " must be positive and finite, got " + value);
            }
            return value;
        }
    }
}
