package io.nosqlbench.fcscan.scan;

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
import java.util.Objects;

/**
 * Settings of a coverage scan: the grid, the pseudo-experiment count and seed, and
 * the calibration tolerances. Immutable; build with {@link #builder(GridSpec)}.
 */
public final class ScanConfig {

    public static final int DEFAULT_PSEUDO_EXPERIMENTS = 1000;
    public static final long DEFAULT_MASTER_SEED = 12345L;
    public static final double DEFAULT_MAX_NON_CONVERGENCE_RATE = 0.01;
    public static final double DEFAULT_RETRY_PERTURBATION_SCALE = 0.1;
    public static final double DEFAULT_GLOBAL_MINIMUM_TOLERANCE = 1e-6;
    public static final double DEFAULT_TAIL_RESOLUTION_FACTOR = 10.0;
    private static final double[] DEFAULT_CONTOUR_SIGMAS = {1.0, 2.0, 3.0};

    private final GridSpec grid;
    private final int pseudoExperiments;
    private final long masterSeed;
    private final RandomStreams.Algorithm algorithm;
    private final NuisanceSource nuisanceSource;
    private final TestStatistic testStatistic;
    private final double maxNonConvergenceRate;
    private final double retryPerturbationScale;
    private final double globalMinimumTolerance;
    private final double tailResolutionFactor;
    private final double[] contourSigmas;

    private ScanConfig(Builder builder) {
        this.grid = builder.grid;
        this.pseudoExperiments = builder.pseudoExperiments;
        this.masterSeed = builder.masterSeed;
        this.algorithm = builder.algorithm;
        this.nuisanceSource = builder.nuisanceSource;
        this.testStatistic = builder.testStatistic;
        this.maxNonConvergenceRate = builder.maxNonConvergenceRate;
        this.retryPerturbationScale = builder.retryPerturbationScale;
        this.globalMinimumTolerance = builder.globalMinimumTolerance;
        this.tailResolutionFactor = builder.tailResolutionFactor;
        this.contourSigmas = builder.contourSigmas.clone();
    }

    public static Builder builder(GridSpec grid) {
        return new Builder(grid);
    }

    public GridSpec grid() {
        return grid;
    }

    /** Pseudo-experiments drawn per grid point. */
    public int pseudoExperiments() {
        return pseudoExperiments;
    }

    public long masterSeed() {
        return masterSeed;
    }

    public RandomStreams.Algorithm algorithm() {
        return algorithm;
    }

    public NuisanceSource nuisanceSource() {
        return nuisanceSource;
    }

    public TestStatistic testStatistic() {
        return testStatistic;
    }

    /** Largest tolerated fraction of non-converged fits before a scan is rejected. */
    public double maxNonConvergenceRate() {
        return maxNonConvergenceRate;
    }

    /** Relative size of the guess perturbation used for the single retry of a failed fit. */
    public double retryPerturbationScale() {
        return retryPerturbationScale;
    }

    /** Slack allowed when a profile λ undercuts the global minimum. */
    public double globalMinimumTolerance() {
        return globalMinimumTolerance;
    }

    /**
     * Expected pseudo-experiment count, in the tail beyond the outermost contour, below
     * which a warning is logged.
     */
    public double tailResolutionFactor() {
        return tailResolutionFactor;
    }

    /** Contour levels of interest, in standard deviations. */
    public double[] contourSigmas() {
        return contourSigmas.clone();
    }

    public RandomStreams randomStreams() {
        return new RandomStreams(algorithm, masterSeed);
    }

    public Builder toBuilder() {
        return new Builder(grid)
            .pseudoExperiments(pseudoExperiments)
            .masterSeed(masterSeed)
            .algorithm(algorithm)
            .nuisanceSource(nuisanceSource)
            .testStatistic(testStatistic)
            .maxNonConvergenceRate(maxNonConvergenceRate)
            .retryPerturbationScale(retryPerturbationScale)
            .globalMinimumTolerance(globalMinimumTolerance)
            .tailResolutionFactor(tailResolutionFactor)
            .contourSigmas(contourSigmas);
    }

    @Override
    public String toString() {
        return "ScanConfig{grid=" + grid
            + ", pseudoExperiments=" + pseudoExperiments
            + ", masterSeed=" + masterSeed
            + ", algorithm=" + algorithm
            + ", nuisanceSource=" + nuisanceSource
            + ", testStatistic=" + testStatistic
            + ", maxNonConvergenceRate=" + maxNonConvergenceRate
            + ", contourSigmas=" + Arrays.toString(contourSigmas) + '}';
    }

    public static final class Builder {
        private GridSpec grid;
        private int pseudoExperiments = DEFAULT_PSEUDO_EXPERIMENTS;
        private long masterSeed = DEFAULT_MASTER_SEED;
        private RandomStreams.Algorithm algorithm = RandomStreams.Algorithm.XO_SHI_RO_256_PP;
        private NuisanceSource nuisanceSource = NuisanceSource.PROFILED;
        private TestStatistic testStatistic = TestStatistic.PROFILE_LAMBDA;
        private double maxNonConvergenceRate = DEFAULT_MAX_NON_CONVERGENCE_RATE;
        private double retryPerturbationScale = DEFAULT_RETRY_PERTURBATION_SCALE;
        private double globalMinimumTolerance = DEFAULT_GLOBAL_MINIMUM_TOLERANCE;
        private double tailResolutionFactor = DEFAULT_TAIL_RESOLUTION_FACTOR;
        private double[] contourSigmas = DEFAULT_CONTOUR_SIGMAS.clone();

        private Builder(GridSpec grid) {
            this.grid = Objects.requireNonNull(grid, "grid cannot be null");
        }

        public Builder grid(GridSpec grid) {
            this.grid = Objects.requireNonNull(grid, "grid cannot be null");
            return this;
        }

        public Builder pseudoExperiments(int pseudoExperiments) {
            if (pseudoExperiments < 1) {
                throw new IllegalArgumentException("pseudoExperiments must be positive: " + pseudoExperiments);
            }
            this.pseudoExperiments = pseudoExperiments;
            return this;
        }

        public Builder masterSeed(long masterSeed) {
            this.masterSeed = masterSeed;
            return this;
        }

        public Builder algorithm(RandomStreams.Algorithm algorithm) {
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm cannot be null");
            return this;
        }

        public Builder nuisanceSource(NuisanceSource nuisanceSource) {
            this.nuisanceSource = Objects.requireNonNull(nuisanceSource, "nuisanceSource cannot be null");
            return this;
        }

        public Builder testStatistic(TestStatistic testStatistic) {
            this.testStatistic = Objects.requireNonNull(testStatistic, "testStatistic cannot be null");
            return this;
        }

        public Builder maxNonConvergenceRate(double maxNonConvergenceRate) {
            if (!(maxNonConvergenceRate >= 0.0 && maxNonConvergenceRate <= 1.0)) {
                throw new IllegalArgumentException(
                    "maxNonConvergenceRate must be within [0, 1]: " + maxNonConvergenceRate);
            }
            this.maxNonConvergenceRate = maxNonConvergenceRate;
            return this;
        }

        public Builder retryPerturbationScale(double retryPerturbationScale) {
            if (!(retryPerturbationScale > 0.0)) {
                throw new IllegalArgumentException(
                    "retryPerturbationScale must be positive: " + retryPerturbationScale);
            }
            this.retryPerturbationScale = retryPerturbationScale;
            return this;
        }

        public Builder globalMinimumTolerance(double globalMinimumTolerance) {
            if (!(globalMinimumTolerance >= 0.0)) {
                throw new IllegalArgumentException(
                    "globalMinimumTolerance must be non-negative: " + globalMinimumTolerance);
            }
            this.globalMinimumTolerance = globalMinimumTolerance;
            return this;
        }

        public Builder tailResolutionFactor(double tailResolutionFactor) {
            if (!(tailResolutionFactor > 0.0)) {
                throw new IllegalArgumentException(
                    "tailResolutionFactor must be positive: " + tailResolutionFactor);
            }
            this.tailResolutionFactor = tailResolutionFactor;
            return this;
        }

        public Builder contourSigmas(double... contourSigmas) {
            for (double sigma : contourSigmas) {
                if (!(sigma > 0.0) || Double.isInfinite(sigma)) {
                    throw new IllegalArgumentException("contour sigma must be positive and finite: " + sigma);
                }
            }
            this.contourSigmas = contourSigmas.clone();
            return this;
        }

        public ScanConfig build() {
            return new ScanConfig(this);
        }
    }
}
