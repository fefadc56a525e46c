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

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Conversions between Gaussian-equivalent significance and coverage probability.
 *
 * <p>An nσ region covers {@code 2Φ(n) − 1} of the probability, where Φ is the
 * standard normal CDF: 0.6827 for 1σ, 0.9545 for 2σ, 0.9973 for 3σ.
 */
public final class ConfidenceLevels {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    private ConfidenceLevels() {}

    /**
     * @param sigmas the significance in standard deviations, positive
     * @return the coverage probability {@code 2Φ(n) − 1}
     */
    public static double probabilityForSigma(double sigmas) {
        return 1.0 - upperTail(sigmas);
    }

    /**
     * @param sigmas the significance in standard deviations, positive
     * @return the two-sided tail {@code 2Φ(−n)} left outside the region
     */
    public static double upperTail(double sigmas) {
        if (!(sigmas > 0.0)) {
            throw new IllegalArgumentException("sigmas must be positive: " + sigmas);
        }
        return 2.0 * STANDARD_NORMAL.cumulativeProbability(-sigmas);
    }

    /**
     * @param probability a coverage probability in (0, 1)
     * @return the matching significance in standard deviations
     */
    public static double sigmaForProbability(double probability) {
        if (!(probability > 0.0 && probability < 1.0)) {
            throw new IllegalArgumentException("probability must be within (0, 1): " + probability);
        }
        return -STANDARD_NORMAL.inverseCumulativeProbability((1.0 - probability) / 2.0);
    }

    /**
     * Pseudo-experiments needed per grid point so that, on average, {@code factor}
     * of them land in the tail beyond an nσ contour.
     */
    public static int minimumPseudoExperiments(double sigmas, double factor) {
        double needed = Math.ceil(factor / upperTail(sigmas));
        return needed >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) needed;
    }
}
