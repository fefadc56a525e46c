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

/**
 * The Monte-Carlo coverage probability at one grid point: the fraction of usable
 * pseudo-experiments whose statistic fell strictly below the observed one.
 *
 * @param point the grid point
 * @param probability the estimated coverage, within [0, 1]
 * @param observedStatistic the statistic of the real data at this point
 * @param pseudoExperiments usable pseudo-experiments behind the estimate
 * @param excluded pseudo-experiments dropped because their fits did not converge
 */
public record CoverageEstimate(GridPoint point, double probability, double observedStatistic,
                               int pseudoExperiments, int excluded) {

    public CoverageEstimate {
        if (pseudoExperiments < 1) {
            throw new IllegalArgumentException("estimate needs at least one pseudo-experiment");
        }
        if (!(probability >= 0.0 && probability <= 1.0)) {
            throw new IllegalArgumentException("probability outside [0, 1]: " + probability);
        }
    }

    /**
     * Binomial standard error {@code sqrt(p(1-p)/N)}.
     */
    public double standardError() {
        return Math.sqrt(probability * (1.0 - probability) / pseudoExperiments);
    }
}
