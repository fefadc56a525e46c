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
 * Fit bookkeeping of a whole scan.
 *
 * @param fitsAttempted fits run, including the global fit
 * @param fitsExcluded fits dropped after a failed retry
 * @param pointsExcluded grid points without a coverage estimate
 * @param pointsBelowGlobalMinimum grid points whose profile λ undercut the global minimum
 */
public record ScanStatistics(int fitsAttempted, int fitsExcluded, int pointsExcluded,
                             int pointsBelowGlobalMinimum) {

    /** @return excluded over attempted fits, zero when nothing was attempted */
    public double nonConvergenceRate() {
        return fitsAttempted == 0 ? 0.0 : (double) fitsExcluded / fitsAttempted;
    }
}
