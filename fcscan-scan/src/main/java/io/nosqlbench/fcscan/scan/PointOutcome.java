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

import java.util.Optional;

/**
 * Everything one grid point contributes to a scan.
 *
 * @param index the grid index
 * @param point the grid point
 * @param estimate the coverage estimate, {@code null} if the point was excluded
 * @param fitsAttempted fits run for this point, counting a retried fit once
 * @param fitsExcluded fits that still failed after their retry
 * @param belowGlobalMinimum whether the real-data profile λ undercut the global minimum
 */
public record PointOutcome(int index, GridPoint point, CoverageEstimate estimate,
                           int fitsAttempted, int fitsExcluded, boolean belowGlobalMinimum) {

    public boolean isExcluded() {
        return estimate == null;
    }

    public Optional<CoverageEstimate> coverage() {
        return Optional.ofNullable(estimate);
    }
}
