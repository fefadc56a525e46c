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

import io.nosqlbench.fcscan.fit.FitResult;

import java.util.List;

/**
 * The outcome of a coverage scan.
 *
 * @param globalFit the unconstrained best fit of the observed spectrum
 * @param surface coverage estimates over the grid
 * @param excludedPoints grid points left without an estimate
 * @param statistics fit bookkeeping
 */
public record ScanResult(FitResult globalFit, CoverageSurface surface,
                         List<GridPoint> excludedPoints, ScanStatistics statistics) {

    public ScanResult {
        excludedPoints = List.copyOf(excludedPoints);
    }
}
