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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Coverage estimates laid out on their grid. Points without an estimate read as NaN.
 */
public final class CoverageSurface {

    private final GridSpec grid;
    private final CoverageEstimate[] estimates;

    /**
     * @param grid the grid the estimates belong to
     * @param estimates one entry per grid index, {@code null} where the point was excluded
     */
    public CoverageSurface(GridSpec grid, List<CoverageEstimate> estimates) {
        if (estimates.size() != grid.size()) {
            throw new IllegalArgumentException(
                "Expected " + grid.size() + " grid entries, got " + estimates.size());
        }
        this.grid = grid;
        this.estimates = estimates.toArray(new CoverageEstimate[0]);
    }

    public GridSpec grid() {
        return grid;
    }

    public Optional<CoverageEstimate> estimate(int index) {
        return Optional.ofNullable(estimates[index]);
    }

    public Optional<CoverageEstimate> estimate(int massIndex, int deltaIndex) {
        return estimate(grid.index(massIndex, deltaIndex));
    }

    public double probability(int massIndex, int deltaIndex) {
        CoverageEstimate estimate = estimates[grid.index(massIndex, deltaIndex)];
        return estimate == null ? Double.NaN : estimate.probability();
    }

    /**
     * @return {@code [deltaIndex][massIndex]} coverage probabilities, NaN where excluded
     */
    public double[][] probabilities() {
        double[][] values = new double[grid.deltaSteps()][grid.massSteps()];
        for (int j = 0; j < grid.deltaSteps(); j++) {
            for (int i = 0; i < grid.massSteps(); i++) {
                values[j][i] = probability(i, j);
            }
        }
        return values;
    }

    /** @return the estimates present, in grid index order */
    public List<CoverageEstimate> estimates() {
        List<CoverageEstimate> present = new ArrayList<>();
        for (CoverageEstimate estimate : estimates) {
            if (estimate != null) {
                present.add(estimate);
            }
        }
        return Collections.unmodifiableList(present);
    }

    /**
     * Grid points inside the confidence region of the given level, meaning their
     * coverage probability does not exceed it.
     */
    public List<GridPoint> acceptedPoints(double level) {
        List<GridPoint> accepted = new ArrayList<>();
        for (CoverageEstimate estimate : estimates) {
            if (estimate != null && estimate.probability() <= level) {
                accepted.add(estimate.point());
            }
        }
        return accepted;
    }

    public boolean isComplete() {
        for (CoverageEstimate estimate : estimates) {
            if (estimate == null) {
                return false;
            }
        }
        return true;
    }
}
