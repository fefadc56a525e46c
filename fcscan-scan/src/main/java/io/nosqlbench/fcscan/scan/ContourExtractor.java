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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Traces iso-probability lines through a coverage surface with marching squares.
 *
 * <p>Crossings are placed by linear interpolation along cell edges. Ambiguous saddle
 * cells are resolved with the mean of their four corners. Cells touching an excluded
 * point are skipped, so a contour may have gaps there.
 */
public final class ContourExtractor {

    private ContourExtractor() {}

    /**
     * @param surface the coverage surface
     * @param level the coverage probability to trace
     * @return the contour segments, in cell order
     */
    public static List<ContourSegment> extract(CoverageSurface surface, double level) {
        GridSpec grid = surface.grid();
        double[][] values = surface.probabilities();
        List<ContourSegment> segments = new ArrayList<>();
        for (int j = 0; j + 1 < grid.deltaSteps(); j++) {
            for (int i = 0; i + 1 < grid.massSteps(); i++) {
                march(grid, values, level, i, j, segments);
            }
        }
        return segments;
    }

    /**
     * Traces the nσ contour, at coverage probability {@code 2Φ(n) − 1}, for each level.
     *
     * @return segments keyed by sigma, in the order given
     */
    public static Map<Double, List<ContourSegment>> extractSigmas(CoverageSurface surface, double... sigmas) {
        Map<Double, List<ContourSegment>> contours = new LinkedHashMap<>();
        for (double sigma : sigmas) {
            contours.put(sigma, extract(surface, ConfidenceLevels.probabilityForSigma(sigma)));
        }
        return contours;
    }

    private static void march(GridSpec grid, double[][] v, double level, int i, int j,
                              List<ContourSegment> out) {
        double v00 = v[j][i];
        double v10 = v[j][i + 1];
        double v11 = v[j + 1][i + 1];
        double v01 = v[j + 1][i];
        if (Double.isNaN(v00) || Double.isNaN(v10) || Double.isNaN(v11) || Double.isNaN(v01)) {
            return;
        }
        int cell = (v00 > level ? 1 : 0) | (v10 > level ? 2 : 0) | (v11 > level ? 4 : 0) | (v01 > level ? 8 : 0);
        if (cell == 0 || cell == 15) {
            return;
        }

        double m0 = grid.massAt(i);
        double m1 = grid.massAt(i + 1);
        double d0 = grid.deltaAt(j);
        double d1 = grid.deltaAt(j + 1);
        GridPoint bottom = new GridPoint(lerp(m0, m1, v00, v10, level), d0);
        GridPoint top = new GridPoint(lerp(m0, m1, v01, v11, level), d1);
        GridPoint left = new GridPoint(m0, lerp(d0, d1, v00, v01, level));
        GridPoint right = new GridPoint(m1, lerp(d0, d1, v10, v11, level));

        switch (cell) {
            case 1, 14 -> out.add(new ContourSegment(left, bottom));
            case 2, 13 -> out.add(new ContourSegment(bottom, right));
            case 3, 12 -> out.add(new ContourSegment(left, right));
            case 4, 11 -> out.add(new ContourSegment(right, top));
            case 6, 9 -> out.add(new ContourSegment(bottom, top));
            case 7, 8 -> out.add(new ContourSegment(left, top));
            case 5 -> {
                if ((v00 + v10 + v11 + v01) / 4.0 > level) {
                    out.add(new ContourSegment(bottom, right));
                    out.add(new ContourSegment(left, top));
                } else {
                    out.add(new ContourSegment(left, bottom));
                    out.add(new ContourSegment(right, top));
                }
            }
            case 10 -> {
                if ((v00 + v10 + v11 + v01) / 4.0 > level) {
                    out.add(new ContourSegment(left, bottom));
                    out.add(new ContourSegment(right, top));
                } else {
                    out.add(new ContourSegment(bottom, right));
                    out.add(new ContourSegment(left, top));
                }
            }
            default -> throw new IllegalStateException("Unexpected cell case " + cell);
        }
    }

    private static double lerp(double x0, double x1, double v0, double v1, double level) {
        if (v1 == v0) {
            return (x0 + x1) / 2.0;
        }
        return x0 + (x1 - x0) * (level - v0) / (v1 - v0);
    }
}
