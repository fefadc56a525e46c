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
import java.util.List;

/**
 * A dense rectangular grid over the (m, Δ) plane.
 *
 * <p>Points are indexed row-major with Δ as the outer axis:
 * {@code index = deltaIndex · massSteps + massIndex}. A single step on an axis
 * places the only point at that axis' minimum. Δ must stay strictly positive.
 *
 * @param massMin smallest m
 * @param massMax largest m
 * @param massSteps number of m values, at least one
 * @param deltaMin smallest Δ, strictly positive
 * @param deltaMax largest Δ
 * @param deltaSteps number of Δ values, at least one
 */
public record GridSpec(double massMin, double massMax, int massSteps,
                       double deltaMin, double deltaMax, int deltaSteps) {

    public GridSpec {
        if (massSteps < 1 || deltaSteps < 1) {
            throw new IllegalArgumentException(
                "Grid needs at least one step per axis, got " + massSteps + "x" + deltaSteps);
        }
        if (!Double.isFinite(massMin) || !Double.isFinite(massMax) || massMax < massMin) {
            throw new IllegalArgumentException("Invalid mass range [" + massMin + ", " + massMax + "]");
        }
        if (!Double.isFinite(deltaMin) || !Double.isFinite(deltaMax) || deltaMax < deltaMin) {
            throw new IllegalArgumentException("Invalid delta range [" + deltaMin + ", " + deltaMax + "]");
        }
        if (deltaMin <= 0.0) {
            throw new IllegalArgumentException("delta must be strictly positive, grid starts at " + deltaMin);
        }
    }

    /**
     * A grid holding one point.
     */
    public static GridSpec single(double mass, double delta) {
        return new GridSpec(mass, mass, 1, delta, delta, 1);
    }

    /** @return total number of grid points */
    public int size() {
        return massSteps * deltaSteps;
    }

    public double massAt(int massIndex) {
        return axisValue(massMin, massMax, massSteps, massIndex);
    }

    public double deltaAt(int deltaIndex) {
        return axisValue(deltaMin, deltaMax, deltaSteps, deltaIndex);
    }

    public int index(int massIndex, int deltaIndex) {
        if (massIndex < 0 || massIndex >= massSteps || deltaIndex < 0 || deltaIndex >= deltaSteps) {
            throw new IndexOutOfBoundsException("(" + massIndex + ", " + deltaIndex + ") outside "
                + massSteps + "x" + deltaSteps + " grid");
        }
        return deltaIndex * massSteps + massIndex;
    }

    public int massIndexOf(int index) {
        return index % massSteps;
    }

    public int deltaIndexOf(int index) {
        return index / massSteps;
    }

    public GridPoint point(int massIndex, int deltaIndex) {
        return new GridPoint(massAt(massIndex), deltaAt(deltaIndex));
    }

    public GridPoint point(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("index " + index + " outside grid of " + size());
        }
        return point(massIndexOf(index), deltaIndexOf(index));
    }

    /** @return every grid point in index order */
    public List<GridPoint> points() {
        List<GridPoint> points = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            points.add(point(i));
        }
        return points;
    }

    private static double axisValue(double min, double max, int steps, int i) {
        if (i < 0 || i >= steps) {
            throw new IndexOutOfBoundsException("axis index " + i + " outside 0.." + (steps - 1));
        }
        if (steps == 1) {
            return min;
        }
        return min + (max - min) * i / (steps - 1);
    }
}
