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

import java.util.Locale;

/**
 * A point (m, Δ) in the plane of the parameters of interest.
 *
 * @param mass the peak position m
 * @param delta the peak width Δ
 */
public record GridPoint(double mass, double delta) {

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(m=%.4g, delta=%.4g)", mass, delta);
    }
}
