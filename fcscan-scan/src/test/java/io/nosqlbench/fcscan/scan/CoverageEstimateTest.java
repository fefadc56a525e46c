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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class CoverageEstimateTest {

    private final GridPoint point = new GridPoint(8.0, 2.0);

    @Test
    void testBinomialStandardError() {
        CoverageEstimate estimate = new CoverageEstimate(point, 0.2, 60.0, 1000, 0);
        assertEquals(Math.sqrt(0.2 * 0.8 / 1000), estimate.standardError(), 1e-15);
    }

    @Test
    void testStandardErrorHalvesWithFourTimesTheExperiments() {
        CoverageEstimate small = new CoverageEstimate(point, 0.3, 60.0, 250, 0);
        CoverageEstimate large = new CoverageEstimate(point, 0.3, 60.0, 1000, 0);
        assertEquals(2.0, small.standardError() / large.standardError(), 1e-12);
    }

    @Test
    void testEdgesHaveZeroError() {
        assertEquals(0.0, new CoverageEstimate(point, 0.0, 60.0, 10, 0).standardError());
        assertEquals(0.0, new CoverageEstimate(point, 1.0, 60.0, 10, 0).standardError());
    }

    @Test
    void testRejectsInvalidEstimates() {
        assertThatThrownBy(() -> new CoverageEstimate(point, 1.5, 60.0, 10, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CoverageEstimate(point, 0.5, 60.0, 0, 10))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
