package io.nosqlbench.fcscan.fit;

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

import io.nosqlbench.fcscan.model.BinIndexSet;
import io.nosqlbench.fcscan.model.CountSpectrum;
import io.nosqlbench.fcscan.model.ParameterVector;

/**
 * The toy counting experiment shared by the fitter tests.
 */
final class ToyData {

    static final BinIndexSet BINS = BinIndexSet.of(20);
    static final CountSpectrum OBSERVED =
        CountSpectrum.of(7, 4, 4, 3, 4, 6, 5, 3, 6, 5, 4, 1, 3, 0, 1, 1, 2, 0, 1, 0);
    static final ParameterVector TRUTH = ParameterVector.of(10.2, 5.3, 3.5, 0.7, 8.3, 1.8);

    /** λ of the observed counts at the global minimum, from an independent reference fit. */
    static final double GLOBAL_LAMBDA = 61.70737;

    private ToyData() {}
}
