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

/**
 * How a fitter keeps A, C/Δ and D non-negative.
 */
public enum ConstraintPolicy {

    /**
     * Unbounded Nelder-Mead search; the model's absolute-value wrapping makes
     * every amplitude sign equivalent, and results are reported canonically.
     */
    ABSOLUTE_VALUE,

    /**
     * BOBYQA search inside explicit box bounds, with lower bounds of zero on the
     * amplitudes and small positive lower bounds on B and Δ.
     */
    BOUNDED
}
