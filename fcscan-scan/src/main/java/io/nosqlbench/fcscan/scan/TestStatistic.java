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
 * The statistic compared between real data and pseudo-experiments.
 */
public enum TestStatistic {

    /** The profile λ at the grid point itself. */
    PROFILE_LAMBDA,

    /**
     * The profile λ minus the unconditional minimum of the same spectrum, clamped at
     * zero. Needs one extra global fit per pseudo-experiment.
     */
    LIKELIHOOD_RATIO
}
