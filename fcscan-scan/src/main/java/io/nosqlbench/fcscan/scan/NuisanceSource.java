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
 * Where the nuisance values of the pseudo-experiment hypothesis come from.
 */
public enum NuisanceSource {

    /**
     * The nuisance values of the real-data profile fit at the grid point, shared by
     * every pseudo-experiment of that point.
     */
    PROFILED,

    /**
     * A fresh Gaussian draw per pseudo-experiment around each prior mean, for every
     * nuisance parameter the prior covers; the others keep their profiled values.
     */
    PRIOR_SAMPLED
}
