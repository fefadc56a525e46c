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

import io.nosqlbench.fcscan.model.Parameter;
import io.nosqlbench.fcscan.model.ParameterVector;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;

/**
 * Perturbs the free coordinates of an initial guess, for fit retries and multi-start.
 *
 * <p>Each free value x becomes {@code x·(1 + scale·g)} with g standard normal, or
 * {@code scale·g} when x is zero. B and Δ stay positive. Fixed coordinates are never touched.
 */
public final class GuessPerturbation {

    private GuessPerturbation() {}

    /**
     * @param guess the guess to perturb
     * @param mask which coordinates are fixed
     * @param rng the random source; its state advances
     * @param scale relative perturbation size
     * @return the perturbed guess
     */
    public static ParameterVector perturb(ParameterVector guess, FitMask mask,
                                          UniformRandomProvider rng, double scale) {
        NormalizedGaussianSampler gaussian = ZigguratSampler.NormalizedGaussian.of(rng);
        ParameterVector result = guess;
        for (Parameter parameter : mask.freeParameters()) {
            double value = guess.get(parameter);
            double g = gaussian.sample();
            double moved = value == 0.0 ? scale * g : value * (1.0 + scale * g);
            if (parameter == Parameter.B || parameter == Parameter.DELTA) {
                moved = Math.abs(moved);
                if (moved == 0.0) {
                    moved = Math.abs(value);
                }
            }
            result = result.with(parameter, moved);
        }
        return result;
    }
}
