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
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Runs a delegate fitter from the initial guess and from {@code starts} perturbed
 * copies of it, keeping the lowest λ.
 *
 * <p>Converged results always win over non-converged ones. Perturbations come from a
 * generator re-created from the same seed on every call, so a given input always
 * yields the same result.
 */
public class MultiStartFitter implements SpectrumFitter {

    private static final Logger logger = LogManager.getLogger(MultiStartFitter.class);

    private final SpectrumFitter delegate;
    private final int starts;
    private final double scale;
    private final long seed;

    /**
     * @param delegate the local fitter
     * @param starts number of perturbed starts besides the initial guess
     * @param scale relative perturbation size, see {@link GuessPerturbation}
     * @param seed seed of the perturbation generator
     */
    public MultiStartFitter(SpectrumFitter delegate, int starts, double scale, long seed) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
        if (starts < 0) {
            throw new IllegalArgumentException("starts cannot be negative, got " + starts);
        }
        this.starts = starts;
        this.scale = scale;
        this.seed = seed;
    }

    @Override
    public FitResult fit(CountSpectrum counts, BinIndexSet bins, FitMask mask, ParameterVector initialGuess) {
        FitResult best = delegate.fit(counts, bins, mask, initialGuess);
        if (mask.freeCount() == 0) {
            return best;
        }
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(seed);
        for (int start = 0; start < starts; start++) {
            ParameterVector guess = GuessPerturbation.perturb(initialGuess, mask, rng, scale);
            FitResult candidate = delegate.fit(counts, bins, mask, guess);
            if (isBetter(candidate, best)) {
                logger.debug("Start {} improved lambda from {} to {}", start + 1, best.lambda(), candidate.lambda());
                best = candidate;
            }
        }
        return best;
    }

    private static boolean isBetter(FitResult candidate, FitResult incumbent) {
        if (candidate.converged() != incumbent.converged()) {
            return candidate.converged();
        }
        return candidate.lambda() < incumbent.lambda();
    }
}
