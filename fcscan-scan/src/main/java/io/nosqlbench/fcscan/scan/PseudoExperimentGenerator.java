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

import io.nosqlbench.fcscan.model.CountSpectrum;
import io.nosqlbench.fcscan.model.MeanSpectrum;
import io.nosqlbench.fcscan.model.NuisancePrior;
import io.nosqlbench.fcscan.model.Parameter;
import io.nosqlbench.fcscan.model.ParameterVector;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.PoissonSampler;
import org.apache.commons.rng.sampling.distribution.SharedStateDiscreteSampler;

/**
 * Draws pseudo-experiment count spectra from a hypothesized mean spectrum.
 *
 * <p>Every bin is an independent Poisson draw. A bin with mean zero always yields
 * zero counts. All randomness comes from the provider handed in, so equal provider
 * states give equal spectra.
 */
public class PseudoExperimentGenerator {

    /** Largest mean the Poisson sampler accepts; the large-mean sampler stops at half the int range. */
    public static final double MAX_MEAN = 0.5 * Integer.MAX_VALUE;

    /** Redraws allowed before prior sampling gives up on an unphysical value. */
    public static final int MAX_PRIOR_REDRAWS = 100;

    /**
     * Draws a single spectrum.
     *
     * @param mean the hypothesized means
     * @param rng the random source; its state advances
     * @return the drawn counts, one per bin
     * @throws SamplingException if a mean exceeds {@link #MAX_MEAN}
     */
    public CountSpectrum generate(MeanSpectrum mean, UniformRandomProvider rng) {
        return batch(mean, rng).next();
    }

    /**
     * Prepares per-bin samplers for repeated draws from the same means.
     *
     * @param mean the hypothesized means
     * @param rng the random source the batch draws from
     * @return a batch producing one spectrum per {@link Batch#next()} call
     * @throws SamplingException if a mean exceeds {@link #MAX_MEAN}
     */
    public Batch batch(MeanSpectrum mean, UniformRandomProvider rng) {
        SharedStateDiscreteSampler[] samplers = new SharedStateDiscreteSampler[mean.size()];
        for (int i = 0; i < samplers.length; i++) {
            double binMean = mean.mean(i);
            if (binMean > MAX_MEAN) {
                throw new SamplingException("Mean " + binMean + " of bin position " + i
                    + " exceeds the Poisson sampler limit " + MAX_MEAN);
            }
            samplers[i] = binMean > 0.0 ? poissonSampler(rng, binMean, i) : null;
        }
        return new Batch(samplers);
    }

    private static SharedStateDiscreteSampler poissonSampler(UniformRandomProvider rng, double mean, int position) {
        try {
            return PoissonSampler.of(rng, mean);
        } catch (IllegalArgumentException e) {
            throw new SamplingException("Poisson sampler rejected mean " + mean + " of bin position " + position
                + ": " + e.getMessage(), e);
        }
    }

    /**
     * Replaces every nuisance parameter the prior covers with a Gaussian draw around
     * the prior mean. B is redrawn until positive; A, C and D enter the model through
     * absolute values and are taken as drawn.
     *
     * @param base the vector supplying parameters the prior does not cover
     * @param prior the nuisance prior
     * @param gaussian a standard normal sampler
     * @return the sampled vector
     * @throws SamplingException if B stays non-positive for {@link #MAX_PRIOR_REDRAWS} draws
     */
    public ParameterVector sampleNuisances(ParameterVector base, NuisancePrior prior,
                                           NormalizedGaussianSampler gaussian) {
        ParameterVector sampled = base;
        for (Parameter parameter : prior.parameters()) {
            NuisancePrior.Term term = prior.term(parameter);
            double value = term.mean() + term.stdDev() * gaussian.sample();
            if (parameter == Parameter.B) {
                int redraws = 0;
                while (value <= 0.0) {
                    if (++redraws > MAX_PRIOR_REDRAWS) {
                        throw new SamplingException("Prior for B (mean " + term.mean() + ", sd "
                            + term.stdDev() + ") produced no positive value in " + MAX_PRIOR_REDRAWS + " draws");
                    }
                    value = term.mean() + term.stdDev() * gaussian.sample();
                }
            }
            sampled = sampled.with(parameter, value);
        }
        return sampled;
    }

    /**
     * Repeated draws from one mean spectrum.
     */
    public static final class Batch {
        private final SharedStateDiscreteSampler[] samplers;

        private Batch(SharedStateDiscreteSampler[] samplers) {
            this.samplers = samplers;
        }

        public int size() {
            return samplers.length;
        }

        public CountSpectrum next() {
            int[] counts = new int[samplers.length];
            for (int i = 0; i < samplers.length; i++) {
                counts[i] = samplers[i] == null ? 0 : samplers[i].sample();
            }
            return CountSpectrum.of(counts);
        }
    }
}
