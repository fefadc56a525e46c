package io.nosqlbench.fcscan.model;

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

import java.util.Objects;

/**
 * Poisson negative log-likelihood of a count spectrum under a mean spectrum.
 *
 * <p>Per bin the contribution is {@code μ_k − d_k·log(μ_k) + log(d_k!)}, with the
 * factorial term taken from {@link CountSpectrum#logFactorialSum()} (log-gamma,
 * never Stirling). A bin with {@code d_k > 0} and {@code μ_k ≤ 0} makes the whole
 * likelihood {@code +∞}; the result is never NaN.
 */
public final class PoissonLikelihood {

    private PoissonLikelihood() {}

    /**
     * @param mean the hypothesized means
     * @param counts the observed or simulated counts
     * @return {@code Σ_k (μ_k − d_k·log(μ_k) + log(d_k!))}, possibly {@code +∞}
     */
    public static double negLogLikelihood(MeanSpectrum mean, CountSpectrum counts) {
        Objects.requireNonNull(mean, "mean cannot be null");
        Objects.requireNonNull(counts, "counts cannot be null");
        if (mean.size() != counts.size()) {
            throw new IllegalArgumentException(
                "Spectrum sizes differ: " + mean.size() + " means vs " + counts.size() + " counts");
        }

        double sum = 0.0;
        for (int i = 0; i < mean.size(); i++) {
            double mu = mean.mean(i);
            int d = counts.count(i);
            if (d == 0) {
                sum += mu;
            } else if (mu <= 0.0) {
                return Double.POSITIVE_INFINITY;
            } else {
                sum += mu - d * Math.log(mu);
            }
        }
        return sum + counts.logFactorialSum();
    }

    /**
     * The test statistic λ, twice the negative log-likelihood.
     */
    public static double lambda(MeanSpectrum mean, CountSpectrum counts) {
        return 2.0 * negLogLikelihood(mean, counts);
    }
}
