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
 * Exponential background, Gaussian peak and flat floor:
 *
 * <pre>
 * μ_k = |A|·exp(−k/B) + |C/Δ|·exp(−½·((k−m)/Δ)²) + |D|
 * </pre>
 *
 * <p>Non-negativity policy: the amplitudes A, C/Δ and D enter through absolute
 * values, so every vector with {@code B ≠ 0} and {@code Δ ≠ 0} yields non-negative
 * means. {@code B} and {@code Δ} are denominators and are rejected when zero; they
 * are not clamped here.
 */
public final class BackgroundPlusPeakModel implements SpectrumModel {

    @Override
    public MeanSpectrum meanSpectrum(ParameterVector parameters, BinIndexSet bins) {
        Objects.requireNonNull(bins, "bins cannot be null");
        validate(parameters);

        double a = Math.abs(parameters.a());
        double b = parameters.b();
        double peakAmplitude = Math.abs(parameters.c() / parameters.delta());
        double d = Math.abs(parameters.d());
        double mass = parameters.mass();
        double delta = parameters.delta();

        double[] means = new double[bins.size()];
        for (int i = 0; i < means.length; i++) {
            int k = bins.index(i);
            double z = (k - mass) / delta;
            double mean = a * Math.exp(-k / b) + peakAmplitude * Math.exp(-0.5 * z * z) + d;
            if (!Double.isFinite(mean)) {
                throw new ModelDomainException("Non-finite mean in bin " + k, parameters);
            }
            means[i] = mean;
        }
        return MeanSpectrum.of(means);
    }

    @Override
    public void validate(ParameterVector parameters) {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        if (!parameters.isFinite()) {
            throw new ModelDomainException("Non-finite parameter", parameters);
        }
        if (parameters.b() == 0.0) {
            throw new ModelDomainException("B must be non-zero", parameters);
        }
        if (parameters.delta() == 0.0) {
            throw new ModelDomainException("delta must be non-zero", parameters);
        }
    }

    @Override
    public ParameterVector canonical(ParameterVector parameters) {
        return ParameterVector.of(
            Math.abs(parameters.a()),
            parameters.b(),
            Math.abs(parameters.c()),
            Math.abs(parameters.d()),
            parameters.mass(),
            Math.abs(parameters.delta()));
    }
}
