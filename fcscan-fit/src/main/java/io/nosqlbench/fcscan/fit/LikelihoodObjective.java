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
import io.nosqlbench.fcscan.model.MeanSpectrum;
import io.nosqlbench.fcscan.model.ModelDomainException;
import io.nosqlbench.fcscan.model.NuisancePrior;
import io.nosqlbench.fcscan.model.Parameter;
import io.nosqlbench.fcscan.model.ParameterVector;
import io.nosqlbench.fcscan.model.PoissonLikelihood;
import io.nosqlbench.fcscan.model.SpectrumModel;
import org.apache.commons.math3.analysis.MultivariateFunction;

/**
 * λ as a function of the free parameters only, with the fixed ones taken from a template.
 *
 * <p>Candidates with {@code B ≤ 0}, {@code Δ ≤ 0}, non-finite coordinates, or an
 * unevaluable spectrum are rejected with {@code +∞}; optimizers that cannot handle
 * infinities see {@code invalidValue} instead. The best candidate seen is retained
 * so a budget-exhausted fit can still report where it got to.
 *
 * <p>Not thread-safe; one instance serves one fit.
 */
final class LikelihoodObjective implements MultivariateFunction {

    private final SpectrumModel model;
    private final BinIndexSet bins;
    private final CountSpectrum counts;
    private final double[] template;
    private final Parameter[] free;
    private final NuisancePrior penaltyPrior;
    private final double invalidValue;

    private int evaluations;
    private double bestValue = Double.POSITIVE_INFINITY;
    private ParameterVector bestParameters;

    LikelihoodObjective(SpectrumModel model, BinIndexSet bins, CountSpectrum counts,
                        ParameterVector template, Parameter[] free, NuisancePrior penaltyPrior,
                        double invalidValue) {
        this.model = model;
        this.bins = bins;
        this.counts = counts;
        this.template = template.toArray();
        this.free = free;
        this.penaltyPrior = penaltyPrior;
        this.invalidValue = invalidValue;
        this.bestParameters = template;
    }

    @Override
    public double value(double[] point) {
        evaluations++;
        ParameterVector candidate = expand(point);
        double value = lambda(candidate);
        if (value < bestValue) {
            bestValue = value;
            bestParameters = candidate;
        }
        return Double.isFinite(value) ? value : invalidValue;
    }

    /**
     * Evaluates λ for a full parameter vector without counting it as an evaluation.
     */
    double lambda(ParameterVector candidate) {
        if (!candidate.isFinite() || candidate.b() <= 0.0 || candidate.delta() <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        MeanSpectrum mean;
        try {
            mean = model.meanSpectrum(candidate, bins);
        } catch (ModelDomainException e) {
            // overflowing candidates are rejected like any other out-of-domain point
            return Double.POSITIVE_INFINITY;
        }
        double lambda = PoissonLikelihood.lambda(mean, counts);
        if (penaltyPrior != null && Double.isFinite(lambda)) {
            lambda += penaltyPrior.penalty(model.canonical(candidate));
        }
        return lambda;
    }

    ParameterVector expand(double[] point) {
        double[] full = template.clone();
        for (int i = 0; i < free.length; i++) {
            full[free[i].ordinal()] = point[i];
        }
        return ParameterVector.fromArray(full);
    }

    double[] project(ParameterVector parameters) {
        double[] point = new double[free.length];
        for (int i = 0; i < free.length; i++) {
            point[i] = parameters.get(free[i]);
        }
        return point;
    }

    Parameter[] freeParameters() {
        return free;
    }

    int evaluations() {
        return evaluations;
    }

    double bestValue() {
        return bestValue;
    }

    ParameterVector bestParameters() {
        return bestParameters;
    }
}
