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
import io.nosqlbench.fcscan.model.NuisancePrior;
import io.nosqlbench.fcscan.model.Parameter;
import io.nosqlbench.fcscan.model.ParameterVector;
import io.nosqlbench.fcscan.model.SpectrumModel;

import java.util.Objects;

/**
 * Common framework for fitters that drive a commons-math3 optimizer over a
 * {@link LikelihoodObjective}.
 *
 * <p>This class validates the inputs, builds the objective for the mask, and turns
 * the best candidate into a canonical {@link FitResult}. Subclasses only run their
 * optimizer and report whether it met its stopping criterion.
 */
public abstract class AbstractSpectrumFitter implements SpectrumFitter {

    protected final SpectrumModel model;
    protected final FitterConfig config;
    private final NuisancePrior penaltyPrior;

    /**
     * @param model the spectrum model to fit
     * @param config minimizer settings
     * @param prior nuisance priors, added to λ only under {@link PriorMode#PENALTY}
     */
    protected AbstractSpectrumFitter(SpectrumModel model, FitterConfig config, NuisancePrior prior) {
        this.model = Objects.requireNonNull(model, "model cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(prior, "prior cannot be null");
        this.penaltyPrior = config.priorMode() == PriorMode.PENALTY && !prior.isEmpty() ? prior : null;
    }

    /**
     * Runs the optimizer from the start point.
     *
     * @param objective the objective over the free parameters
     * @param start the free-parameter start point
     * @return true if the optimizer met its stopping criterion
     */
    protected abstract boolean minimize(LikelihoodObjective objective, double[] start);

    /**
     * @return the value reported to the optimizer for rejected candidates
     */
    protected double invalidValue() {
        return Double.POSITIVE_INFINITY;
    }

    @Override
    public FitResult fit(CountSpectrum counts, BinIndexSet bins, FitMask mask, ParameterVector initialGuess) {
        Objects.requireNonNull(counts, "counts cannot be null");
        Objects.requireNonNull(bins, "bins cannot be null");
        Objects.requireNonNull(mask, "mask cannot be null");
        if (counts.size() != bins.size()) {
            throw new IllegalArgumentException(
                "counts has " + counts.size() + " bins but the bin set has " + bins.size());
        }
        model.validate(initialGuess);

        LikelihoodObjective objective = new LikelihoodObjective(
            model, bins, counts, initialGuess, mask.freeParameters(), penaltyPrior, invalidValue());

        boolean converged;
        if (mask.freeCount() == 0) {
            objective.value(new double[0]);
            converged = true;
        } else {
            converged = minimize(objective, objective.project(initialGuess));
        }

        double lambda = objective.bestValue();
        if (!Double.isFinite(lambda)) {
            converged = false;
        }
        ParameterVector best = Double.isFinite(lambda)
            ? model.canonical(objective.bestParameters())
            : initialGuess;
        boolean atBoundary = converged && isAtBoundary(best, objective.freeParameters());
        return new FitResult(best, lambda, converged, atBoundary, objective.evaluations());
    }

    /**
     * @param parameters canonical fitted parameters
     * @param free the parameters that were free in the fit
     * @return true if any free parameter lies within the boundary tolerance of its bounds
     */
    protected boolean isAtBoundary(ParameterVector parameters, Parameter[] free) {
        double tolerance = config.boundaryTolerance();
        for (Parameter parameter : free) {
            double value = parameters.get(parameter);
            if (value - config.lowerBound(parameter) <= tolerance
                || config.upperBound(parameter) - value <= tolerance) {
                return true;
            }
        }
        return false;
    }
}
