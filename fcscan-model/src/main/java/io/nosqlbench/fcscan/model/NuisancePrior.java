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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * External Gaussian knowledge about nuisance parameters, as (mean, standard deviation) pairs.
 *
 * <p>Depending on configuration it seeds fits, enters λ as the additive penalty
 * {@link #penalty(ParameterVector)}, or centers the nuisance draws of
 * pseudo-experiments. It is constant for a run.
 */
public final class NuisancePrior {

    /**
     * Gaussian prior term for one nuisance parameter.
     *
     * @param mean the prior mean
     * @param stdDev the prior standard deviation, strictly positive
     */
    public record Term(double mean, double stdDev) {
        public Term {
            if (!Double.isFinite(mean)) {
                throw new IllegalArgumentException("mean must be finite, got " + mean);
            }
            if (!(stdDev > 0.0) || !Double.isFinite(stdDev)) {
                throw new IllegalArgumentException("stdDev must be positive and finite, got " + stdDev);
            }
        }
    }

    private static final NuisancePrior NONE = new NuisancePrior(new EnumMap<>(Parameter.class));

    private final Map<Parameter, Term> terms;

    private NuisancePrior(EnumMap<Parameter, Term> terms) {
        this.terms = Collections.unmodifiableMap(terms);
    }

    /** @return a prior carrying no information */
    public static NuisancePrior none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public boolean contains(Parameter parameter) {
        return terms.containsKey(parameter);
    }

    /**
     * @param parameter a nuisance parameter with a prior term
     * @return its term
     * @throws IllegalArgumentException if there is no term for the parameter
     */
    public Term term(Parameter parameter) {
        Term term = terms.get(parameter);
        if (term == null) {
            throw new IllegalArgumentException("No prior for parameter " + parameter.label());
        }
        return term;
    }

    public Set<Parameter> parameters() {
        return terms.keySet();
    }

    /**
     * Gaussian penalty in λ units: {@code Σ ((θ − mean)/σ)²}, which is twice the
     * negative log of the Gaussian prior density up to a constant.
     *
     * @param parameters canonical parameter values
     * @return the penalty, zero for an empty prior
     */
    public double penalty(ParameterVector parameters) {
        double penalty = 0.0;
        for (Map.Entry<Parameter, Term> entry : terms.entrySet()) {
            Term term = entry.getValue();
            double z = (parameters.get(entry.getKey()) - term.mean()) / term.stdDev();
            penalty += z * z;
        }
        return penalty;
    }

    /**
     * Replaces the prior-covered nuisance values of a vector with the prior means.
     */
    public ParameterVector applyMeans(ParameterVector parameters) {
        ParameterVector result = parameters;
        for (Map.Entry<Parameter, Term> entry : terms.entrySet()) {
            result = result.with(entry.getKey(), entry.getValue().mean());
        }
        return result;
    }

    @Override
    public String toString() {
        return "NuisancePrior" + terms;
    }

    /** Builder for {@link NuisancePrior}. */
    public static final class Builder {

        private final EnumMap<Parameter, Term> terms = new EnumMap<>(Parameter.class);

        private Builder() {}

        /**
         * Adds a Gaussian term.
         *
         * @throws IllegalArgumentException if the parameter is a parameter of interest
         */
        public Builder term(Parameter parameter, double mean, double stdDev) {
            Objects.requireNonNull(parameter, "parameter cannot be null");
            if (parameter.isOfInterest()) {
                throw new IllegalArgumentException(
                    "Priors apply to nuisance parameters only, not " + parameter.label());
            }
            terms.put(parameter, new Term(mean, stdDev));
            return this;
        }

        public NuisancePrior build() {
            return new NuisancePrior(new EnumMap<>(terms));
        }
    }
}
