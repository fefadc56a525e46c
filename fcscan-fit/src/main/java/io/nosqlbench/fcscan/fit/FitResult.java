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

import io.nosqlbench.fcscan.model.ParameterVector;

/// Outcome of one fitter invocation.
///
/// @param parameters the canonical parameters at the minimum found, or the best
///     candidate seen when the fit did not converge
/// @param lambda the minimized test statistic λ, possibly including a prior penalty
/// @param converged false when the minimizer exhausted its budget or failed internally
/// @param atBoundary true when a converged minimum sits on a non-negativity or box bound
/// @param evaluations number of objective evaluations spent
public record FitResult(ParameterVector parameters, double lambda, boolean converged,
                        boolean atBoundary, int evaluations) {

    /// Creates a fit result.
    public FitResult {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters cannot be null");
        }
        if (Double.isNaN(lambda)) {
            throw new IllegalArgumentException("lambda cannot be NaN");
        }
    }

    /// @return this result
    /// @throws FitNonConvergenceException if the fit did not converge
    public FitResult requireConverged() {
        if (!converged) {
            throw new FitNonConvergenceException(this);
        }
        return this;
    }
}
