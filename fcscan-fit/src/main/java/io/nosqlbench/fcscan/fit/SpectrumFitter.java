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

/// Minimizes the test statistic λ of a count spectrum over a subset of the model parameters.
///
/// ## Fit Modes
///
/// ```
/// FitMask.global()           all six parameters free      → λ_B, the unconditional best fit
/// FitMask.pointOfInterest()  m, Δ pinned at a grid point  → λ_p, the profile fit
/// ```
///
/// Fixed parameters keep the values they have in the initial guess. The fitter
/// is a local minimizer: the caller supplies a good initial guess, typically the
/// global best fit's nuisance values.
///
/// ## Failure Signalling
///
/// A fit that exhausts its budget returns a result with
/// [FitResult#converged()] false rather than throwing; a converged fit resting
/// on a constraint is reported through [FitResult#atBoundary()] instead.
///
/// @see SimplexSpectrumFitter
/// @see BoundedSpectrumFitter
/// @see MultiStartFitter
public interface SpectrumFitter {

    /// Fits the model to the counts.
    ///
    /// @param counts observed or simulated counts
    /// @param bins the bin indices the counts belong to
    /// @param mask which parameters are held fixed
    /// @param initialGuess the starting point, also supplying the fixed values
    /// @return the fit result
    /// @throws io.nosqlbench.fcscan.model.ModelDomainException if the initial guess is not evaluable
    FitResult fit(CountSpectrum counts, BinIndexSet bins, FitMask mask, ParameterVector initialGuess);
}
