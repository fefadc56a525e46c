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

/// A parametric model of the mean counts per bin of an energy spectrum.
///
/// ## Contract
///
/// Implementations are pure functions: the same parameters and bins always
/// produce the same [MeanSpectrum], of the same length as the bin set, with
/// every mean finite and non-negative.
///
/// ## Non-negativity
///
/// How a model keeps its means non-negative is part of its documented policy.
/// [BackgroundPlusPeakModel] wraps the amplitude terms in absolute values, so
/// minimizers may search over the whole real line for those parameters, and
/// [#canonical(ParameterVector)] maps any such vector to its physical
/// equivalent.
///
/// @see BackgroundPlusPeakModel
public interface SpectrumModel {

    /// Computes the Poisson mean of every bin.
    ///
    /// @param parameters the model parameters
    /// @param bins the bin indices to evaluate
    /// @return the mean spectrum, one mean per bin
    /// @throws ModelDomainException if the parameters are outside the model's domain
    MeanSpectrum meanSpectrum(ParameterVector parameters, BinIndexSet bins);

    /// Checks that the parameters can be evaluated at all.
    ///
    /// @param parameters the parameters to check
    /// @throws ModelDomainException if they cannot
    void validate(ParameterVector parameters);

    /// Returns the physically meaningful representative of a parameter vector,
    /// which produces the same mean spectrum.
    ///
    /// @param parameters any evaluable parameter vector
    /// @return the canonical vector
    ParameterVector canonical(ParameterVector parameters);
}
