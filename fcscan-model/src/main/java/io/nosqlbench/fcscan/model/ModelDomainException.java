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

/// Thrown when the spectrum model is evaluated outside its domain.
///
/// This covers B = 0 or Δ = 0, non-finite parameters, and any evaluation
/// that yields a non-finite or negative mean. It indicates a misconfigured
/// parameter grid or prior and is never retried.
public class ModelDomainException extends RuntimeException {

    private final ParameterVector parameters;

    public ModelDomainException(String message) {
        this(message, null);
    }

    public ModelDomainException(String message, ParameterVector parameters) {
        super(parameters == null ? message : message + " at " + parameters);
        this.parameters = parameters;
    }

    /// @return the offending parameters, or null when not known
    public ParameterVector getParameters() {
        return parameters;
    }
}
