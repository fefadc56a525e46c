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

/// Thrown when a fit that must converge did not.
///
/// Individual fits report non-convergence through [FitResult#converged()];
/// this exception is raised by callers that cannot continue without a
/// converged result.
public class FitNonConvergenceException extends RuntimeException {

    private final FitResult result;

    public FitNonConvergenceException(FitResult result) {
        this("Fit did not converge after " + result.evaluations() + " evaluations", result);
    }

    public FitNonConvergenceException(String message, FitResult result) {
        super(message + " (best lambda " + result.lambda() + " at " + result.parameters() + ")");
        this.result = result;
    }

    /// @return the last non-converged result
    public FitResult getResult() {
        return result;
    }
}
