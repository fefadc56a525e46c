package io.nosqlbench.fcscan.scan;

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

import java.util.Locale;

/// Thrown when too many fits of a scan failed to converge for its coverage
/// estimates to be trusted.
public class CalibrationException extends RuntimeException {

    private final int excludedFits;
    private final int attemptedFits;

    public CalibrationException(int excludedFits, int attemptedFits, double maxRate) {
        super(String.format(Locale.ROOT, "%d of %d fits did not converge (rate %.4f exceeds limit %.4f)",
            excludedFits, attemptedFits, (double) excludedFits / attemptedFits, maxRate));
        this.excludedFits = excludedFits;
        this.attemptedFits = attemptedFits;
    }

    public int getExcludedFits() {
        return excludedFits;
    }

    public int getAttemptedFits() {
        return attemptedFits;
    }
}
