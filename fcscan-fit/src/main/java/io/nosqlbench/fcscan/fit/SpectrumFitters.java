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

import io.nosqlbench.fcscan.model.NuisancePrior;
import io.nosqlbench.fcscan.model.SpectrumModel;

/**
 * Builds the fitter a {@link FitterConfig} describes.
 */
public final class SpectrumFitters {

    private SpectrumFitters() {}

    /**
     * @param model the spectrum model
     * @param config minimizer settings; the constraint policy picks the optimizer and a
     *               positive {@link FitterConfig#multiStarts()} wraps it in a {@link MultiStartFitter}
     * @param prior nuisance priors for the optional penalty
     * @return the configured fitter
     */
    public static SpectrumFitter create(SpectrumModel model, FitterConfig config, NuisancePrior prior) {
        SpectrumFitter fitter;
        switch (config.constraintPolicy()) {
            case BOUNDED:
                fitter = new BoundedSpectrumFitter(model, config, prior);
                break;
            case ABSOLUTE_VALUE:
            default:
                fitter = new SimplexSpectrumFitter(model, config, prior);
                break;
        }
        if (config.multiStarts() > 0) {
            fitter = new MultiStartFitter(fitter, config.multiStarts(), config.multiStartScale(), config.multiStartSeed());
        }
        return fitter;
    }
}
