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

import io.nosqlbench.fcscan.model.BackgroundPlusPeakModel;
import io.nosqlbench.fcscan.model.NuisancePrior;
import io.nosqlbench.fcscan.model.Parameter;
import io.nosqlbench.fcscan.model.ParameterVector;
import io.nosqlbench.fcscan.model.PoissonLikelihood;
import io.nosqlbench.fcscan.model.SpectrumModel;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static io.nosqlbench.fcscan.fit.ToyData.BINS;
import static io.nosqlbench.fcscan.fit.ToyData.OBSERVED;
import static io.nosqlbench.fcscan.fit.ToyData.TRUTH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class BoundedSpectrumFitterTest {

    private final SpectrumModel model = new BackgroundPlusPeakModel();
    private final FitterConfig config = FitterConfig.builder()
        .constraintPolicy(ConstraintPolicy.BOUNDED)
        .build();
    private final BoundedSpectrumFitter fitter = new BoundedSpectrumFitter(model, config, NuisancePrior.none());

    @Test
    void testGlobalFitBeatsTruthInsideBounds() {
        FitResult result = fitter.fit(OBSERVED, BINS, FitMask.global(), TRUTH);

        double truthLambda = PoissonLikelihood.lambda(model.meanSpectrum(TRUTH, BINS), OBSERVED);
        assertTrue(result.converged());
        assertThat(result.lambda()).isLessThanOrEqualTo(truthLambda);
        for (Parameter parameter : Parameter.values()) {
            assertThat(result.parameters().get(parameter))
                .isBetween(config.lowerBound(parameter), config.upperBound(parameter));
        }
    }

    @Test
    void testStartOutsideBoundsIsClamped() {
        ParameterVector outside = TRUTH.with(Parameter.D, -0.7);
        FitResult result = fitter.fit(OBSERVED, BINS, FitMask.pointOfInterest(), outside);

        assertTrue(result.converged());
        assertThat(result.parameters().d()).isGreaterThanOrEqualTo(0.0);
        assertEquals(TRUTH.mass(), result.parameters().mass());
    }

    @Test
    void testSingleFreeParameterRejected() {
        FitMask onlyD = FitMask.fixing(Parameter.A, Parameter.B, Parameter.C, Parameter.MASS, Parameter.DELTA);
        assertThatThrownBy(() -> fitter.fit(OBSERVED, BINS, onlyD, TRUTH))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("two free parameters");
    }

    @Test
    void testFactoryHonoursPolicy() {
        assertThat(SpectrumFitters.create(model, config, NuisancePrior.none()))
            .isInstanceOf(BoundedSpectrumFitter.class);
        assertThat(SpectrumFitters.create(model, FitterConfig.defaults(), NuisancePrior.none()))
            .isInstanceOf(SimplexSpectrumFitter.class);
        assertThat(SpectrumFitters.create(model, FitterConfig.builder().multiStarts(2).build(), NuisancePrior.none()))
            .isInstanceOf(MultiStartFitter.class);
    }
}
