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
import io.nosqlbench.fcscan.model.ModelDomainException;
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
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class SimplexSpectrumFitterTest {

    private final SpectrumModel model = new BackgroundPlusPeakModel();
    private final SimplexSpectrumFitter fitter = new SimplexSpectrumFitter(model);

    private double lambdaAt(ParameterVector parameters) {
        return PoissonLikelihood.lambda(model.meanSpectrum(parameters, BINS), OBSERVED);
    }

    @Test
    void testFlatModelFitsSampleMean() {
        // With A = C = 0 held fixed the model reduces to μ_k = |D|
        FitMask onlyD = FitMask.fixing(Parameter.A, Parameter.B, Parameter.C, Parameter.MASS, Parameter.DELTA);
        ParameterVector guess = ParameterVector.of(0.0, 1.0, 0.0, 1.0, 5.0, 1.0);

        FitResult result = fitter.fit(OBSERVED, BINS, onlyD, guess);

        double sampleMean = (double) OBSERVED.total() / OBSERVED.size();
        assertTrue(result.converged());
        assertEquals(sampleMean, result.parameters().d(), 1e-4);
        assertEquals(0.0, result.parameters().a());
        assertEquals(5.0, result.parameters().mass());
    }

    @Test
    void testGlobalFitBeatsTruth() {
        FitResult result = fitter.fit(OBSERVED, BINS, FitMask.global(), TRUTH);

        assertTrue(result.converged());
        assertThat(result.lambda()).isFinite();
        assertThat(result.lambda()).isLessThanOrEqualTo(lambdaAt(TRUTH));
        assertThat(result.lambda()).isCloseTo(ToyData.GLOBAL_LAMBDA, within(1e-2));
        assertThat(result.lambda()).isCloseTo(lambdaAt(result.parameters()), within(1e-9));
    }

    @Test
    void testGlobalFitReportsCanonicalParameters() {
        ParameterVector flipped = ParameterVector.of(-10.2, 5.3, -3.5, -0.7, 8.3, 1.8);
        FitResult result = fitter.fit(OBSERVED, BINS, FitMask.global(), flipped);

        assertThat(result.parameters().a()).isGreaterThanOrEqualTo(0.0);
        assertThat(result.parameters().c()).isGreaterThanOrEqualTo(0.0);
        assertThat(result.parameters().d()).isGreaterThanOrEqualTo(0.0);
        assertThat(result.parameters().delta()).isGreaterThan(0.0);
    }

    @Test
    void testProfileFitKeepsPointOfInterestPinned() {
        ParameterVector guess = TRUTH.withPointOfInterest(12.0, 2.5);
        FitResult result = fitter.fit(OBSERVED, BINS, FitMask.pointOfInterest(), guess);

        assertTrue(result.converged());
        assertEquals(12.0, result.parameters().mass());
        assertEquals(2.5, result.parameters().delta());
    }

    @Test
    void testProfileAtGlobalOptimumRecoversGlobalLambda() {
        FitResult global = fitter.fit(OBSERVED, BINS, FitMask.global(), TRUTH);
        FitResult profile = fitter.fit(OBSERVED, BINS, FitMask.pointOfInterest(), global.parameters());

        assertTrue(profile.converged());
        assertEquals(global.lambda(), profile.lambda(), 1e-4);
    }

    @Test
    void testProfileLambdaNeverBelowGlobalMinimum() {
        FitResult global = fitter.fit(OBSERVED, BINS, FitMask.global(), TRUTH);
        for (double mass : new double[]{3.0, 8.0, 15.0}) {
            for (double delta : new double[]{0.5, 2.0, 4.0}) {
                ParameterVector guess = global.parameters().withPointOfInterest(mass, delta);
                FitResult profile = fitter.fit(OBSERVED, BINS, FitMask.pointOfInterest(), guess);
                assertThat(profile.lambda())
                    .as("profile at m=%s delta=%s", mass, delta)
                    .isGreaterThanOrEqualTo(global.lambda() - 1e-6);
            }
        }
    }

    @Test
    void testExhaustedBudgetIsReportedAsNonConvergence() {
        SimplexSpectrumFitter starved = new SimplexSpectrumFitter(
            model, FitterConfig.builder().maxEvaluations(10).build(), NuisancePrior.none());

        FitResult result = starved.fit(OBSERVED, BINS, FitMask.global(), TRUTH);

        assertThat(result.converged()).isFalse();
        assertThat(result.atBoundary()).isFalse();
        assertThat(result.lambda()).isLessThanOrEqualTo(lambdaAt(TRUTH));
        assertThatThrownBy(result::requireConverged).isInstanceOf(FitNonConvergenceException.class);
    }

    @Test
    void testUnevaluableInitialGuessIsDomainError() {
        ParameterVector badGuess = TRUTH.with(Parameter.B, 0.0);
        assertThatThrownBy(() -> fitter.fit(OBSERVED, BINS, FitMask.global(), badGuess))
            .isInstanceOf(ModelDomainException.class);
    }

    @Test
    void testBinCountMismatchRejected() {
        assertThatThrownBy(() -> fitter.fit(OBSERVED, io.nosqlbench.fcscan.model.BinIndexSet.of(10),
            FitMask.global(), TRUTH))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testZeroAmplitudeFitIsFlaggedAtBoundary() {
        // A peak just past the last bin only adds events where few were seen, so C goes to zero
        FitMask mask = FitMask.fixing(Parameter.A, Parameter.B, Parameter.D, Parameter.MASS, Parameter.DELTA);
        ParameterVector guess = TRUTH.withPointOfInterest(22.0, 2.0);

        FitResult result = fitter.fit(OBSERVED, BINS, mask, guess);

        assertTrue(result.converged());
        assertThat(result.atBoundary()).isTrue();
    }
}
