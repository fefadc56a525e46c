package io.nosqlbench.fcscan.analysis;

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

import io.nosqlbench.fcscan.fit.ConstraintPolicy;
import io.nosqlbench.fcscan.fit.FitterConfig;
import io.nosqlbench.fcscan.fit.PriorMode;
import io.nosqlbench.fcscan.model.NuisancePrior;
import io.nosqlbench.fcscan.model.Parameter;
import io.nosqlbench.fcscan.model.ParameterVector;
import io.nosqlbench.fcscan.scan.GridSpec;
import io.nosqlbench.fcscan.scan.NuisanceSource;
import io.nosqlbench.fcscan.scan.RandomStreams;
import io.nosqlbench.fcscan.scan.ScanConfig;
import io.nosqlbench.fcscan.scan.TestStatistic;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class AnalysisConfigTest {

    @Test
    void testToyAnalysisResource() {
        AnalysisConfig config = AnalysisConfig.toyAnalysis();

        assertEquals(20, config.observedCounts().size());
        assertEquals(60, config.observedCounts().total());
        assertEquals(20, config.binIndexSet().size());
        assertEquals(ParameterVector.of(10.26, 5.16, 3.31, 0.76, 8.0, 2.0), config.initialGuessVector());

        NuisancePrior prior = config.nuisancePrior();
        assertThat(prior.parameters()).containsExactly(Parameter.A, Parameter.B, Parameter.C, Parameter.D);
        assertEquals(0.04, prior.term(Parameter.D).stdDev());

        GridSpec grid = config.gridSpec();
        assertEquals(48, grid.size());

        ScanConfig scan = config.scanConfig();
        assertEquals(1000, scan.pseudoExperiments());
        assertEquals(12345L, scan.masterSeed());
        assertEquals(RandomStreams.Algorithm.XO_SHI_RO_256_PP, scan.algorithm());
        assertEquals(NuisanceSource.PROFILED, scan.nuisanceSource());
        assertEquals(TestStatistic.PROFILE_LAMBDA, scan.testStatistic());
        assertArrayEquals(new double[]{1.0, 2.0, 3.0}, scan.contourSigmas());

        FitterConfig fitter = config.fitterConfig();
        assertEquals(ConstraintPolicy.ABSOLUTE_VALUE, fitter.constraintPolicy());
        assertEquals(PriorMode.NONE, fitter.priorMode());
        assertEquals(20_000, fitter.maxEvaluations());
    }

    @Test
    void testMinimalConfigUsesDefaults() {
        AnalysisConfig config = AnalysisConfig.fromJson("""
            {
              "observed": [3, 2, 1, 0],
              "priors": {"A": {"mean": 3.0, "std_dev": 0.5}, "B": {"mean": 2.0, "std_dev": 0.2},
                         "C": {"mean": 1.0, "std_dev": 0.3}, "D": {"mean": 0.1, "std_dev": 0.05}},
              "grid": {"mass_min": 1.0, "mass_max": 3.0, "mass_steps": 3,
                       "delta_min": 0.5, "delta_max": 1.5, "delta_steps": 2}
            }
            """);

        assertEquals(ParameterVector.of(3.0, 2.0, 1.0, 0.1, 2.0, 1.0), config.initialGuessVector());
        ScanConfig scan = config.scanConfig();
        assertEquals(ScanConfig.DEFAULT_PSEUDO_EXPERIMENTS, scan.pseudoExperiments());
        assertEquals(ScanConfig.DEFAULT_MAX_NON_CONVERGENCE_RATE, scan.maxNonConvergenceRate());
        assertEquals(FitterConfig.DEFAULT_MAX_EVALUATIONS, config.fitterConfig().maxEvaluations());
    }

    @Test
    void testFitterSettings() {
        AnalysisConfig config = AnalysisConfig.fromJson("""
            {
              "observed": [1, 2],
              "grid": {"mass_min": 1.0, "delta_min": 1.0},
              "nuisance_source": "prior_sampled",
              "test_statistic": "likelihood_ratio",
              "fitter": {"constraint_policy": "bounded", "prior_mode": "penalty",
                         "max_evaluations": 500, "bounds": {"m": [0.0, 20.0], "A": [0.0, 50.0]}}
            }
            """);

        FitterConfig fitter = config.fitterConfig();
        assertEquals(ConstraintPolicy.BOUNDED, fitter.constraintPolicy());
        assertEquals(PriorMode.PENALTY, fitter.priorMode());
        assertEquals(500, fitter.maxEvaluations());
        assertEquals(20.0, fitter.upperBound(Parameter.MASS));
        assertEquals(50.0, fitter.upperBound(Parameter.A));
        assertEquals(NuisanceSource.PRIOR_SAMPLED, config.scanConfig().nuisanceSource());
        assertEquals(TestStatistic.LIKELIHOOD_RATIO, config.scanConfig().testStatistic());
        assertEquals(1, config.gridSpec().size());
    }

    @Test
    void testFitterTolerancesAreConfigurable() {
        AnalysisConfig config = AnalysisConfig.fromJson("""
            {
              "observed": [1, 2],
              "grid": {"mass_min": 1.0, "delta_min": 1.0},
              "fitter": {"restart_tolerance": 1e-4, "simplex_step_fraction": 0.25,
                         "minimum_simplex_step": 0.05, "initial_trust_region_radius": 2.0,
                         "stopping_trust_region_radius": 1e-6, "boundary_tolerance": 1e-3,
                         "multi_starts": 3, "multi_start_scale": 0.4, "multi_start_seed": 9}
            }
            """);

        FitterConfig fitter = config.fitterConfig();
        assertEquals(1e-4, fitter.restartTolerance());
        assertEquals(0.25, fitter.simplexStepFraction());
        assertEquals(0.05, fitter.minimumSimplexStep());
        assertEquals(2.0, fitter.initialTrustRegionRadius());
        assertEquals(1e-6, fitter.stoppingTrustRegionRadius());
        assertEquals(1e-3, fitter.boundaryTolerance());
        assertEquals(3, fitter.multiStarts());
        assertEquals(0.4, fitter.multiStartScale());
        assertEquals(9L, fitter.multiStartSeed());
    }

    @Test
    void testUnsetFitterTolerancesKeepDefaults() {
        FitterConfig fitter = AnalysisConfig.toyAnalysis().fitterConfig();
        FitterConfig defaults = FitterConfig.defaults();

        assertEquals(defaults.restartTolerance(), fitter.restartTolerance());
        assertEquals(defaults.simplexStepFraction(), fitter.simplexStepFraction());
        assertEquals(defaults.initialTrustRegionRadius(), fitter.initialTrustRegionRadius());
        assertEquals(defaults.boundaryTolerance(), fitter.boundaryTolerance());
        assertEquals(defaults.multiStartScale(), fitter.multiStartScale());
    }

    @Test
    void testMissingNuisanceWithoutPrior() {
        AnalysisConfig config = AnalysisConfig.fromJson("""
            {"observed": [1, 2], "initial_guess": {"A": 1.0, "B": 1.0, "C": 1.0},
             "grid": {"mass_min": 1.0, "delta_min": 1.0}}
            """);

        assertThatThrownBy(config::initialGuessVector)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("initial_guess.D");
    }

    @Test
    void testUnknownNamesAreRejected() {
        AnalysisConfig badSource = AnalysisConfig.fromJson("""
            {"observed": [1], "grid": {"mass_min": 1.0, "delta_min": 1.0}, "nuisance_source": "bootstrap"}
            """);
        assertThatThrownBy(badSource::scanConfig).isInstanceOf(IllegalArgumentException.class);

        AnalysisConfig badPrior = AnalysisConfig.fromJson("""
            {"observed": [1], "priors": {"E": {"mean": 1.0, "std_dev": 1.0}}}
            """);
        assertThatThrownBy(badPrior::nuisancePrior).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testSaveAndLoad(@TempDir Path dir) throws IOException {
        AnalysisConfig original = AnalysisConfig.toyAnalysis();
        original.setPseudoExperiments(250);
        Path file = dir.resolve("analysis.json");

        original.save(file);
        AnalysisConfig loaded = AnalysisConfig.load(file);

        assertEquals(250, loaded.scanConfig().pseudoExperiments());
        assertEquals(original.observedCounts(), loaded.observedCounts());
        assertEquals(original.initialGuessVector(), loaded.initialGuessVector());
        assertEquals(original.gridSpec(), loaded.gridSpec());
    }
}
