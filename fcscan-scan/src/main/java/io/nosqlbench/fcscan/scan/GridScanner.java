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

import io.nosqlbench.fcscan.fit.FitMask;
import io.nosqlbench.fcscan.fit.FitNonConvergenceException;
import io.nosqlbench.fcscan.fit.FitResult;
import io.nosqlbench.fcscan.fit.GuessPerturbation;
import io.nosqlbench.fcscan.fit.SpectrumFitter;
import io.nosqlbench.fcscan.model.BinIndexSet;
import io.nosqlbench.fcscan.model.CountSpectrum;
import io.nosqlbench.fcscan.model.NuisancePrior;
import io.nosqlbench.fcscan.model.ParameterVector;
import io.nosqlbench.fcscan.model.SpectrumModel;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Estimates the Feldman-Cousins coverage probability at every point of an (m, Δ) grid.
 *
 * <p>At each grid point the observed spectrum is profiled: m and Δ are pinned to the
 * point and the nuisance parameters are fitted, giving the observed statistic. That
 * profile fit is then the hypothesis from which pseudo-experiments are drawn; each is
 * profiled at the same point, and the coverage estimate is the fraction whose statistic
 * lies strictly below the observed one.
 *
 * <p>A fit that does not converge is retried once from a perturbed guess. A fit that
 * fails twice is excluded: a pseudo-experiment is dropped from its point's estimate,
 * and a real-data failure drops the whole point. If the fraction of excluded fits over
 * the scan exceeds {@link ScanConfig#maxNonConvergenceRate()} the scan fails with a
 * {@link CalibrationException}.
 *
 * <p>Grid point {@code i} draws all its randomness from {@link RandomStreams#stream(long)}
 * with index {@code i}, so {@link #evaluatePoint} gives the same outcome no matter which
 * other points are evaluated, or in what order.
 */
public class GridScanner {

    private static final Logger logger = LogManager.getLogger(GridScanner.class);

    private final SpectrumModel model;
    private final SpectrumFitter fitter;
    private final BinIndexSet bins;
    private final NuisancePrior prior;
    private final ParameterVector initialGuess;
    private final ScanConfig config;
    private final RandomStreams streams;
    private final PseudoExperimentGenerator generator;

    public GridScanner(SpectrumModel model, SpectrumFitter fitter, BinIndexSet bins,
                       NuisancePrior prior, ParameterVector initialGuess, ScanConfig config) {
        this(model, fitter, bins, prior, initialGuess, config, new PseudoExperimentGenerator());
    }

    public GridScanner(SpectrumModel model, SpectrumFitter fitter, BinIndexSet bins,
                       NuisancePrior prior, ParameterVector initialGuess, ScanConfig config,
                       PseudoExperimentGenerator generator) {
        this.model = Objects.requireNonNull(model, "model cannot be null");
        this.fitter = Objects.requireNonNull(fitter, "fitter cannot be null");
        this.bins = Objects.requireNonNull(bins, "bins cannot be null");
        this.prior = Objects.requireNonNull(prior, "prior cannot be null");
        this.initialGuess = Objects.requireNonNull(initialGuess, "initialGuess cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.generator = Objects.requireNonNull(generator, "generator cannot be null");
        this.streams = config.randomStreams();
        if (config.nuisanceSource() == NuisanceSource.PRIOR_SAMPLED && prior.isEmpty()) {
            throw new IllegalArgumentException("Prior-sampled nuisances need a non-empty nuisance prior");
        }
    }

    /**
     * Runs the full scan over the observed spectrum.
     *
     * @param observed the observed counts
     * @return the coverage surface with its bookkeeping
     * @throws FitNonConvergenceException if the global fit fails even after its retry
     * @throws CalibrationException if too many fits were excluded
     * @throws SamplingException if a hypothesis cannot be sampled
     */
    public ScanResult scan(CountSpectrum observed) {
        GridSpec grid = config.grid();
        checkTailResolution();
        logger.info("Scanning {} grid points with {} pseudo-experiments each ({} nuisances, {})",
            grid.size(), config.pseudoExperiments(), config.nuisanceSource(), config.testStatistic());

        FitResult global = globalFit(observed);
        logger.info("Global fit: lambda={} at {}", global.lambda(), global.parameters());

        int fitsAttempted = 1;
        int fitsExcluded = 0;
        int pointsBelowGlobal = 0;
        List<CoverageEstimate> estimates = new ArrayList<>(grid.size());
        List<GridPoint> excludedPoints = new ArrayList<>();
        for (int index = 0; index < grid.size(); index++) {
            PointOutcome outcome = evaluatePoint(index, observed, global);
            fitsAttempted += outcome.fitsAttempted();
            fitsExcluded += outcome.fitsExcluded();
            if (outcome.belowGlobalMinimum()) {
                pointsBelowGlobal++;
            }
            if (outcome.isExcluded()) {
                excludedPoints.add(outcome.point());
            }
            estimates.add(outcome.estimate());
            if (outcome.isExcluded()) {
                logger.debug("Point {}/{} {}: excluded", index + 1, grid.size(), outcome.point());
            } else {
                logger.debug("Point {}/{} {}: p={} +/- {}", index + 1, grid.size(), outcome.point(),
                    outcome.estimate().probability(), outcome.estimate().standardError());
            }
        }

        ScanStatistics statistics =
            new ScanStatistics(fitsAttempted, fitsExcluded, excludedPoints.size(), pointsBelowGlobal);
        logger.info("Scan finished: {} fits, {} excluded (rate {}), {} points excluded, {} below global minimum",
            statistics.fitsAttempted(), statistics.fitsExcluded(), statistics.nonConvergenceRate(),
            statistics.pointsExcluded(), statistics.pointsBelowGlobalMinimum());
        if (statistics.nonConvergenceRate() > config.maxNonConvergenceRate()) {
            throw new CalibrationException(fitsExcluded, fitsAttempted, config.maxNonConvergenceRate());
        }
        return new ScanResult(global, new CoverageSurface(grid, estimates), excludedPoints, statistics);
    }

    /**
     * Fits all six parameters to the observed spectrum, retrying once on failure.
     *
     * @param observed the observed counts
     * @return the converged global fit
     * @throws FitNonConvergenceException if the retry also fails
     */
    public FitResult globalFit(CountSpectrum observed) {
        UniformRandomProvider rng = streams.globalStream();
        FitResult result = fitWithRetry(observed, FitMask.global(), initialGuess, rng);
        if (!result.converged()) {
            logger.error("Global fit did not converge: {}", result);
        }
        return result.requireConverged();
    }

    /**
     * Evaluates a single grid point.
     *
     * @param index the grid index
     * @param observed the observed counts
     * @param global the global fit of the observed counts
     * @return the point's estimate and fit bookkeeping
     */
    public PointOutcome evaluatePoint(int index, CountSpectrum observed, FitResult global) {
        GridPoint point = config.grid().point(index);
        UniformRandomProvider rng = streams.stream(index);
        FitMask mask = FitMask.pointOfInterest();

        ParameterVector start = global.parameters().withPointOfInterest(point.mass(), point.delta());
        FitResult profile = fitWithRetry(observed, mask, start, rng);
        if (!profile.converged()) {
            logger.warn("Excluding grid point {}: profile fit of the observed spectrum did not converge", point);
            return new PointOutcome(index, point, null, 1, 1, false);
        }

        boolean belowGlobal = profile.lambda() < global.lambda() - config.globalMinimumTolerance();
        if (belowGlobal) {
            logger.warn("Profile lambda {} at {} is below the global minimum {}; the global fit missed a deeper minimum",
                profile.lambda(), point, global.lambda());
        }
        double observedStatistic = config.testStatistic() == TestStatistic.LIKELIHOOD_RATIO
            ? Math.max(0.0, profile.lambda() - global.lambda())
            : profile.lambda();

        ParameterVector hypothesis = profile.parameters();
        boolean priorSampled = config.nuisanceSource() == NuisanceSource.PRIOR_SAMPLED;
        PseudoExperimentGenerator.Batch batch =
            priorSampled ? null : generator.batch(model.meanSpectrum(hypothesis, bins), rng);
        NormalizedGaussianSampler gaussian = priorSampled ? ZigguratSampler.NormalizedGaussian.of(rng) : null;

        int attempted = 1;
        int excluded = 0;
        int usable = 0;
        int below = 0;
        for (int n = 0; n < config.pseudoExperiments(); n++) {
            ParameterVector truth = hypothesis;
            CountSpectrum pseudo;
            if (priorSampled) {
                truth = generator.sampleNuisances(hypothesis, prior, gaussian);
                pseudo = generator.generate(model.meanSpectrum(truth, bins), rng);
            } else {
                pseudo = batch.next();
            }

            attempted++;
            FitResult pseudoProfile = fitWithRetry(pseudo, mask, truth, rng);
            if (!pseudoProfile.converged()) {
                excluded++;
                continue;
            }
            double statistic = pseudoProfile.lambda();
            if (config.testStatistic() == TestStatistic.LIKELIHOOD_RATIO) {
                attempted++;
                FitResult pseudoGlobal = fitWithRetry(pseudo, FitMask.global(), truth, rng);
                if (!pseudoGlobal.converged()) {
                    excluded++;
                    continue;
                }
                statistic = Math.max(0.0, pseudoProfile.lambda() - Math.min(pseudoGlobal.lambda(), pseudoProfile.lambda()));
            }
            usable++;
            if (statistic < observedStatistic) {
                below++;
            }
        }

        if (usable == 0) {
            logger.warn("Excluding grid point {}: none of {} pseudo-experiments could be fitted",
                point, config.pseudoExperiments());
            return new PointOutcome(index, point, null, attempted, excluded, belowGlobal);
        }
        CoverageEstimate estimate = new CoverageEstimate(point, (double) below / usable, observedStatistic,
            usable, config.pseudoExperiments() - usable);
        return new PointOutcome(index, point, estimate, attempted, excluded, belowGlobal);
    }

    private FitResult fitWithRetry(CountSpectrum counts, FitMask mask, ParameterVector guess,
                                   UniformRandomProvider rng) {
        FitResult first = fitter.fit(counts, bins, mask, guess);
        if (first.converged()) {
            return first;
        }
        ParameterVector perturbed = GuessPerturbation.perturb(guess, mask, rng, config.retryPerturbationScale());
        logger.debug("Fit did not converge after {} evaluations, retrying from {}", first.evaluations(), perturbed);
        return fitter.fit(counts, bins, mask, perturbed);
    }

    private void checkTailResolution() {
        for (double sigma : config.contourSigmas()) {
            int minimum = ConfidenceLevels.minimumPseudoExperiments(sigma, config.tailResolutionFactor());
            if (config.pseudoExperiments() < minimum) {
                logger.warn("{} pseudo-experiments per point cannot resolve the {} sigma contour; at least {} are needed",
                    config.pseudoExperiments(), sigma, minimum);
            }
        }
    }
}
