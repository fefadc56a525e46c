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

import io.nosqlbench.fcscan.fit.FitResult;
import io.nosqlbench.fcscan.fit.SpectrumFitter;
import io.nosqlbench.fcscan.fit.SpectrumFitters;
import io.nosqlbench.fcscan.model.BackgroundPlusPeakModel;
import io.nosqlbench.fcscan.model.CountSpectrum;
import io.nosqlbench.fcscan.model.SpectrumModel;
import io.nosqlbench.fcscan.scan.ContourExtractor;
import io.nosqlbench.fcscan.scan.ContourSegment;
import io.nosqlbench.fcscan.scan.GridScanner;
import io.nosqlbench.fcscan.scan.ScanConfig;
import io.nosqlbench.fcscan.scan.ScanResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

/**
 * Wires a background-plus-peak model, a fitter and a grid scanner together from an
 * {@link AnalysisConfig}.
 */
public class ProfiledFcAnalysis {

    private static final Logger logger = LogManager.getLogger(ProfiledFcAnalysis.class);

    private final CountSpectrum observed;
    private final ScanConfig scanConfig;
    private final GridScanner scanner;

    public ProfiledFcAnalysis(AnalysisConfig config) {
        this(config, new BackgroundPlusPeakModel());
    }

    public ProfiledFcAnalysis(AnalysisConfig config, SpectrumModel model) {
        this.observed = config.observedCounts();
        this.scanConfig = config.scanConfig();
        SpectrumFitter fitter = SpectrumFitters.create(model, config.fitterConfig(), config.nuisancePrior());
        this.scanner = new GridScanner(model, fitter, config.binIndexSet(), config.nuisancePrior(),
            config.initialGuessVector(), scanConfig);
        logger.debug("Analysis of {} bins configured: {}", observed.size(), scanConfig);
    }

    /** @return the global fit of the observed spectrum */
    public FitResult globalFit() {
        return scanner.globalFit(observed);
    }

    /** Runs the full coverage scan. */
    public ScanResult run() {
        return scanner.scan(observed);
    }

    /**
     * Traces the configured contour levels through a scan's coverage surface.
     *
     * @return segments keyed by sigma
     */
    public Map<Double, List<ContourSegment>> contours(ScanResult result) {
        return ContourExtractor.extractSigmas(result.surface(), scanConfig.contourSigmas());
    }

    public GridScanner getScanner() {
        return scanner;
    }

    public CountSpectrum getObserved() {
        return observed;
    }
}
