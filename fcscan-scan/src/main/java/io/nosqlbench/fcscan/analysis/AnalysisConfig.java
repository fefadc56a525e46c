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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.fcscan.fit.ConstraintPolicy;
import io.nosqlbench.fcscan.fit.FitterConfig;
import io.nosqlbench.fcscan.fit.PriorMode;
import io.nosqlbench.fcscan.model.BinIndexSet;
import io.nosqlbench.fcscan.model.CountSpectrum;
import io.nosqlbench.fcscan.model.NuisancePrior;
import io.nosqlbench.fcscan.model.Parameter;
import io.nosqlbench.fcscan.model.ParameterVector;
import io.nosqlbench.fcscan.scan.GridSpec;
import io.nosqlbench.fcscan.scan.NuisanceSource;
import io.nosqlbench.fcscan.scan.RandomStreams;
import io.nosqlbench.fcscan.scan.ScanConfig;
import io.nosqlbench.fcscan.scan.TestStatistic;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * JSON-serializable description of a complete profiled Feldman-Cousins analysis:
 * the observed spectrum, the starting point, the nuisance priors, the scan grid and
 * the fitter and scan settings.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "observed": [7, 4, 4, 3, ...],
 *   "initial_guess": {"A": 10.26, "B": 5.16, "C": 3.31, "D": 0.76, "m": 8.0, "delta": 2.0},
 *   "priors": {"A": {"mean": 10.26, "std_dev": 0.3}, ...},   // optional
 *   "grid": {"mass_min": 2, "mass_max": 16, "mass_steps": 8,
 *            "delta_min": 0.5, "delta_max": 5, "delta_steps": 6},
 *   "pseudo_experiments": 1000,
 *   "seed": 12345,
 *   "rng_algorithm": "xo_shi_ro_256_pp",                    // optional
 *   "nuisance_source": "profiled",                          // or "prior_sampled"
 *   "test_statistic": "profile_lambda",                     // or "likelihood_ratio"
 *   "max_non_convergence_rate": 0.01,
 *   "contour_sigmas": [1, 2, 3],
 *   "fitter": {"constraint_policy": "absolute_value", "prior_mode": "none",
 *              "max_evaluations": 20000, "restarts": 5, "restart_tolerance": 1e-6,
 *              "simplex_step_fraction": 0.1, "minimum_simplex_step": 0.01,
 *              "initial_trust_region_radius": 0.5, "stopping_trust_region_radius": 1e-8,
 *              "boundary_tolerance": 1e-6, "multi_starts": 0, "multi_start_scale": 0.2,
 *              "bounds": {"m": [0, 20]}}
 * }
 * }</pre>
 *
 * <p>Absent optional fields fall back to the defaults of {@link ScanConfig} and
 * {@link FitterConfig}. Missing nuisance entries of {@code initial_guess} are taken
 * from the prior means; a missing m or Δ defaults to the centre of the grid.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * AnalysisConfig config = AnalysisConfig.load(Path.of("analysis.json"));
 * ScanResult result = new ProfiledFcAnalysis(config).run();
 * }</pre>
 */
public class AnalysisConfig {

    /** Classpath resource holding the toy analysis. */
    public static final String TOY_ANALYSIS_RESOURCE = "/fcscan-toy-analysis.json";

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("observed")
    private int[] observed;

    @SerializedName("initial_guess")
    private Map<String, Double> initialGuess;

    @SerializedName("priors")
    private Map<String, PriorConfig> priors;

    @SerializedName("grid")
    private GridConfig grid;

    @SerializedName("pseudo_experiments")
    private Integer pseudoExperiments;

    @SerializedName("seed")
    private Long seed;

    @SerializedName("rng_algorithm")
    private String rngAlgorithm;

    @SerializedName("nuisance_source")
    private String nuisanceSource;

    @SerializedName("test_statistic")
    private String testStatistic;

    @SerializedName("max_non_convergence_rate")
    private Double maxNonConvergenceRate;

    @SerializedName("retry_perturbation_scale")
    private Double retryPerturbationScale;

    @SerializedName("global_minimum_tolerance")
    private Double globalMinimumTolerance;

    @SerializedName("tail_resolution_factor")
    private Double tailResolutionFactor;

    @SerializedName("contour_sigmas")
    private double[] contourSigmas;

    @SerializedName("fitter")
    private FitterSettings fitter;

    /**
     * A Gaussian prior on one nuisance parameter.
     */
    public static class PriorConfig {
        @SerializedName("mean")
        private Double mean;

        @SerializedName("std_dev")
        private Double stdDev;

        public PriorConfig() {
        }

        public PriorConfig(double mean, double stdDev) {
            this.mean = mean;
            this.stdDev = stdDev;
        }

        public Double getMean() {
            return mean;
        }

        public Double getStdDev() {
            return stdDev;
        }
    }

    /**
     * The (m, Δ) scan grid.
     */
    public static class GridConfig {
        @SerializedName("mass_min")
        private Double massMin;

        @SerializedName("mass_max")
        private Double massMax;

        @SerializedName("mass_steps")
        private Integer massSteps;

        @SerializedName("delta_min")
        private Double deltaMin;

        @SerializedName("delta_max")
        private Double deltaMax;

        @SerializedName("delta_steps")
        private Integer deltaSteps;

        public GridConfig() {
        }

        public GridConfig(double massMin, double massMax, int massSteps,
                          double deltaMin, double deltaMax, int deltaSteps) {
            this.massMin = massMin;
            this.massMax = massMax;
            this.massSteps = massSteps;
            this.deltaMin = deltaMin;
            this.deltaMax = deltaMax;
            this.deltaSteps = deltaSteps;
        }

        public GridSpec toGridSpec() {
            Objects.requireNonNull(massMin, "grid.mass_min is required");
            Objects.requireNonNull(deltaMin, "grid.delta_min is required");
            int ms = massSteps != null ? massSteps : 1;
            int ds = deltaSteps != null ? deltaSteps : 1;
            return new GridSpec(massMin, massMax != null ? massMax : massMin, ms,
                deltaMin, deltaMax != null ? deltaMax : deltaMin, ds);
        }
    }

    /**
     * Minimizer settings.
     */
    public static class FitterSettings {
        @SerializedName("constraint_policy")
        private String constraintPolicy;

        @SerializedName("prior_mode")
        private String priorMode;

        @SerializedName("max_evaluations")
        private Integer maxEvaluations;

        @SerializedName("relative_tolerance")
        private Double relativeTolerance;

        @SerializedName("absolute_tolerance")
        private Double absoluteTolerance;

        @SerializedName("restarts")
        private Integer restarts;

        @SerializedName("restart_tolerance")
        private Double restartTolerance;

        @SerializedName("simplex_step_fraction")
        private Double simplexStepFraction;

        @SerializedName("minimum_simplex_step")
        private Double minimumSimplexStep;

        @SerializedName("initial_trust_region_radius")
        private Double initialTrustRegionRadius;

        @SerializedName("stopping_trust_region_radius")
        private Double stoppingTrustRegionRadius;

        @SerializedName("boundary_tolerance")
        private Double boundaryTolerance;

        @SerializedName("multi_starts")
        private Integer multiStarts;

        @SerializedName("multi_start_scale")
        private Double multiStartScale;

        @SerializedName("multi_start_seed")
        private Long multiStartSeed;

        /** Per-parameter {@code [lower, upper]} bounds, keyed by parameter label. */
        @SerializedName("bounds")
        private Map<String, double[]> bounds;

        public FitterSettings() {
        }

        public String getConstraintPolicy() {
            return constraintPolicy;
        }

        public void setConstraintPolicy(String constraintPolicy) {
            this.constraintPolicy = constraintPolicy;
        }

        public String getPriorMode() {
            return priorMode;
        }

        public void setPriorMode(String priorMode) {
            this.priorMode = priorMode;
        }

        public Integer getMaxEvaluations() {
            return maxEvaluations;
        }

        public void setMaxEvaluations(Integer maxEvaluations) {
            this.maxEvaluations = maxEvaluations;
        }

        public FitterConfig toFitterConfig() {
            FitterConfig.Builder builder = FitterConfig.builder();
            if (constraintPolicy != null) {
                builder.constraintPolicy(parseEnum(ConstraintPolicy.class, constraintPolicy));
            }
            if (priorMode != null) {
                builder.priorMode(parseEnum(PriorMode.class, priorMode));
            }
            if (maxEvaluations != null) {
                builder.maxEvaluations(maxEvaluations);
            }
            if (relativeTolerance != null) {
                builder.relativeTolerance(relativeTolerance);
            }
            if (absoluteTolerance != null) {
                builder.absoluteTolerance(absoluteTolerance);
            }
            if (restarts != null) {
                builder.restarts(restarts);
            }
            if (restartTolerance != null) {
                builder.restartTolerance(restartTolerance);
            }
            if (simplexStepFraction != null) {
                builder.simplexStepFraction(simplexStepFraction);
            }
            if (minimumSimplexStep != null) {
                builder.minimumSimplexStep(minimumSimplexStep);
            }
            if (initialTrustRegionRadius != null) {
                builder.initialTrustRegionRadius(initialTrustRegionRadius);
            }
            if (stoppingTrustRegionRadius != null) {
                builder.stoppingTrustRegionRadius(stoppingTrustRegionRadius);
            }
            if (boundaryTolerance != null) {
                builder.boundaryTolerance(boundaryTolerance);
            }
            if (multiStarts != null) {
                builder.multiStarts(multiStarts);
            }
            if (multiStartScale != null) {
                builder.multiStartScale(multiStartScale);
            }
            if (multiStartSeed != null) {
                builder.multiStartSeed(multiStartSeed);
            }
            if (bounds != null) {
                Map<Parameter, double[]> parsed = new EnumMap<>(Parameter.class);
                bounds.forEach((name, range) -> {
                    if (range == null || range.length != 2) {
                        throw new IllegalArgumentException("bounds for " + name + " must be [lower, upper]");
                    }
                    parsed.put(Parameter.fromName(name), range);
                });
                builder.bounds(parsed);
            }
            return builder.build();
        }
    }

    public AnalysisConfig() {
    }

    public int[] getObserved() {
        return observed;
    }

    public void setObserved(int[] observed) {
        this.observed = observed;
    }

    public Map<String, Double> getInitialGuess() {
        return initialGuess;
    }

    public void setInitialGuess(Map<String, Double> initialGuess) {
        this.initialGuess = initialGuess;
    }

    public Map<String, PriorConfig> getPriors() {
        return priors;
    }

    public void setPriors(Map<String, PriorConfig> priors) {
        this.priors = priors;
    }

    public GridConfig getGrid() {
        return grid;
    }

    public void setGrid(GridConfig grid) {
        this.grid = grid;
    }

    public Integer getPseudoExperiments() {
        return pseudoExperiments;
    }

    public void setPseudoExperiments(Integer pseudoExperiments) {
        this.pseudoExperiments = pseudoExperiments;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public String getNuisanceSource() {
        return nuisanceSource;
    }

    public void setNuisanceSource(String nuisanceSource) {
        this.nuisanceSource = nuisanceSource;
    }

    public String getTestStatistic() {
        return testStatistic;
    }

    public void setTestStatistic(String testStatistic) {
        this.testStatistic = testStatistic;
    }

    public FitterSettings getFitter() {
        return fitter;
    }

    public void setFitter(FitterSettings fitter) {
        this.fitter = fitter;
    }

    /**
     * @return the observed spectrum
     * @throws NullPointerException if {@code observed} is absent
     */
    public CountSpectrum observedCounts() {
        Objects.requireNonNull(observed, "observed is required");
        return CountSpectrum.of(observed);
    }

    /** @return bins 1..n for the n observed counts */
    public BinIndexSet binIndexSet() {
        return BinIndexSet.of(observedCounts().size());
    }

    public NuisancePrior nuisancePrior() {
        if (priors == null || priors.isEmpty()) {
            return NuisancePrior.none();
        }
        NuisancePrior.Builder builder = NuisancePrior.builder();
        priors.forEach((name, prior) -> {
            Objects.requireNonNull(prior.getMean(), "priors." + name + ".mean is required");
            Objects.requireNonNull(prior.getStdDev(), "priors." + name + ".std_dev is required");
            builder.term(Parameter.fromName(name), prior.getMean(), prior.getStdDev());
        });
        return builder.build();
    }

    public GridSpec gridSpec() {
        Objects.requireNonNull(grid, "grid is required");
        return grid.toGridSpec();
    }

    /**
     * Builds the starting point of the global fit.
     *
     * @throws IllegalArgumentException if a nuisance parameter has neither a guess nor a prior
     */
    public ParameterVector initialGuessVector() {
        Map<Parameter, Double> values = new EnumMap<>(Parameter.class);
        if (initialGuess != null) {
            initialGuess.forEach((name, value) -> values.put(Parameter.fromName(name), value));
        }
        NuisancePrior prior = nuisancePrior();
        GridSpec gridSpec = gridSpec();
        double[] vector = new double[Parameter.COUNT];
        for (Parameter parameter : Parameter.values()) {
            Double value = values.get(parameter);
            if (value == null) {
                if (parameter == Parameter.MASS) {
                    value = (gridSpec.massMin() + gridSpec.massMax()) / 2.0;
                } else if (parameter == Parameter.DELTA) {
                    value = (gridSpec.deltaMin() + gridSpec.deltaMax()) / 2.0;
                } else if (prior.contains(parameter)) {
                    value = prior.term(parameter).mean();
                } else {
                    throw new IllegalArgumentException(
                        "initial_guess." + parameter.label() + " is required when no prior covers it");
                }
            }
            vector[parameter.ordinal()] = value;
        }
        return ParameterVector.fromArray(vector);
    }

    public FitterConfig fitterConfig() {
        return fitter == null ? FitterConfig.defaults() : fitter.toFitterConfig();
    }

    public ScanConfig scanConfig() {
        ScanConfig.Builder builder = ScanConfig.builder(gridSpec());
        if (pseudoExperiments != null) {
            builder.pseudoExperiments(pseudoExperiments);
        }
        if (seed != null) {
            builder.masterSeed(seed);
        }
        if (rngAlgorithm != null) {
            builder.algorithm(RandomStreams.Algorithm.fromName(rngAlgorithm));
        }
        if (nuisanceSource != null) {
            builder.nuisanceSource(parseEnum(NuisanceSource.class, nuisanceSource));
        }
        if (testStatistic != null) {
            builder.testStatistic(parseEnum(TestStatistic.class, testStatistic));
        }
        if (maxNonConvergenceRate != null) {
            builder.maxNonConvergenceRate(maxNonConvergenceRate);
        }
        if (retryPerturbationScale != null) {
            builder.retryPerturbationScale(retryPerturbationScale);
        }
        if (globalMinimumTolerance != null) {
            builder.globalMinimumTolerance(globalMinimumTolerance);
        }
        if (tailResolutionFactor != null) {
            builder.tailResolutionFactor(tailResolutionFactor);
        }
        if (contourSigmas != null) {
            builder.contourSigmas(contourSigmas);
        }
        return builder.build();
    }

    /**
     * Loads an AnalysisConfig from JSON.
     *
     * @param json the JSON string
     * @return the parsed configuration
     * @throws JsonParseException if the JSON is malformed
     */
    public static AnalysisConfig fromJson(String json) {
        return requirePresent(GSON.fromJson(json, AnalysisConfig.class));
    }

    /**
     * Loads an AnalysisConfig from a Reader.
     *
     * @param reader the reader providing JSON
     * @return the parsed configuration
     */
    public static AnalysisConfig fromJson(Reader reader) {
        return requirePresent(GSON.fromJson(reader, AnalysisConfig.class));
    }

    /**
     * Loads an AnalysisConfig from a JSON file.
     *
     * @param path the file to read
     * @return the parsed configuration
     * @throws IOException if the file cannot be read
     */
    public static AnalysisConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    /**
     * The bundled toy analysis: a twenty-bin spectrum with Gaussian priors on all
     * four nuisance parameters.
     */
    public static AnalysisConfig toyAnalysis() {
        try (InputStream stream = AnalysisConfig.class.getResourceAsStream(TOY_ANALYSIS_RESOURCE)) {
            if (stream == null) {
                throw new IllegalStateException("Missing classpath resource " + TOY_ANALYSIS_RESOURCE);
            }
            return fromJson(new InputStreamReader(stream, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + TOY_ANALYSIS_RESOURCE, e);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            toJson(writer);
        }
    }

    private static AnalysisConfig requirePresent(AnalysisConfig config) {
        if (config == null) {
            throw new JsonParseException("Empty analysis configuration");
        }
        return config;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + value, e);
        }
    }
}
