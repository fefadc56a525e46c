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
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Nelder-Mead fitter for the {@link ConstraintPolicy#ABSOLUTE_VALUE} policy.
 *
 * <p>The simplex roams the whole real line for every free parameter; the model's
 * absolute values keep the means non-negative. Because Nelder-Mead can stall on a
 * collapsed simplex, a converged search is restarted from its optimum with a fresh
 * simplex until λ stops improving by more than {@link FitterConfig#restartTolerance()}.
 * All restarts share one evaluation budget.
 */
public class SimplexSpectrumFitter extends AbstractSpectrumFitter {

    private static final Logger logger = LogManager.getLogger(SimplexSpectrumFitter.class);

    public SimplexSpectrumFitter(SpectrumModel model, FitterConfig config, NuisancePrior prior) {
        super(model, config, prior);
    }

    public SimplexSpectrumFitter(SpectrumModel model) {
        this(model, FitterConfig.defaults(), NuisancePrior.none());
    }

    @Override
    protected boolean minimize(LikelihoodObjective objective, double[] start) {
        double[] point = start;
        double previous = Double.POSITIVE_INFINITY;

        for (int pass = 0; pass <= config.restarts(); pass++) {
            int remaining = config.maxEvaluations() - objective.evaluations();
            if (remaining <= 0) {
                logger.debug("Evaluation budget of {} spent after {} passes", config.maxEvaluations(), pass);
                return false;
            }

            SimplexOptimizer optimizer = new SimplexOptimizer(config.relativeTolerance(), config.absoluteTolerance());
            PointValuePair optimum;
            try {
                optimum = optimizer.optimize(
                    new MaxEval(remaining),
                    new ObjectiveFunction(objective),
                    GoalType.MINIMIZE,
                    new InitialGuess(point),
                    new NelderMeadSimplex(steps(point)));
            } catch (MathIllegalStateException e) {
                logger.debug("Simplex pass {} stopped without converging: {}", pass, e.getMessage());
                return false;
            }

            double value = optimum.getValue();
            if (Math.abs(previous - value) <= config.restartTolerance()) {
                return true;
            }
            previous = value;
            point = optimum.getPoint();
        }

        logger.debug("Lambda still moving after {} restarts, last value {}", config.restarts(), previous);
        return false;
    }

    private double[] steps(double[] point) {
        double[] steps = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            steps[i] = Math.max(Math.abs(point[i]) * config.simplexStepFraction(), config.minimumSimplexStep());
        }
        return steps;
    }
}
