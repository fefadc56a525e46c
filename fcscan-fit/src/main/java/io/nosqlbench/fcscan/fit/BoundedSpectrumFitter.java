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
import io.nosqlbench.fcscan.model.Parameter;
import io.nosqlbench.fcscan.model.SpectrumModel;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * BOBYQA fitter for the {@link ConstraintPolicy#BOUNDED} policy.
 *
 * <p>The free parameters are boxed by {@link FitterConfig#lowerBound(Parameter)} and
 * {@link FitterConfig#upperBound(Parameter)}; the start point is clamped into the box.
 * BOBYQA interpolates a quadratic model of λ, so rejected candidates are reported as
 * {@link #INVALID_LAMBDA} rather than infinity. It needs at least two free parameters.
 */
public class BoundedSpectrumFitter extends AbstractSpectrumFitter {

    private static final Logger logger = LogManager.getLogger(BoundedSpectrumFitter.class);

    /** Finite stand-in for λ = +∞. */
    public static final double INVALID_LAMBDA = 1.0e12;

    public BoundedSpectrumFitter(SpectrumModel model, FitterConfig config, NuisancePrior prior) {
        super(model, config, prior);
    }

    @Override
    protected double invalidValue() {
        return INVALID_LAMBDA;
    }

    @Override
    protected boolean minimize(LikelihoodObjective objective, double[] start) {
        Parameter[] free = objective.freeParameters();
        if (free.length < 2) {
            throw new IllegalArgumentException(
                "Bounded fits need at least two free parameters, got " + free.length);
        }

        double[] lower = new double[free.length];
        double[] upper = new double[free.length];
        double[] clamped = new double[free.length];
        for (int i = 0; i < free.length; i++) {
            lower[i] = config.lowerBound(free[i]);
            upper[i] = config.upperBound(free[i]);
            clamped[i] = Math.min(Math.max(start[i], lower[i]), upper[i]);
        }

        BOBYQAOptimizer optimizer = new BOBYQAOptimizer(
            2 * free.length + 1, config.initialTrustRegionRadius(), config.stoppingTrustRegionRadius());
        try {
            optimizer.optimize(
                new MaxEval(config.maxEvaluations()),
                new ObjectiveFunction(objective),
                GoalType.MINIMIZE,
                new InitialGuess(clamped),
                new SimpleBounds(lower, upper));
            return true;
        } catch (MathIllegalStateException e) {
            logger.debug("BOBYQA stopped without converging after {} evaluations: {}",
                objective.evaluations(), e.getMessage());
            return false;
        }
    }
}
