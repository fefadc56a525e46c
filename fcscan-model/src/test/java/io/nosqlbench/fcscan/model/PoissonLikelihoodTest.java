package io.nosqlbench.fcscan.model;

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

import org.apache.commons.math3.util.CombinatoricsUtils;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
public class PoissonLikelihoodTest {

    private static final int[] OBSERVED = {7, 4, 4, 3, 4, 6, 5, 3, 6, 5, 4, 1, 3, 0, 1, 1, 2, 0, 1, 0};

    @Test
    void testSingleBinMatchesPoissonLogPmf() {
        CountSpectrum counts = CountSpectrum.of(3);
        MeanSpectrum mean = MeanSpectrum.of(2.5);
        double expected = 2.5 - 3 * Math.log(2.5) + Math.log(6.0);

        assertEquals(expected, PoissonLikelihood.negLogLikelihood(mean, counts), 1e-12);
        assertEquals(2 * expected, PoissonLikelihood.lambda(mean, counts), 1e-12);
    }

    @Test
    void testLogFactorialUsesExactValuesForLargeCounts() {
        CountSpectrum counts = CountSpectrum.of(0, 1, 20, 170);
        double expected = CombinatoricsUtils.factorialLog(20) + CombinatoricsUtils.factorialLog(170);
        assertEquals(expected, counts.logFactorialSum(), 1e-9);
    }

    @Test
    void testMinimizedWhereMeansEqualCounts() {
        CountSpectrum counts = CountSpectrum.of(OBSERVED);
        double[] exact = new double[OBSERVED.length];
        for (int i = 0; i < exact.length; i++) {
            exact[i] = Math.max(OBSERVED[i], 0.0);
        }
        double best = PoissonLikelihood.lambda(MeanSpectrum.of(exact), counts);

        for (int i = 0; i < exact.length; i++) {
            for (double shift : new double[]{-0.1, 0.1}) {
                double[] moved = exact.clone();
                moved[i] = Math.max(0.0, moved[i] + shift);
                if (moved[i] == exact[i]) {
                    continue;
                }
                assertThat(PoissonLikelihood.lambda(MeanSpectrum.of(moved), counts)).isGreaterThan(best);
            }
        }
    }

    @Test
    void testConstantModelMinimizedAtSampleMean() {
        CountSpectrum counts = CountSpectrum.of(OBSERVED);
        double sampleMean = (double) counts.total() / counts.size();

        double atMean = PoissonLikelihood.lambda(constant(sampleMean, counts.size()), counts);
        assertThat(PoissonLikelihood.lambda(constant(sampleMean * 0.99, counts.size()), counts)).isGreaterThan(atMean);
        assertThat(PoissonLikelihood.lambda(constant(sampleMean * 1.01, counts.size()), counts)).isGreaterThan(atMean);
    }

    @Test
    void testZeroMeanWithZeroCountIsFinite() {
        double value = PoissonLikelihood.negLogLikelihood(MeanSpectrum.of(0.0, 1.0), CountSpectrum.of(0, 1));
        assertEquals(1.0, value, 1e-12);
    }

    @Test
    void testZeroMeanWithPositiveCountIsInfinite() {
        double value = PoissonLikelihood.negLogLikelihood(MeanSpectrum.of(0.0, 1.0), CountSpectrum.of(2, 1));
        assertThat(value).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void testSizeMismatchRejected() {
        assertThatThrownBy(() -> PoissonLikelihood.lambda(MeanSpectrum.of(1.0), CountSpectrum.of(1, 2)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testInvalidSpectraRejected() {
        assertThatThrownBy(() -> MeanSpectrum.of(1.0, -0.5)).isInstanceOf(ModelDomainException.class);
        assertThatThrownBy(() -> MeanSpectrum.of(Double.NaN)).isInstanceOf(ModelDomainException.class);
        assertThatThrownBy(() -> CountSpectrum.of(1, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    private static MeanSpectrum constant(double value, int size) {
        double[] means = new double[size];
        java.util.Arrays.fill(means, value);
        return MeanSpectrum.of(means);
    }
}
