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

import org.apache.commons.math3.special.Gamma;

import java.util.Arrays;
import java.util.Objects;

/**
 * Observed or simulated event counts per bin.
 *
 * <p>The data-only term {@code Σ log(d_k!)} of the Poisson likelihood is computed once,
 * with log-gamma, when the spectrum is created.
 */
public final class CountSpectrum {

    private final int[] counts;
    private final double logFactorialSum;

    private CountSpectrum(int[] counts) {
        this.counts = counts;
        double sum = 0.0;
        for (int count : counts) {
            sum += Gamma.logGamma(count + 1.0);
        }
        this.logFactorialSum = sum;
    }

    /**
     * Wraps a copy of the given counts.
     *
     * @param counts per-bin event counts
     * @return the spectrum
     * @throws IllegalArgumentException if any count is negative
     */
    public static CountSpectrum of(int... counts) {
        Objects.requireNonNull(counts, "counts cannot be null");
        int[] copy = counts.clone();
        for (int i = 0; i < copy.length; i++) {
            if (copy[i] < 0) {
                throw new IllegalArgumentException("Negative count " + copy[i] + " in bin position " + i);
            }
        }
        return new CountSpectrum(copy);
    }

    public int size() {
        return counts.length;
    }

    /**
     * @param position 0-based bin position
     * @return the count in that bin
     */
    public int count(int position) {
        return counts[position];
    }

    public long total() {
        long total = 0;
        for (int count : counts) {
            total += count;
        }
        return total;
    }

    /** @return {@code Σ log(d_k!)} over all bins */
    public double logFactorialSum() {
        return logFactorialSum;
    }

    public int[] toArray() {
        return counts.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CountSpectrum && Arrays.equals(counts, ((CountSpectrum) o).counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return "CountSpectrum" + Arrays.toString(counts);
    }
}
