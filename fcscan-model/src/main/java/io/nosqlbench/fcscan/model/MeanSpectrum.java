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

import java.util.Arrays;
import java.util.Objects;

/**
 * Poisson means per bin, derived from a {@link ParameterVector} by a {@link SpectrumModel}.
 *
 * <p>Every element is finite and non-negative. Instances are recomputed from their
 * parameters whenever needed and are never persisted on their own.
 */
public final class MeanSpectrum {

    private final double[] means;

    private MeanSpectrum(double[] means) {
        this.means = means;
    }

    /**
     * Wraps a copy of the given means.
     *
     * @param means per-bin Poisson means
     * @return the spectrum
     * @throws ModelDomainException if any mean is negative or not finite
     */
    public static MeanSpectrum of(double... means) {
        Objects.requireNonNull(means, "means cannot be null");
        double[] copy = means.clone();
        for (int i = 0; i < copy.length; i++) {
            if (!Double.isFinite(copy[i]) || copy[i] < 0.0) {
                throw new ModelDomainException("Invalid mean " + copy[i] + " in bin position " + i);
            }
        }
        return new MeanSpectrum(copy);
    }

    public int size() {
        return means.length;
    }

    /**
     * @param position 0-based bin position
     * @return the Poisson mean of that bin
     */
    public double mean(int position) {
        return means[position];
    }

    /** @return sum of all bin means */
    public double total() {
        double total = 0.0;
        for (double mean : means) {
            total += mean;
        }
        return total;
    }

    public double[] toArray() {
        return means.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MeanSpectrum && Arrays.equals(means, ((MeanSpectrum) o).means);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(means);
    }

    @Override
    public String toString() {
        return "MeanSpectrum" + Arrays.toString(means);
    }
}
