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

/**
 * Dense, contiguous, 1-based bin indices {@code 1..N_b} of an energy spectrum.
 *
 * <p>The indices are the k values plugged into the spectrum model, so the
 * 1-based convention is part of the model's meaning (the peak position m is
 * expressed in the same units).
 */
public final class BinIndexSet {

    private final int size;

    private BinIndexSet(int size) {
        this.size = size;
    }

    /**
     * Creates the bin index set {@code 1..binCount}.
     *
     * @param binCount number of bins, at least one
     * @return the index set
     */
    public static BinIndexSet of(int binCount) {
        if (binCount < 1) {
            throw new IllegalArgumentException("binCount must be at least 1, got " + binCount);
        }
        return new BinIndexSet(binCount);
    }

    /** @return N_b */
    public int size() {
        return size;
    }

    /**
     * @param position 0-based position in the set
     * @return the bin index k at that position
     */
    public int index(int position) {
        if (position < 0 || position >= size) {
            throw new IndexOutOfBoundsException("position " + position + " outside 0.." + (size - 1));
        }
        return position + 1;
    }

    public int first() {
        return 1;
    }

    public int last() {
        return size;
    }

    /** @return the bin indices in order */
    public int[] indices() {
        int[] indices = new int[size];
        for (int i = 0; i < size; i++) {
            indices[i] = i + 1;
        }
        return indices;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BinIndexSet && ((BinIndexSet) o).size == size;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(size);
    }

    @Override
    public String toString() {
        return "BinIndexSet[1.." + size + "]";
    }
}
