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

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.core.source64.SplitMix64;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Deterministic, independent random streams derived from a single master seed.
 *
 * <p>Each stream is keyed by a long index. Grid point {@code i} of a scan draws from
 * stream {@code i}; the global fit of the real data draws from {@link #GLOBAL_STREAM}.
 * A stream depends only on the master seed, the algorithm and its own index, so the
 * points of a scan can be evaluated in any order and still give identical results.
 *
 * <p>The seed of stream {@code k} is the first output of a SplitMix64 generator
 * started at {@code masterSeed ^ mix(k)}, where {@code mix} is SplitMix64's own
 * output function. Distinct indices therefore never share a starting state.
 */
public class RandomStreams {

    /** Stream index reserved for the global fit of the observed spectrum. */
    public static final long GLOBAL_STREAM = -1L;

    /**
     * PRNG algorithms a scan may run on.
     * XO_SHI_RO_256_PP is the default for its statistical quality and speed.
     */
    public enum Algorithm {
        /**
         * XorShiro256++, 256-bit state, period 2^256 - 1.
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * XorShiro128++, 128-bit state, period 2^128 - 1.
         */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),

        /**
         * SplitMix64, 64-bit state, period 2^64.
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /**
         * Mersenne Twister, 19937-bit state.
         */
        MT(RandomSource.MT),

        /**
         * KISS, 128-bit state.
         */
        KISS(RandomSource.KISS);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }

        /**
         * Resolves an algorithm by name, ignoring case.
         *
         * @param name the algorithm name
         * @return the matching algorithm
         * @throws IllegalArgumentException if no algorithm has that name
         */
        public static Algorithm fromName(String name) {
            for (Algorithm algorithm : values()) {
                if (algorithm.name().equalsIgnoreCase(name)) {
                    return algorithm;
                }
            }
            throw new IllegalArgumentException("Unknown random algorithm: " + name);
        }
    }

    private final Algorithm algorithm;
    private final long masterSeed;

    public RandomStreams(Algorithm algorithm, long masterSeed) {
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm must not be null");
        }
        this.algorithm = algorithm;
        this.masterSeed = masterSeed;
    }

    public RandomStreams(long masterSeed) {
        this(Algorithm.XO_SHI_RO_256_PP, masterSeed);
    }

    /**
     * Creates a generator with the given algorithm, seeded directly.
     *
     * @param algorithm the PRNG algorithm to use
     * @param seed the seed
     * @return a uniform random provider
     */
    public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return (RestorableUniformRandomProvider) algorithm.getSource().create(seed);
    }

    /**
     * Creates a fresh generator for a stream. Calling this twice with the same index
     * yields two generators producing the same sequence.
     *
     * @param index the stream index
     * @return a new generator positioned at the start of the stream
     */
    public RestorableUniformRandomProvider stream(long index) {
        return create(algorithm, streamSeed(index));
    }

    /** @return a fresh generator for the global fit */
    public RestorableUniformRandomProvider globalStream() {
        return stream(GLOBAL_STREAM);
    }

    /**
     * The seed handed to the generator of a stream.
     *
     * @param index the stream index
     * @return the derived seed
     */
    public long streamSeed(long index) {
        long streamKey = new SplitMix64(index).nextLong();
        return new SplitMix64(masterSeed ^ streamKey).nextLong();
    }
}
