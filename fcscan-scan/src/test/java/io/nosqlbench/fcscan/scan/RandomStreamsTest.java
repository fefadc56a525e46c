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

import org.apache.commons.rng.RandomProviderState;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

@Tag("unit")
class RandomStreamsTest {

    @Test
    void testSameIndexReproducesSequence() {
        RandomStreams streams = new RandomStreams(12345L);
        RestorableUniformRandomProvider first = streams.stream(7);
        RestorableUniformRandomProvider second = streams.stream(7);

        for (int i = 0; i < 100; i++) {
            assertEquals(first.nextLong(), second.nextLong());
        }
    }

    @Test
    void testEqualMasterSeedsGiveEqualStreams() {
        RestorableUniformRandomProvider a = new RandomStreams(99L).stream(3);
        RestorableUniformRandomProvider b = new RandomStreams(99L).stream(3);

        assertEquals(a.nextDouble(), b.nextDouble());
        assertEquals(a.nextDouble(), b.nextDouble());
    }

    @Test
    void testIndicesGetDistinctSeeds() {
        RandomStreams streams = new RandomStreams(12345L);
        Set<Long> seeds = new HashSet<>();
        for (long index = -1; index < 1000; index++) {
            seeds.add(streams.streamSeed(index));
        }
        assertThat(seeds).hasSize(1001);
    }

    @Test
    void testGlobalStreamIsSeparateFromGridPoints() {
        RandomStreams streams = new RandomStreams(12345L);

        assertEquals(streams.streamSeed(RandomStreams.GLOBAL_STREAM), streams.streamSeed(-1L));
        assertNotEquals(streams.globalStream().nextLong(), streams.stream(0).nextLong());
    }

    @Test
    void testMasterSeedChangesStreams() {
        assertNotEquals(new RandomStreams(1L).stream(0).nextLong(), new RandomStreams(2L).stream(0).nextLong());
    }

    @Test
    void testAlgorithmsDiffer() {
        long seed = 12345L;
        RestorableUniformRandomProvider rng1 = RandomStreams.create(RandomStreams.Algorithm.XO_SHI_RO_256_PP, seed);
        RestorableUniformRandomProvider rng2 = RandomStreams.create(RandomStreams.Algorithm.XO_SHI_RO_128_PP, seed);

        assertNotEquals(rng1.nextLong(), rng2.nextLong());
    }

    @Test
    void testEveryAlgorithmCreatesRestorableStreams() {
        for (RandomStreams.Algorithm algorithm : RandomStreams.Algorithm.values()) {
            RestorableUniformRandomProvider rng = new RandomStreams(algorithm, 42L).stream(5);
            rng.nextInt();
            RandomProviderState state = rng.saveState();
            int c1 = rng.nextInt();
            rng.restoreState(state);
            assertEquals(c1, rng.nextInt(), "restore failed for " + algorithm);
        }
    }

    @Test
    void testAlgorithmFromName() {
        assertEquals(RandomStreams.Algorithm.MT, RandomStreams.Algorithm.fromName("mt"));
        assertEquals(RandomStreams.Algorithm.XO_SHI_RO_256_PP, RandomStreams.Algorithm.fromName("xo_shi_ro_256_pp"));
        assertThatThrownBy(() -> RandomStreams.Algorithm.fromName("lcg"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
