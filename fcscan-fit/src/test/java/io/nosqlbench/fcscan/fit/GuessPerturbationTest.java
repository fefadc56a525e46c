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

import io.nosqlbench.fcscan.model.Parameter;
import io.nosqlbench.fcscan.model.ParameterVector;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

@Tag("unit")
public class GuessPerturbationTest {

    @Test
    void testOnlyFreeParametersMove() {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(99L);
        ParameterVector guess = ParameterVector.of(10.2, 5.3, 3.5, 0.0, 8.3, 1.8);

        for (int i = 0; i < 100; i++) {
            ParameterVector moved = GuessPerturbation.perturb(guess, FitMask.pointOfInterest(), rng, 0.5);
            assertEquals(8.3, moved.mass());
            assertEquals(1.8, moved.delta());
            assertNotEquals(guess.a(), moved.a());
            assertNotEquals(0.0, moved.d());
            assertThat(moved.b()).isGreaterThan(0.0);
        }
    }

    @Test
    void testWidthStaysPositiveWhenFree() {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(5L);
        ParameterVector guess = ParameterVector.of(1, 1, 1, 1, 1, 1);
        for (int i = 0; i < 200; i++) {
            ParameterVector moved = GuessPerturbation.perturb(guess, FitMask.global(), rng, 2.0);
            assertThat(moved.delta()).isGreaterThan(0.0);
            assertThat(moved.b()).isGreaterThan(0.0);
        }
    }

    @Test
    void testFullyFixedMaskReturnsSameValues() {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(5L);
        ParameterVector guess = ParameterVector.of(1, 2, 3, 4, 5, 6);
        FitMask all = FitMask.fixing(Parameter.values());
        assertEquals(guess, GuessPerturbation.perturb(guess, all, rng, 1.0));
    }
}
