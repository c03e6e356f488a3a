package io.pcvct.variations.sampling;

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

import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class RandomGeneratorsTest {

    @Test
    void permutationsCoverEveryIndex() {
        int[] permutation = RandomGenerators.permutation(20, RandomGenerators.create(12L));
        int[] sorted = permutation.clone();
        Arrays.sort(sorted);
        for (int i = 0; i < 20; i++) {
            assertThat(sorted[i]).isEqualTo(i);
        }
    }

    @Test
    void seedsAreReproducible() {
        for (RandomGenerators.Algorithm algorithm : RandomGenerators.Algorithm.values()) {
            UniformRandomProvider a = RandomGenerators.create(algorithm, 2024L);
            UniformRandomProvider b = RandomGenerators.create(algorithm, 2024L);
            assertThat(a.nextLong()).as(algorithm.name()).isEqualTo(b.nextLong());
        }
        assertThat(RandomGenerators.permutation(10, RandomGenerators.create(5L)))
            .isEqualTo(RandomGenerators.permutation(10, RandomGenerators.create(5L)));
    }
}
