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
import org.apache.commons.rng.sampling.PermutationSampler;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Seeded random number generators for sampling designs.
 *
 * <p>Every random design takes its {@link UniformRandomProvider} explicitly, so
 * that a study is reproducible from its seed. These helpers create providers and
 * draw the permutations the designs are built from.
 */
public final class RandomGenerators {

    /**
     * PRNG algorithms offered for study seeds.
     */
    public enum Algorithm {
        /** XorShiro256++, 256-bit state; the default. */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),
        /** XorShiro128++, 128-bit state. */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),
        /** SplitMix64, 64-bit state. */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),
        /** Mersenne Twister, 19937-bit state. */
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /**
     * @param algorithm the PRNG algorithm
     * @param seed the seed
     * @return a new provider
     */
    public static UniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /**
     * @param seed the seed
     * @return a new XorShiro256++ provider
     */
    public static UniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Draws a uniformly random permutation of {@code 0 .. n-1}.
     *
     * @param n the permutation length
     * @param rng the random source
     * @return a shuffled array of the integers 0 to n-1
     */
    public static int[] permutation(int n, UniformRandomProvider rng) {
        int[] permutation = PermutationSampler.natural(n);
        PermutationSampler.shuffle(rng, permutation);
        return permutation;
    }
}
