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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Latin hypercube designs on the unit cube.
 *
 * <p>The unit interval is split into {@code n} equal bins. Each column of the
 * design is a permutation of the bins, so every bin is hit exactly once per
 * dimension. A bin contributes its center, or a uniform point inside it when
 * noise is requested.
 *
 * <p>When {@code n = k^d} an orthogonal design can be built instead: the cube is
 * additionally split into {@code k^d} equal sub-cubes and each sub-cube receives
 * exactly one point.
 */
public final class LatinHypercube {

    private LatinHypercube() {
    }

    /**
     * Generates a design.
     *
     * @param n the number of samples
     * @param d the number of dimensions
     * @param addNoise place each point uniformly inside its bin instead of at its center
     * @param orthogonalize use an orthogonal design when {@code n} is a perfect {@code d}-th power
     * @param rng the random source
     * @return the coordinates, one row per sample and one column per dimension
     */
    public static double[][] generate(int n, int d, boolean addNoise, boolean orthogonalize, UniformRandomProvider rng) {
        if (n < 1) {
            throw new IllegalArgumentException("Latin hypercube needs at least one sample, got " + n);
        }
        if (d < 1) {
            throw new IllegalArgumentException("Latin hypercube needs at least one dimension, got " + d);
        }
        double[] binValues = new double[n];
        for (int i = 0; i < n; i++) {
            double offset = addNoise ? rng.nextDouble() : 0.5;
            binValues[i] = (i + 1 - offset) / n;
        }

        int[][] bins;
        int k = orthogonalSide(n, d);
        if (orthogonalize && k > 0) {
            bins = orthogonalIndices(k, d, rng);
        } else {
            bins = new int[n][d];
            for (int j = 0; j < d; j++) {
                int[] permutation = RandomGenerators.permutation(n, rng);
                for (int i = 0; i < n; i++) {
                    bins[i][j] = permutation[i];
                }
            }
        }

        double[][] cdfs = new double[n][d];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < d; j++) {
                cdfs[i][j] = binValues[bins[i][j]];
            }
        }
        return cdfs;
    }

    /**
     * @return {@code k} when {@code n == k^d} for {@code k = round(n^(1/d))}, otherwise 0
     */
    static int orthogonalSide(int n, int d) {
        int k = (int) Math.round(Math.pow(n, 1.0 / d));
        return pow(k, d) == n ? k : 0;
    }

    /**
     * Builds an orthogonal Latin hypercube of {@code k^d} points.
     *
     * <p>Dimensions are filled one at a time. Before dimension {@code i} is filled,
     * the rows are sorted so that consecutive blocks share one coarse cell of the
     * first {@code i} dimensions. One row is taken from each block at a time and
     * those rows receive a shuffled run of consecutive bins, which keeps every
     * coarse cell of the new dimension balanced across the existing blocks.
     *
     * @param k the number of coarse cells per dimension
     * @param d the number of dimensions
     * @param rng the random source
     * @return bin indices in {@code 0 .. k^d - 1}, one row per sample
     */
    static int[][] orthogonalIndices(int k, int d, UniformRandomProvider rng) {
        int n = pow(k, d);
        int coarseWidth = n / k;
        int[][] rows = new int[n][d];
        for (int i = 0; i < d; i++) {
            if (i == 0) {
                for (int r = 0; r < n; r++) {
                    rows[r][0] = r;
                }
            } else {
                int blockCount = pow(k, i);
                int blockSize = pow(k, d - i);
                List<List<Integer>> blocks = new ArrayList<>(blockCount);
                for (int b = 0; b < blockCount; b++) {
                    List<Integer> block = new ArrayList<>(blockSize);
                    for (int r = b * blockSize; r < (b + 1) * blockSize; r++) {
                        block.add(r);
                    }
                    blocks.add(block);
                }
                for (int point = 0; point < blockSize; point++) {
                    int[] chosen = new int[blockCount];
                    for (int b = 0; b < blockCount; b++) {
                        List<Integer> block = blocks.get(b);
                        chosen[b] = block.remove(rng.nextInt(block.size()));
                    }
                    int[] permutation = RandomGenerators.permutation(blockCount, rng);
                    for (int b = 0; b < blockCount; b++) {
                        rows[chosen[b]][i] = permutation[b] + point * blockCount;
                    }
                }
            }
            final int sorted = i + 1;
            Arrays.sort(rows, coarseOrder(sorted, coarseWidth));
        }
        return rows;
    }

    private static Comparator<int[]> coarseOrder(int columns, int coarseWidth) {
        return (a, b) -> {
            for (int c = 0; c < columns; c++) {
                int cmp = Integer.compare(a[c] / coarseWidth, b[c] / coarseWidth);
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
    }

    static int pow(int base, int exponent) {
        int result = 1;
        for (int i = 0; i < exponent; i++) {
            result = Math.multiplyExact(result, base);
        }
        return result;
    }
}
