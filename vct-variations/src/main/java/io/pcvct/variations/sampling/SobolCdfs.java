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

import io.pcvct.variations.VariationValidationException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.random.SobolSequenceGenerator;

import java.util.Arrays;

/**
 * Sobol design coordinates from the commons-math3 generator (Joe-Kuo direction numbers).
 *
 * <p>A design of {@code n} points with {@code matrixCount} matrices over {@code d}
 * dimensions draws points of dimension {@code d * matrixCount}; the first {@code d}
 * coordinates of each point belong to matrix 0, the next {@code d} to matrix 1,
 * and so on.
 */
public final class SobolCdfs {

    private SobolCdfs() {
    }

    /**
     * @param n the number of design points
     * @param d the number of dimensions
     * @param matrixCount the number of matrices
     * @param randomization applied to drawn points
     * @param subsequence the part of the sequence to use
     * @return coordinates indexed {@code [dimension][matrix][point]}
     */
    public static double[][][] generate(int n, int d, int matrixCount, SobolRandomization randomization,
                                        SobolSubsequence subsequence) {
        if (d < 1 || matrixCount < 1) {
            throw new VariationValidationException("Sobol design needs at least one dimension and one matrix, got d="
                + d + ", matrices=" + matrixCount);
        }
        int width = Math.multiplyExact(d, matrixCount);
        SobolSequenceGenerator generator;
        try {
            generator = new SobolSequenceGenerator(width);
        } catch (MathIllegalArgumentException e) {
            throw new VariationValidationException("Sobol sequence cannot provide " + width + " coordinates", e);
        }

        int draws = subsequence.draws(n);
        double[][] points = new double[draws][];
        for (int i = 0; i < draws; i++) {
            points[i] = (i == 0 && subsequence.skip() > 0) ? generator.skipTo(subsequence.skip()) : generator.nextVector();
        }
        randomization.apply(points);

        double[][][] cube = new double[d][matrixCount][n];
        for (int i = 0; i < n; i++) {
            double[] point;
            if (i < draws) {
                point = points[i];
            } else {
                point = new double[width];
                Arrays.fill(point, 1.0);
            }
            for (int m = 0; m < matrixCount; m++) {
                for (int j = 0; j < d; j++) {
                    cube[j][m][i] = point[m * d + j];
                }
            }
        }
        return cube;
    }
}
