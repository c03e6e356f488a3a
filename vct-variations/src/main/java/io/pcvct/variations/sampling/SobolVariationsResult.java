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

import io.pcvct.variations.VariationId;

import java.util.List;

/**
 * Result of {@link SobolVariation}.
 *
 * <p>The design consists of {@code n} points, each split into
 * {@code matrixCount} matrices of {@code d} coordinates. Ids are ordered by
 * point, then by matrix.
 */
public final class SobolVariationsResult extends AddVariationsResult {

    private final double[][][] cube;
    private final int sampleCount;
    private final int matrixCount;

    SobolVariationsResult(List<VariationId> variationIds, double[][][] cube, int sampleCount, int matrixCount) {
        super(variationIds);
        this.cube = cube;
        this.sampleCount = sampleCount;
        this.matrixCount = matrixCount;
    }

    public int sampleCount() {
        return sampleCount;
    }

    public int matrixCount() {
        return matrixCount;
    }

    /**
     * @param sample the point index
     * @param matrix the matrix index
     * @return the id of that point's row in that matrix
     */
    public VariationId variationId(int sample, int matrix) {
        return variationIds().get(sample * matrixCount + matrix);
    }

    /**
     * @param dimension the dimension index
     * @param matrix the matrix index
     * @param sample the point index
     * @return the coordinate
     */
    public double cdf(int dimension, int matrix, int sample) {
        return cube[dimension][matrix][sample];
    }

    /**
     * @param matrix the matrix index
     * @return that matrix's coordinates, one row per sample and one column per dimension
     */
    public double[][] matrix(int matrix) {
        double[][] rows = new double[sampleCount][cube.length];
        for (int i = 0; i < sampleCount; i++) {
            for (int d = 0; d < cube.length; d++) {
                rows[i][d] = cube[d][matrix][i];
            }
        }
        return rows;
    }
}
