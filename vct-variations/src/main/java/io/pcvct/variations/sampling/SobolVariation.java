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

import io.pcvct.variations.ParsedVariations;
import io.pcvct.variations.VariationId;
import io.pcvct.variations.VariationLocation;
import io.pcvct.variations.VariationValidationException;
import io.pcvct.variations.persistence.VariationMaterializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;

/**
 * Quasi-random sampling method based on the Sobol sequence.
 *
 * <p>Each design point carries {@code matrixCount} independent matrices of
 * coordinates, as required by Saltelli-style estimators. Every (point, matrix)
 * pair is materialized as its own parameter set.
 *
 * <pre>{@code
 * SobolVariation sobol = SobolVariation.builder(15)
 *     .matrixCount(2)
 *     .skipStart(SkipStart.auto())
 *     .build();
 * }</pre>
 *
 * @see SobolSubsequence
 */
public final class SobolVariation implements VariationMethod {

    private static final Logger logger = LogManager.getLogger(SobolVariation.class);

    private final int n;
    private final int matrixCount;
    private final SobolRandomization randomization;
    private final SkipStart skipStart;
    private final Boolean includeOne;

    private SobolVariation(Builder builder) {
        this.n = builder.n;
        this.matrixCount = builder.matrixCount;
        this.randomization = builder.randomization;
        this.skipStart = builder.skipStart;
        this.includeOne = builder.includeOne;
    }

    public static Builder builder(int n) {
        return new Builder(n);
    }

    /// @return a builder copying this method's settings
    public Builder toBuilder() {
        return new Builder(n)
            .matrixCount(matrixCount)
            .randomization(randomization)
            .skipStart(skipStart)
            .includeOne(includeOne);
    }

    public int getN() {
        return n;
    }

    public int getMatrixCount() {
        return matrixCount;
    }

    /**
     * Generates the raw design for {@code d} dimensions.
     *
     * @return coordinates indexed {@code [dimension][matrix][point]}
     */
    public double[][][] generateCdfs(int d) {
        SobolSubsequence subsequence = SobolSubsequence.choose(n, skipStart, includeOne);
        logger.debug("Sobol design n={} d={} matrices={} uses {}", n, d, matrixCount, subsequence);
        return SobolCdfs.generate(n, d, matrixCount, randomization, subsequence);
    }

    @Override
    public SobolVariationsResult addVariations(ParsedVariations parsed, VariationId reference,
                                               VariationMaterializer materializer) {
        int d = parsed.dimensionCount();
        double[][][] cube = generateCdfs(d);

        // rows ordered by point, then matrix
        double[][] rows = new double[n * matrixCount][d];
        for (int i = 0; i < n; i++) {
            for (int m = 0; m < matrixCount; m++) {
                for (int j = 0; j < d; j++) {
                    rows[i * matrixCount + m][j] = cube[j][m][i];
                }
            }
        }
        Map<VariationLocation, int[]> ids = new EnumMap<>(VariationLocation.class);
        for (VariationLocation location : parsed.usedLocations()) {
            ids.put(location, materializer.materialize(location, parsed, reference.get(location), rows));
        }
        logger.info("Sobol design: {} points x {} matrices over {} dimensions", n, matrixCount, d);
        return new SobolVariationsResult(AddVariationsResult.combine(ids, reference, rows.length), cube, n, matrixCount);
    }

    @Override
    public String toString() {
        return "SobolVariation{n=" + n + ", matrices=" + matrixCount + ", skipStart=" + skipStart
            + ", includeOne=" + includeOne + "}";
    }

    /**
     * Builder for {@link SobolVariation}.
     */
    public static final class Builder {
        private final int n;
        private int matrixCount = 1;
        private SobolRandomization randomization = SobolRandomization.none();
        private SkipStart skipStart = SkipStart.auto();
        private Boolean includeOne;

        private Builder(int n) {
            this.n = n;
        }

        public Builder matrixCount(int matrixCount) {
            this.matrixCount = matrixCount;
            return this;
        }

        public Builder randomization(SobolRandomization randomization) {
            this.randomization = randomization;
            return this;
        }

        public Builder skipStart(SkipStart skipStart) {
            this.skipStart = skipStart;
            return this;
        }

        /// @param includeOne whether to end with the all-ones point; null leaves it to {@link SobolSubsequence#choose}
        public Builder includeOne(Boolean includeOne) {
            this.includeOne = includeOne;
            return this;
        }

        public SobolVariation build() {
            if (n < 1) {
                throw new VariationValidationException("Sobol design needs at least one point, got " + n);
            }
            if (matrixCount < 1) {
                throw new VariationValidationException("Sobol design needs at least one matrix, got " + matrixCount);
            }
            if (randomization == null || skipStart == null) {
                throw new VariationValidationException("randomization and skipStart must not be null");
            }
            return new SobolVariation(this);
        }
    }
}
