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

import io.pcvct.variations.DistributedVariation;
import io.pcvct.variations.ParsedVariations;
import io.pcvct.variations.VariationId;
import io.pcvct.variations.VariationLocation;
import io.pcvct.variations.persistence.InMemoryVariationStore;
import io.pcvct.variations.persistence.VariationMaterializer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class SobolCdfsTest {

    private static double[] oneDimensional(int n, SkipStart skip, Boolean includeOne) {
        return SobolVariation.builder(n).skipStart(skip).includeOne(includeOne).build().generateCdfs(1)[0][0];
    }

    @Test
    void powerOfTwoStartsAtTheOrigin() {
        assertThat(oneDimensional(8, SkipStart.auto(), null))
            .containsExactly(new double[]{0.0, 0.5, 0.75, 0.25, 0.375, 0.875, 0.625, 0.125}, within(1e-15));
    }

    @Test
    void oneBelowAPowerOfTwoSkipsTheOrigin() {
        double[] cdfs = oneDimensional(7, SkipStart.auto(), null);
        Arrays.sort(cdfs);
        assertThat(cdfs).containsExactly(new double[]{0.125, 0.25, 0.375, 0.5, 0.625, 0.75, 0.875}, within(1e-15));
    }

    @Test
    void oneAboveAPowerOfTwoEndsAtOne() {
        double[] cdfs = oneDimensional(9, SkipStart.auto(), null);
        assertThat(cdfs[0]).isZero();
        assertThat(cdfs[8]).isEqualTo(1.0);
    }

    @Test
    void commonDenominatorUsesOddNumerators() {
        double[] cdfs = oneDimensional(4, SkipStart.toCommonDenominator(), false);
        Arrays.sort(cdfs);
        assertThat(cdfs).containsExactly(new double[]{0.125, 0.375, 0.625, 0.875}, within(1e-15));
    }

    @Test
    void matricesUseDistinctCoordinates() {
        double[][][] cube = SobolVariation.builder(8).matrixCount(2).build().generateCdfs(2);
        assertThat(cube.length).isEqualTo(2);
        assertThat(cube[0].length).isEqualTo(2);
        assertThat(cube[0][0]).hasSize(8);
        assertThat(cube[0][0]).isNotEqualTo(cube[0][1]);
        assertThat(cube[1][0]).isNotEqualTo(cube[0][0]);
    }

    @Test
    void randomShiftStaysInTheUnitInterval() {
        double[][][] cube = SobolVariation.builder(16)
            .randomization(SobolRandomization.randomShift(RandomGenerators.create(1L)))
            .build()
            .generateCdfs(3);
        for (double[][] dimension : cube) {
            for (double value : dimension[0]) {
                assertThat(value).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);
            }
        }
        assertThat(cube[0][0][0]).isNotZero();
    }

    @Test
    void variationsAreOrderedByPointThenMatrix() throws IOException {
        InMemoryVariationStore store = SamplingFixtures.store();
        SobolVariation sobol = SobolVariation.builder(7).matrixCount(2).build();
        SobolVariationsResult result = sobol.addVariations(
            ParsedVariations.parse(DistributedVariation.uniform(SamplingFixtures.RATE, 0.0, 1.0)),
            VariationId.base(), new VariationMaterializer(store));

        assertThat(result.size()).isEqualTo(14);
        assertThat(result.sampleCount()).isEqualTo(7);
        assertThat(result.matrixCount()).isEqualTo(2);
        for (int i = 0; i < 7; i++) {
            for (int m = 0; m < 2; m++) {
                int id = result.variationId(i, m).get(VariationLocation.CONFIG);
                assertThat(result.variationIds().get(2 * i + m).get(VariationLocation.CONFIG)).isEqualTo(id);
                assertThat((Double) store.referenceValue(VariationLocation.CONFIG, id, SamplingFixtures.RATE.columnName()))
                    .isCloseTo(result.cdf(0, m, i), within(1e-15));
                assertThat(result.matrix(m)[i][0]).isEqualTo(result.cdf(0, m, i));
            }
        }
        assertThat(sobol.toBuilder().build().getMatrixCount()).isEqualTo(2);
    }
}
