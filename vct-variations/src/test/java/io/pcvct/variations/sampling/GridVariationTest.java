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

import io.pcvct.variations.DiscreteVariation;
import io.pcvct.variations.DistributedVariation;
import io.pcvct.variations.ParsedVariations;
import io.pcvct.variations.VariationId;
import io.pcvct.variations.VariationLocation;
import io.pcvct.variations.VariationValidationException;
import io.pcvct.variations.persistence.InMemoryVariationStore;
import io.pcvct.variations.persistence.VariationMaterializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static io.pcvct.variations.sampling.SamplingFixtures.MAX_TIME;
import static io.pcvct.variations.sampling.SamplingFixtures.RATE;
import static io.pcvct.variations.sampling.SamplingFixtures.X0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GridVariationTest {

    private InMemoryVariationStore store;
    private VariationMaterializer materializer;

    @BeforeEach
    void setUp() throws IOException {
        store = SamplingFixtures.store();
        materializer = new VariationMaterializer(store);
    }

    @Test
    void enumeratesEveryCombinationFirstDimensionSlowest() {
        GridVariationsResult result = new GridVariation().addVariations(
            ParsedVariations.parse(DiscreteVariation.of(RATE, 0.1, 0.2), DiscreteVariation.of(MAX_TIME, 100, 200, 300)),
            VariationId.base(), materializer);

        assertThat(result.size()).isEqualTo(6);
        assertThat(result.shape()).containsExactly(2, 3);
        assertThat(result.variationIds()).doesNotHaveDuplicates();
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 3; j++) {
                int id = result.variationId(i, j).get(VariationLocation.CONFIG);
                assertThat(result.variationIds().get(i * 3 + j).get(VariationLocation.CONFIG)).isEqualTo(id);
                assertThat(store.referenceValue(VariationLocation.CONFIG, id, RATE.columnName())).isEqualTo(i == 0 ? 0.1 : 0.2);
                assertThat(store.referenceValue(VariationLocation.CONFIG, id, MAX_TIME.columnName())).isEqualTo(100 * (j + 1));
            }
        }
    }

    @Test
    void rerunningReusesRows() {
        GridVariation grid = new GridVariation();
        List<DiscreteVariation<Double>> variations = List.of(DiscreteVariation.of(RATE, 0.1, 0.2, 0.3));
        AddVariationsResult first = grid.addVariations(variations, VariationId.base(), materializer);
        AddVariationsResult second = grid.addVariations(variations, VariationId.base(), materializer);

        assertThat(second.variationIds()).isEqualTo(first.variationIds());
        assertThat(store.rowCount(VariationLocation.CONFIG)).isEqualTo(4);
    }

    @Test
    void broadcastsAcrossLocations() {
        VariationId reference = VariationId.base().with(VariationLocation.INTRACELLULAR, 5);
        GridVariationsResult result = new GridVariation().addVariations(
            ParsedVariations.parse(DiscreteVariation.of(RATE, 0.1, 0.2), DiscreteVariation.of(X0, -10.0, 0.0, 10.0)),
            reference, materializer);

        assertThat(result.size()).isEqualTo(6);
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 3; j++) {
                VariationId id = result.variationId(i, j);
                assertThat(id.get(VariationLocation.CONFIG)).isEqualTo(result.variationId(i, 0).get(VariationLocation.CONFIG));
                assertThat(id.get(VariationLocation.IC_CELL)).isEqualTo(result.variationId(0, j).get(VariationLocation.IC_CELL));
                assertThat(id.get(VariationLocation.INTRACELLULAR)).isEqualTo(5);
            }
        }
        assertThat(result.variationId(0, 1).get(VariationLocation.IC_CELL)).isZero();
        assertThat(store.rowCount(VariationLocation.IC_CELL)).isEqualTo(3);
    }

    @Test
    void continuousDimensionsAreRejected() {
        ParsedVariations parsed = ParsedVariations.parse(
            DiscreteVariation.of(RATE, 0.1, 0.2), DistributedVariation.uniform(MAX_TIME, 0.0, 1.0));
        assertThatThrownBy(() -> new GridVariation().addVariations(parsed, VariationId.base(), materializer))
            .isInstanceOf(VariationValidationException.class);
    }

    @Test
    void gridIndicesAreChecked() {
        GridVariationsResult result = new GridVariation().addVariations(
            ParsedVariations.parse(DiscreteVariation.of(RATE, 0.1, 0.2)), VariationId.base(), materializer);
        assertThatThrownBy(() -> result.variationId(2)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> result.variationId(0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
