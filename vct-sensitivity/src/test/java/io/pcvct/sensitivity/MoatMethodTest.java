package io.pcvct.sensitivity;

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
import io.pcvct.variations.VariationLocation;
import io.pcvct.variations.persistence.InMemoryVariationStore;
import io.pcvct.variations.persistence.VariationMaterializer;
import io.pcvct.variations.sampling.LhsVariation;
import io.pcvct.variations.sampling.RandomGenerators;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Set;

import static io.pcvct.sensitivity.StudyFixtures.X1;
import static io.pcvct.sensitivity.StudyFixtures.X2;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class MoatMethodTest {

    private InMemoryVariationStore store;
    private RecordingSimulationExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        store = StudyFixtures.store();
        executor = new RecordingSimulationExecutor();
    }

    private MoatSampling run(MoatMethod method, ParsedVariations parsed, int replicates) {
        return method.runSampling(replicates, parsed, new VariationMaterializer(store), executor, GsaRunOptions.defaults());
    }

    @Test
    void additiveBinaryModelHasConstantEffects() {
        ParsedVariations parsed = ParsedVariations.parse(DiscreteVariation.of(X1, 0, 1), DiscreteVariation.of(X2, 0, 1));
        MoatSampling sampling = run(MoatMethod.withDefaults(RandomGenerators.create(17L)), parsed, 1);

        MorrisResult result = sampling.calculate(StudyFixtures.objective("x+y", store, executor, x -> x[0] + x[1]));

        assertThat(result.means()).containsExactly(2.0, 2.0);
        assertThat(result.meansStar()).containsExactly(2.0, 2.0);
        assertThat(result.variances()).containsExactly(0.0, 0.0);
        assertThat(result.effects()).hasDimensions(MoatMethod.DEFAULT_N, 2);
    }

    @Test
    void linearModelRecoversSignedSlopes() {
        ParsedVariations parsed = ParsedVariations.parse(
            DistributedVariation.uniform(X1, 0.0, 1.0), DistributedVariation.uniform(X2, 0.0, 1.0));
        MoatMethod method = new MoatMethod(LhsVariation.builder(9, RandomGenerators.create(3L)).addNoise(true).build());
        MoatSampling sampling = run(method, parsed, 1);

        MorrisResult result = sampling.calculate(StudyFixtures.objective("3x-2y", store, executor, x -> 3 * x[0] - 2 * x[1]));

        assertThat(result.means()).containsExactly(new double[]{3.0, -2.0}, within(1e-9));
        assertThat(result.meansStar()).containsExactly(new double[]{3.0, 2.0}, within(1e-9));
        assertThat(result.variances()).containsExactly(new double[]{0.0, 0.0}, within(1e-9));
    }

    @Test
    void tableHasBaseAndOnePerturbationPerFeature() {
        ParsedVariations parsed = ParsedVariations.parse(
            DistributedVariation.uniform(X1, 0.0, 1.0), DistributedVariation.uniform(StudyFixtures.X0, -1.0, 1.0));
        MoatSampling sampling = run(new MoatMethod(LhsVariation.builder(4, RandomGenerators.create(9L)).build()), parsed, 2);

        ConfigurationTable table = sampling.table();
        assertThat(table.header()).containsExactly("base", X1.columnName(), StudyFixtures.X0.columnName());
        assertThat(table.rowCount()).isEqualTo(4);
        assertThat(sampling.featureNames()).containsExactly(X1.columnName(), StudyFixtures.X0.columnName());
        assertThat(sampling.simulations().values()).allSatisfy(simulations -> assertThat(simulations).hasSize(2));

        for (int i = 0; i < 4; i++) {
            int base = table.get(i, 0);
            int x1Moved = table.get(i, 1);
            int x0Moved = table.get(i, 2);
            int baseSim = sampling.simulations().get(base).get(0);
            int x1Sim = sampling.simulations().get(x1Moved).get(0);
            int x0Sim = sampling.simulations().get(x0Moved).get(0);
            // moving x1 leaves the cell location untouched, and the other way round
            assertThat(executor.variationOf(x1Sim).get(VariationLocation.IC_CELL))
                .isEqualTo(executor.variationOf(baseSim).get(VariationLocation.IC_CELL));
            assertThat(executor.variationOf(x0Sim).get(VariationLocation.CONFIG))
                .isEqualTo(executor.variationOf(baseSim).get(VariationLocation.CONFIG));
            assertThat(Math.abs(sampling.step(i, 0))).isEqualTo(0.5);
        }
    }

    @Test
    void ignoringFeaturesIsRejectedBeforeAnythingRuns() {
        ParsedVariations parsed = ParsedVariations.parse(DiscreteVariation.of(X1, 0, 1), DiscreteVariation.of(X2, 0, 1));
        GsaRunOptions options = GsaRunOptions.builder().ignoreIndices(Set.of(1)).build();

        assertThatThrownBy(() -> MoatMethod.withDefaults(RandomGenerators.create(1L))
            .runSampling(1, parsed, new VariationMaterializer(store), executor, options))
            .isInstanceOf(UnsupportedGsaOptionException.class);
        assertThat(executor.configurationCount()).isZero();
        assertThat(store.rowCount(VariationLocation.CONFIG)).isEqualTo(1);
    }

    @Test
    void replicatesMustBePositive() {
        ParsedVariations parsed = ParsedVariations.parse(DiscreteVariation.of(X1, 0, 1));
        assertThatThrownBy(() -> run(MoatMethod.withDefaults(RandomGenerators.create(1L)), parsed, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
