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

import io.pcvct.variations.DistributedVariation;
import io.pcvct.variations.ParsedVariations;
import io.pcvct.variations.persistence.InMemoryVariationStore;
import io.pcvct.variations.persistence.VariationMaterializer;
import io.pcvct.variations.sampling.RandomGenerators;
import io.pcvct.variations.sampling.RbdVariation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.Set;

import static io.pcvct.sensitivity.StudyFixtures.X1;
import static io.pcvct.sensitivity.StudyFixtures.X2;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class RbdMethodTest {

    private InMemoryVariationStore store;
    private RecordingSimulationExecutor executor;
    private ParsedVariations parsed;

    @BeforeEach
    void setUp() throws IOException {
        store = StudyFixtures.store();
        executor = new RecordingSimulationExecutor();
        parsed = ParsedVariations.parse(
            DistributedVariation.uniform(X1, 0.0, 1.0), DistributedVariation.uniform(X2, 0.0, 1.0));
    }

    private RbdSampling run(RbdMethod method, GsaRunOptions options) {
        return method.runSampling(1, parsed, new VariationMaterializer(store), executor, options);
    }

    @Test
    void randomDesignSeparatesInfluentialAndDummyFeatures() {
        RbdSampling sampling = run(new RbdMethod(RbdVariation.random(501, RandomGenerators.create(21L))),
            GsaRunOptions.defaults());
        RbdResult result = sampling.calculate(StudyFixtures.objective("x1", store, executor, x -> x[0]));

        assertThat(result.firstOrder()[0]).isGreaterThan(0.95);
        assertThat(result.firstOrder()[1]).isLessThan(0.1);
        assertThat(sampling.isHalfPeriod()).isFalse();
        assertThat(sampling.numHarmonics()).isEqualTo(RbdMethod.DEFAULT_NUM_HARMONICS);
    }

    @Test
    void sobolDesignIsMirroredToAFullPeriod() {
        RbdSampling sampling = run(new RbdMethod(RbdVariation.sobol(257)), GsaRunOptions.defaults());
        RbdResult result = sampling.calculate(StudyFixtures.objective("x1", store, executor, x -> x[0]));

        assertThat(sampling.isHalfPeriod()).isTrue();
        assertThat(sampling.table().rowCount()).isEqualTo(257);
        assertThat(sampling.table().header()).containsExactly(X1.columnName(), X2.columnName());
        assertThat(result.firstOrder()[0]).isGreaterThan(0.95);
    }

    @Test
    void ignoringFeaturesIsRejected() {
        assertThatThrownBy(() -> run(new RbdMethod(RbdVariation.sobol(8)),
            GsaRunOptions.builder().ignoreIndices(Set.of(0)).build()))
            .isInstanceOf(UnsupportedGsaOptionException.class);
        assertThat(executor.configurationCount()).isZero();
    }

    @Test
    void pureFirstHarmonicIsFullyExplained() {
        int size = 64;
        double[] signal = new double[size];
        for (int t = 0; t < size; t++) {
            signal[t] = 3.0 + Math.cos(2 * Math.PI * t / size);
        }
        assertThat(RbdSampling.firstOrderIndex(signal, 6, "x")).isCloseTo(1.0, within(1e-9));

        for (int t = 0; t < size; t++) {
            signal[t] = Math.cos(2 * Math.PI * 20 * t / size);
        }
        assertThat(RbdSampling.firstOrderIndex(signal, 6, "x")).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void constantSignalHasNoIndex() {
        assertThatThrownBy(() -> RbdSampling.firstOrderIndex(new double[]{2.0, 2.0, 2.0, 2.0}, 6, "x1"))
            .isInstanceOf(SensitivityComputationException.class)
            .hasMessageContaining("x1");

        for (int size : new int[]{14, 126}) {
            double[] constant = new double[size];
            Arrays.fill(constant, 0.1);
            assertThatThrownBy(() -> RbdSampling.firstOrderIndex(constant, 6, "x2"))
                .isInstanceOf(SensitivityComputationException.class);
        }
    }

    @Test
    void smallSignalOnLargeOffsetKeepsItsVariance() {
        int size = 62;
        double[] signal = new double[size];
        for (int t = 0; t < size; t++) {
            signal[t] = 1e6 + 1e-4 * Math.cos(2 * Math.PI * t / size);
        }
        assertThat(RbdSampling.firstOrderIndex(signal, 6, "x")).isCloseTo(1.0, within(1e-4));
    }

    @Test
    void harmonicsMustBePositive() {
        assertThatThrownBy(() -> new RbdMethod(RbdVariation.sobol(8), 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
