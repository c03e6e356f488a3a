package io.pcvct.sensitivity.config;

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

import com.google.gson.JsonPrimitive;
import io.pcvct.sensitivity.FirstOrderEstimator;
import io.pcvct.sensitivity.GsaRunOptions;
import io.pcvct.sensitivity.MoatMethod;
import io.pcvct.sensitivity.RbdMethod;
import io.pcvct.sensitivity.ReplicatePolicy;
import io.pcvct.sensitivity.SobolMethod;
import io.pcvct.sensitivity.TotalOrderEstimator;
import io.pcvct.variations.CoVariation;
import io.pcvct.variations.DiscreteVariation;
import io.pcvct.variations.DistributedVariation;
import io.pcvct.variations.Variation;
import io.pcvct.variations.VariationValidationException;
import io.pcvct.variations.distribution.NormalDistribution;
import io.pcvct.variations.distribution.UniformDistribution;
import io.pcvct.variations.sampling.RandomGenerators;
import io.pcvct.variations.sampling.SkipStart;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class StudyConfigTest {

    private static final String SOBOL_STUDY = "{\n"
        + "  \"method\": \"sobol\",\n"
        + "  \"n\": 15,\n"
        + "  \"replicates\": 3,\n"
        + "  \"seed\": 42,\n"
        + "  \"first_order\": \"Sobol1993\",\n"
        + "  \"total_order\": \"Sobol2007\",\n"
        + "  \"skip_start\": true,\n"
        + "  \"ignore_indices\": [2],\n"
        + "  \"replicate_policy\": \"exclude_missing\",\n"
        + "  \"variations\": [\n"
        + "    {\"target\": [\"overall\", \"max_time\"], \"values\": [1440, 2880]},\n"
        + "    {\"target\": [\"cell_definitions\", \"cell_definition:name:default\", \"rate\"],\n"
        + "     \"distribution\": {\"type\": \"uniform\", \"lower\": 0.001, \"upper\": 0.01}},\n"
        + "    {\"covary\": [\n"
        + "      {\"target\": [\"microenvironment_setup\", \"variable:name:oxygen\", \"diffusion_coefficient\"],\n"
        + "       \"distribution\": {\"type\": \"normal\", \"mean\": 1000.0, \"std_dev\": 100.0}},\n"
        + "      {\"target\": [\"microenvironment_setup\", \"variable:name:oxygen\", \"decay_rate\"],\n"
        + "       \"distribution\": {\"type\": \"normal\", \"mean\": 0.1, \"std_dev\": 0.01}, \"flip\": true}\n"
        + "    ]}\n"
        + "  ]\n"
        + "}";

    @Test
    void readsVariationsInDeclarationOrder() {
        List<Variation> variations = StudyConfig.fromJson(SOBOL_STUDY).toVariations();

        assertThat(variations).hasSize(3);
        assertThat(variations.get(0)).isInstanceOfSatisfying(DiscreteVariation.class,
            v -> assertThat(v.values()).containsExactly(1440, 2880));
        assertThat(variations.get(1)).isInstanceOfSatisfying(DistributedVariation.class,
            v -> assertThat(v.distribution()).isEqualTo(new UniformDistribution(0.001, 0.01)));
        assertThat(variations.get(2)).isInstanceOfSatisfying(CoVariation.class, v -> {
            assertThat(v.elementaryVariations()).hasSize(2);
            DistributedVariation decay = (DistributedVariation) v.elementaryVariations().get(1);
            assertThat(decay.isFlipped()).isTrue();
            assertThat(decay.distribution()).isEqualTo(new NormalDistribution(0.1, 0.01));
        });
    }

    @Test
    void buildsTheConfiguredMethodAndOptions() {
        StudyConfig config = StudyConfig.fromJson(SOBOL_STUDY);

        assertThat(config.getReplicates()).isEqualTo(3);
        assertThat(config.toMethod()).isInstanceOfSatisfying(SobolMethod.class, method -> {
            assertThat(method.getFirstOrder()).isEqualTo(FirstOrderEstimator.SOBOL_1993);
            assertThat(method.getTotalOrder()).isEqualTo(TotalOrderEstimator.SOBOL_2007);
        });

        GsaRunOptions options = config.toRunOptions().build();
        assertThat(options.getIgnoreIndices()).containsExactly(2);
        assertThat(options.getReplicatePolicy()).isEqualTo(ReplicatePolicy.EXCLUDE_MISSING);
    }

    @Test
    void skipStartAcceptsBooleansAndCounts() {
        assertThat(StudyConfig.toSkipStart(null)).isEqualTo(SkipStart.auto());
        assertThat(StudyConfig.toSkipStart(new JsonPrimitive(true))).isEqualTo(SkipStart.toCommonDenominator());
        assertThat(StudyConfig.toSkipStart(new JsonPrimitive(false))).isEqualTo(SkipStart.none());
        assertThat(StudyConfig.toSkipStart(new JsonPrimitive(3))).isEqualTo(SkipStart.count(3));
        assertThatThrownBy(() -> StudyConfig.toSkipStart(new JsonPrimitive("sometimes")))
            .hasMessageContaining("skip_start");
    }

    @Test
    void moatDefaultsAndDrawnSeed() {
        StudyConfig config = StudyConfig.fromJson("{\"method\": \"MOAT\", \"variations\": []}");
        assertThat(config.getSeed()).isNull();

        assertThat(config.toMethod()).isInstanceOfSatisfying(MoatMethod.class, method -> {
            assertThat(method.getLhs().getN()).isEqualTo(MoatMethod.DEFAULT_N);
            assertThat(method.getLhs().isOrthogonalize()).isTrue();
        });
        assertThat(config.getSeed()).isNotNull();
        assertThat(config.getReplicates()).isEqualTo(1);
    }

    @Test
    void rbdDefaultsToSobolMode() {
        assertThat(StudyConfig.fromJson("{\"method\": \"rbd\", \"n\": 16}").toMethod())
            .isInstanceOfSatisfying(RbdMethod.class, method -> {
                assertThat(method.getRbd().isUseSobol()).isTrue();
                assertThat(method.getNumHarmonics()).isEqualTo(RbdMethod.DEFAULT_NUM_HARMONICS);
            });
        assertThat(StudyConfig.fromJson("{\"method\": \"rbd\", \"n\": 10, \"use_sobol\": false, \"seed\": 1, \"num_harmonics\": 4}").toMethod())
            .isInstanceOfSatisfying(RbdMethod.class, method -> {
                assertThat(method.getRbd().isUseSobol()).isFalse();
                assertThat(method.getNumHarmonics()).isEqualTo(4);
            });
    }

    @Test
    void algorithmSelectsTheGenerator() {
        assertThat(new StudyConfig().getAlgorithm()).isEqualTo(RandomGenerators.Algorithm.XO_SHI_RO_256_PP);
        assertThat(StudyConfig.fromJson("{\"algorithm\": \"mt\"}").getAlgorithm()).isEqualTo(RandomGenerators.Algorithm.MT);
        assertThat(new StudyConfig().setAlgorithm("split-mix-64").getAlgorithm())
            .isEqualTo(RandomGenerators.Algorithm.SPLIT_MIX_64);
        assertThatThrownBy(() -> StudyConfig.fromJson(
            "{\"method\": \"rbd\", \"n\": 10, \"use_sobol\": false, \"seed\": 1, \"algorithm\": \"pcg\"}").toMethod())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pcg");
    }

    @Test
    void invalidConfigurationsAreRejected() {
        assertThatThrownBy(() -> new StudyConfig().toMethod()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StudyConfig().setMethod("fast").toMethod())
            .hasMessageContaining("fast");
        assertThatThrownBy(() -> new StudyConfig().setMethod("sobol").toMethod())
            .hasMessageContaining("'n'");
        assertThatThrownBy(() -> StudyConfig.fromJson("{\"variations\": []}").toVariations())
            .isInstanceOf(VariationValidationException.class);
        assertThatThrownBy(() -> StudyConfig.fromJson(
            "{\"variations\": [{\"target\": [\"overall\", \"max_time\"]}]}").toVariations())
            .isInstanceOf(VariationValidationException.class)
            .hasMessageContaining("exactly one");
    }

    @Test
    void savedConfigurationsReadBack(@TempDir Path dir) throws IOException {
        StudyConfig config = new StudyConfig()
            .setMethod("sobol")
            .setN(31)
            .setSeed(7L)
            .setSkipStart(new JsonPrimitive(2))
            .setIgnoreIndices(List.of(0))
            .setVariations(List.of(
                StudyConfig.VariationConfig.discrete(List.of("overall", "dt_diffusion"), List.of(0.01, 0.02)),
                StudyConfig.VariationConfig.distributed(List.of("overall", "max_time"),
                    new NormalDistribution(1440.0, 60.0), false)));
        Path file = dir.resolve("study.json");
        config.saveToFile(file);

        StudyConfig read = StudyConfig.loadFromFile(file);
        assertThat(read.getN()).isEqualTo(31);
        assertThat(read.getSeed()).isEqualTo(7L);
        assertThat(StudyConfig.toSkipStart(new JsonPrimitive(2))).isEqualTo(SkipStart.count(2));
        assertThat(read.toRunOptions().build().getIgnoreIndices()).containsExactly(0);
        List<Variation> variations = read.toVariations();
        List<Object> values = new ArrayList<>(((DiscreteVariation<?>) variations.get(0)).values());
        assertThat(values).containsExactly(0.01, 0.02);
        assertThat(((DistributedVariation) variations.get(1)).distribution()).isEqualTo(new NormalDistribution(1440.0, 60.0));
        assertThat(read.toJson()).isEqualTo(config.toJson());
    }
}
