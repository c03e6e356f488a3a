package io.pcvct.variations;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class CoVariationTest {

    private static final TargetPath DIFFUSION =
        TargetPath.of("microenvironment_setup", "variable:name:oxygen", "physical_parameter_set", "diffusion_coefficient");
    private static final TargetPath DECAY =
        TargetPath.of("microenvironment_setup", "variable:name:oxygen", "physical_parameter_set", "decay_rate");

    @Test
    void mixedKindsAreRejected() {
        assertThatThrownBy(() -> CoVariation.of(
            DiscreteVariation.of(DIFFUSION, 1.0, 2.0),
            DistributedVariation.uniform(DECAY, 0.0, 1.0)))
            .isInstanceOf(VariationValidationException.class)
            .hasMessageContaining("all discrete or all distributed");
    }

    @Test
    void discreteMembersMustHaveEqualLengths() {
        assertThatThrownBy(() -> CoVariation.of(
            DiscreteVariation.of(DIFFUSION, 1.0, 2.0, 3.0),
            DiscreteVariation.of(DECAY, 0.1, 0.2)))
            .isInstanceOf(VariationValidationException.class);

        CoVariation ok = CoVariation.of(
            DiscreteVariation.of(DIFFUSION, 1.0, 2.0, 3.0),
            DiscreteVariation.of(DECAY, 0.1, 0.2, 0.3));
        assertThat(ok.dimensionSize()).isEqualTo(3);
        assertThat(ok.inverse(0.5)).containsExactly(2.0, 0.2);
    }

    @Test
    void flippedMembersMoveInMirror() {
        CoVariation covariation = CoVariation.of(
            DistributedVariation.uniform(DIFFUSION, 0.0, 1.0),
            DistributedVariation.uniform(DECAY, 0.0, 1.0, true));
        Object[] values = covariation.inverse(0.2);
        assertThat((Double) values[0]).isCloseTo(0.2, within(1e-12));
        assertThat((Double) values[1]).isCloseTo(0.8, within(1e-12));
        assertThat(covariation.dimensionSize()).isEqualTo(Variation.CONTINUOUS);
    }

    @Test
    void columnNameJoinsMembers() {
        CoVariation covariation = CoVariation.of(
            DistributedVariation.uniform(DIFFUSION, 0.0, 1.0),
            DistributedVariation.uniform(DECAY, 0.0, 1.0));
        assertThat(covariation.columnName()).isEqualTo(DIFFUSION.columnName() + " AND " + DECAY.columnName());
        assertThat(covariation.asCoVariation()).isSameAs(covariation);
    }
}
