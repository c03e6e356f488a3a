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

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class DiscreteVariationTest {

    private final DiscreteVariation<Integer> maxTime =
        DiscreteVariation.of(TargetPath.of("overall", "max_time"), 10, 20, 30, 40);

    @Test
    void cdfSpacesValuesEvenly() {
        assertThat(maxTime.cdf(10)).isEqualTo(0.0);
        assertThat(maxTime.cdf(20)).isCloseTo(1.0 / 3, within(1e-15));
        assertThat(maxTime.cdf(30)).isCloseTo(2.0 / 3, within(1e-15));
        assertThat(maxTime.cdf(40)).isEqualTo(1.0);
    }

    @Test
    void inverseUndoesCdf() {
        for (Integer value : maxTime.values()) {
            assertThat(maxTime.inverse(maxTime.cdf(value))).isEqualTo(value);
        }
    }

    @Test
    void inverseUsesEqualBins() {
        assertThat(maxTime.inverse(0.0)).isEqualTo(10);
        assertThat(maxTime.inverse(0.24)).isEqualTo(10);
        assertThat(maxTime.inverse(0.25)).isEqualTo(20);
        assertThat(maxTime.inverse(0.74)).isEqualTo(30);
        assertThat(maxTime.inverse(1.0)).isEqualTo(40);
        assertThat(maxTime.inverse(new double[]{0.1, 0.6, 0.9})).containsExactly(10, 30, 40);
    }

    @Test
    void singleValueSitsAtZero() {
        DiscreteVariation<String> single = DiscreteVariation.of(TargetPath.of("options", "random_seed"), "system_clock");
        assertThat(single.cdf("system_clock")).isEqualTo(0.0);
        assertThat(single.inverse(0.7)).isEqualTo("system_clock");
        assertThat(single.dimensionSize()).isEqualTo(1);
    }

    @Test
    void nonMembersAndBadCoordinatesAreRejected() {
        assertThatThrownBy(() -> maxTime.cdf(25))
            .isInstanceOf(VariationValidationException.class)
            .hasMessageContaining("25");
        assertThatThrownBy(() -> maxTime.inverse(1.5)).isInstanceOf(VariationValidationException.class);
        assertThatThrownBy(() -> maxTime.inverse(Double.NaN)).isInstanceOf(VariationValidationException.class);
        assertThatThrownBy(() -> DiscreteVariation.of(List.of("overall", "max_time"), List.of()))
            .isInstanceOf(VariationValidationException.class);
    }

    @Test
    void describesItsDimension() {
        assertThat(maxTime.dimensionSize()).isEqualTo(4);
        assertThat(maxTime.location()).isEqualTo(VariationLocation.CONFIG);
        assertThat(maxTime.columnName()).isEqualTo("overall/max_time");
        assertThat(maxTime.elementaryVariations()).containsExactly(maxTime);
        assertThat(maxTime.asCoVariation().elementaryVariations()).containsExactly(maxTime);
    }
}
