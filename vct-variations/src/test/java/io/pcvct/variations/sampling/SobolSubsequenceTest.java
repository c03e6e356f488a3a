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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SobolSubsequenceTest {

    @ParameterizedTest
    @CsvSource({
        "7, 1, false",
        "15, 1, false",
        "8, 0, false",
        "9, 0, true",
        "17, 0, true",
        "10, 0, false",
        "1, 1, false"
    })
    void automaticChoiceFollowsTheSampleCount(int n, int skip, boolean includeOne) {
        SobolSubsequence subsequence = SobolSubsequence.choose(n, SkipStart.auto(), null);
        assertThat(subsequence.skip()).isEqualTo(skip);
        assertThat(subsequence.includeOne()).isEqualTo(includeOne);
        assertThat(subsequence.draws(n)).isEqualTo(includeOne ? n - 1 : n);
    }

    @Test
    void explicitIncludeOneWins() {
        assertThat(SobolSubsequence.choose(9, SkipStart.auto(), false)).isEqualTo(new SobolSubsequence(0, false));
        assertThat(SobolSubsequence.choose(8, SkipStart.auto(), true)).isEqualTo(new SobolSubsequence(0, true));
    }

    @ParameterizedTest
    @CsvSource({"1, 1", "2, 2", "3, 4", "4, 4", "5, 8", "8, 8", "9, 16"})
    void commonDenominatorSkipsToTheNextPowerOfTwo(int n, int skip) {
        assertThat(SobolSubsequence.choose(n, SkipStart.toCommonDenominator(), false).skip()).isEqualTo(skip);
    }

    @Test
    void fixedSkips() {
        assertThat(SobolSubsequence.choose(8, SkipStart.count(3), null).skip()).isEqualTo(3);
        assertThat(SobolSubsequence.choose(7, SkipStart.none(), null).skip()).isZero();
        assertThatThrownBy(() -> SkipStart.count(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SobolSubsequence.choose(0, SkipStart.auto(), null))
            .isInstanceOf(io.pcvct.variations.VariationValidationException.class);
    }
}
