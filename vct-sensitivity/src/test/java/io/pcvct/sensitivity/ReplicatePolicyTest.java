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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ReplicatePolicyTest {

    private static final List<OptionalDouble> ALL_PRESENT = List.of(OptionalDouble.of(1.0), OptionalDouble.of(3.0));
    private static final List<OptionalDouble> ONE_MISSING =
        List.of(OptionalDouble.of(1.0), OptionalDouble.empty(), OptionalDouble.of(5.0));

    @Test
    void propagateAveragesCompleteReplicates() {
        assertThat(ReplicatePolicy.PROPAGATE.aggregate(4, ALL_PRESENT)).isEqualTo(2.0);
    }

    @Test
    void propagateFailsOnAnyMissingReplicate() {
        assertThatThrownBy(() -> ReplicatePolicy.PROPAGATE.aggregate(4, ONE_MISSING))
            .isInstanceOfSatisfying(ObjectiveEvaluationException.class,
                e -> assertThat(e.getConfigurationId()).isEqualTo(4))
            .hasMessageContaining("replicate 1");
    }

    @Test
    void excludeMissingAveragesTheRest() {
        assertThat(ReplicatePolicy.EXCLUDE_MISSING.aggregate(7, ONE_MISSING)).isEqualTo(3.0);
        assertThat(ReplicatePolicy.EXCLUDE_MISSING.aggregate(7, ALL_PRESENT)).isEqualTo(2.0);
    }

    @Test
    void excludeMissingFailsWhenNothingIsLeft() {
        assertThatThrownBy(() -> ReplicatePolicy.EXCLUDE_MISSING.aggregate(7,
            List.of(OptionalDouble.empty(), OptionalDouble.empty())))
            .isInstanceOf(ObjectiveEvaluationException.class)
            .hasMessageContaining("all 2 replicates failed");
    }

    @Test
    void noReplicatesIsAnError() {
        for (ReplicatePolicy policy : ReplicatePolicy.values()) {
            assertThatThrownBy(() -> policy.aggregate(1, List.of())).isInstanceOf(ObjectiveEvaluationException.class);
        }
    }

    @Test
    void nanObjectivesCountAsMissing() {
        ObjectiveFunction function = ObjectiveFunction.of("odd only", id -> id % 2 == 1 ? id : Double.NaN);
        assertThat(function.evaluate(3)).hasValue(3.0);
        assertThat(function.evaluate(4)).isEmpty();
        assertThat(function).hasToString("odd only");
    }
}
