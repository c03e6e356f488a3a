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

import io.pcvct.variations.TargetPath;
import io.pcvct.variations.VariationLocation;
import io.pcvct.variations.persistence.InMemoryVariationStore;

import java.io.IOException;

final class SamplingFixtures {

    static final TargetPath RATE = TargetPath.of("cell_definitions", "cell_definition:name:default", "rate");
    static final TargetPath MAX_TIME = TargetPath.of("overall", "max_time");
    static final TargetPath X0 = TargetPath.of("cell_patches:name:default", "patch_collection:type:disc", "patch:ID:1", "x0");

    private SamplingFixtures() {
    }

    static InMemoryVariationStore store() throws IOException {
        return InMemoryVariationStore.builder()
            .baseValue(VariationLocation.CONFIG, RATE.columnName(), 0.0)
            .baseValue(VariationLocation.CONFIG, MAX_TIME.columnName(), 1440)
            .baseValue(VariationLocation.IC_CELL, X0.columnName(), 0.0)
            .build();
    }
}
