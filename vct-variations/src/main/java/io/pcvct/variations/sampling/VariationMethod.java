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

import io.pcvct.variations.ParsedVariations;
import io.pcvct.variations.Variation;
import io.pcvct.variations.VariationId;
import io.pcvct.variations.persistence.VariationMaterializer;

import java.util.List;

/// A sampling method: turns parsed variations into a design and materializes it.
///
/// Implementations hold their own parameters and random source; the design for a
/// given random state is deterministic.
public interface VariationMethod {

    /// Generates and materializes a design.
    ///
    /// @param parsed the variations, one dimension each
    /// @param reference the row ids whose values fill non-varied columns
    /// @param materializer the materializer writing rows to the store
    /// @return the design's variation ids and any auxiliary design data
    AddVariationsResult addVariations(ParsedVariations parsed, VariationId reference, VariationMaterializer materializer);

    /// Parses the variations, then calls {@link #addVariations(ParsedVariations, VariationId, VariationMaterializer)}.
    default AddVariationsResult addVariations(List<? extends Variation> variations, VariationId reference,
                                              VariationMaterializer materializer) {
        return addVariations(ParsedVariations.parse(variations), reference, materializer);
    }
}
