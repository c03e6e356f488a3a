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

import java.util.List;

/// One sampled dimension of a study: either a single {@link ElementaryVariation}
/// or a {@link CoVariation} whose members move together.
public interface Variation {

    /// Marker for the size of a continuous dimension.
    int CONTINUOUS = -1;

    /// @return the number of discrete levels, or {@link #CONTINUOUS}
    int dimensionSize();

    /// @return the elementary variations sampled by this dimension, in declaration order
    List<ElementaryVariation> elementaryVariations();

    /// @return the label of this dimension in scheme tables and results
    String columnName();

    /// @return this dimension as a co-variation, wrapping an elementary variation if needed
    CoVariation asCoVariation();
}
