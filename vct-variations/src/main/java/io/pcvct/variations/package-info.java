/// Model of parameter variations for agent-based simulation studies.
///
/// A study varies parameters addressed by {@link io.pcvct.variations.TargetPath}s.
/// Each varied parameter is an {@link io.pcvct.variations.ElementaryVariation},
/// either discrete over explicit values or distributed over a continuous
/// distribution, and maps values to and from design coordinates in [0, 1].
/// Several of them may share one coordinate as a {@link io.pcvct.variations.CoVariation}.
///
/// ## Key Components
///
/// - {@link io.pcvct.variations.ParsedVariations}: dimensions of a study, partitioned by storage location
/// - {@link io.pcvct.variations.VariationLocation}: the input document a parameter belongs to
/// - {@link io.pcvct.variations.VariationId}: one row id per location, identifying a parameter set
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
