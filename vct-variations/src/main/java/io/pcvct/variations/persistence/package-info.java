/// Storage of variation rows.
///
/// {@link io.pcvct.variations.persistence.VariationStore} is the persistence seam;
/// {@link io.pcvct.variations.persistence.InMemoryVariationStore} implements it with
/// an optional JSON-lines journal. {@link io.pcvct.variations.persistence.VariationMaterializer}
/// turns design coordinates into deduplicated row ids.
package io.pcvct.variations.persistence;

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
