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

/// Thrown when a variation, a variation set or a sampling request is malformed.
///
/// Raised synchronously, before any design row is materialized or any run is
/// dispatched: mixed co-variation kinds, unequal discrete lengths, a CDF query for
/// a value that is not a member of a discrete variation, grid sampling over a
/// continuous dimension, an invalid target path, or an RBD sample count that is
/// not within one of a power of two.
public class VariationValidationException extends IllegalArgumentException {

    public VariationValidationException(String message) {
        super(message);
    }

    public VariationValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
