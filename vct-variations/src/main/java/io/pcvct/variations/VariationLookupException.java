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

import java.util.NoSuchElementException;

/// Thrown when a persisted variation row, column or location cannot be found.
public class VariationLookupException extends NoSuchElementException {

    private final VariationLocation location;

    public VariationLookupException(VariationLocation location, String message) {
        super(location.key() + ": " + message);
        this.location = location;
    }

    /// @return the location whose table was queried
    public VariationLocation getLocation() {
        return location;
    }
}
