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

import io.pcvct.variations.VariationId;

import java.util.List;

/// Result of {@link GridVariation}: ids laid out row-major over the grid shape.
public final class GridVariationsResult extends AddVariationsResult {

    private final int[] shape;

    GridVariationsResult(List<VariationId> variationIds, int[] shape) {
        super(variationIds);
        this.shape = shape.clone();
    }

    /// @return the number of levels of each dimension
    public int[] shape() {
        return shape.clone();
    }

    /// @param index one level index per dimension
    /// @return the id of that grid point
    public VariationId variationId(int... index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("Expected " + shape.length + " indices, got " + index.length);
        }
        int flat = 0;
        for (int i = 0; i < shape.length; i++) {
            if (index[i] < 0 || index[i] >= shape[i]) {
                throw new IndexOutOfBoundsException("Index " + index[i] + " out of range for dimension " + i
                    + " of size " + shape[i]);
            }
            flat = flat * shape[i] + index[i];
        }
        return variationIds().get(flat);
    }
}
