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
import io.pcvct.variations.VariationLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The variation ids produced by one sampling method invocation.
 *
 * <p>Subclasses add the auxiliary data their method generates, such as the raw
 * design coordinates.
 */
public class AddVariationsResult {

    private final List<VariationId> variationIds;

    public AddVariationsResult(List<VariationId> variationIds) {
        this.variationIds = Collections.unmodifiableList(new ArrayList<>(variationIds));
    }

    /**
     * @return one id per design point, in the method's design order
     */
    public List<VariationId> variationIds() {
        return variationIds;
    }

    public int size() {
        return variationIds.size();
    }

    /**
     * Combines per-location row ids into per-point variation ids.
     *
     * @param idsByLocation row ids of each varied location, all of length {@code n}
     * @param reference ids used for locations absent from {@code idsByLocation}
     * @param n the number of design points
     * @return one variation id per design point
     */
    static List<VariationId> combine(Map<VariationLocation, int[]> idsByLocation, VariationId reference, int n) {
        List<VariationId> ids = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            VariationId id = reference;
            for (Map.Entry<VariationLocation, int[]> entry : idsByLocation.entrySet()) {
                id = id.with(entry.getKey(), entry.getValue()[i]);
            }
            ids.add(id);
        }
        return ids;
    }
}
