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
import io.pcvct.variations.VariationId;
import io.pcvct.variations.VariationLocation;
import io.pcvct.variations.persistence.VariationMaterializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/// Full factorial design over discrete dimensions.
///
/// Every combination of levels becomes one design point; points are ordered
/// row-major over the dimension sizes, so the first dimension varies slowest.
public final class GridVariation implements VariationMethod {

    private static final Logger logger = LogManager.getLogger(GridVariation.class);

    @Override
    public GridVariationsResult addVariations(ParsedVariations parsed, VariationId reference,
                                              VariationMaterializer materializer) {
        int[] shape = parsed.dimensionSizes();
        Map<VariationLocation, int[]> ids = new EnumMap<>(VariationLocation.class);
        int n = -1;
        for (VariationLocation location : VariationLocation.values()) {
            int[] locationIds = materializer.materializeGrid(location, parsed, reference.get(location));
            n = locationIds.length;
            if (!parsed.get(location).isEmpty()) {
                ids.put(location, locationIds);
            }
        }
        logger.info("Grid design with shape {} has {} points", Arrays.toString(shape), n);
        return new GridVariationsResult(AddVariationsResult.combine(ids, reference, n), shape);
    }

    @Override
    public String toString() {
        return "GridVariation";
    }
}
