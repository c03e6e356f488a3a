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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered list of variations partitioned by storage location.
 *
 * <p>Every declared variation becomes one dimension, numbered from 0 in
 * declaration order; elementary variations are wrapped as singleton
 * co-variations. Each elementary variation lands in exactly one
 * {@link LocationParsedVariations} bucket, tagged with its dimension index.
 * Locations without variations map to an empty bucket.
 *
 * <p>The same target path may not appear twice, since it would be written to a
 * single persisted column from two dimensions.
 */
public final class ParsedVariations {

    private final List<CoVariation> dimensions;
    private final int[] dimensionSizes;
    private final Map<VariationLocation, LocationParsedVariations> byLocation;

    private ParsedVariations(List<CoVariation> dimensions) {
        this.dimensions = Collections.unmodifiableList(dimensions);
        this.dimensionSizes = new int[dimensions.size()];

        Map<VariationLocation, List<ElementaryVariation>> variations = new EnumMap<>(VariationLocation.class);
        Map<VariationLocation, List<Integer>> indices = new EnumMap<>(VariationLocation.class);
        Set<TargetPath> seen = new HashSet<>();
        for (int d = 0; d < dimensions.size(); d++) {
            CoVariation dimension = dimensions.get(d);
            dimensionSizes[d] = dimension.dimensionSize();
            for (ElementaryVariation ev : dimension.elementaryVariations()) {
                if (!seen.add(ev.target())) {
                    throw new VariationValidationException("Target " + ev.target() + " is varied more than once");
                }
                variations.computeIfAbsent(ev.location(), l -> new ArrayList<>()).add(ev);
                indices.computeIfAbsent(ev.location(), l -> new ArrayList<>()).add(d);
            }
        }

        Map<VariationLocation, LocationParsedVariations> parsed = new EnumMap<>(VariationLocation.class);
        for (VariationLocation location : VariationLocation.values()) {
            parsed.put(location, variations.containsKey(location)
                ? new LocationParsedVariations(variations.get(location), indices.get(location))
                : LocationParsedVariations.empty());
        }
        this.byLocation = Collections.unmodifiableMap(parsed);
    }

    /**
     * Parses an ordered list of variations into dimensions and location buckets.
     *
     * @param variations the variations, one dimension each
     * @return the parsed set
     * @throws VariationValidationException if the list is empty or a target repeats
     */
    public static ParsedVariations parse(List<? extends Variation> variations) {
        if (variations == null || variations.isEmpty()) {
            throw new VariationValidationException("At least one variation is required");
        }
        List<CoVariation> dimensions = new ArrayList<>(variations.size());
        for (Variation variation : variations) {
            dimensions.add(variation.asCoVariation());
        }
        return new ParsedVariations(dimensions);
    }

    public static ParsedVariations parse(Variation... variations) {
        return parse(List.of(variations));
    }

    public int dimensionCount() {
        return dimensions.size();
    }

    /// @return the cardinality of each dimension, {@link Variation#CONTINUOUS} for continuous ones
    public int[] dimensionSizes() {
        return dimensionSizes.clone();
    }

    public int dimensionSize(int dimension) {
        return dimensionSizes[dimension];
    }

    public boolean isAllDiscrete() {
        for (int size : dimensionSizes) {
            if (size == Variation.CONTINUOUS) {
                return false;
            }
        }
        return true;
    }

    public CoVariation dimension(int dimension) {
        return dimensions.get(dimension);
    }

    public List<CoVariation> dimensions() {
        return dimensions;
    }

    public LocationParsedVariations get(VariationLocation location) {
        return byLocation.get(location);
    }

    /// @return the locations that have at least one variation, in enum order
    public List<VariationLocation> usedLocations() {
        List<VariationLocation> used = new ArrayList<>();
        for (Map.Entry<VariationLocation, LocationParsedVariations> entry : byLocation.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                used.add(entry.getKey());
            }
        }
        return used;
    }

    /// @return one label per dimension
    public List<String> columnNames() {
        List<String> names = new ArrayList<>(dimensions.size());
        for (CoVariation dimension : dimensions) {
            names.add(dimension.columnName());
        }
        return names;
    }
}
