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
import java.util.List;
import java.util.TreeSet;

/// The elementary variations stored at one location, each paired with the index
/// of the dimension that samples it.
///
/// Dimension indices are 0-based and non-decreasing.
///
/// @param variations the elementary variations, in declaration order
/// @param dimensionIndices for each variation, the index of its owning dimension
public record LocationParsedVariations(List<ElementaryVariation> variations, List<Integer> dimensionIndices) {

    public LocationParsedVariations {
        if (variations.size() != dimensionIndices.size()) {
            throw new IllegalArgumentException("variations and dimension indices differ in length: "
                + variations.size() + " != " + dimensionIndices.size());
        }
        for (int i = 1; i < dimensionIndices.size(); i++) {
            if (dimensionIndices.get(i) < dimensionIndices.get(i - 1)) {
                throw new IllegalArgumentException("dimension indices must be non-decreasing: " + dimensionIndices);
            }
        }
        variations = List.copyOf(variations);
        dimensionIndices = List.copyOf(dimensionIndices);
    }

    public static LocationParsedVariations empty() {
        return new LocationParsedVariations(List.of(), List.of());
    }

    public boolean isEmpty() {
        return variations.isEmpty();
    }

    /// @return the distinct owned dimension indices, ascending
    public List<Integer> ownedDimensions() {
        return Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(dimensionIndices)));
    }

    public boolean ownsDimension(int dimension) {
        return dimensionIndices.contains(dimension);
    }

    /// @return the variations of this location sampled by the given dimension
    public List<ElementaryVariation> variationsForDimension(int dimension) {
        List<ElementaryVariation> result = new ArrayList<>();
        for (int i = 0; i < variations.size(); i++) {
            if (dimensionIndices.get(i) == dimension) {
                result.add(variations.get(i));
            }
        }
        return result;
    }

    /// @return the persisted column names of this location's variations
    public List<String> columnNames() {
        List<String> names = new ArrayList<>(variations.size());
        for (ElementaryVariation variation : variations) {
            names.add(variation.columnName());
        }
        return names;
    }
}
