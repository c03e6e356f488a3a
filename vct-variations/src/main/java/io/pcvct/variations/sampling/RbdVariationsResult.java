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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link RbdVariation}.
 *
 * <p>Besides one id per design point, it holds for every dimension the
 * permutation that puts the design points in increasing angular order along that
 * dimension, and for every location the row-id matrix already reordered by those
 * permutations: column {@code j} of a location's matrix lists that location's ids
 * in dimension {@code j}'s order.
 */
public final class RbdVariationsResult extends AddVariationsResult {

    private final double[][] cdfs;
    private final int[][] sortingIndices;
    private final Map<VariationLocation, int[][]> locationSortedIds;

    RbdVariationsResult(List<VariationId> variationIds, double[][] cdfs, int[][] sortingIndices,
                        Map<VariationLocation, int[][]> locationSortedIds) {
        super(variationIds);
        this.cdfs = cdfs;
        this.sortingIndices = sortingIndices;
        this.locationSortedIds = Collections.unmodifiableMap(locationSortedIds);
    }

    public double cdf(int sample, int dimension) {
        return cdfs[sample][dimension];
    }

    /// @return the design point at the given angular rank along the given dimension
    public int sortingIndex(int rank, int dimension) {
        return sortingIndices[rank][dimension];
    }

    /// @return row ids of one location, one row per rank and one column per dimension
    public int[][] locationSortedIds(VariationLocation location) {
        int[][] ids = locationSortedIds.get(location);
        int[][] copy = new int[ids.length][];
        for (int i = 0; i < ids.length; i++) {
            copy[i] = ids[i].clone();
        }
        return copy;
    }

    /// @return the ids of all locations, one row per rank and one column per dimension
    public VariationId[][] sortedVariationIds() {
        int n = sortingIndices.length;
        int d = n == 0 ? 0 : sortingIndices[0].length;
        VariationId[][] ids = new VariationId[n][d];
        for (int rank = 0; rank < n; rank++) {
            for (int j = 0; j < d; j++) {
                ids[rank][j] = variationIds().get(sortingIndices[rank][j]);
            }
        }
        return ids;
    }
}
