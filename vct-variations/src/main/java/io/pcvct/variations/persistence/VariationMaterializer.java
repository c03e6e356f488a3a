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

import io.pcvct.variations.DiscreteVariation;
import io.pcvct.variations.ElementaryVariation;
import io.pcvct.variations.LocationParsedVariations;
import io.pcvct.variations.ParsedVariations;
import io.pcvct.variations.Variation;
import io.pcvct.variations.VariationLocation;
import io.pcvct.variations.VariationValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns design coordinates into persisted variation rows.
 *
 * <p>For each design row, every elementary variation of a location is evaluated
 * at the coordinate of its owning dimension. Columns that are not varied are
 * copied from a reference row, and the resulting tuple is resolved through
 * {@link VariationStore#getOrInsertRow}. Identical tuples therefore always map
 * to the same id, whichever sampling method produced them.
 *
 * <p>A location without variations resolves every design row to the reference id.
 */
public final class VariationMaterializer {

    private static final Logger logger = LogManager.getLogger(VariationMaterializer.class);

    private final VariationStore store;

    public VariationMaterializer(VariationStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
    }

    public VariationStore store() {
        return store;
    }

    /**
     * Materializes a matrix of design coordinates at one location.
     *
     * @param location the table to populate
     * @param parsed the parsed variations
     * @param referenceId the row whose values fill the non-varied columns
     * @param cdfs design coordinates, one row per sample and one column per dimension
     * @return one row id per design row
     */
    public int[] materialize(VariationLocation location, ParsedVariations parsed, int referenceId, double[][] cdfs) {
        LocationParsedVariations variations = parsed.get(location);
        int[] ids = new int[cdfs.length];
        if (variations.isEmpty()) {
            Arrays.fill(ids, referenceId);
            return ids;
        }
        Map<String, Object> staticColumns = staticColumns(location, variations.variations(), referenceId);
        for (int row = 0; row < cdfs.length; row++) {
            if (cdfs[row].length != parsed.dimensionCount()) {
                throw new VariationValidationException("Design row " + row + " has " + cdfs[row].length
                    + " coordinates, expected " + parsed.dimensionCount());
            }
            Map<String, Object> varied = new LinkedHashMap<>();
            for (int k = 0; k < variations.variations().size(); k++) {
                ElementaryVariation variation = variations.variations().get(k);
                double cdf = cdfs[row][variations.dimensionIndices().get(k)];
                varied.put(variation.columnName(), variation.inverse(cdf));
            }
            ids[row] = store.getOrInsertRow(location, staticColumns, varied);
        }
        logger.debug("Materialized {} design rows at {}", cdfs.length, location.key());
        return ids;
    }

    /**
     * Materializes the full factorial grid of all discrete dimensions at one location.
     *
     * <p>The result is laid out in row-major order over
     * {@link ParsedVariations#dimensionSizes()}, so the first dimension varies
     * slowest. Combinations are enumerated over the dimensions this location owns
     * and then repeated along the dimensions it does not own.
     *
     * @param location the table to populate
     * @param parsed the parsed variations; every dimension must be discrete
     * @param referenceId the row whose values fill the non-varied columns
     * @return one row id per grid point
     * @throws VariationValidationException if a dimension is continuous
     */
    public int[] materializeGrid(VariationLocation location, ParsedVariations parsed, int referenceId) {
        int[] sizes = parsed.dimensionSizes();
        for (int d = 0; d < sizes.length; d++) {
            if (sizes[d] == Variation.CONTINUOUS) {
                throw new VariationValidationException("Grid sampling needs discrete dimensions, but dimension "
                    + d + " (" + parsed.dimension(d).columnName() + ") is continuous");
            }
        }
        int total = product(sizes);
        int[] ids = new int[total];
        LocationParsedVariations variations = parsed.get(location);
        if (variations.isEmpty()) {
            Arrays.fill(ids, referenceId);
            return ids;
        }

        List<Integer> owned = variations.ownedDimensions();
        int[] localSizes = new int[owned.size()];
        for (int i = 0; i < localSizes.length; i++) {
            localSizes[i] = sizes[owned.get(i)];
        }
        int[] ownedPosition = new int[variations.variations().size()];
        for (int k = 0; k < ownedPosition.length; k++) {
            ownedPosition[k] = owned.indexOf(variations.dimensionIndices().get(k));
        }

        Map<String, Object> staticColumns = staticColumns(location, variations.variations(), referenceId);
        int[] localIds = new int[product(localSizes)];
        int[] localIndex = new int[localSizes.length];
        for (int flat = 0; flat < localIds.length; flat++) {
            unravel(flat, localSizes, localIndex);
            Map<String, Object> varied = new LinkedHashMap<>();
            for (int k = 0; k < ownedPosition.length; k++) {
                DiscreteVariation<?> variation = (DiscreteVariation<?>) variations.variations().get(k);
                varied.put(variation.columnName(), variation.values().get(localIndex[ownedPosition[k]]));
            }
            localIds[flat] = store.getOrInsertRow(location, staticColumns, varied);
        }

        int[] index = new int[sizes.length];
        for (int flat = 0; flat < total; flat++) {
            unravel(flat, sizes, index);
            int local = 0;
            for (int i = 0; i < localSizes.length; i++) {
                local = local * localSizes[i] + index[owned.get(i)];
            }
            ids[flat] = localIds[local];
        }
        logger.debug("Materialized {} grid combinations at {} over dimensions {}", localIds.length, location.key(), owned);
        return ids;
    }

    /**
     * Materializes one explicit tuple at one location.
     *
     * @param location the table to populate
     * @param variations the variations to set
     * @param values one value per variation
     * @param referenceId the row whose values fill every other column
     * @return the row id
     */
    public int materializeValues(VariationLocation location, List<ElementaryVariation> variations,
                                 List<?> values, int referenceId) {
        if (variations.size() != values.size()) {
            throw new VariationValidationException(
                "Got " + values.size() + " values for " + variations.size() + " variations");
        }
        Map<String, Object> staticColumns = staticColumns(location, variations, referenceId);
        Map<String, Object> varied = new LinkedHashMap<>();
        for (int k = 0; k < variations.size(); k++) {
            varied.put(variations.get(k).columnName(), values.get(k));
        }
        return store.getOrInsertRow(location, staticColumns, varied);
    }

    private Map<String, Object> staticColumns(VariationLocation location, List<ElementaryVariation> varied, int referenceId) {
        Map<String, Object> columns = new LinkedHashMap<>(store.referenceRow(location, referenceId));
        for (ElementaryVariation variation : varied) {
            columns.remove(variation.columnName());
        }
        return columns;
    }

    static int product(int[] sizes) {
        int product = 1;
        for (int size : sizes) {
            product = Math.multiplyExact(product, size);
        }
        return product;
    }

    /// Row-major index decomposition; the last dimension varies fastest.
    static void unravel(int flat, int[] sizes, int[] index) {
        for (int i = sizes.length - 1; i >= 0; i--) {
            index[i] = flat % sizes[i];
            flat /= sizes[i];
        }
    }
}
