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

import io.pcvct.variations.VariationLocation;

import java.util.List;
import java.util.Map;

/**
 * Persistence collaborator holding one table of variation rows per location.
 *
 * <p>Row 0 of every table is the base row: the parameter values of the
 * unmodified input documents. Rows are created by {@link #getOrInsertRow} and are
 * never mutated or deleted. Implementations must make get-or-insert atomic: two
 * concurrent calls with the same tuple return the same id and create one row.
 */
public interface VariationStore {

    /**
     * Returns the id of the row holding exactly the given tuple, inserting it if
     * no such row exists.
     *
     * @param location the table to search
     * @param staticColumns columns copied unchanged from a reference row
     * @param variedColumns columns set by the current design row
     * @return the id of the matching row
     * @throws io.pcvct.variations.VariationLookupException if a column is unknown
     */
    int getOrInsertRow(VariationLocation location, Map<String, ?> staticColumns, Map<String, ?> variedColumns);

    /**
     * @param location the table
     * @param id a row id
     * @param column a column name
     * @return the stored value
     * @throws io.pcvct.variations.VariationLookupException if the row or column does not exist
     */
    Object referenceValue(VariationLocation location, int id, String column);

    /**
     * @param location the table
     * @param id a row id
     * @return the whole row, in column order
     * @throws io.pcvct.variations.VariationLookupException if the row does not exist
     */
    Map<String, Object> referenceRow(VariationLocation location, int id);

    /**
     * @param location the table
     * @return the column names of the table, in order
     */
    List<String> columns(VariationLocation location);

    /**
     * @param location the table
     * @return the number of rows, including the base row
     */
    int rowCount(VariationLocation location);
}
