package io.pcvct.sensitivity;

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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The realized design of a sensitivity study: a labelled matrix of configuration ids.
 *
 * <p>Each column holds one role of the design (for example the base points of a
 * Morris design, or matrix A of a Sobol' design) and each row one design point.
 */
public final class ConfigurationTable {

    private final List<String> header;
    private final int[][] ids;

    public ConfigurationTable(List<String> header, int[][] ids) {
        for (int[] row : ids) {
            if (row.length != header.size()) {
                throw new IllegalArgumentException("Row has " + row.length + " ids but the header has "
                    + header.size() + " labels");
            }
        }
        this.header = List.copyOf(header);
        this.ids = new int[ids.length][];
        for (int i = 0; i < ids.length; i++) {
            this.ids[i] = ids[i].clone();
        }
    }

    public List<String> header() {
        return header;
    }

    public int rowCount() {
        return ids.length;
    }

    public int columnCount() {
        return header.size();
    }

    public int get(int row, int column) {
        return ids[row][column];
    }

    public int[] row(int row) {
        return ids[row].clone();
    }

    /// @return every distinct configuration id, in first-appearance order
    public List<Integer> distinctIds() {
        Set<Integer> distinct = new LinkedHashSet<>();
        for (int[] row : ids) {
            for (int id : row) {
                distinct.add(id);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(distinct));
    }
}
