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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/// One persisted row id per location; together they identify one parameter set.
///
/// Immutable. Every location always has an id; locations that a design does not
/// vary keep the id of the reference they were derived from.
public final class VariationId {

    private static final VariationId BASE = new VariationId(new EnumMap<>(VariationLocation.class));

    private final Map<VariationLocation, Integer> ids;

    private VariationId(Map<VariationLocation, Integer> ids) {
        EnumMap<VariationLocation, Integer> copy = new EnumMap<>(VariationLocation.class);
        for (VariationLocation location : VariationLocation.values()) {
            Integer id = ids.get(location);
            copy.put(location, id == null ? 0 : id);
        }
        this.ids = Collections.unmodifiableMap(copy);
    }

    /// @return the id of the base row (0) at every location
    public static VariationId base() {
        return BASE;
    }

    /// @param ids ids by location; missing locations get the base row id 0
    public static VariationId of(Map<VariationLocation, Integer> ids) {
        return new VariationId(ids);
    }

    public int get(VariationLocation location) {
        return ids.get(location);
    }

    /// @return a copy of this id with one location replaced
    public VariationId with(VariationLocation location, int id) {
        EnumMap<VariationLocation, Integer> copy = new EnumMap<>(ids);
        copy.put(location, id);
        return new VariationId(copy);
    }

    public Map<VariationLocation, Integer> asMap() {
        return ids;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariationId)) return false;
        return ids.equals(((VariationId) o).ids);
    }

    @Override
    public int hashCode() {
        return ids.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("VariationId{");
        boolean first = true;
        for (Map.Entry<VariationLocation, Integer> entry : ids.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(entry.getKey().key()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }
}
