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

import java.util.List;

/// Storage location of a varied parameter.
///
/// Each location corresponds to one input document of the simulator and to one
/// table of persisted variation rows. The location of a variation is never given
/// explicitly; it is inferred from the first element of its {@link TargetPath}.
public enum VariationLocation {
    CONFIG("config"),
    RULESETS_COLLECTION("rulesets_collection"),
    INTRACELLULAR("intracellular"),
    IC_CELL("ic_cell"),
    IC_ECM("ic_ecm");

    private final String key;

    VariationLocation(String key) {
        this.key = key;
    }

    /// @return the lower-case key used in journals and configuration files
    public String key() {
        return key;
    }

    /// Infers the location that owns the given path.
    ///
    /// @param path the target path
    /// @return the owning location, {@link #CONFIG} when no other location matches
    public static VariationLocation of(TargetPath path) {
        List<String> elements = path.elements();
        String first = elements.get(0);
        if (first.startsWith("behavior_ruleset:name:")) {
            return RULESETS_COLLECTION;
        }
        if (first.equals("intracellulars")) {
            return INTRACELLULAR;
        }
        if (first.startsWith("cell_patches:name:")) {
            return IC_CELL;
        }
        if (first.startsWith("layer:ID:")) {
            return IC_ECM;
        }
        return CONFIG;
    }

    /// Looks up a location by its key.
    ///
    /// @param key the key, for example {@code "ic_cell"}
    /// @return the matching location
    /// @throws IllegalArgumentException if no location has that key
    public static VariationLocation fromKey(String key) {
        for (VariationLocation location : values()) {
            if (location.key.equals(key)) {
                return location;
            }
        }
        throw new IllegalArgumentException("Unknown variation location: '" + key + "'");
    }
}
