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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/// Symbolic path to one varied element of a simulator input document.
///
/// Each element is either a bare tag ({@code overall}), a tag selected by an
/// attribute value ({@code cell_definition:name:default}) or a tag selected by the
/// content of a child ({@code rule::signal:oxygen}). An element with more than three
/// {@code :}-separated tokens is only accepted in the custom-data form
/// {@code tag:attribute:custom:<name>}.
///
/// Elements of the form {@code custom:<name>} (and {@code custom: <name>}) are
/// rewritten to {@code custom <name>}, the spelling the simulator uses for
/// custom data in rules.
public final class TargetPath {

    private static final String CUSTOM_PREFIX = "custom:";

    private final List<String> elements;

    /// Creates a path after validating and normalizing its elements.
    ///
    /// @param elements the path elements, outermost first
    /// @throws VariationValidationException if the path is empty or an element is malformed
    public TargetPath(List<String> elements) {
        if (elements == null || elements.isEmpty()) {
            throw new VariationValidationException("Target path must have at least one element");
        }
        List<String> normalized = new ArrayList<>(elements.size());
        for (String element : elements) {
            if (element == null || element.isEmpty()) {
                throw new VariationValidationException("Target path " + elements + " contains an empty element");
            }
            if (element.startsWith(CUSTOM_PREFIX)) {
                element = "custom " + element.substring(CUSTOM_PREFIX.length()).stripLeading();
            }
            validateElement(element, elements);
            normalized.add(element);
        }
        this.elements = Collections.unmodifiableList(normalized);
    }

    public static TargetPath of(String... elements) {
        return new TargetPath(Arrays.asList(elements));
    }

    private static void validateElement(String element, List<String> path) {
        String[] tokens = element.split(":", -1);
        if (tokens.length < 4) {
            return;
        }
        // tag::child:content with a colon in the content, or tag:attribute:custom:name
        if (tokens[1].isEmpty() || tokens[2].equals("custom")) {
            return;
        }
        throw new VariationValidationException(
            "Invalid target path element '" + element + "' in " + path
                + ": more than three ':'-separated tokens are only allowed for custom data (tag:attribute:custom:name)");
    }

    public List<String> elements() {
        return elements;
    }

    /// @return the persisted column name, the elements joined with {@code /}
    public String columnName() {
        return String.join("/", elements);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TargetPath)) return false;
        return elements.equals(((TargetPath) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return columnName();
    }
}
