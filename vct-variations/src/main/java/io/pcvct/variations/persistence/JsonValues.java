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

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.math.BigInteger;

/// Converts between JSON scalars and the Java values stored in variation rows.
///
/// Numbers keep the integer/floating distinction of their source text, so a value
/// written as {@code 3} reads back as an {@link Integer} (or {@link Long}) and
/// {@code 3.0} as a {@link Double}. Row identity compares numbers by value, see
/// {@link #canonical(Object)}.
public final class JsonValues {

    private JsonValues() {
    }

    /// @param value a row value (number, boolean, string or null)
    /// @return its JSON form
    public static JsonElement toJson(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof Number) {
            return new JsonPrimitive((Number) value);
        }
        if (value instanceof Boolean) {
            return new JsonPrimitive((Boolean) value);
        }
        return new JsonPrimitive(value.toString());
    }

    /// @param element a JSON scalar
    /// @return the corresponding Java value
    /// @throws IllegalArgumentException if the element is an array or object
    public static Object fromJson(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonPrimitive()) {
            throw new IllegalArgumentException("Expected a JSON scalar, got " + element);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return parseNumber(primitive.getAsString());
        }
        return primitive.getAsString();
    }

    static Number parseNumber(String text) {
        if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0
            || text.contains("Infinity") || text.contains("NaN")) {
            return Double.parseDouble(text);
        }
        long value = Long.parseLong(text);
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return (int) value;
        }
        return value;
    }

    /// The string form used to compare row values.
    ///
    /// Finite numbers compare by numeric value, so {@code 1440} and {@code 1440.0}
    /// name the same tuple; their plain decimal form without trailing zeros is used.
    /// Everything else, including NaN and infinities, uses {@code String.valueOf}.
    ///
    /// @param value a row value
    /// @return the canonical string
    public static String canonical(Object value) {
        if (value instanceof Number && isFinite((Number) value)) {
            BigDecimal decimal = new BigDecimal(value.toString()).stripTrailingZeros();
            return decimal.signum() == 0 ? "0" : decimal.toPlainString();
        }
        return String.valueOf(value);
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.isFinite(number.doubleValue());
        }
        return number instanceof Integer || number instanceof Long || number instanceof Short
            || number instanceof Byte || number instanceof BigDecimal || number instanceof BigInteger;
    }
}
