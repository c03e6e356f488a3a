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
import java.util.Objects;

/**
 * A variation over an explicit, ordered list of values.
 *
 * <p>The i-th of n values (0-based) sits at coordinate {@code i / (n - 1)}; a
 * single value sits at 0. The inverse partitions [0, 1] into n equal bins, so a
 * coordinate c selects value {@code min(floor(c * n), n - 1)}.
 *
 * @param <T> the value type
 */
public final class DiscreteVariation<T> extends ElementaryVariation {

    private final List<T> values;

    public DiscreteVariation(TargetPath target, List<T> values) {
        super(target);
        if (values == null || values.isEmpty()) {
            throw new VariationValidationException("Discrete variation for " + target + " must have at least one value");
        }
        List<T> copy = new ArrayList<>(values.size());
        for (T value : values) {
            if (value == null) {
                throw new VariationValidationException("Discrete variation for " + target + " contains a null value");
            }
            copy.add(value);
        }
        this.values = Collections.unmodifiableList(copy);
    }

    @SafeVarargs
    public static <T> DiscreteVariation<T> of(TargetPath target, T... values) {
        return new DiscreteVariation<>(target, Arrays.asList(values));
    }

    public static <T> DiscreteVariation<T> of(List<String> target, List<T> values) {
        return new DiscreteVariation<>(new TargetPath(target), values);
    }

    public List<T> values() {
        return values;
    }

    @Override
    public int dimensionSize() {
        return values.size();
    }

    @Override
    public double cdf(Object value) {
        int index = values.indexOf(value);
        if (index < 0) {
            throw new VariationValidationException(
                "Value " + value + " is not one of the values " + values + " of " + columnName());
        }
        if (values.size() == 1) {
            return 0.0;
        }
        return (double) index / (values.size() - 1);
    }

    @Override
    public T inverse(double cdf) {
        checkCoordinate(cdf, this);
        int n = values.size();
        int index = (int) Math.floor(cdf * n);
        return values.get(Math.min(Math.max(index, 0), n - 1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiscreteVariation)) return false;
        DiscreteVariation<?> that = (DiscreteVariation<?>) o;
        return target().equals(that.target()) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target(), values);
    }

    @Override
    public String toString() {
        return "DiscreteVariation{" + location().key() + ", " + target() + ", " + values + "}";
    }
}
