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

import java.util.Objects;

/**
 * How many leading points of the Sobol sequence a design skips.
 *
 * <ul>
 *   <li>{@link #auto()}: decided from the sample count by {@link SobolSubsequence#choose}</li>
 *   <li>{@link #none()}: start at the first point, which is the origin</li>
 *   <li>{@link #toCommonDenominator()}: skip to the start of the smallest run of
 *       consecutive points sharing a power-of-two denominator that holds all draws</li>
 *   <li>{@link #count(int)}: skip a fixed number of points</li>
 * </ul>
 */
public final class SkipStart {

    enum Kind { AUTO, NONE, COMMON_DENOMINATOR, COUNT }

    private static final SkipStart AUTO = new SkipStart(Kind.AUTO, 0);
    private static final SkipStart NONE = new SkipStart(Kind.NONE, 0);
    private static final SkipStart COMMON_DENOMINATOR = new SkipStart(Kind.COMMON_DENOMINATOR, 0);

    private final Kind kind;
    private final int count;

    private SkipStart(Kind kind, int count) {
        this.kind = kind;
        this.count = count;
    }

    public static SkipStart auto() {
        return AUTO;
    }

    public static SkipStart none() {
        return NONE;
    }

    public static SkipStart toCommonDenominator() {
        return COMMON_DENOMINATOR;
    }

    public static SkipStart count(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Skip count must not be negative, got " + count);
        }
        return new SkipStart(Kind.COUNT, count);
    }

    Kind kind() {
        return kind;
    }

    int skipCount() {
        return count;
    }

    public boolean isAuto() {
        return kind == Kind.AUTO;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SkipStart)) return false;
        SkipStart that = (SkipStart) o;
        return kind == that.kind && count == that.count;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, count);
    }

    @Override
    public String toString() {
        return kind == Kind.COUNT ? "SkipStart[" + count + "]" : "SkipStart[" + kind.name().toLowerCase() + "]";
    }
}
