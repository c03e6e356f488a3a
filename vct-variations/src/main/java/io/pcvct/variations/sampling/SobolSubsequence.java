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

import io.pcvct.variations.VariationValidationException;

/**
 * Which part of the Sobol sequence a design of {@code n} points uses.
 *
 * <p>With an automatic skip the choice depends on {@code n}:
 * <pre>
 * n = 2^k - 1   skip the origin
 * n = 2^k + 1   start at the origin; include the point 1 unless told not to
 * otherwise     start at the origin
 * </pre>
 *
 * <p>When {@code includeOne} holds, {@code n - 1} points are drawn and the
 * all-ones point is appended.
 *
 * @param skip the number of leading sequence points to skip
 * @param includeOne whether the all-ones point ends the design
 */
public record SobolSubsequence(int skip, boolean includeOne) {

    /**
     * Resolves the subsequence for a design.
     *
     * @param n the number of design points, at least 1
     * @param skipStart the requested skip
     * @param includeOne the requested inclusion of the all-ones point, or null when unset
     * @return the resolved subsequence
     */
    public static SobolSubsequence choose(int n, SkipStart skipStart, Boolean includeOne) {
        if (n < 1) {
            throw new VariationValidationException("Sobol design needs at least one point, got " + n);
        }
        SkipStart skip = skipStart;
        Boolean include = includeOne;
        if (skip.isAuto()) {
            if (isPowerOfTwo(n + 1)) {
                skip = SkipStart.count(1);
            } else {
                skip = SkipStart.none();
                if (isPowerOfTwo(n - 1) && include == null) {
                    include = Boolean.TRUE;
                }
            }
        }
        boolean resolvedInclude = Boolean.TRUE.equals(include);
        int draws = n - (resolvedInclude ? 1 : 0);
        int skipped;
        switch (skip.kind()) {
            case NONE:
                skipped = 0;
                break;
            case COUNT:
                skipped = skip.skipCount();
                break;
            case COMMON_DENOMINATOR:
                skipped = draws <= 1 ? 1 : 1 << (floorLog2(draws - 1) + 1);
                break;
            default:
                throw new IllegalStateException("Unresolved skip " + skip);
        }
        return new SobolSubsequence(skipped, resolvedInclude);
    }

    /// @return the number of points drawn from the sequence
    public int draws(int n) {
        return n - (includeOne ? 1 : 0);
    }

    static boolean isPowerOfTwo(int x) {
        return x > 0 && (x & (x - 1)) == 0;
    }

    static int floorLog2(int x) {
        return 31 - Integer.numberOfLeadingZeros(x);
    }
}
