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

import org.apache.commons.rng.UniformRandomProvider;

/// Randomization applied to drawn Sobol points before the all-ones point is appended.
@FunctionalInterface
public interface SobolRandomization {

    /// Randomizes points in place.
    ///
    /// @param points the drawn points, one row per point
    void apply(double[][] points);

    /// @return the identity randomization
    static SobolRandomization none() {
        return points -> { };
    }

    /// Cranley-Patterson rotation: one uniform shift per coordinate, applied modulo 1.
    ///
    /// @param rng the random source for the shift
    static SobolRandomization randomShift(UniformRandomProvider rng) {
        return points -> {
            if (points.length == 0) {
                return;
            }
            double[] shift = new double[points[0].length];
            for (int j = 0; j < shift.length; j++) {
                shift[j] = rng.nextDouble();
            }
            for (double[] point : points) {
                for (int j = 0; j < point.length; j++) {
                    double x = point[j] + shift[j];
                    point[j] = x >= 1.0 ? x - 1.0 : x;
                }
            }
        };
    }
}
