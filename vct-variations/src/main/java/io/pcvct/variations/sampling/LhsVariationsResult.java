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

import io.pcvct.variations.VariationId;

import java.util.List;

/// Result of {@link LhsVariation}: one id per sample plus the sample's coordinates.
public final class LhsVariationsResult extends AddVariationsResult {

    private final double[][] cdfs;

    LhsVariationsResult(List<VariationId> variationIds, double[][] cdfs) {
        super(variationIds);
        this.cdfs = cdfs;
    }

    /// @return the design coordinates, one row per sample and one column per dimension
    public double[][] cdfs() {
        double[][] copy = new double[cdfs.length][];
        for (int i = 0; i < cdfs.length; i++) {
            copy[i] = cdfs[i].clone();
        }
        return copy;
    }

    public double cdf(int sample, int dimension) {
        return cdfs[sample][dimension];
    }
}
