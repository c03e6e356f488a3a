package io.pcvct.variations.distribution;

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

import org.apache.commons.math3.distribution.RealDistribution;

/// Exposes any commons-math3 {@link RealDistribution} as a {@link ScalarDistribution}.
///
/// Useful for distributions without a dedicated class here (gamma, beta, log-normal
/// and so on). Wrapped distributions have no registered JSON type and cannot be
/// written by {@link DistributionTypeAdapterFactory}.
public final class RealDistributionAdapter implements ScalarDistribution {

    public static final String MODEL_TYPE = "commons-math";

    private final RealDistribution delegate;

    public RealDistributionAdapter(RealDistribution delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate distribution must not be null");
        }
        this.delegate = delegate;
    }

    public RealDistribution getDelegate() {
        return delegate;
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    @Override
    public double cdf(double x) {
        return delegate.cumulativeProbability(x);
    }

    @Override
    public double quantile(double p) {
        ScalarDistribution.checkProbability(p);
        return delegate.inverseCumulativeProbability(p);
    }

    @Override
    public String toString() {
        return delegate.getClass().getSimpleName();
    }
}
