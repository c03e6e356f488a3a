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

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * Uniform distribution over the closed interval [lower, upper].
 *
 * <pre>{@code
 * CDF(x)      = (x - lower) / (upper - lower), clamped to [0, 1]
 * quantile(p) = lower + p * (upper - lower)
 * }</pre>
 *
 * <p>The range is recomputed on each call rather than cached so that instances
 * created by Gson, which bypasses the constructor, behave identically.
 */
@DistributionType(UniformDistribution.MODEL_TYPE)
public final class UniformDistribution implements ScalarDistribution {

    public static final String MODEL_TYPE = "uniform";

    @SerializedName("lower")
    private final double lower;

    @SerializedName("upper")
    private final double upper;

    /**
     * @param lower the lower bound, inclusive
     * @param upper the upper bound, inclusive; must exceed {@code lower}
     * @throws IllegalArgumentException if the bounds are not finite or not ordered
     */
    public UniformDistribution(double lower, double upper) {
        if (!Double.isFinite(lower) || !Double.isFinite(upper)) {
            throw new IllegalArgumentException("Uniform bounds must be finite: [" + lower + ", " + upper + "]");
        }
        if (lower >= upper) {
            throw new IllegalArgumentException("lower (" + lower + ") must be less than upper (" + upper + ")");
        }
        this.lower = lower;
        this.upper = upper;
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    @Override
    public double cdf(double x) {
        if (x <= lower) return 0.0;
        if (x >= upper) return 1.0;
        return (x - lower) / (upper - lower);
    }

    @Override
    public double quantile(double p) {
        ScalarDistribution.checkProbability(p);
        if (p == 1.0) {
            return upper;
        }
        return lower + p * (upper - lower);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UniformDistribution)) return false;
        UniformDistribution that = (UniformDistribution) o;
        return Double.compare(that.lower, lower) == 0 && Double.compare(that.upper, upper) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper);
    }

    @Override
    public String toString() {
        return "Uniform[" + lower + ", " + upper + "]";
    }
}
