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
 * Normal distribution N(mean, stdDev&sup2;), optionally truncated to [lower, upper].
 *
 * <p>An untruncated distribution uses infinite bounds. Both directions go through
 * the standard normal CDF Φ and its inverse from commons-math3:
 *
 * <pre>{@code
 * a = Φ((lower - mean) / stdDev),  b = Φ((upper - mean) / stdDev)
 * CDF(x)      = (Φ((x - mean) / stdDev) - a) / (b - a)
 * quantile(p) = mean + stdDev * Φ⁻¹(a + p * (b - a))
 * }</pre>
 *
 * <p>With infinite bounds a = 0 and b = 1, so the truncated and untruncated
 * forms share one code path. Infinite bounds are written to JSON as
 * {@code "-Infinity"}/{@code "Infinity"} and read back leniently.
 */
@DistributionType(NormalDistribution.MODEL_TYPE)
public final class NormalDistribution implements ScalarDistribution {

    public static final String MODEL_TYPE = "normal";

    private static final org.apache.commons.math3.distribution.NormalDistribution STANDARD =
        new org.apache.commons.math3.distribution.NormalDistribution(null, 0.0, 1.0);

    @SerializedName("mean")
    private final double mean;

    @SerializedName("std_dev")
    private final double stdDev;

    @SerializedName("lower")
    private final double lower;

    @SerializedName("upper")
    private final double upper;

    /// Used by Gson; bounds missing from the JSON stay infinite.
    private NormalDistribution() {
        this(0.0, 1.0);
    }

    /**
     * Creates an untruncated normal distribution.
     *
     * @param mean the mean
     * @param stdDev the standard deviation, must be positive
     */
    public NormalDistribution(double mean, double stdDev) {
        this(mean, stdDev, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    /**
     * Creates a normal distribution truncated to [lower, upper].
     *
     * @param mean the mean of the parent normal
     * @param stdDev the standard deviation of the parent normal, must be positive
     * @param lower the lower truncation bound, may be {@code -Infinity}
     * @param upper the upper truncation bound, may be {@code +Infinity}
     * @throws IllegalArgumentException if stdDev is not positive or the bounds are not ordered
     */
    public NormalDistribution(double mean, double stdDev, double lower, double upper) {
        if (!(stdDev > 0.0) || !Double.isFinite(stdDev)) {
            throw new IllegalArgumentException("Standard deviation must be positive and finite, got " + stdDev);
        }
        if (!Double.isFinite(mean)) {
            throw new IllegalArgumentException("Mean must be finite, got " + mean);
        }
        if (Double.isNaN(lower) || Double.isNaN(upper) || lower >= upper) {
            throw new IllegalArgumentException("lower (" + lower + ") must be less than upper (" + upper + ")");
        }
        this.mean = mean;
        this.stdDev = stdDev;
        this.lower = lower;
        this.upper = upper;
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    public boolean isTruncated() {
        return lower != Double.NEGATIVE_INFINITY || upper != Double.POSITIVE_INFINITY;
    }

    @Override
    public double cdf(double x) {
        if (x <= lower) return 0.0;
        if (x >= upper) return 1.0;
        double a = standardCdf(lower);
        double b = standardCdf(upper);
        return (standardCdf(x) - a) / (b - a);
    }

    @Override
    public double quantile(double p) {
        ScalarDistribution.checkProbability(p);
        if (p == 0.0) return lower;
        if (p == 1.0) return upper;
        double a = standardCdf(lower);
        double b = standardCdf(upper);
        double x = mean + stdDev * STANDARD.inverseCumulativeProbability(a + p * (b - a));
        return Math.max(lower, Math.min(upper, x));
    }

    private double standardCdf(double x) {
        if (x == Double.NEGATIVE_INFINITY) return 0.0;
        if (x == Double.POSITIVE_INFINITY) return 1.0;
        return STANDARD.cumulativeProbability((x - mean) / stdDev);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalDistribution)) return false;
        NormalDistribution that = (NormalDistribution) o;
        return Double.compare(that.mean, mean) == 0
            && Double.compare(that.stdDev, stdDev) == 0
            && Double.compare(that.lower, lower) == 0
            && Double.compare(that.upper, upper) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stdDev, lower, upper);
    }

    @Override
    public String toString() {
        if (isTruncated()) {
            return "Normal[μ=" + mean + ", σ=" + stdDev + ", [" + lower + ", " + upper + "]]";
        }
        return "Normal[μ=" + mean + ", σ=" + stdDev + "]";
    }
}
