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

import io.pcvct.variations.distribution.NormalDistribution;
import io.pcvct.variations.distribution.ScalarDistribution;
import io.pcvct.variations.distribution.UniformDistribution;

import java.util.Objects;

/**
 * A variation whose values follow a continuous distribution.
 *
 * <p>When {@code flip} is set the coordinate runs against the distribution:
 * {@code cdf(x) = 1 - F(x)} and {@code inverse(c) = F⁻¹(1 - c)}. Inside a
 * {@link CoVariation} a flipped member therefore moves opposite to the others.
 */
public final class DistributedVariation extends ElementaryVariation {

    private final ScalarDistribution distribution;
    private final boolean flip;

    public DistributedVariation(TargetPath target, ScalarDistribution distribution, boolean flip) {
        super(target);
        if (distribution == null) {
            throw new VariationValidationException("Distributed variation for " + target + " needs a distribution");
        }
        this.distribution = distribution;
        this.flip = flip;
    }

    public DistributedVariation(TargetPath target, ScalarDistribution distribution) {
        this(target, distribution, false);
    }

    public static DistributedVariation uniform(TargetPath target, double lower, double upper) {
        return uniform(target, lower, upper, false);
    }

    public static DistributedVariation uniform(TargetPath target, double lower, double upper, boolean flip) {
        return new DistributedVariation(target, new UniformDistribution(lower, upper), flip);
    }

    public static DistributedVariation normal(TargetPath target, double mean, double stdDev) {
        return normal(target, mean, stdDev, false);
    }

    public static DistributedVariation normal(TargetPath target, double mean, double stdDev, boolean flip) {
        return new DistributedVariation(target, new NormalDistribution(mean, stdDev), flip);
    }

    /// Normal distribution truncated to [lower, upper].
    public static DistributedVariation normal(TargetPath target, double mean, double stdDev,
                                              double lower, double upper, boolean flip) {
        return new DistributedVariation(target, new NormalDistribution(mean, stdDev, lower, upper), flip);
    }

    public ScalarDistribution distribution() {
        return distribution;
    }

    public boolean isFlipped() {
        return flip;
    }

    @Override
    public int dimensionSize() {
        return CONTINUOUS;
    }

    @Override
    public double cdf(Object value) {
        if (!(value instanceof Number)) {
            throw new VariationValidationException(
                "Value " + value + " of " + columnName() + " is not numeric");
        }
        double f = distribution.cdf(((Number) value).doubleValue());
        return flip ? 1.0 - f : f;
    }

    @Override
    public Double inverse(double cdf) {
        checkCoordinate(cdf, this);
        return distribution.quantile(flip ? 1.0 - cdf : cdf);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DistributedVariation)) return false;
        DistributedVariation that = (DistributedVariation) o;
        return flip == that.flip && target().equals(that.target()) && distribution.equals(that.distribution);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target(), distribution, flip);
    }

    @Override
    public String toString() {
        return "DistributedVariation{" + location().key() + ", " + target() + ", " + distribution
            + (flip ? ", flipped" : "") + "}";
    }
}
