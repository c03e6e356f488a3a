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

/**
 * A continuous univariate distribution used by a distributed variation.
 *
 * <p>Only the two directions of the probability integral transform are needed:
 * {@link #cdf(double)} maps a parameter value into [0, 1] and {@link #quantile(double)}
 * maps a design coordinate back into the parameter's domain. Implementations must
 * be immutable and satisfy {@code quantile(cdf(x)) == x} up to numerical precision
 * for every {@code x} in the support.
 *
 * @see DistributionTypeAdapterFactory
 */
public interface ScalarDistribution {

    /**
     * Returns the type discriminator written to JSON, for example {@code "uniform"}.
     *
     * @return the distribution type name
     */
    String getModelType();

    /**
     * Cumulative distribution function.
     *
     * @param x a value
     * @return P(X &le; x)
     */
    double cdf(double x);

    /**
     * Inverse cumulative distribution function.
     *
     * @param p a probability in [0, 1]
     * @return the smallest x with cdf(x) &ge; p
     * @throws IllegalArgumentException if p is outside [0, 1]
     */
    double quantile(double p);

    /**
     * Validates a probability argument for {@link #quantile(double)}.
     *
     * @param p the probability
     * @throws IllegalArgumentException if p is NaN or outside [0, 1]
     */
    static void checkProbability(double p) {
        if (!(p >= 0.0 && p <= 1.0)) {
            throw new IllegalArgumentException("Probability must be in [0, 1], got " + p);
        }
    }
}
