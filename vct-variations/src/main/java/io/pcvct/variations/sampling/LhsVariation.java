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

import io.pcvct.variations.ParsedVariations;
import io.pcvct.variations.VariationId;
import io.pcvct.variations.VariationLocation;
import io.pcvct.variations.VariationValidationException;
import io.pcvct.variations.persistence.VariationMaterializer;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;

/**
 * Latin hypercube sampling method.
 *
 * <pre>{@code
 * LhsVariation lhs = LhsVariation.builder(16, RandomGenerators.create(42L))
 *     .addNoise(false)
 *     .orthogonalize(true)
 *     .build();
 * }</pre>
 *
 * @see LatinHypercube
 */
public final class LhsVariation implements VariationMethod {

    private static final Logger logger = LogManager.getLogger(LhsVariation.class);

    private final int n;
    private final boolean addNoise;
    private final boolean orthogonalize;
    private final UniformRandomProvider rng;

    private LhsVariation(Builder builder) {
        this.n = builder.n;
        this.addNoise = builder.addNoise;
        this.orthogonalize = builder.orthogonalize;
        this.rng = builder.rng;
    }

    /**
     * @param n the number of samples
     * @param rng the random source
     * @return a builder with {@code addNoise = false} and {@code orthogonalize = true}
     */
    public static Builder builder(int n, UniformRandomProvider rng) {
        return new Builder(n, rng);
    }

    public int getN() {
        return n;
    }

    public boolean isAddNoise() {
        return addNoise;
    }

    public boolean isOrthogonalize() {
        return orthogonalize;
    }

    @Override
    public LhsVariationsResult addVariations(ParsedVariations parsed, VariationId reference,
                                             VariationMaterializer materializer) {
        int d = parsed.dimensionCount();
        double[][] cdfs = LatinHypercube.generate(n, d, addNoise, orthogonalize, rng);
        Map<VariationLocation, int[]> ids = new EnumMap<>(VariationLocation.class);
        for (VariationLocation location : parsed.usedLocations()) {
            ids.put(location, materializer.materialize(location, parsed, reference.get(location), cdfs));
        }
        logger.info("LHS design: {} samples over {} dimensions (orthogonal: {})",
            n, d, orthogonalize && LatinHypercube.orthogonalSide(n, d) > 0);
        return new LhsVariationsResult(AddVariationsResult.combine(ids, reference, n), cdfs);
    }

    @Override
    public String toString() {
        return "LhsVariation{n=" + n + ", addNoise=" + addNoise + ", orthogonalize=" + orthogonalize + "}";
    }

    /**
     * Builder for {@link LhsVariation}.
     */
    public static final class Builder {
        private final int n;
        private final UniformRandomProvider rng;
        private boolean addNoise = false;
        private boolean orthogonalize = true;

        private Builder(int n, UniformRandomProvider rng) {
            this.n = n;
            this.rng = rng;
        }

        public Builder addNoise(boolean addNoise) {
            this.addNoise = addNoise;
            return this;
        }

        public Builder orthogonalize(boolean orthogonalize) {
            this.orthogonalize = orthogonalize;
            return this;
        }

        public LhsVariation build() {
            if (n < 1) {
                throw new VariationValidationException("LHS needs at least one sample, got " + n);
            }
            if (rng == null) {
                throw new VariationValidationException("LHS needs a random source");
            }
            return new LhsVariation(this);
        }
    }
}
