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

import java.util.List;

/**
 * One varied parameter, addressed by a {@link TargetPath}.
 *
 * <p>An elementary variation maps between parameter values and design
 * coordinates in [0, 1]: {@link #cdf(Object)} places a value on the unit interval
 * and {@link #inverse(double)} recovers a value from a coordinate. For every value
 * {@code v} in the variation's domain, {@code inverse(cdf(v))} equals {@code v}.
 *
 * <p>Instances are immutable.
 */
public abstract class ElementaryVariation implements Variation {

    private final TargetPath target;
    private final VariationLocation location;

    protected ElementaryVariation(TargetPath target) {
        if (target == null) {
            throw new VariationValidationException("Variation target must not be null");
        }
        this.target = target;
        this.location = VariationLocation.of(target);
    }

    public TargetPath target() {
        return target;
    }

    public VariationLocation location() {
        return location;
    }

    /**
     * Places a parameter value on the unit interval.
     *
     * @param value a value of this variation
     * @return its design coordinate in [0, 1]
     * @throws VariationValidationException if the value is outside the variation's domain
     */
    public abstract double cdf(Object value);

    /**
     * Recovers the parameter value at a design coordinate.
     *
     * @param cdf a coordinate in [0, 1]
     * @return the value at that coordinate
     * @throws VariationValidationException if the coordinate is outside [0, 1]
     */
    public abstract Object inverse(double cdf);

    /**
     * Vectorized {@link #inverse(double)}.
     *
     * @param cdfs design coordinates
     * @return the values at those coordinates, in the same order
     */
    public Object[] inverse(double[] cdfs) {
        Object[] values = new Object[cdfs.length];
        for (int i = 0; i < cdfs.length; i++) {
            values[i] = inverse(cdfs[i]);
        }
        return values;
    }

    @Override
    public List<ElementaryVariation> elementaryVariations() {
        return List.of(this);
    }

    @Override
    public String columnName() {
        return target.columnName();
    }

    @Override
    public CoVariation asCoVariation() {
        return CoVariation.of(this);
    }

    protected static void checkCoordinate(double cdf, ElementaryVariation variation) {
        if (!(cdf >= 0.0 && cdf <= 1.0)) {
            throw new VariationValidationException(
                "Design coordinate " + cdf + " for " + variation.columnName() + " is outside [0, 1]");
        }
    }
}
