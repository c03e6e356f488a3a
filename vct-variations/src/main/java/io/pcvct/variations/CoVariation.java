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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A group of elementary variations sampled from one shared coordinate.
 *
 * <p>All members are discrete with the same number of values, or all members are
 * distributed. A single coordinate is fanned out to every member, so members move
 * in lockstep (or, for flipped distributed members, in mirror).
 */
public final class CoVariation implements Variation {

    private final List<ElementaryVariation> members;

    public CoVariation(List<? extends ElementaryVariation> members) {
        if (members == null || members.isEmpty()) {
            throw new VariationValidationException("Co-variation must have at least one member");
        }
        boolean discrete = members.get(0) instanceof DiscreteVariation;
        int size = members.get(0).dimensionSize();
        for (ElementaryVariation member : members) {
            if (member == null) {
                throw new VariationValidationException("Co-variation contains a null member");
            }
            if ((member instanceof DiscreteVariation) != discrete) {
                throw new VariationValidationException(
                    "Co-variation members must be all discrete or all distributed: " + members);
            }
            if (discrete && member.dimensionSize() != size) {
                throw new VariationValidationException(
                    "Discrete co-variation members must have the same number of values; "
                        + member.columnName() + " has " + member.dimensionSize() + ", expected " + size);
            }
        }
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
    }

    public static CoVariation of(ElementaryVariation... members) {
        return new CoVariation(Arrays.asList(members));
    }

    @Override
    public int dimensionSize() {
        return members.get(0).dimensionSize();
    }

    @Override
    public List<ElementaryVariation> elementaryVariations() {
        return members;
    }

    @Override
    public String columnName() {
        return members.stream().map(ElementaryVariation::columnName).collect(Collectors.joining(" AND "));
    }

    @Override
    public CoVariation asCoVariation() {
        return this;
    }

    /**
     * Evaluates every member at one shared coordinate.
     *
     * @param cdf the dimension's coordinate
     * @return one value per member, in member order
     */
    public Object[] inverse(double cdf) {
        Object[] values = new Object[members.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = members.get(i).inverse(cdf);
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoVariation)) return false;
        return members.equals(((CoVariation) o).members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return "CoVariation" + members;
    }
}
