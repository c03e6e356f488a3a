package io.pcvct.sensitivity;

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
import io.pcvct.variations.persistence.VariationMaterializer;
import io.pcvct.variations.sampling.RbdVariation;
import io.pcvct.variations.sampling.RbdVariationsResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Random balance design first-order sensitivity analysis.
 *
 * @see RbdSampling
 */
public final class RbdMethod implements GsaMethod<RbdSampling> {

    public static final String NAME = "rbd";

    /// Default number of harmonics attributed to a feature.
    public static final int DEFAULT_NUM_HARMONICS = 6;

    private static final Logger logger = LogManager.getLogger(RbdMethod.class);

    private final RbdVariation rbd;
    private final int numHarmonics;

    public RbdMethod(RbdVariation rbd) {
        this(rbd, DEFAULT_NUM_HARMONICS);
    }

    public RbdMethod(RbdVariation rbd, int numHarmonics) {
        if (numHarmonics < 1) {
            throw new IllegalArgumentException("At least one harmonic is required, got " + numHarmonics);
        }
        this.rbd = rbd;
        this.numHarmonics = numHarmonics;
    }

    @Override
    public String name() {
        return NAME;
    }

    public RbdVariation getRbd() {
        return rbd;
    }

    public int getNumHarmonics() {
        return numHarmonics;
    }

    @Override
    public RbdSampling runSampling(int replicates, ParsedVariations parsed, VariationMaterializer materializer,
                                   SimulationExecutor executor, GsaRunOptions options) {
        if (!options.getIgnoreIndices().isEmpty()) {
            throw new UnsupportedGsaOptionException("RBD does not support ignoring features (got "
                + options.getIgnoreIndices() + "); only Sobol' does");
        }
        Configurations.requirePositiveReplicates(replicates);

        RbdVariationsResult design = rbd.addVariations(parsed, options.getReference(), materializer);
        VariationId[][] cells = design.sortedVariationIds();
        ConfigurationTable table = Configurations.register(parsed.columnNames(), cells, executor);
        logger.info("RBD design: {} points, {} features, {} harmonics", cells.length, parsed.dimensionCount(), numHarmonics);
        return new RbdSampling(parsed.columnNames(), table, Configurations.runReplicates(table, replicates, executor),
            options.getReplicatePolicy(), numHarmonics, rbd.isHalfPeriod());
    }

    @Override
    public String toString() {
        return "RbdMethod{" + rbd + ", numHarmonics=" + numHarmonics + "}";
    }
}
