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

import io.pcvct.variations.ElementaryVariation;
import io.pcvct.variations.LocationParsedVariations;
import io.pcvct.variations.ParsedVariations;
import io.pcvct.variations.VariationId;
import io.pcvct.variations.VariationLocation;
import io.pcvct.variations.persistence.VariationMaterializer;
import io.pcvct.variations.sampling.LhsVariation;
import io.pcvct.variations.sampling.LhsVariationsResult;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Morris one-at-a-time screening.
 *
 * <p>Base points come from a Latin hypercube. For each base point and feature,
 * one perturbed point moves only that feature's design coordinate by half the
 * unit interval: up when the coordinate is below 0.5, otherwise down. The
 * perturbed parameter set keeps every other value of the base point.
 */
public final class MoatMethod implements GsaMethod<MoatSampling> {

    public static final String NAME = "moat";

    /// Default number of base points.
    public static final int DEFAULT_N = 15;

    private static final Logger logger = LogManager.getLogger(MoatMethod.class);

    private final LhsVariation lhs;

    /// @param lhs the design of the base points
    public MoatMethod(LhsVariation lhs) {
        this.lhs = lhs;
    }

    /// @return a method with {@value #DEFAULT_N} orthogonalized, noise-free base points
    public static MoatMethod withDefaults(UniformRandomProvider rng) {
        return new MoatMethod(LhsVariation.builder(DEFAULT_N, rng).build());
    }

    @Override
    public String name() {
        return NAME;
    }

    public LhsVariation getLhs() {
        return lhs;
    }

    @Override
    public MoatSampling runSampling(int replicates, ParsedVariations parsed, VariationMaterializer materializer,
                                    SimulationExecutor executor, GsaRunOptions options) {
        if (!options.getIgnoreIndices().isEmpty()) {
            throw new UnsupportedGsaOptionException("MOAT does not support ignoring features (got "
                + options.getIgnoreIndices() + "); only Sobol' does");
        }
        Configurations.requirePositiveReplicates(replicates);

        LhsVariationsResult base = lhs.addVariations(parsed, options.getReference(), materializer);
        int n = base.size();
        int d = parsed.dimensionCount();
        double[][] steps = new double[n][d];
        VariationId[][] cells = new VariationId[n][1 + d];
        for (int i = 0; i < n; i++) {
            VariationId baseId = base.variationIds().get(i);
            cells[i][0] = baseId;
            for (int j = 0; j < d; j++) {
                double cdf = base.cdf(i, j);
                double step = cdf < 0.5 ? 0.5 : -0.5;
                steps[i][j] = step;
                cells[i][1 + j] = perturb(parsed, materializer, baseId, j, cdf + step);
            }
        }

        List<String> header = new ArrayList<>();
        header.add("base");
        header.addAll(parsed.columnNames());
        ConfigurationTable table = Configurations.register(header, cells, executor);
        logger.info("MOAT design: {} base points, {} features, {} configurations", n, d, table.distinctIds().size());
        return new MoatSampling(parsed.columnNames(), table,
            Configurations.runReplicates(table, replicates, executor), options.getReplicatePolicy(), steps);
    }

    private static VariationId perturb(ParsedVariations parsed, VariationMaterializer materializer,
                                       VariationId baseId, int dimension, double cdf) {
        VariationId perturbed = baseId;
        for (VariationLocation location : parsed.usedLocations()) {
            LocationParsedVariations variations = parsed.get(location);
            if (!variations.ownsDimension(dimension)) {
                continue;
            }
            List<ElementaryVariation> moved = variations.variationsForDimension(dimension);
            List<Object> values = new ArrayList<>(moved.size());
            for (ElementaryVariation variation : moved) {
                values.add(variation.inverse(cdf));
            }
            int id = materializer.materializeValues(location, moved, values, baseId.get(location));
            perturbed = perturbed.with(location, id);
        }
        return perturbed;
    }

    @Override
    public String toString() {
        return "MoatMethod{" + lhs + "}";
    }
}
