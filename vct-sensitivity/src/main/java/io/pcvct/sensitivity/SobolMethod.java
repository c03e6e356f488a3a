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
import io.pcvct.variations.VariationLocation;
import io.pcvct.variations.VariationValidationException;
import io.pcvct.variations.persistence.VariationMaterializer;
import io.pcvct.variations.sampling.SkipStart;
import io.pcvct.variations.sampling.SobolRandomization;
import io.pcvct.variations.sampling.SobolVariation;
import io.pcvct.variations.sampling.SobolVariationsResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Sobol' variance-based sensitivity analysis.
 *
 * <p>Two design matrices A and B come from one Sobol design with two matrices.
 * For every analyzed feature i, the hybrid A_B(i) takes A's coordinates with
 * column i replaced by B's; only locations owning feature i are re-materialized,
 * the others keep A's rows.
 *
 * <pre>{@code
 * SobolMethod sobol = SobolMethod.builder(15)
 *     .firstOrder(FirstOrderEstimator.JANSEN_1999)
 *     .totalOrder(TotalOrderEstimator.JANSEN_1999)
 *     .build();
 * }</pre>
 */
public final class SobolMethod implements GsaMethod<SobolSampling> {

    public static final String NAME = "sobol";

    private static final Logger logger = LogManager.getLogger(SobolMethod.class);

    private final SobolVariation sobol;
    private final FirstOrderEstimator firstOrder;
    private final TotalOrderEstimator totalOrder;

    private SobolMethod(Builder builder) {
        this.sobol = SobolVariation.builder(builder.n)
            .matrixCount(2)
            .randomization(builder.randomization)
            .skipStart(builder.skipStart)
            .includeOne(builder.includeOne)
            .build();
        this.firstOrder = builder.firstOrder;
        this.totalOrder = builder.totalOrder;
    }

    public static Builder builder(int n) {
        return new Builder(n);
    }

    @Override
    public String name() {
        return NAME;
    }

    public FirstOrderEstimator getFirstOrder() {
        return firstOrder;
    }

    public TotalOrderEstimator getTotalOrder() {
        return totalOrder;
    }

    @Override
    public SobolSampling runSampling(int replicates, ParsedVariations parsed, VariationMaterializer materializer,
                                     SimulationExecutor executor, GsaRunOptions options) {
        int d = parsed.dimensionCount();
        List<Integer> focus = new ArrayList<>();
        for (int i = 0; i < d; i++) {
            if (!options.getIgnoreIndices().contains(i)) {
                focus.add(i);
            }
        }
        for (int ignored : options.getIgnoreIndices()) {
            if (ignored < 0 || ignored >= d) {
                throw new VariationValidationException("Ignored feature index " + ignored + " is outside 0.." + (d - 1));
            }
        }
        Configurations.requirePositiveReplicates(replicates);

        VariationId reference = options.getReference();
        SobolVariationsResult design = sobol.addVariations(parsed, reference, materializer);
        int n = design.sampleCount();
        double[][] a = design.matrix(0);
        double[][] b = design.matrix(1);

        VariationId[][] cells = new VariationId[n][2 + focus.size()];
        for (int k = 0; k < n; k++) {
            cells[k][0] = design.variationId(k, 0);
            cells[k][1] = design.variationId(k, 1);
        }
        for (int f = 0; f < focus.size(); f++) {
            int feature = focus.get(f);
            double[][] hybrid = new double[n][];
            for (int k = 0; k < n; k++) {
                hybrid[k] = a[k].clone();
                hybrid[k][feature] = b[k][feature];
            }
            for (int k = 0; k < n; k++) {
                cells[k][2 + f] = cells[k][0];
            }
            for (VariationLocation location : parsed.usedLocations()) {
                if (!parsed.get(location).ownsDimension(feature)) {
                    continue;
                }
                int[] ids = materializer.materialize(location, parsed, reference.get(location), hybrid);
                for (int k = 0; k < n; k++) {
                    cells[k][2 + f] = cells[k][2 + f].with(location, ids[k]);
                }
            }
        }

        List<String> featureNames = new ArrayList<>();
        for (int feature : focus) {
            featureNames.add(parsed.dimension(feature).columnName());
        }
        List<String> header = new ArrayList<>();
        header.add("A");
        header.add("B");
        header.addAll(featureNames);
        ConfigurationTable table = Configurations.register(header, cells, executor);
        logger.info("Sobol' design: {} points, {} of {} features analyzed, {} configurations",
            n, focus.size(), d, table.distinctIds().size());
        return new SobolSampling(featureNames, table, Configurations.runReplicates(table, replicates, executor),
            options.getReplicatePolicy(), firstOrder, totalOrder);
    }

    @Override
    public String toString() {
        return "SobolMethod{" + sobol + ", firstOrder=" + firstOrder.label() + ", totalOrder=" + totalOrder.label() + "}";
    }

    /**
     * Builder for {@link SobolMethod}.
     */
    public static final class Builder {
        private final int n;
        private FirstOrderEstimator firstOrder = FirstOrderEstimator.JANSEN_1999;
        private TotalOrderEstimator totalOrder = TotalOrderEstimator.JANSEN_1999;
        private SobolRandomization randomization = SobolRandomization.none();
        private SkipStart skipStart = SkipStart.auto();
        private Boolean includeOne;

        private Builder(int n) {
            this.n = n;
        }

        public Builder firstOrder(FirstOrderEstimator firstOrder) {
            this.firstOrder = firstOrder;
            return this;
        }

        public Builder totalOrder(TotalOrderEstimator totalOrder) {
            this.totalOrder = totalOrder;
            return this;
        }

        public Builder randomization(SobolRandomization randomization) {
            this.randomization = randomization;
            return this;
        }

        public Builder skipStart(SkipStart skipStart) {
            this.skipStart = skipStart;
            return this;
        }

        public Builder includeOne(Boolean includeOne) {
            this.includeOne = includeOne;
            return this;
        }

        public SobolMethod build() {
            if (firstOrder == null || totalOrder == null) {
                throw new IllegalArgumentException("estimators must not be null");
            }
            return new SobolMethod(this);
        }
    }
}
