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
import io.pcvct.variations.Variation;
import io.pcvct.variations.persistence.VariationMaterializer;
import io.pcvct.variations.persistence.VariationStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;

/**
 * Runs a sensitivity study end to end.
 *
 * <p>Parses the variations, realizes the method's design, records the scheme
 * when an output directory is set, and computes statistics for each objective.
 *
 * <pre>{@code
 * SensitivityRunner runner = new SensitivityRunner(store, executor);
 * SobolSampling sampling = runner.run(SobolMethod.builder(15).build(), 3,
 *     variations, List.of(finalPopulation), GsaRunOptions.defaults());
 * SobolResult indices = sampling.calculate(finalPopulation);
 * }</pre>
 */
public final class SensitivityRunner {

    private static final Logger logger = LogManager.getLogger(SensitivityRunner.class);

    private final VariationMaterializer materializer;
    private final SimulationExecutor executor;

    public SensitivityRunner(VariationStore store, SimulationExecutor executor) {
        this.materializer = new VariationMaterializer(store);
        this.executor = executor;
    }

    /**
     * @param method the sensitivity method
     * @param replicates the number of replicates per configuration
     * @param variations the varied parameters, one feature each
     * @param functions objectives to compute statistics for immediately; more can be computed later
     * @param options shared options
     * @return the realized study with the statistics of each function cached
     * @throws IOException if the scheme cannot be recorded
     */
    public <S extends GsaSampling<?>> S run(GsaMethod<S> method, int replicates, List<? extends Variation> variations,
                                            List<ObjectiveFunction> functions, GsaRunOptions options) throws IOException {
        ParsedVariations parsed = ParsedVariations.parse(variations);
        logger.info("Starting {} study over {} features with {} replicate(s)", method.name(),
            parsed.dimensionCount(), replicates);
        S sampling = method.runSampling(replicates, parsed, materializer, executor, options);
        if (options.getSchemeDirectory() != null) {
            SchemeRecorder.record(sampling, options.getSchemeDirectory());
        }
        for (ObjectiveFunction function : functions) {
            sampling.calculate(function);
        }
        return sampling;
    }
}
