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
import io.pcvct.variations.persistence.VariationMaterializer;

/**
 * A global sensitivity analysis method.
 *
 * <p>{@link #runSampling} generates the method's design, materializes it,
 * registers every distinct parameter set with the executor and waits for the
 * replicates. Malformed requests fail before anything is materialized.
 *
 * @param <S> the realized study type
 */
public interface GsaMethod<S extends GsaSampling<?>> {

    /// @return the method's short name, for example {@code "moat"}
    String name();

    /**
     * @param replicates the number of replicates per configuration
     * @param parsed the variations, one feature each
     * @param materializer writes design rows to the variation store
     * @param executor registers configurations and runs replicates
     * @param options shared options
     * @return the realized study
     */
    S runSampling(int replicates, ParsedVariations parsed, VariationMaterializer materializer,
                  SimulationExecutor executor, GsaRunOptions options);
}
