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

import io.pcvct.variations.VariationId;

import java.util.List;

/**
 * Execution collaborator: registers parameter sets and runs their replicates.
 *
 * <p>A configuration is one parameter set (one {@link VariationId}); each of its
 * replicates is one simulation run. Implementations deduplicate configurations,
 * so registering the same variation id twice returns the same configuration id.
 */
public interface SimulationExecutor {

    /**
     * Registers a parameter set.
     *
     * @param variationId the row ids of the parameter set
     * @return the configuration id, stable for equal variation ids
     */
    int configurationId(VariationId variationId);

    /**
     * Runs (or reuses) replicates of a configuration and waits for them.
     *
     * @param configurationId a registered configuration
     * @param replicates the number of replicates required
     * @return the simulation ids of the replicates
     */
    List<Integer> replicates(int configurationId, int replicates);
}
