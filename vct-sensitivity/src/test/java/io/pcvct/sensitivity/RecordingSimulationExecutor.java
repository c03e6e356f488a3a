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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// In-memory executor: configurations and simulations are numbered from 1 in
/// registration order, and every simulation remembers its parameter set.
final class RecordingSimulationExecutor implements SimulationExecutor {

    private final Map<VariationId, Integer> configurationIds = new LinkedHashMap<>();
    private final List<VariationId> configurations = new ArrayList<>();
    private final Map<Integer, List<Integer>> simulationsByConfiguration = new LinkedHashMap<>();
    private final List<Integer> configurationOfSimulation = new ArrayList<>();

    @Override
    public synchronized int configurationId(VariationId variationId) {
        return configurationIds.computeIfAbsent(variationId, id -> {
            configurations.add(id);
            return configurations.size();
        });
    }

    @Override
    public synchronized List<Integer> replicates(int configurationId, int replicates) {
        if (configurationId < 1 || configurationId > configurations.size()) {
            throw new IllegalArgumentException("Unknown configuration " + configurationId);
        }
        List<Integer> simulations = simulationsByConfiguration.computeIfAbsent(configurationId, c -> new ArrayList<>());
        while (simulations.size() < replicates) {
            configurationOfSimulation.add(configurationId);
            simulations.add(configurationOfSimulation.size());
        }
        return new ArrayList<>(simulations.subList(0, replicates));
    }

    synchronized VariationId variationOf(int simulationId) {
        return configurations.get(configurationOfSimulation.get(simulationId - 1) - 1);
    }

    synchronized int configurationOf(int simulationId) {
        return configurationOfSimulation.get(simulationId - 1);
    }

    synchronized int configurationCount() {
        return configurations.size();
    }

    synchronized int simulationCount() {
        return configurationOfSimulation.size();
    }
}
