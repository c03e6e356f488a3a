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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Registration of design cells with the {@link SimulationExecutor}.
final class Configurations {

    private static final Logger logger = LogManager.getLogger(Configurations.class);

    private Configurations() {
    }

    /// @return a table of the configuration id of each design cell
    static ConfigurationTable register(List<String> header, VariationId[][] cells, SimulationExecutor executor) {
        int[][] ids = new int[cells.length][];
        for (int i = 0; i < cells.length; i++) {
            ids[i] = new int[cells[i].length];
            for (int j = 0; j < cells[i].length; j++) {
                ids[i][j] = executor.configurationId(cells[i][j]);
            }
        }
        return new ConfigurationTable(header, ids);
    }

    /// Runs the replicates of every distinct configuration in the table.
    static Map<Integer, List<Integer>> runReplicates(ConfigurationTable table, int replicates, SimulationExecutor executor) {
        List<Integer> distinct = table.distinctIds();
        logger.info("Running {} replicate(s) of {} distinct configurations", replicates, distinct.size());
        Map<Integer, List<Integer>> simulations = new LinkedHashMap<>();
        for (int configurationId : distinct) {
            simulations.put(configurationId, List.copyOf(executor.replicates(configurationId, replicates)));
        }
        return simulations;
    }

    static void requirePositiveReplicates(int replicates) {
        if (replicates < 1) {
            throw new IllegalArgumentException("At least one replicate is required, got " + replicates);
        }
    }
}
