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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * A realized sensitivity study: the configuration table, the simulations run for
 * each configuration, and the statistics computed so far.
 *
 * <p>Statistics are computed lazily by {@link #calculate(ObjectiveFunction)} and
 * cached by function identity; the cache only grows.
 *
 * @param <R> the statistics type of the method
 */
public abstract class GsaSampling<R> {

    private static final Logger logger = LogManager.getLogger(GsaSampling.class);

    private final String methodName;
    private final List<String> featureNames;
    private final ConfigurationTable table;
    private final Map<Integer, List<Integer>> simulations;
    private final ReplicatePolicy replicatePolicy;
    private final Map<ObjectiveFunction, R> results = new LinkedHashMap<>();

    protected GsaSampling(String methodName, List<String> featureNames, ConfigurationTable table,
                          Map<Integer, List<Integer>> simulations, ReplicatePolicy replicatePolicy) {
        this.methodName = methodName;
        this.featureNames = List.copyOf(featureNames);
        this.table = table;
        this.simulations = Collections.unmodifiableMap(new LinkedHashMap<>(simulations));
        this.replicatePolicy = replicatePolicy;
    }

    /// @return the method's short name, used for the scheme file name
    public String methodName() {
        return methodName;
    }

    /// @return the label of each feature the statistics are reported for, in order
    public List<String> featureNames() {
        return featureNames;
    }

    public ConfigurationTable table() {
        return table;
    }

    /// @return the simulation ids of each configuration
    public Map<Integer, List<Integer>> simulations() {
        return simulations;
    }

    public ReplicatePolicy replicatePolicy() {
        return replicatePolicy;
    }

    /**
     * Computes, or returns the cached, statistics for an objective.
     *
     * @param function the objective
     * @return the statistics
     * @throws ObjectiveEvaluationException if a configuration cannot be evaluated
     * @throws SensitivityComputationException if the statistics cannot be normalized
     */
    public synchronized R calculate(ObjectiveFunction function) {
        R cached = results.get(function);
        if (cached != null) {
            return cached;
        }
        logger.debug("Computing {} statistics for {}", methodName, function);
        R result = compute(evaluate(function));
        results.put(function, result);
        return result;
    }

    /// @return the statistics computed so far, by objective
    public synchronized Map<ObjectiveFunction, R> results() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    /**
     * Evaluates an objective over the configuration table, once per distinct configuration.
     *
     * @return objective values shaped like the table
     */
    protected double[][] evaluate(ObjectiveFunction function) {
        Map<Integer, Double> byConfiguration = new HashMap<>();
        double[][] values = new double[table.rowCount()][table.columnCount()];
        for (int i = 0; i < table.rowCount(); i++) {
            for (int j = 0; j < table.columnCount(); j++) {
                int configurationId = table.get(i, j);
                values[i][j] = byConfiguration.computeIfAbsent(configurationId, id -> evaluateConfiguration(function, id));
            }
        }
        return values;
    }

    private double evaluateConfiguration(ObjectiveFunction function, int configurationId) {
        List<Integer> simulationIds = simulations.get(configurationId);
        if (simulationIds == null) {
            throw new ObjectiveEvaluationException(configurationId, "no simulations were recorded");
        }
        List<OptionalDouble> replicateValues = new ArrayList<>(simulationIds.size());
        for (int simulationId : simulationIds) {
            replicateValues.add(function.evaluate(simulationId));
        }
        return replicatePolicy.aggregate(configurationId, replicateValues);
    }

    /**
     * Computes statistics from objective values.
     *
     * @param values objective values shaped like {@link #table()}
     * @return the statistics
     */
    protected abstract R compute(double[][] values);
}
