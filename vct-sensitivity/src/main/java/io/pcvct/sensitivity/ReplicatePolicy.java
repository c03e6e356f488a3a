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

import java.util.List;
import java.util.OptionalDouble;

/**
 * How the objective values of a configuration's replicates combine into one value.
 */
public enum ReplicatePolicy {

    /**
     * Average all replicates; any failed replicate fails the configuration.
     */
    PROPAGATE {
        @Override
        public double aggregate(int configurationId, List<OptionalDouble> values) {
            requireReplicates(configurationId, values);
            double sum = 0.0;
            for (int i = 0; i < values.size(); i++) {
                OptionalDouble value = values.get(i);
                if (value.isEmpty()) {
                    throw new ObjectiveEvaluationException(configurationId,
                        "replicate " + i + " of " + values.size() + " has no objective value");
                }
                sum += value.getAsDouble();
            }
            return sum / values.size();
        }
    },

    /**
     * Average the successful replicates, warning about failures; fails only when
     * every replicate failed.
     */
    EXCLUDE_MISSING {
        @Override
        public double aggregate(int configurationId, List<OptionalDouble> values) {
            requireReplicates(configurationId, values);
            double sum = 0.0;
            int count = 0;
            for (OptionalDouble value : values) {
                if (value.isPresent()) {
                    sum += value.getAsDouble();
                    count++;
                }
            }
            if (count == 0) {
                throw new ObjectiveEvaluationException(configurationId,
                    "all " + values.size() + " replicates failed");
            }
            if (count < values.size()) {
                logger.warn("Configuration {}: {} of {} replicates failed; averaging the remaining {}",
                    configurationId, values.size() - count, values.size(), count);
            }
            return sum / count;
        }
    };

    private static final Logger logger = LogManager.getLogger(ReplicatePolicy.class);

    /**
     * @param configurationId the configuration, for messages
     * @param values the objective value of each replicate
     * @return the configuration's objective value
     * @throws ObjectiveEvaluationException if the policy rejects the values
     */
    public abstract double aggregate(int configurationId, List<OptionalDouble> values);

    private static void requireReplicates(int configurationId, List<OptionalDouble> values) {
        if (values.isEmpty()) {
            throw new ObjectiveEvaluationException(configurationId, "no replicates were run");
        }
    }
}
