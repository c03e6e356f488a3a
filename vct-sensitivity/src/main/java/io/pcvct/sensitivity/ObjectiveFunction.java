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

import java.util.OptionalDouble;
import java.util.function.IntToDoubleFunction;

/// A scalar summary of one simulation's output.
///
/// Results are cached per function instance, so the same instance must be passed
/// to get a cached result back.
@FunctionalInterface
public interface ObjectiveFunction {

    /// @param simulationId the simulation to summarize
    /// @return the objective value, or empty if the simulation failed or has no usable output
    OptionalDouble evaluate(int simulationId);

    /// Wraps a plain function, treating NaN as a failed evaluation.
    ///
    /// @param name a label used in logs
    /// @param function the objective
    /// @return the wrapped objective
    static ObjectiveFunction of(String name, IntToDoubleFunction function) {
        return new ObjectiveFunction() {
            @Override
            public OptionalDouble evaluate(int simulationId) {
                double value = function.applyAsDouble(simulationId);
                return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
