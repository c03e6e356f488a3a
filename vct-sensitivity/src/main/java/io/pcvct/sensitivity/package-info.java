/// Global sensitivity analysis over realized variation designs.
///
/// A {@link io.pcvct.sensitivity.GsaMethod} builds its design, registers each
/// parameter set with a {@link io.pcvct.sensitivity.SimulationExecutor} and returns a
/// {@link io.pcvct.sensitivity.GsaSampling} that computes statistics per
/// {@link io.pcvct.sensitivity.ObjectiveFunction}.
///
/// ## Methods
///
/// - {@link io.pcvct.sensitivity.MoatMethod}: Morris elementary effects
/// - {@link io.pcvct.sensitivity.SobolMethod}: Sobol' first- and total-order indices
/// - {@link io.pcvct.sensitivity.RbdMethod}: random balance design first-order indices
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
