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

/**
 * Morris elementary-effect statistics, one entry per feature.
 *
 * @param means mean elementary effect
 * @param meansStar mean absolute elementary effect (μ*)
 * @param variances sample variance of the elementary effects, 0 with a single base point
 * @param effects raw elementary effects, one row per base point and one column per feature
 */
public record MorrisResult(double[] means, double[] meansStar, double[] variances, double[][] effects) {
}
