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

import org.apache.commons.math3.stat.StatUtils;

import java.util.List;
import java.util.Map;

/**
 * A realized Morris one-at-a-time study.
 *
 * <p>Column 0 of the table holds the base points; column {@code 1 + j} holds the
 * base point with feature {@code j} moved by {@link #step(int, int)} in design
 * coordinates.
 *
 * <p>An elementary effect is {@code (f(moved) - f(base)) / step}. Dividing by the
 * signed step makes a downward move report the slope's sign as well, so for a
 * linear objective every effect equals its slope. Implementations that use
 * {@code 2 · (f(moved) - f(base))} regardless of direction negate the downward
 * effects; their μ differs from this one, while μ* is the same.
 */
public final class MoatSampling extends GsaSampling<MorrisResult> {

    private final double[][] steps;

    MoatSampling(List<String> featureNames, ConfigurationTable table, Map<Integer, List<Integer>> simulations,
                 ReplicatePolicy replicatePolicy, double[][] steps) {
        super(MoatMethod.NAME, featureNames, table, simulations, replicatePolicy);
        this.steps = steps;
    }

    /// @return the signed coordinate step of feature j at base point i, ±0.5
    public double step(int basePoint, int feature) {
        return steps[basePoint][feature];
    }

    @Override
    protected MorrisResult compute(double[][] values) {
        int n = values.length;
        int d = featureNames().size();
        double[][] effects = new double[n][d];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < d; j++) {
                effects[i][j] = (values[i][1 + j] - values[i][0]) / steps[i][j];
            }
        }
        double[] means = new double[d];
        double[] meansStar = new double[d];
        double[] variances = new double[d];
        for (int j = 0; j < d; j++) {
            double[] column = new double[n];
            double[] absolute = new double[n];
            for (int i = 0; i < n; i++) {
                column[i] = effects[i][j];
                absolute[i] = Math.abs(effects[i][j]);
            }
            means[j] = StatUtils.mean(column);
            meansStar[j] = StatUtils.mean(absolute);
            variances[j] = StatUtils.variance(column);
        }
        return new MorrisResult(means, meansStar, variances, effects);
    }
}
