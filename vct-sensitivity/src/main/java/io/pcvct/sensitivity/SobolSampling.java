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
 * A realized Sobol' study.
 *
 * <p>Column 0 of the table holds matrix A, column 1 matrix B, and column
 * {@code 2 + k} the hybrid A_B(i) for the k-th analyzed feature i.
 */
public final class SobolSampling extends GsaSampling<SobolResult> {

    private final FirstOrderEstimator firstOrder;
    private final TotalOrderEstimator totalOrder;

    SobolSampling(List<String> featureNames, ConfigurationTable table, Map<Integer, List<Integer>> simulations,
                  ReplicatePolicy replicatePolicy, FirstOrderEstimator firstOrder, TotalOrderEstimator totalOrder) {
        super(SobolMethod.NAME, featureNames, table, simulations, replicatePolicy);
        this.firstOrder = firstOrder;
        this.totalOrder = totalOrder;
    }

    public FirstOrderEstimator firstOrderEstimator() {
        return firstOrder;
    }

    public TotalOrderEstimator totalOrderEstimator() {
        return totalOrder;
    }

    @Override
    protected SobolResult compute(double[][] values) {
        int n = values.length;
        double[] fA = column(values, 0);
        double[] fB = column(values, 1);

        double[] pooled = new double[2 * n];
        System.arraycopy(fA, 0, pooled, 0, n);
        System.arraycopy(fB, 0, pooled, n, n);
        double variance = StatUtils.variance(pooled);
        if (!(variance > 0.0) || !Double.isFinite(variance)) {
            throw new SensitivityComputationException(
                "Objective variance over the Sobol' design is " + variance + "; indices are undefined");
        }
        double expectedSquared = 0.0;
        for (int k = 0; k < n; k++) {
            expectedSquared += fA[k] * fB[k];
        }
        expectedSquared /= n;

        int features = featureNames().size();
        double[] first = new double[features];
        double[] total = new double[features];
        for (int f = 0; f < features; f++) {
            double[] fABi = column(values, 2 + f);
            first[f] = firstOrder.partialVariance(fA, fB, fABi, variance, expectedSquared) / variance;
            total[f] = totalOrder.partialVariance(fA, fB, fABi, variance, expectedSquared) / variance;
        }
        return new SobolResult(first, total);
    }

    private static double[] column(double[][] values, int j) {
        double[] column = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            column[i] = values[i][j];
        }
        return column;
    }
}
