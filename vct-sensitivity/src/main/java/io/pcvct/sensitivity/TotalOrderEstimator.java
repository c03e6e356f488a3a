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
 * Estimators of the total-order partial variance {@code V_Ti}.
 *
 * @see FirstOrderEstimator
 */
public enum TotalOrderEstimator {

    /** {@code V - mean(f_A · f_ABi) + E²} */
    HOMMA_1996("Homma1996") {
        @Override
        public double partialVariance(double[] fA, double[] fB, double[] fABi, double totalVariance, double expectedSquared) {
            double sum = 0.0;
            for (int k = 0; k < fA.length; k++) {
                sum += fA[k] * fABi[k];
            }
            return totalVariance - sum / fA.length + expectedSquared;
        }
    },

    /** {@code ½ · mean((f_ABi - f_A)²)} */
    JANSEN_1999("Jansen1999") {
        @Override
        public double partialVariance(double[] fA, double[] fB, double[] fABi, double totalVariance, double expectedSquared) {
            double sum = 0.0;
            for (int k = 0; k < fA.length; k++) {
                double diff = fABi[k] - fA[k];
                sum += diff * diff;
            }
            return 0.5 * sum / fA.length;
        }
    },

    /** {@code mean(f_A · (f_A - f_ABi))} */
    SOBOL_2007("Sobol2007") {
        @Override
        public double partialVariance(double[] fA, double[] fB, double[] fABi, double totalVariance, double expectedSquared) {
            double sum = 0.0;
            for (int k = 0; k < fA.length; k++) {
                sum += fA[k] * (fA[k] - fABi[k]);
            }
            return sum / fA.length;
        }
    };

    private final String label;

    TotalOrderEstimator(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @return the estimated total-order partial variance of feature i
     * @see FirstOrderEstimator#partialVariance
     */
    public abstract double partialVariance(double[] fA, double[] fB, double[] fABi,
                                           double totalVariance, double expectedSquared);

    /// @param label an estimator label such as {@code "Sobol2007"}, matched case-insensitively
    public static TotalOrderEstimator fromLabel(String label) {
        for (TotalOrderEstimator estimator : values()) {
            if (estimator.label.equalsIgnoreCase(label)) {
                return estimator;
            }
        }
        throw new IllegalArgumentException("Unknown total-order estimator '" + label + "'");
    }
}
