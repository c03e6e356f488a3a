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
 * Estimators of the first-order partial variance {@code V_i} from Saltelli-style
 * A/B/A_B(i) evaluations.
 *
 * <p>{@code E²} is {@code mean(f_A · f_B)} and {@code V} the sample variance of
 * the pooled A and B evaluations.
 */
public enum FirstOrderEstimator {

    /** {@code mean(f_B · f_ABi) - E²} */
    SOBOL_1993("Sobol1993") {
        @Override
        public double partialVariance(double[] fA, double[] fB, double[] fABi, double totalVariance, double expectedSquared) {
            double sum = 0.0;
            for (int k = 0; k < fA.length; k++) {
                sum += fB[k] * fABi[k];
            }
            return sum / fA.length - expectedSquared;
        }
    },

    /** {@code V - ½ · mean((f_B - f_ABi)²)} */
    JANSEN_1999("Jansen1999") {
        @Override
        public double partialVariance(double[] fA, double[] fB, double[] fABi, double totalVariance, double expectedSquared) {
            double sum = 0.0;
            for (int k = 0; k < fA.length; k++) {
                double diff = fB[k] - fABi[k];
                sum += diff * diff;
            }
            return totalVariance - 0.5 * sum / fA.length;
        }
    },

    /** {@code mean(f_B · (f_ABi - f_A))} */
    SALTELLI_2010("Saltelli2010") {
        @Override
        public double partialVariance(double[] fA, double[] fB, double[] fABi, double totalVariance, double expectedSquared) {
            double sum = 0.0;
            for (int k = 0; k < fA.length; k++) {
                sum += fB[k] * (fABi[k] - fA[k]);
            }
            return sum / fA.length;
        }
    };

    private final String label;

    FirstOrderEstimator(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @param fA evaluations of matrix A
     * @param fB evaluations of matrix B
     * @param fABi evaluations of A with column i taken from B
     * @param totalVariance {@code V}
     * @param expectedSquared {@code E²}
     * @return the estimated first-order partial variance of feature i
     */
    public abstract double partialVariance(double[] fA, double[] fB, double[] fABi,
                                           double totalVariance, double expectedSquared);

    /// @param label an estimator label such as {@code "Jansen1999"}, matched case-insensitively
    public static FirstOrderEstimator fromLabel(String label) {
        for (FirstOrderEstimator estimator : values()) {
            if (estimator.label.equalsIgnoreCase(label)) {
                return estimator;
            }
        }
        throw new IllegalArgumentException("Unknown first-order estimator '" + label + "'");
    }
}
