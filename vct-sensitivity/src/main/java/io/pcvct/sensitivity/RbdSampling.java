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

import java.util.List;
import java.util.Map;

/**
 * A realized random balance design study.
 *
 * <p>Column j of the table lists the configurations in increasing angular order
 * along feature j. The first-order index of feature j is the share of the
 * objective's spectral power, in that order, carried by the first
 * {@code numHarmonics} harmonics:
 *
 * <pre>{@code
 * S_j = 2 · Σ_{k=1..min(N-1, H)} |Y_k|² / Σ_{k=1..N-1} |Y_k|²
 * }</pre>
 *
 * <p>Half-period designs are first mirrored (rows n-2 down to 1 appended) so
 * the signal covers a full period.
 */
public final class RbdSampling extends GsaSampling<RbdResult> {

    /// Deviations smaller than this fraction of the largest magnitude are rounding noise.
    private static final double RELATIVE_TOLERANCE = 1e-12;

    private final int numHarmonics;
    private final boolean halfPeriod;

    RbdSampling(List<String> featureNames, ConfigurationTable table, Map<Integer, List<Integer>> simulations,
                ReplicatePolicy replicatePolicy, int numHarmonics, boolean halfPeriod) {
        super(RbdMethod.NAME, featureNames, table, simulations, replicatePolicy);
        this.numHarmonics = numHarmonics;
        this.halfPeriod = halfPeriod;
    }

    public int numHarmonics() {
        return numHarmonics;
    }

    public boolean isHalfPeriod() {
        return halfPeriod;
    }

    @Override
    protected RbdResult compute(double[][] values) {
        int d = featureNames().size();
        double[] indices = new double[d];
        for (int j = 0; j < d; j++) {
            double[] signal = signal(values, j);
            indices[j] = firstOrderIndex(signal, numHarmonics, featureNames().get(j));
        }
        return new RbdResult(indices);
    }

    private double[] signal(double[][] values, int j) {
        int n = values.length;
        int mirrored = halfPeriod ? Math.max(0, n - 2) : 0;
        double[] signal = new double[n + mirrored];
        for (int i = 0; i < n; i++) {
            signal[i] = values[i][j];
        }
        for (int m = 0; m < mirrored; m++) {
            signal[n + m] = values[n - 2 - m][j];
        }
        return signal;
    }

    /**
     * Spectral share of the first harmonics of a signal.
     *
     * <p>The signal is centered on its mean first. The total power
     * {@code Σ_{k=1..N-1} |Y_k|² / N} then equals the sum of squared deviations
     * (Parseval), and only the first harmonics are computed by direct DFT. A total
     * power below the rounding noise of the signal's magnitude counts as no variance.
     */
    static double firstOrderIndex(double[] signal, int numHarmonics, String feature) {
        int size = signal.length;
        double sum = 0.0;
        double scale = 0.0;
        for (double x : signal) {
            sum += x;
            scale = Math.max(scale, Math.abs(x));
        }
        double mean = sum / size;
        double[] centered = new double[size];
        double totalPower = 0.0;
        for (int t = 0; t < size; t++) {
            centered[t] = signal[t] - mean;
            totalPower += centered[t] * centered[t];
        }
        double noise = RELATIVE_TOLERANCE * scale;
        if (!Double.isFinite(totalPower) || totalPower <= size * noise * noise) {
            throw new SensitivityComputationException(
                "Objective has no variance along " + feature + " (spectral power " + totalPower + ")");
        }
        double harmonicPower = 0.0;
        int maxHarmonic = Math.min(size - 1, numHarmonics);
        for (int k = 1; k <= maxHarmonic; k++) {
            double re = 0.0;
            double im = 0.0;
            for (int t = 0; t < size; t++) {
                double angle = 2.0 * Math.PI * k * t / size;
                re += centered[t] * Math.cos(angle);
                im -= centered[t] * Math.sin(angle);
            }
            harmonicPower += (re * re + im * im) / size;
        }
        return 2.0 * harmonicPower / totalPower;
    }
}
