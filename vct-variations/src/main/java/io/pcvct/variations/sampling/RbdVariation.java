package io.pcvct.variations.sampling;

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

import io.pcvct.variations.ParsedVariations;
import io.pcvct.variations.VariationId;
import io.pcvct.variations.VariationLocation;
import io.pcvct.variations.VariationValidationException;
import io.pcvct.variations.persistence.VariationMaterializer;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Random balance design sampling method.
 *
 * <p>Every dimension traces a periodic curve through its design points; sorting
 * the points by one dimension's angle recovers that curve, so a Fourier analysis
 * of the outputs in that order measures that dimension's contribution.
 *
 * <p>In Sobol mode (the default) each dimension's coordinates come from a
 * one-dimensional Sobol subsequence, which covers half a period; {@code n} must
 * then lie within one of a power of two. In random mode the angles are evenly
 * spaced over a full period {@code [-π, π)}, independently permuted per
 * dimension, and mapped to {@code ½ + asin(sin s) / π}.
 */
public final class RbdVariation implements VariationMethod {

    private static final Logger logger = LogManager.getLogger(RbdVariation.class);

    private final int n;
    private final boolean useSobol;
    private final int pow2Diff;
    private final UniformRandomProvider rng;

    /// Coordinates and per-dimension angular orderings of an RBD design.
    ///
    /// @param cdfs coordinates, one row per point and one column per dimension
    /// @param sortingIndices column j lists the points in increasing angle along dimension j
    public record Design(double[][] cdfs, int[][] sortingIndices) {
    }

    private RbdVariation(int n, boolean useSobol, UniformRandomProvider rng) {
        if (n < 1) {
            throw new VariationValidationException("RBD needs at least one point, got " + n);
        }
        this.n = n;
        this.useSobol = useSobol;
        this.rng = rng;
        if (useSobol) {
            int k = (int) Math.round(Math.log(n) / Math.log(2));
            this.pow2Diff = n - (1 << k);
            if (Math.abs(pow2Diff) > 1) {
                throw new VariationValidationException("RBD with Sobol sampling needs n within 1 of a power of two; "
                    + n + " is " + pow2Diff + " from 2^" + k);
            }
        } else {
            if (rng == null) {
                throw new VariationValidationException("RBD random sampling needs a random source");
            }
            this.pow2Diff = 0;
        }
    }

    /// @param n the number of design points, within 1 of a power of two
    public static RbdVariation sobol(int n) {
        return new RbdVariation(n, true, null);
    }

    /// @param n the number of design points
    /// @param rng the source of the per-dimension permutations
    public static RbdVariation random(int n, UniformRandomProvider rng) {
        return new RbdVariation(n, false, rng);
    }

    public int getN() {
        return n;
    }

    public boolean isUseSobol() {
        return useSobol;
    }

    /// @return n minus the nearest power of two; always 0 in random mode
    public int getPow2Diff() {
        return pow2Diff;
    }

    /// @return the number of periods each dimension traces: ½ in Sobol mode, 1 in random mode
    public double getNumCycles() {
        return useSobol ? 0.5 : 1.0;
    }

    /// @return whether each dimension covers only half a period
    public boolean isHalfPeriod() {
        return useSobol;
    }

    /**
     * Generates the design for {@code d} dimensions.
     */
    public Design generate(int d) {
        double[][] cdfs = new double[n][d];
        int[][] sortingIndices = new int[n][d];
        if (useSobol) {
            if (n == 1) {
                for (int j = 0; j < d; j++) {
                    cdfs[0][j] = 0.5;
                }
                return new Design(cdfs, sortingIndices);
            }
            SkipStart skip = pow2Diff == -1 ? SkipStart.count(1)
                : pow2Diff == 0 ? SkipStart.toCommonDenominator()
                : SkipStart.none();
            SobolSubsequence subsequence = SobolSubsequence.choose(n, skip, pow2Diff == 1);
            double[][][] cube = SobolCdfs.generate(n, d, 1, SobolRandomization.none(), subsequence);
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < d; j++) {
                    cdfs[i][j] = cube[j][0][i];
                }
            }
            for (int j = 0; j < d; j++) {
                setColumn(sortingIndices, j, argsort(column(cdfs, j)));
            }
        } else {
            double[] angles = new double[n];
            for (int i = 0; i < n; i++) {
                angles[i] = -Math.PI + 2 * Math.PI * i / n;
            }
            for (int j = 0; j < d; j++) {
                int[] permutation = RandomGenerators.permutation(n, rng);
                double[] permuted = new double[n];
                for (int i = 0; i < n; i++) {
                    permuted[i] = angles[permutation[i]];
                    cdfs[i][j] = 0.5 + Math.asin(Math.sin(permuted[i])) / Math.PI;
                }
                setColumn(sortingIndices, j, argsort(permuted));
            }
        }
        return new Design(cdfs, sortingIndices);
    }

    @Override
    public RbdVariationsResult addVariations(ParsedVariations parsed, VariationId reference,
                                             VariationMaterializer materializer) {
        int d = parsed.dimensionCount();
        Design design = generate(d);
        Map<VariationLocation, int[]> ids = new EnumMap<>(VariationLocation.class);
        Map<VariationLocation, int[][]> sortedIds = new EnumMap<>(VariationLocation.class);
        List<VariationLocation> used = parsed.usedLocations();
        for (VariationLocation location : VariationLocation.values()) {
            int[] locationIds;
            if (used.contains(location)) {
                locationIds = materializer.materialize(location, parsed, reference.get(location), design.cdfs());
                ids.put(location, locationIds);
            } else {
                locationIds = new int[n];
                Arrays.fill(locationIds, reference.get(location));
            }
            int[][] sorted = new int[n][d];
            for (int rank = 0; rank < n; rank++) {
                for (int j = 0; j < d; j++) {
                    sorted[rank][j] = locationIds[design.sortingIndices()[rank][j]];
                }
            }
            sortedIds.put(location, sorted);
        }
        logger.info("RBD design: {} points over {} dimensions ({} mode)", n, d, useSobol ? "sobol" : "random");
        return new RbdVariationsResult(AddVariationsResult.combine(ids, reference, n),
            design.cdfs(), design.sortingIndices(), sortedIds);
    }

    private static double[] column(double[][] matrix, int j) {
        double[] column = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            column[i] = matrix[i][j];
        }
        return column;
    }

    private static void setColumn(int[][] matrix, int j, int[] column) {
        for (int i = 0; i < column.length; i++) {
            matrix[i][j] = column[i];
        }
    }

    /// Stable argsort.
    static int[] argsort(double[] values) {
        Integer[] order = new Integer[values.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(values[a], values[b]));
        int[] result = new int[order.length];
        for (int i = 0; i < order.length; i++) {
            result[i] = order[i];
        }
        return result;
    }

    @Override
    public String toString() {
        return "RbdVariation{n=" + n + ", useSobol=" + useSobol + "}";
    }
}
