/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.variogram.lag;

import com.github.tinemuz.variogram.lag.RawVariogram.DistanceBin;
import com.github.tinemuz.variogram.lag.RawVariogram.LagEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Empirical variogram of a gridded field for every lag within a radius.
 *
 * <p>Lags considered are {@code (0, 1..n)}, {@code (1..m, 0)} and
 * {@code (1..m, ±1..n)}, where {@code m = min(round(R/dx), rows)} and
 * {@code n = min(round(R/dy), cols)}, restricted to physical lengths in
 * {@code (0, R]} and ordered by length. For each lag the semivariance is the
 * mean of {@code 0.5 * (a - b)^2} over all cell pairs where both values are
 * present. Distance bins pool the lags of equal length, weighting each lag by
 * its pair count.</p>
 */
public final class MatrixLagVariogram implements LagVariogramCalculator {
    private static final Logger log = LoggerFactory.getLogger(MatrixLagVariogram.class);
    // Cressie-Hawkins bias correction: 0.457 + 0.494 / N
    private static final double CH_CONSTANT = 0.457;
    private static final double CH_PER_PAIR = 0.494;

    @Override
    public RawVariogram compute(double[][] matrix, double radius, double dx, double dy) {
        checkMatrix(matrix);
        if (!(radius > 0) || Double.isInfinite(radius)) {
            throw new IllegalArgumentException("radius must be positive and finite: " + radius);
        }
        if (!(dx > 0) || !(dy > 0) || Double.isInfinite(dx) || Double.isInfinite(dy)) {
            throw new IllegalArgumentException("spacing must be positive: dx=" + dx + ", dy=" + dy);
        }
        final int rows = matrix.length;
        final int cols = matrix[0].length;
        int m = (int) Math.min(Math.rint(radius / dx), rows);
        int n = (int) Math.min(Math.rint(radius / dy), cols);

        // STEP 1: enumerate lag vectors with a non-negative row displacement
        List<int[]> candidates = new ArrayList<>();
        for (int c = 1; c <= n; c++) candidates.add(new int[] {0, c});
        for (int r = 1; r <= m; r++) candidates.add(new int[] {r, 0});
        for (int c = 1; c <= n; c++) {
            for (int r = m; r >= 1; r--) candidates.add(new int[] {r, -c});
            for (int r = 1; r <= m; r++) candidates.add(new int[] {r, c});
        }

        // STEP 2: keep lags within the radius, shortest first (stable for ties)
        List<Lag> lags = new ArrayList<>();
        for (int[] lag : candidates) {
            double d = Math.hypot(dx * lag[0], dy * lag[1]);
            if (d > 0 && d <= radius) lags.add(new Lag(lag[0], lag[1], d));
        }
        lags.sort(Comparator.comparingDouble(Lag::distance));

        // STEP 3: squared differences per lag
        List<LagEntry> entries = new ArrayList<>(lags.size());
        for (Lag lag : lags) {
            entries.add(evaluate(matrix, lag.row(), lag.col(), lag.distance()));
        }

        // STEP 4: pool lags of equal length
        List<DistanceBin> bins = bin(entries);
        log.debug(
                "Variogram over {}x{} matrix: radius={}, dx={}, dy={}, {} lags in {} distance bins",
                rows, cols, radius, dx, dy, entries.size(), bins.size());
        if (entries.isEmpty()) {
            log.warn("Radius {} is shorter than the lattice spacing ({}, {}); no lag computed",
                    radius, dx, dy);
        }
        return new RawVariogram(entries, bins);
    }

    private static LagEntry evaluate(double[][] mat, int r, int c, double distance) {
        final int rows = mat.length;
        final int cols = mat[0].length;
        final int jFrom = Math.max(0, -c);
        final int jTo = Math.min(cols, cols - c);
        int count = 0;
        double sumHalfSq = 0.0;
        double sumRoot = 0.0;
        for (int i = 0; i + r < rows; i++) {
            double[] a = mat[i];
            double[] b = mat[i + r];
            for (int j = jFrom; j < jTo; j++) {
                double diff = a[j] - b[j + c];
                if (Double.isNaN(diff)) continue;
                count++;
                sumHalfSq += 0.5 * diff * diff;
                sumRoot += Math.sqrt(Math.abs(diff));
            }
        }
        if (count == 0) return new LagEntry(r, c, distance, Double.NaN, Double.NaN, 0);
        double meanRoot = sumRoot / count;
        double robust = 0.5 * Math.pow(meanRoot, 4) / (CH_CONSTANT + CH_PER_PAIR / count);
        return new LagEntry(r, c, distance, sumHalfSq / count, robust, count);
    }

    private static List<DistanceBin> bin(List<LagEntry> entries) {
        Map<Double, double[]> acc = new LinkedHashMap<>();
        for (LagEntry e : entries) {
            double[] sums = acc.computeIfAbsent(e.distance(), k -> new double[2]);
            if (e.pairs() > 0) {
                sums[0] += e.semivariance() * e.pairs();
                sums[1] += e.pairs();
            }
        }
        List<DistanceBin> bins = new ArrayList<>(acc.size());
        for (Map.Entry<Double, double[]> b : acc.entrySet()) {
            double[] sums = b.getValue();
            int pairs = (int) sums[1];
            bins.add(new DistanceBin(b.getKey(), pairs > 0 ? sums[0] / pairs : Double.NaN, pairs));
        }
        return bins;
    }

    private static void checkMatrix(double[][] matrix) {
        if (matrix == null || matrix.length == 0 || matrix[0] == null || matrix[0].length == 0) {
            throw new IllegalArgumentException("matrix must have at least one cell");
        }
        for (double[] row : matrix) {
            if (row == null || row.length != matrix[0].length) {
                throw new IllegalArgumentException("matrix rows must all have the same length");
            }
        }
    }

    private record Lag(int row, int col, double distance) {}
}
