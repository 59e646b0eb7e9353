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
package com.github.tinemuz.variogram;

import com.github.tinemuz.variogram.lag.RawVariogram;
import com.github.tinemuz.variogram.lag.RawVariogram.DistanceBin;
import com.github.tinemuz.variogram.lag.RawVariogram.LagEntry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the isotropic, anisotropic, heat and surface representations from
 * a raw lag variogram.
 *
 * <p>The raw variogram is the only source of truth: no squared difference is
 * recomputed here. Every derived value is a pure function of it.</p>
 */
public final class VariogramAggregator {
    private static final Logger log = LoggerFactory.getLogger(VariogramAggregator.class);
    private static final Comparator<LagKey> LAG_ORDER =
            Comparator.comparingInt(LagKey::row).thenComparingInt(LagKey::col);

    private final VariogramSettings settings;
    private final ColorRamp ramp;

    public VariogramAggregator(VariogramSettings settings) {
        this.settings = settings;
        this.ramp = ColorRamp.of(settings);
    }

    /**
     * Derive all four representations.
     *
     * @param raw  per-lag semivariances from a {@link com.github.tinemuz.variogram.lag.LagVariogramCalculator}
     * @param dx   row spacing
     * @param dy   column spacing
     * @param plot representations selected for display
     */
    public Variogram aggregate(RawVariogram raw, double dx, double dy, Variogram.Plot plot) {
        AnisotropicVariogram aniso = anisotropic(raw, dx, dy);
        IsotropicVariogram iso = isotropic(raw);
        HeatVariogram heat = heat(aniso, dx, dy);
        SurfaceVariogram surface = surface(heat);
        log.debug("Aggregated {} lags into {}, {}, {}", raw.lags().size(), iso, heat, surface);
        return new Variogram(iso, aniso, heat, surface, plot, settings.minPairs());
    }

    /** Raw lags re-expressed in physical units. */
    AnisotropicVariogram anisotropic(RawVariogram raw, double dx, double dy) {
        List<AnisotropicVariogram.Cell> cells = new ArrayList<>(raw.lags().size());
        for (LagEntry e : raw.lags()) {
            cells.add(new AnisotropicVariogram.Cell(
                    e.rowLag(), e.colLag(), e.rowLag() * dx, e.colLag() * dy,
                    e.semivariance(), e.pairs()));
        }
        return new AnisotropicVariogram(cells);
    }

    IsotropicVariogram isotropic(RawVariogram raw) {
        List<IsotropicVariogram.Row> rows = new ArrayList<>(raw.bins().size());
        for (DistanceBin b : raw.bins()) {
            rows.add(new IsotropicVariogram.Row(b.distance(), b.semivariance(), b.pairs()));
        }
        return new IsotropicVariogram(rows);
    }

    /**
     * Fold lags sharing {@code (|row|, |col|)}. The value is the mean of the
     * members ignoring missing ones; pair counts are combined per
     * {@link VariogramSettings#countFold()}.
     */
    HeatVariogram heat(AnisotropicVariogram aniso, double dx, double dy) {
        Map<LagKey, List<AnisotropicVariogram.Cell>> groups = new TreeMap<>(LAG_ORDER);
        for (AnisotropicVariogram.Cell c : aniso.cells()) {
            LagKey key = new LagKey(Math.abs(c.rowLag()), Math.abs(c.colLag()));
            groups.computeIfAbsent(key, k -> new ArrayList<>(4)).add(c);
        }
        List<HeatVariogram.Cell> cells = new ArrayList<>(groups.size());
        for (Map.Entry<LagKey, List<AnisotropicVariogram.Cell>> g : groups.entrySet()) {
            List<AnisotropicVariogram.Cell> members = g.getValue();
            double[] z = new double[members.size()];
            double[] n = new double[members.size()];
            for (int i = 0; i < members.size(); i++) {
                z[i] = members.get(i).z();
                n[i] = members.get(i).pairs();
            }
            double pairs =
                    settings.countFold() == VariogramSettings.CountFold.SUM
                            ? Averages.sum(n, true)
                            : Averages.mean(n, true);
            LagKey key = g.getKey();
            cells.add(new HeatVariogram.Cell(
                    key.row(), key.col(), key.row() * dx, key.col() * dy,
                    Averages.mean(z, true), pairs));
        }
        return new HeatVariogram(cells);
    }

    /** Reshape the heat table onto its distinct row and column levels. */
    SurfaceVariogram surface(HeatVariogram heat) {
        TreeSet<Integer> rowLags = new TreeSet<>();
        TreeSet<Integer> colLags = new TreeSet<>();
        for (HeatVariogram.Cell c : heat.cells()) {
            rowLags.add(c.rowLag());
            colLags.add(c.colLag());
        }
        Map<Integer, Integer> rowIndex = index(rowLags);
        Map<Integer, Integer> colIndex = index(colLags);

        double[] x = new double[rowLags.size()];
        double[] y = new double[colLags.size()];
        double[][] z = filled(x.length, y.length);
        double[][] pairs = filled(x.length, y.length);
        for (HeatVariogram.Cell c : heat.cells()) {
            int i = rowIndex.get(c.rowLag());
            int j = colIndex.get(c.colLag());
            x[i] = c.x();
            y[j] = c.y();
            z[i][j] = c.z();
            pairs[i][j] = c.pairs();
        }
        return SurfaceVariogram.of(x, y, z, pairs, ramp);
    }

    private static Map<Integer, Integer> index(TreeSet<Integer> levels) {
        Map<Integer, Integer> out = new TreeMap<>();
        for (int level : levels) out.put(level, out.size());
        return out;
    }

    private static double[][] filled(int rows, int cols) {
        double[][] m = new double[rows][cols];
        for (double[] r : m) Arrays.fill(r, Double.NaN);
        return m;
    }

    private record LagKey(int row, int col) {}
}
