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

import java.awt.Color;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heat variogram reshaped into a surface mesh for perspective rendering.
 *
 * <p>The distinct absolute row and column displacements are the axis levels
 * (not necessarily evenly spaced). {@code z[i][j]} holds the heat value at
 * levels {@code (x[i], y[j])}, NaN where there is none, and {@code pairs} is
 * the parallel array of pair counts. Each facet, the quadrilateral between
 * four neighbouring vertices, is shaded by the mean of its non-missing
 * corners, binned onto a {@link ColorRamp} over the range of facet means.</p>
 */
public final class SurfaceVariogram implements VariogramView {
    private static final Logger log = LoggerFactory.getLogger(SurfaceVariogram.class);

    private final double[] x;
    private final double[] y;
    private final double[][] z;
    private final double[][] pairs;
    private final double[][] facetMeans;
    private final int[][] facetLevels;
    private final ColorRamp ramp;
    private final Range zLimits;

    /** Closed interval of z values for renderer configuration. */
    public record Range(double lower, double upper) {}

    private SurfaceVariogram(
            double[] x, double[] y, double[][] z, double[][] pairs, ColorRamp ramp) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.pairs = pairs;
        this.ramp = ramp;
        this.facetMeans = facetMeans(z, true);
        this.facetLevels = shade(facetMeans, ramp);
        double top = Averages.max(z);
        this.zLimits = Double.isNaN(top) ? null : new Range(0.0, top);
    }

    /**
     * Build a surface from its vertex arrays; the arrays are copied.
     *
     * @param x     row displacement levels, length {@code z.length}
     * @param y     column displacement levels, length {@code z[i].length}
     * @param z     vertex values, NaN where missing
     * @param pairs pair counts, same shape as {@code z}
     * @param ramp  colour ramp for facet shading
     */
    public static SurfaceVariogram of(
            double[] x, double[] y, double[][] z, double[][] pairs, ColorRamp ramp) {
        if (z.length != x.length || pairs.length != x.length) {
            throw new IllegalArgumentException(
                    "z and pairs need " + x.length + " rows: " + z.length + ", " + pairs.length);
        }
        for (int i = 0; i < z.length; i++) {
            if (z[i].length != y.length || pairs[i].length != y.length) {
                throw new IllegalArgumentException("z and pairs need " + y.length + " columns");
            }
        }
        return new SurfaceVariogram(x.clone(), y.clone(), deepCopy(z), deepCopy(pairs), ramp);
    }

    /**
     * Mean of the four corners of every 2x2 block, one row and column fewer
     * than {@code values}.
     *
     * @param ignoreMissing average the non-missing corners only; otherwise a
     *                      missing corner makes the facet missing
     */
    static double[][] facetMeans(double[][] values, boolean ignoreMissing) {
        int nx = values.length;
        int ny = nx == 0 ? 0 : values[0].length;
        if (nx < 2 || ny < 2) return new double[0][0];
        double[][] out = new double[nx - 1][ny - 1];
        double[] corners = new double[4];
        for (int i = 0; i < nx - 1; i++) {
            for (int j = 0; j < ny - 1; j++) {
                corners[0] = values[i + 1][j + 1];
                corners[1] = values[i + 1][j];
                corners[2] = values[i][j + 1];
                corners[3] = values[i][j];
                out[i][j] = Averages.mean(corners, ignoreMissing);
            }
        }
        return out;
    }

    private static int[][] shade(double[][] means, ColorRamp ramp) {
        double lo = Averages.min(means);
        double hi = Averages.max(means);
        int[][] levels = new int[means.length][];
        for (int i = 0; i < means.length; i++) {
            levels[i] = new int[means[i].length];
            for (int j = 0; j < means[i].length; j++) {
                levels[i][j] = ramp.levelOf(means[i][j], lo, hi);
            }
        }
        return levels;
    }

    @Override
    public VariogramKind kind() {
        return VariogramKind.PERSPECTIVE;
    }

    /**
     * Blanks vertices with fewer than {@code minPairs} pairs, then recomputes
     * the z range and the facet shading from what remains.
     */
    @Override
    public SurfaceVariogram filterUnstable(int minPairs) {
        IsotropicVariogram.checkThreshold(minPairs);
        double[][] kept = deepCopy(z);
        boolean changed = false;
        for (int i = 0; i < kept.length; i++) {
            for (int j = 0; j < kept[i].length; j++) {
                if (pairs[i][j] < minPairs && !Double.isNaN(kept[i][j])) {
                    kept[i][j] = Double.NaN;
                    changed = true;
                }
            }
        }
        if (!changed) return this;
        SurfaceVariogram filtered = new SurfaceVariogram(x, y, kept, pairs, ramp);
        if (!filtered.hasStableCells()) {
            log.warn("No surface cell has at least {} pairs", minPairs);
        }
        return filtered;
    }

    /** Row displacement levels. */
    public double[] x() {
        return x.clone();
    }

    /** Column displacement levels. */
    public double[] y() {
        return y.clone();
    }

    public double[][] z() {
        return deepCopy(z);
    }

    public double z(int i, int j) {
        return z[i][j];
    }

    /** Pair counts, parallel to {@link #z()}; NaN where there is no heat cell. */
    public double[][] pairs() {
        return deepCopy(pairs);
    }

    public int rows() {
        return x.length;
    }

    public int cols() {
        return y.length;
    }

    /** Facet shading values, {@code rows() - 1} by {@code cols() - 1}. */
    public double[][] facetMeans() {
        return deepCopy(facetMeans);
    }

    /** Ramp level of a facet, or -1 when all its corners are missing. */
    public int facetLevel(int i, int j) {
        return facetLevels[i][j];
    }

    /** Facet colours; {@code null} where the facet has no value. */
    public Color[][] facetColors() {
        Color[][] out = new Color[facetLevels.length][];
        for (int i = 0; i < facetLevels.length; i++) {
            out[i] = new Color[facetLevels[i].length];
            for (int j = 0; j < facetLevels[i].length; j++) {
                int level = facetLevels[i][j];
                out[i][j] = level < 0 ? null : ramp.color(level);
            }
        }
        return out;
    }

    public ColorRamp ramp() {
        return ramp;
    }

    /** Range {@code [0, max z]}, empty when no vertex has a value. */
    public Optional<Range> zLimits() {
        return Optional.ofNullable(zLimits);
    }

    /** Whether any vertex still has a value. */
    public boolean hasStableCells() {
        return zLimits != null;
    }

    private static double[][] deepCopy(double[][] m) {
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++) out[i] = m[i].clone();
        return out;
    }

    @Override
    public String toString() {
        return "SurfaceVariogram{" + rows() + "x" + cols()
                + ", zLimits=" + (zLimits == null ? "none" : "[" + zLimits.lower() + ", " + zLimits.upper() + "]")
                + "}";
    }
}
