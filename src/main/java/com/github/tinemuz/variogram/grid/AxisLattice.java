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
package com.github.tinemuz.variogram.grid;

import com.github.tinemuz.variogram.VariogramException;
import com.github.tinemuz.variogram.VariogramException.Kind;
import java.util.Arrays;

/**
 * Lattice levels inferred for a single axis.
 *
 * <p>The step is the smallest gap between consecutive distinct observed
 * values, or 1 when the axis has a single distinct value. It is not a common
 * divisor of all gaps, so irregular spacing may be caught only when the axis
 * is filled.</p>
 */
public final class AxisLattice {
    // Sorted values within this many ulps of the axis magnitude are one level
    private static final double SAME_VALUE_ULPS = 4.0;

    /** Largest number of levels a filled axis may have. */
    public static final int MAX_FILL_LEVELS = 1 << 20;

    private final String name;
    private final double step;
    private final double[] levels;
    private final boolean filled;

    private AxisLattice(String name, double step, double[] levels, boolean filled) {
        this.name = name;
        this.step = step;
        this.levels = levels;
        this.filled = filled;
    }

    /**
     * Infer the lattice of one axis.
     *
     * @param name          axis name used in error messages
     * @param values        observed values, in any order, duplicates allowed
     * @param autofill      fill the gaps between minimum and maximum at the step
     * @param snapTolerance largest offset of an observed value from a filled
     *                      level, as a fraction of the step
     * @throws VariogramException {@code EMPTY_AXIS} without values,
     *         {@code IRREGULAR_SPACING} when a filled axis misses an observed
     *         value, {@code INVALID_INPUT} when the fill needs more than
     *         {@link #MAX_FILL_LEVELS} levels
     */
    static AxisLattice infer(String name, double[] values, boolean autofill, double snapTolerance) {
        if (values.length == 0) {
            throw new VariogramException(Kind.EMPTY_AXIS, "axis " + name + " has no values");
        }
        double[] distinct = distinctSorted(values);
        double min = distinct[0];
        double max = distinct[distinct.length - 1];

        double step = 1.0;
        if (distinct.length > 1) {
            step = Double.POSITIVE_INFINITY;
            for (int i = 1; i < distinct.length; i++) {
                step = Math.min(step, distinct[i] - distinct[i - 1]);
            }
        }
        if (!autofill || distinct.length == 1) {
            return new AxisLattice(name, step, distinct, autofill);
        }

        double count = Math.rint((max - min) / step) + 1;
        if (count > MAX_FILL_LEVELS) {
            throw new VariogramException(
                    Kind.INVALID_INPUT,
                    "axis " + name + " would need " + (long) count + " levels at step " + step
                            + " to fill " + min + ".." + max + "; at most " + MAX_FILL_LEVELS
                            + " are allowed");
        }
        double[] levels = new double[(int) count];
        for (int k = 0; k < levels.length; k++) {
            levels[k] = min + k * step;
        }
        for (double v : distinct) {
            double offset = (v - min) / step;
            if (Math.abs(offset - Math.rint(offset)) > snapTolerance) {
                throw new VariogramException(
                        Kind.IRREGULAR_SPACING,
                        "axis " + name + ": value " + v + " is " + offset
                                + " steps of " + step + " from " + min
                                + ", not on the filled sequence");
            }
        }
        return new AxisLattice(name, step, levels, true);
    }

    private static double[] distinctSorted(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double eps =
                SAME_VALUE_ULPS
                        * Math.ulp(Math.max(Math.abs(sorted[0]), Math.abs(sorted[sorted.length - 1])));
        double[] out = new double[sorted.length];
        int n = 0;
        for (double v : sorted) {
            if (n == 0 || v - out[n - 1] > eps) out[n++] = v;
        }
        return Arrays.copyOf(out, n);
    }

    /**
     * Position of {@code value} among the levels: offset rounding on a filled
     * axis, nearest level otherwise.
     */
    public int indexOf(double value) {
        if (filled && levels.length > 1) {
            int k = (int) Math.rint((value - levels[0]) / step);
            return Math.max(0, Math.min(levels.length - 1, k));
        }
        int pos = Arrays.binarySearch(levels, value);
        if (pos >= 0) return pos;
        int hi = -pos - 1;
        if (hi == 0) return 0;
        if (hi == levels.length) return levels.length - 1;
        return (value - levels[hi - 1]) <= (levels[hi] - value) ? hi - 1 : hi;
    }

    public String name() {
        return name;
    }

    public double step() {
        return step;
    }

    public int size() {
        return levels.length;
    }

    public double level(int i) {
        return levels[i];
    }

    public double[] levels() {
        return levels.clone();
    }

    /** Whether gaps between the observed values were filled. */
    public boolean isFilled() {
        return filled;
    }
}
