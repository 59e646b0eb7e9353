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
import java.util.HashMap;
import java.util.Map;

/**
 * Ordered set of 2-D observation locations, one per observation.
 *
 * <p>Duplicate locations are accepted here; whether they are an error is up
 * to the consumer. Values are copied in and never exposed mutably.</p>
 */
public final class Coordinates {
    private final double[] x;
    private final double[] y;

    private Coordinates(double[] x, double[] y) {
        this.x = x;
        this.y = y;
    }

    /**
     * Coordinates from two parallel arrays.
     *
     * @throws VariogramException {@code INVALID_INPUT} for null, empty,
     *         mismatched or non-finite input
     */
    public static Coordinates of(double[] x, double[] y) {
        if (x == null || y == null) {
            throw new VariogramException(Kind.INVALID_INPUT, "coordinates are missing");
        }
        if (x.length != y.length) {
            throw new VariogramException(
                    Kind.INVALID_INPUT,
                    "x and y have different lengths: " + x.length + " vs " + y.length);
        }
        if (x.length == 0) {
            throw new VariogramException(Kind.INVALID_INPUT, "coordinates are empty");
        }
        for (int i = 0; i < x.length; i++) {
            if (!Double.isFinite(x[i]) || !Double.isFinite(y[i])) {
                throw new VariogramException(
                        Kind.INVALID_INPUT,
                        "coordinate " + i + " is not finite: (" + x[i] + ", " + y[i] + ")");
            }
        }
        return new Coordinates(x.clone(), y.clone());
    }

    /**
     * Coordinates from a two-column matrix, one row per observation.
     *
     * @throws VariogramException {@code INVALID_INPUT} unless every row has
     *         exactly two finite values
     */
    public static Coordinates of(double[][] rows) {
        if (rows == null) {
            throw new VariogramException(Kind.INVALID_INPUT, "coordinates are missing");
        }
        double[] xs = new double[rows.length];
        double[] ys = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i] == null || rows[i].length != 2) {
                throw new VariogramException(
                        Kind.INVALID_INPUT,
                        "coordinates must have exactly 2 columns; row " + i + " has "
                                + (rows[i] == null ? 0 : rows[i].length));
            }
            xs[i] = rows[i][0];
            ys[i] = rows[i][1];
        }
        return of(xs, ys);
    }

    public int size() {
        return x.length;
    }

    public double x(int i) {
        return x[i];
    }

    public double y(int i) {
        return y[i];
    }

    public double[] xs() {
        return x.clone();
    }

    public double[] ys() {
        return y.clone();
    }

    /**
     * Index of the first observation whose location exactly repeats an earlier
     * one, or -1 when all locations are distinct.
     */
    public int firstDuplicate() {
        Map<Location, Integer> seen = new HashMap<>(x.length * 2);
        for (int i = 0; i < x.length; i++) {
            // + 0.0 folds -0.0 onto 0.0
            if (seen.putIfAbsent(new Location(x[i] + 0.0, y[i] + 0.0), i) != null) return i;
        }
        return -1;
    }

    /** Index of the earlier observation sharing the location of observation {@code i}. */
    public int firstOccurrenceOf(int i) {
        for (int j = 0; j < i; j++) {
            if (x[j] == x[i] && y[j] == y[i]) return j;
        }
        return i;
    }

    /** Largest euclidean distance between any two observations (0 for one point). */
    public double maxPairwiseDistance() {
        double best = 0.0;
        for (int i = 0; i < x.length; i++) {
            for (int j = i + 1; j < x.length; j++) {
                double d = Math.hypot(x[i] - x[j], y[i] - y[j]);
                if (d > best) best = d;
            }
        }
        return best;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinates)) return false;
        Coordinates other = (Coordinates) o;
        return Arrays.equals(x, other.x) && Arrays.equals(y, other.y);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(x) + Arrays.hashCode(y);
    }

    @Override
    public String toString() {
        return "Coordinates{n=" + x.length + "}";
    }

    private record Location(double x, double y) {}
}
