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

/** Arithmetic means with explicit handling of missing (NaN) values. */
final class Averages {
    private Averages() {}

    /**
     * Mean of {@code values}.
     *
     * @param ignoreMissing skip NaN entries; otherwise any NaN makes the mean NaN
     * @return the mean, or NaN when no value takes part
     */
    static double mean(double[] values, boolean ignoreMissing) {
        double sum = 0.0;
        int n = 0;
        for (double v : values) {
            if (Double.isNaN(v)) {
                if (ignoreMissing) continue;
                return Double.NaN;
            }
            sum += v;
            n++;
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    /** Sum of {@code values}; NaN entries are skipped when {@code ignoreMissing}. */
    static double sum(double[] values, boolean ignoreMissing) {
        double sum = 0.0;
        for (double v : values) {
            if (Double.isNaN(v)) {
                if (ignoreMissing) continue;
                return Double.NaN;
            }
            sum += v;
        }
        return sum;
    }

    /** Largest non-NaN entry of a matrix, or NaN when every entry is missing. */
    static double max(double[][] values) {
        double best = Double.NaN;
        for (double[] row : values) {
            for (double v : row) {
                if (!Double.isNaN(v) && (Double.isNaN(best) || v > best)) best = v;
            }
        }
        return best;
    }

    /** Smallest non-NaN entry of a matrix, or NaN when every entry is missing. */
    static double min(double[][] values) {
        double best = Double.NaN;
        for (double[] row : values) {
            for (double v : row) {
                if (!Double.isNaN(v) && (Double.isNaN(best) || v < best)) best = v;
            }
        }
        return best;
    }
}
