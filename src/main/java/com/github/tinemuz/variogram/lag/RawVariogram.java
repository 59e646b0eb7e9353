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

import java.util.List;

/**
 * Anisotropic variogram by integer lag, plus its distance-binned version.
 * Immutable.
 */
public final class RawVariogram {
    private final List<LagEntry> lags;
    private final List<DistanceBin> bins;

    /**
     * Semivariance for one lag vector.
     *
     * @param rowLag             row displacement, never negative
     * @param colLag             column displacement, any sign
     * @param distance           physical length of the lag
     * @param semivariance       mean of half squared differences, NaN without pairs
     * @param robustSemivariance Cressie-Hawkins estimate, NaN without pairs
     * @param pairs              number of pairs with both values present
     */
    public record LagEntry(
            int rowLag,
            int colLag,
            double distance,
            double semivariance,
            double robustSemivariance,
            int pairs) {}

    /** Semivariance for all lags sharing one physical distance. */
    public record DistanceBin(double distance, double semivariance, int pairs) {}

    /**
     * @throws IllegalArgumentException if a lag has a negative row displacement
     *         or a negative pair count
     */
    public RawVariogram(List<LagEntry> lags, List<DistanceBin> bins) {
        for (LagEntry e : lags) {
            if (e.rowLag() < 0) {
                throw new IllegalArgumentException(
                        "row lags must be non-negative: (" + e.rowLag() + ", " + e.colLag() + ")");
            }
            if (e.pairs() < 0) {
                throw new IllegalArgumentException("negative pair count for lag " + e);
            }
        }
        this.lags = List.copyOf(lags);
        this.bins = List.copyOf(bins);
    }

    public List<LagEntry> lags() {
        return lags;
    }

    public List<DistanceBin> bins() {
        return bins;
    }

    /** Sum of pair counts over all lags. */
    public long totalPairs() {
        long total = 0;
        for (LagEntry e : lags) total += e.pairs();
        return total;
    }
}
