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

import java.util.ArrayList;
import java.util.List;

/** Semivariance as a function of distance, one row per distance bin. */
public final class IsotropicVariogram implements VariogramView {
    private final List<Row> rows;

    /** One distance bin. */
    public record Row(double distance, double semivariance, int pairs) {}

    public IsotropicVariogram(List<Row> rows) {
        this.rows = List.copyOf(rows);
    }

    public List<Row> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    @Override
    public VariogramKind kind() {
        return VariogramKind.ISOTROPIC;
    }

    /** Drops bins with fewer than {@code minPairs} pairs. */
    @Override
    public IsotropicVariogram filterUnstable(int minPairs) {
        checkThreshold(minPairs);
        List<Row> kept = new ArrayList<>(rows.size());
        for (Row r : rows) {
            if (r.pairs() >= minPairs) kept.add(r);
        }
        return kept.size() == rows.size() ? this : new IsotropicVariogram(kept);
    }

    static void checkThreshold(int minPairs) {
        if (minPairs < 0) throw new IllegalArgumentException("minPairs must be >= 0: " + minPairs);
    }

    @Override
    public String toString() {
        return "IsotropicVariogram{" + rows.size() + " bins}";
    }
}
