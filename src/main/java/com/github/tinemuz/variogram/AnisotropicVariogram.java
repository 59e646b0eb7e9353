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

/** Semivariance for every lag vector, in physical units. */
public final class AnisotropicVariogram implements VariogramView {
    private final List<Cell> cells;

    /**
     * One lag vector.
     *
     * @param rowLag integer row displacement, never negative
     * @param colLag integer column displacement
     * @param x      {@code rowLag * dx}
     * @param y      {@code colLag * dy}
     * @param z      semivariance, NaN when missing or filtered
     * @param pairs  pairs the semivariance was computed from
     */
    public record Cell(int rowLag, int colLag, double x, double y, double z, int pairs) {}

    public AnisotropicVariogram(List<Cell> cells) {
        this.cells = List.copyOf(cells);
    }

    public List<Cell> cells() {
        return cells;
    }

    public int size() {
        return cells.size();
    }

    @Override
    public VariogramKind kind() {
        return VariogramKind.ANISOTROPIC;
    }

    /** Blanks the semivariance of lags with fewer than {@code minPairs} pairs. */
    @Override
    public AnisotropicVariogram filterUnstable(int minPairs) {
        IsotropicVariogram.checkThreshold(minPairs);
        boolean changed = false;
        List<Cell> out = new ArrayList<>(cells.size());
        for (Cell c : cells) {
            if (c.pairs() < minPairs && !Double.isNaN(c.z())) {
                out.add(new Cell(c.rowLag(), c.colLag(), c.x(), c.y(), Double.NaN, c.pairs()));
                changed = true;
            } else {
                out.add(c);
            }
        }
        return changed ? new AnisotropicVariogram(out) : this;
    }

    @Override
    public String toString() {
        return "AnisotropicVariogram{" + cells.size() + " lags}";
    }
}
