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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Infers the regular lattice that holds a set of scattered coordinates.
 *
 * <p>Each axis is handled on its own: sort the distinct values, take the
 * smallest consecutive gap as the step, then either fill the full arithmetic
 * sequence from minimum to maximum or keep the observed values with their
 * gaps. Duplicate coordinates collapse onto one level and never create an
 * extra one.</p>
 */
public final class LatticeBuilder {
    private static final Logger log = LoggerFactory.getLogger(LatticeBuilder.class);

    /** Default tolerance, as a fraction of a step, when snapping onto a filled axis. */
    public static final double DEFAULT_SNAP_TOLERANCE = 1e-6;

    /** Largest number of cells a lattice may have. */
    public static final long MAX_CELLS = 1L << 26;

    private LatticeBuilder() {}

    /**
     * Build the lattice of {@code coordinates}.
     *
     * @param coordinates observation locations
     * @param autofill    fill gaps so both axes are complete arithmetic sequences
     * @return lattice descriptor with one cell per observation
     * @throws com.github.tinemuz.variogram.VariogramException
     *         {@code IRREGULAR_SPACING} when a filled axis misses an observed value,
     *         {@code INVALID_INPUT} when the lattice would exceed {@link #MAX_CELLS} cells
     */
    public static Lattice build(Coordinates coordinates, boolean autofill) {
        return build(coordinates, autofill, DEFAULT_SNAP_TOLERANCE);
    }

    public static Lattice build(Coordinates coordinates, boolean autofill, double snapTolerance) {
        AxisLattice rowAxis = AxisLattice.infer("x", coordinates.xs(), autofill, snapTolerance);
        AxisLattice colAxis = AxisLattice.infer("y", coordinates.ys(), autofill, snapTolerance);
        long cells = (long) rowAxis.size() * colAxis.size();
        if (cells > MAX_CELLS) {
            throw new VariogramException(
                    Kind.INVALID_INPUT,
                    "lattice of " + rowAxis.size() + "x" + colAxis.size() + " cells exceeds "
                            + MAX_CELLS + " cells");
        }

        int n = coordinates.size();
        int[] cellRow = new int[n];
        int[] cellCol = new int[n];
        for (int i = 0; i < n; i++) {
            cellRow[i] = rowAxis.indexOf(coordinates.x(i));
            cellCol[i] = colAxis.indexOf(coordinates.y(i));
        }
        Lattice lattice = new Lattice(rowAxis, colAxis, cellRow, cellCol);
        log.debug(
                "Built {} lattice {} for {} observations",
                autofill ? "filled" : "unfilled", lattice, n);
        return lattice;
    }
}
