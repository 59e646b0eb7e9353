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
 * Regular lattice containing a set of observations.
 *
 * <p>Rows follow the x axis and columns the y axis. Every observation maps to
 * exactly one cell; under autofill, cells without an observation stay empty.
 * Instances are immutable.</p>
 */
public final class Lattice {
    private final AxisLattice rowAxis;
    private final AxisLattice colAxis;
    private final int[] cellRow;
    private final int[] cellCol;

    Lattice(AxisLattice rowAxis, AxisLattice colAxis, int[] cellRow, int[] cellCol) {
        this.rowAxis = rowAxis;
        this.colAxis = colAxis;
        this.cellRow = cellRow;
        this.cellCol = cellCol;
    }

    /** Cell position of one observation. */
    public record Cell(int row, int col) {}

    public AxisLattice rowAxis() {
        return rowAxis;
    }

    public AxisLattice colAxis() {
        return colAxis;
    }

    /** Row spacing (along x). */
    public double dx() {
        return rowAxis.step();
    }

    /** Column spacing (along y). */
    public double dy() {
        return colAxis.step();
    }

    public int rows() {
        return rowAxis.size();
    }

    public int cols() {
        return colAxis.size();
    }

    /** Number of observations mapped onto the lattice. */
    public int size() {
        return cellRow.length;
    }

    public Cell cell(int observation) {
        return new Cell(cellRow[observation], cellCol[observation]);
    }

    /** Zero-based column-major index of the observation's cell. */
    public int linearIndex(int observation) {
        return cellRow[observation] + cellCol[observation] * rows();
    }

    /**
     * Lay values out on the lattice. Cells without an observation are NaN.
     *
     * @param values one value per observation, in observation order
     * @return a fresh {@code rows x cols} matrix
     * @throws VariogramException {@code INVALID_INPUT} on a length mismatch,
     *         {@code DUPLICATE_LOCATION} when two observations share a cell
     */
    public double[][] populate(double[] values) {
        if (values == null || values.length != cellRow.length) {
            throw new VariogramException(
                    Kind.INVALID_INPUT,
                    "expected " + cellRow.length + " values, got "
                            + (values == null ? 0 : values.length));
        }
        double[][] m = new double[rows()][cols()];
        for (double[] row : m) Arrays.fill(row, Double.NaN);
        int[][] owner = new int[rows()][cols()];
        for (int i = 0; i < values.length; i++) {
            int r = cellRow[i];
            int c = cellCol[i];
            if (owner[r][c] != 0) {
                throw new VariogramException(
                        Kind.DUPLICATE_LOCATION,
                        "observations " + (owner[r][c] - 1) + " and " + i
                                + " fall in the same cell (" + r + ", " + c + ")");
            }
            owner[r][c] = i + 1;
            m[r][c] = values[i];
        }
        return m;
    }

    @Override
    public String toString() {
        return "Lattice{" + rows() + "x" + cols() + ", step=(" + dx() + ", " + dy() + ")}";
    }
}
