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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.variogram.VariogramException;
import com.github.tinemuz.variogram.VariogramException.Kind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CoordinatesTest {

    @Test
    @DisplayName("Two-column rows are split into x and y")
    void fromRows() {
        Coordinates c = Coordinates.of(new double[][] {{1, 2}, {3, 4}});

        assertEquals(2, c.size());
        assertEquals(3, c.x(1));
        assertEquals(4, c.y(1));
    }

    @Test
    @DisplayName("Rows without exactly two columns are rejected")
    void wrongColumnCount() {
        VariogramException e =
                assertThrows(
                        VariogramException.class,
                        () -> Coordinates.of(new double[][] {{1, 2}, {3, 4, 5}}));
        assertEquals(Kind.INVALID_INPUT, e.kind());
    }

    @Test
    @DisplayName("Missing, empty, misaligned and non-finite input is rejected")
    void invalidInput() {
        assertInvalid(() -> Coordinates.of((double[][]) null));
        assertInvalid(() -> Coordinates.of(new double[0], new double[0]));
        assertInvalid(() -> Coordinates.of(new double[] {1, 2}, new double[] {1}));
        assertInvalid(() -> Coordinates.of(new double[] {1, Double.NaN}, new double[] {1, 2}));
        assertInvalid(
                () -> Coordinates.of(new double[] {1, 2}, new double[] {Double.POSITIVE_INFINITY, 2}));
    }

    @Test
    @DisplayName("Exact duplicate locations are found")
    void duplicates() {
        Coordinates distinct = Coordinates.of(new double[] {0, 1, 0}, new double[] {0, 0, 1});
        Coordinates repeated = Coordinates.of(new double[] {0, 1, 0, 1}, new double[] {0, 0, 1, 0});

        assertEquals(-1, distinct.firstDuplicate());
        assertEquals(3, repeated.firstDuplicate());
        assertEquals(1, repeated.firstOccurrenceOf(3));
    }

    @Test
    @DisplayName("Negative zero is the same location as zero")
    void negativeZero() {
        Coordinates c = Coordinates.of(new double[] {0.0, -0.0}, new double[] {1, 1});

        assertEquals(1, c.firstDuplicate());
    }

    @Test
    @DisplayName("Largest pairwise distance")
    void maxPairwiseDistance() {
        Coordinates c = Coordinates.of(new double[] {0, 3, 1}, new double[] {0, 4, 1});

        assertEquals(5.0, c.maxPairwiseDistance(), 1e-12);
        assertEquals(0.0, Coordinates.of(new double[] {1}, new double[] {1}).maxPairwiseDistance());
    }

    @Test
    @DisplayName("Input arrays are copied")
    void defensiveCopies() {
        double[] x = {1, 2};
        Coordinates c = Coordinates.of(x, new double[] {1, 2});
        x[0] = 99;

        assertEquals(1, c.x(0));
        c.xs()[1] = 99;
        assertEquals(2, c.x(1));
    }

    // Helper methods

    private static void assertInvalid(org.junit.jupiter.api.function.Executable call) {
        VariogramException e = assertThrows(VariogramException.class, call);
        assertEquals(Kind.INVALID_INPUT, e.kind());
    }
}
