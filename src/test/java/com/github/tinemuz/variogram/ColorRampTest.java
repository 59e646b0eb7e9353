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

import static org.junit.jupiter.api.Assertions.*;

import java.awt.Color;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ColorRampTest {

    @Test
    @DisplayName("Ramp runs from the low to the high colour")
    void endpoints() {
        ColorRamp ramp = new ColorRamp(Color.BLUE, Color.GREEN, 100);

        assertEquals(100, ramp.levels());
        assertEquals(Color.BLUE, ramp.color(0));
        assertEquals(Color.GREEN, ramp.color(99));
    }

    @Test
    @DisplayName("Intermediate levels are interpolated in RGB")
    void interpolation() {
        ColorRamp ramp = new ColorRamp(Color.BLACK, Color.WHITE, 3);

        assertEquals(new Color(128, 128, 128), ramp.color(1));
    }

    @Test
    @DisplayName("Values fall in equal-width bins")
    void levelOf() {
        ColorRamp ramp = new ColorRamp(Color.BLACK, Color.WHITE, 4);

        assertEquals(0, ramp.levelOf(0.0, 0.0, 4.0));
        assertEquals(0, ramp.levelOf(1.0, 0.0, 4.0));
        assertEquals(1, ramp.levelOf(1.5, 0.0, 4.0));
        assertEquals(3, ramp.levelOf(4.0, 0.0, 4.0));
        assertEquals(-1, ramp.levelOf(Double.NaN, 0.0, 4.0));
    }

    @Test
    @DisplayName("Degenerate range maps to the middle level")
    void degenerateRange() {
        ColorRamp ramp = new ColorRamp(Color.BLACK, Color.WHITE, 100);

        assertEquals(49, ramp.levelOf(2.0, 2.0, 2.0));
    }
}
