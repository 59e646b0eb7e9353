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

import java.awt.Color;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-size colour ramp linearly interpolated in RGB between two endpoints.
 *
 * <p>Values are mapped onto the ramp with equal-width bins over a
 * {@code [min, max]} range; bins are closed on the right, so the minimum falls
 * in the first bin and the maximum in the last.</p>
 */
public final class ColorRamp {
    private final List<Color> colors;

    public ColorRamp(Color low, Color high, int levels) {
        if (levels < 1) throw new IllegalArgumentException("levels must be >= 1: " + levels);
        List<Color> c = new ArrayList<>(levels);
        for (int i = 0; i < levels; i++) {
            double t = levels == 1 ? 0.0 : (double) i / (levels - 1);
            c.add(new Color(
                    lerp(low.getRed(), high.getRed(), t),
                    lerp(low.getGreen(), high.getGreen(), t),
                    lerp(low.getBlue(), high.getBlue(), t)));
        }
        this.colors = Collections.unmodifiableList(c);
    }

    public static ColorRamp of(VariogramSettings settings) {
        return new ColorRamp(settings.lowColor(), settings.highColor(), settings.colorLevels());
    }

    public int levels() {
        return colors.size();
    }

    public Color color(int level) {
        return colors.get(level);
    }

    public List<Color> colors() {
        return colors;
    }

    /**
     * Bin index of {@code value} among {@link #levels()} equal-width bins over
     * {@code [min, max]}. A degenerate range puts every value in the middle bin.
     *
     * @return the level in {@code [0, levels)}, or -1 for a missing value
     */
    public int levelOf(double value, double min, double max) {
        if (Double.isNaN(value)) return -1;
        int n = colors.size();
        if (!(max > min)) return (n - 1) / 2;
        double width = (max - min) / n;
        int level = (int) Math.ceil((value - min) / width) - 1;
        return Math.max(0, Math.min(n - 1, level));
    }

    static String toHex(Color c) {
        return String.format("#%02X%02X%02X", c.getRed(), c.getGreen(), c.getBlue());
    }

    private static int lerp(int a, int b, double t) {
        return (int) Math.round(a + (b - a) * t);
    }
}
