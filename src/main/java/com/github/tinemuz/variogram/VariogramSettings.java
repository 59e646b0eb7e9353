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
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable settings for variogram aggregation and stability filtering.
 *
 * <p>Defaults come from the classpath resource <code>variogram.properties</code>.
 * The value is handed explicitly to {@link VariogramAggregator}; there is no
 * process-wide palette or option store. Use the {@code with...} methods to
 * derive a copy with one setting changed.</p>
 */
public final class VariogramSettings {
    private static final Logger log = LoggerFactory.getLogger(VariogramSettings.class);
    private static final String RESOURCE = "variogram.properties";
    private static volatile VariogramSettings defaults;

    /** How pair counts of quadrant-folded lags are combined into one heat cell. */
    public enum CountFold {
        /** Add the counts of all folded lags; no pair is lost or counted twice. */
        SUM,
        /** Average the counts of the folded lags. */
        MEAN
    }

    private final int minPairs;
    private final Color lowColor;
    private final Color highColor;
    private final int colorLevels;
    private final CountFold countFold;
    private final double radiusDivisor;
    private final double snapTolerance;

    private VariogramSettings(
            int minPairs,
            Color lowColor,
            Color highColor,
            int colorLevels,
            CountFold countFold,
            double radiusDivisor,
            double snapTolerance) {
        if (minPairs < 0) throw new IllegalArgumentException("minPairs must be >= 0: " + minPairs);
        if (colorLevels < 1) {
            throw new IllegalArgumentException("colorLevels must be >= 1: " + colorLevels);
        }
        if (!(radiusDivisor > 0) || Double.isInfinite(radiusDivisor)) {
            throw new IllegalArgumentException("radiusDivisor must be positive: " + radiusDivisor);
        }
        if (!(snapTolerance >= 0 && snapTolerance < 0.5)) {
            throw new IllegalArgumentException("snapTolerance must be in [0, 0.5): " + snapTolerance);
        }
        if (lowColor == null || highColor == null || countFold == null) {
            throw new IllegalArgumentException("colours and count fold are required");
        }
        this.minPairs = minPairs;
        this.lowColor = lowColor;
        this.highColor = highColor;
        this.colorLevels = colorLevels;
        this.countFold = countFold;
        this.radiusDivisor = radiusDivisor;
        this.snapTolerance = snapTolerance;
    }

    /**
     * Settings read from <code>variogram.properties</code> on the classpath.
     * The resource is parsed once; later calls return the same instance.
     *
     * @throws IllegalStateException if the resource is missing or invalid
     */
    public static VariogramSettings defaults() {
        VariogramSettings d = defaults;
        if (d == null) {
            synchronized (VariogramSettings.class) {
                d = defaults;
                if (d == null) {
                    d = loadFromResource(RESOURCE);
                    defaults = d;
                }
            }
        }
        return d;
    }

    /**
     * Parse settings from a classpath resource. Keys that are absent fall back
     * to built-in values; keys that are present but malformed are an error.
     */
    static VariogramSettings loadFromResource(String resource) {
        InputStream in = VariogramSettings.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.error("Variogram settings '{}' not found on classpath", resource);
            throw new IllegalStateException(
                    "Variogram settings '" + resource + "' not found on classpath");
        }
        Properties props = new Properties();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            log.error("Failed to read variogram settings '{}'", resource, e);
            throw new IllegalStateException("Failed to read variogram settings '" + resource + "'", e);
        }
        try {
            VariogramSettings s = fromProperties(props);
            log.debug("Loaded variogram settings from {}: {}", resource, s);
            return s;
        } catch (RuntimeException e) {
            log.error("Failed to parse variogram settings '{}'", resource, e);
            throw new IllegalStateException("Failed to parse variogram settings '" + resource + "'", e);
        }
    }

    static VariogramSettings fromProperties(Properties props) {
        return new VariogramSettings(
                Integer.parseInt(props.getProperty("min.pairs", "30").trim()),
                Color.decode(props.getProperty("color.low", "#034E7B").trim()),
                Color.decode(props.getProperty("color.high", "#FDAE6B").trim()),
                Integer.parseInt(props.getProperty("color.levels", "100").trim()),
                CountFold.valueOf(
                        props.getProperty("count.fold", "SUM").trim().toUpperCase(Locale.ROOT)),
                Double.parseDouble(props.getProperty("radius.divisor", "3").trim()),
                Double.parseDouble(props.getProperty("snap.tolerance", "1e-6").trim()));
    }

    /** Pair-count threshold below which a cell is considered unstable. */
    public int minPairs() {
        return minPairs;
    }

    /** Colour of the lowest facet level. */
    public Color lowColor() {
        return lowColor;
    }

    /** Colour of the highest facet level. */
    public Color highColor() {
        return highColor;
    }

    /** Number of colour levels facets are binned into. */
    public int colorLevels() {
        return colorLevels;
    }

    public CountFold countFold() {
        return countFold;
    }

    /** The default radius is the largest pairwise distance divided by this. */
    public double radiusDivisor() {
        return radiusDivisor;
    }

    /** Largest offset from a filled level, as a fraction of the step. */
    public double snapTolerance() {
        return snapTolerance;
    }

    public VariogramSettings withMinPairs(int value) {
        return new VariogramSettings(
                value, lowColor, highColor, colorLevels, countFold, radiusDivisor, snapTolerance);
    }

    public VariogramSettings withColors(Color low, Color high) {
        return new VariogramSettings(
                minPairs, low, high, colorLevels, countFold, radiusDivisor, snapTolerance);
    }

    public VariogramSettings withColorLevels(int value) {
        return new VariogramSettings(
                minPairs, lowColor, highColor, value, countFold, radiusDivisor, snapTolerance);
    }

    public VariogramSettings withCountFold(CountFold value) {
        return new VariogramSettings(
                minPairs, lowColor, highColor, colorLevels, value, radiusDivisor, snapTolerance);
    }

    public VariogramSettings withRadiusDivisor(double value) {
        return new VariogramSettings(
                minPairs, lowColor, highColor, colorLevels, countFold, value, snapTolerance);
    }

    public VariogramSettings withSnapTolerance(double value) {
        return new VariogramSettings(
                minPairs, lowColor, highColor, colorLevels, countFold, radiusDivisor, value);
    }

    @Override
    public String toString() {
        return "VariogramSettings{minPairs=" + minPairs
                + ", lowColor=" + ColorRamp.toHex(lowColor)
                + ", highColor=" + ColorRamp.toHex(highColor)
                + ", colorLevels=" + colorLevels
                + ", countFold=" + countFold
                + ", radiusDivisor=" + radiusDivisor
                + ", snapTolerance=" + snapTolerance + "}";
    }
}
