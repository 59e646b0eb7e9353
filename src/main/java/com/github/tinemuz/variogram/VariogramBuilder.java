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

import com.github.tinemuz.variogram.grid.Coordinates;
import com.github.tinemuz.variogram.grid.Lattice;
import com.github.tinemuz.variogram.grid.LatticeBuilder;
import com.github.tinemuz.variogram.lag.LagVariogramCalculator;
import com.github.tinemuz.variogram.lag.MatrixLagVariogram;
import com.github.tinemuz.variogram.lag.RawVariogram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the empirical variogram of residuals over their observation
 * locations.
 *
 * <p>Values default to the residuals of the supplied {@link SpatialModel} and
 * locations to its coordinates; either can be overridden, and with both
 * overridden no model is needed. The locations are placed on a filled regular
 * lattice, the values laid out on it and the lag variogram computed within a
 * radius that defaults to a third of the largest pairwise distance.</p>
 *
 * <pre>{@code
 * Variogram v = new VariogramBuilder()
 *         .coordinates(Coordinates.of(x, y))
 *         .values(residuals)
 *         .compute()
 *         .filterUnstable();
 * }</pre>
 *
 * <p>Builders are not thread-safe; the variograms they produce are
 * immutable.</p>
 */
public final class VariogramBuilder {
    private static final Logger log = LoggerFactory.getLogger(VariogramBuilder.class);

    private SpatialModel model;
    private Coordinates coordinates;
    private double[] values;
    private Double radius;
    private Variogram.Plot plot = Variogram.Plot.ALL;
    private LagVariogramCalculator calculator = new MatrixLagVariogram();
    private VariogramSettings settings;

    public VariogramBuilder model(SpatialModel model) {
        this.model = model;
        return this;
    }

    /** Locations to use instead of the model's coordinates. */
    public VariogramBuilder coordinates(Coordinates coordinates) {
        this.coordinates = coordinates;
        return this;
    }

    /** Values to use instead of the model's residuals. */
    public VariogramBuilder values(double[] values) {
        this.values = values == null ? null : values.clone();
        return this;
    }

    /** Largest separation, in coordinate units, to compute the variogram for. */
    public VariogramBuilder radius(double radius) {
        this.radius = radius;
        return this;
    }

    public VariogramBuilder plot(Variogram.Plot plot) {
        this.plot = plot;
        return this;
    }

    public VariogramBuilder calculator(LagVariogramCalculator calculator) {
        this.calculator = calculator;
        return this;
    }

    public VariogramBuilder settings(VariogramSettings settings) {
        this.settings = settings;
        return this;
    }

    /**
     * Compute the variogram. Either every representation is returned or the
     * call fails before the lag computation starts.
     *
     * @throws VariogramException {@code INVALID_INPUT} when locations or
     *         values are missing, misaligned or fewer than two, or the radius
     *         is not positive; {@code DUPLICATE_LOCATION} when two
     *         observations share a location; {@code IRREGULAR_SPACING} when
     *         the locations do not fit a regular lattice
     */
    public Variogram compute() {
        VariogramSettings s = settings != null ? settings : VariogramSettings.defaults();
        if (plot == null) throw VariogramException.invalidInput("plot selection is missing");
        if (calculator == null) throw VariogramException.invalidInput("lag calculator is missing");

        // STEP 1: resolve locations and values, explicit ones first
        if (model == null && (coordinates == null || values == null)) {
            throw VariogramException.invalidInput(
                    "missing input: supply a fitted model, or both coordinates and values");
        }
        Coordinates coord = coordinates != null ? coordinates : modelCoordinates();
        double[] z = values != null ? values : modelResiduals();
        if (coord.size() < 2) {
            throw VariogramException.invalidInput(
                    "at least 2 observations are needed, got " + coord.size());
        }
        if (z.length != coord.size()) {
            throw VariogramException.invalidInput(
                    coord.size() + " locations but " + z.length + " values");
        }
        if (radius != null && (!(radius > 0) || radius.isInfinite())) {
            throw VariogramException.invalidInput("radius must be positive and finite: " + radius);
        }

        // STEP 2: at most one observation per location
        int dup = coord.firstDuplicate();
        if (dup >= 0) {
            throw new VariogramException(
                    VariogramException.Kind.DUPLICATE_LOCATION,
                    "more than one observation at (" + coord.x(dup) + ", " + coord.y(dup)
                            + "): observations " + coord.firstOccurrenceOf(dup) + " and " + dup);
        }

        // STEP 3: lay the values out on a filled lattice
        Lattice lattice = LatticeBuilder.build(coord, true, s.snapTolerance());
        double[][] matrix = lattice.populate(z);

        // STEP 4: raw lag variogram, then derived representations
        double r = radius != null ? radius : coord.maxPairwiseDistance() / s.radiusDivisor();
        log.debug("Computing variogram of {} observations on {} with radius {}",
                coord.size(), lattice, r);
        RawVariogram raw = calculator.compute(matrix, r, lattice.dx(), lattice.dy());
        if (raw == null) {
            throw new IllegalStateException("lag calculator returned no variogram");
        }
        return new VariogramAggregator(s).aggregate(raw, lattice.dx(), lattice.dy(), plot);
    }

    private Coordinates modelCoordinates() {
        double[][] c = model.coordinates();
        if (c == null) throw VariogramException.invalidInput("missing input: model has no coordinates");
        return Coordinates.of(c);
    }

    private double[] modelResiduals() {
        double[] r = model.residuals();
        if (r == null) throw VariogramException.invalidInput("missing input: model has no residuals");
        return r.clone();
    }
}
