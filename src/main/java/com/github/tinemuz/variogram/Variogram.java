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
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Empirical variogram in its four representations.
 *
 * <p>Computed once per request and never mutated. Stability filtering
 * returns a filtered copy.</p>
 */
public final class Variogram {
    private static final VariogramKind[] DISPLAY_ORDER = {
        VariogramKind.ISOTROPIC, VariogramKind.HEAT, VariogramKind.PERSPECTIVE, VariogramKind.ANISOTROPIC
    };

    private final IsotropicVariogram isotropic;
    private final AnisotropicVariogram anisotropic;
    private final HeatVariogram heat;
    private final SurfaceVariogram perspective;
    private final Plot plot;
    private final int defaultMinPairs;

    /** Which representations a caller wants displayed. */
    public enum Plot {
        ALL(VariogramKind.values()),
        ISOTROPIC(VariogramKind.ISOTROPIC),
        ANISOTROPIC(VariogramKind.ANISOTROPIC),
        PERSPECTIVE(VariogramKind.PERSPECTIVE),
        HEAT(VariogramKind.HEAT),
        NONE();

        private final Set<VariogramKind> kinds;

        Plot(VariogramKind... kinds) {
            this.kinds =
                    kinds.length == 0
                            ? EnumSet.noneOf(VariogramKind.class)
                            : EnumSet.copyOf(Arrays.asList(kinds));
        }

        public boolean includes(VariogramKind kind) {
            return kinds.contains(kind);
        }
    }

    Variogram(
            IsotropicVariogram isotropic,
            AnisotropicVariogram anisotropic,
            HeatVariogram heat,
            SurfaceVariogram perspective,
            Plot plot,
            int defaultMinPairs) {
        this.isotropic = isotropic;
        this.anisotropic = anisotropic;
        this.heat = heat;
        this.perspective = perspective;
        this.plot = plot;
        this.defaultMinPairs = defaultMinPairs;
    }

    public IsotropicVariogram isotropic() {
        return isotropic;
    }

    public AnisotropicVariogram anisotropic() {
        return anisotropic;
    }

    public HeatVariogram heat() {
        return heat;
    }

    public SurfaceVariogram perspective() {
        return perspective;
    }

    public Plot plot() {
        return plot;
    }

    public VariogramView view(VariogramKind kind) {
        return switch (kind) {
            case ISOTROPIC -> isotropic;
            case ANISOTROPIC -> anisotropic;
            case HEAT -> heat;
            case PERSPECTIVE -> perspective;
        };
    }

    /** Representations selected by {@link #plot()}, in display order. */
    public List<VariogramView> selected() {
        List<VariogramView> out = new ArrayList<>(4);
        for (VariogramKind kind : DISPLAY_ORDER) {
            if (plot.includes(kind)) out.add(view(kind));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Copy without values computed from fewer than {@code minPairs} pairs:
     * isotropic bins are dropped, heat, anisotropic and surface values are
     * blanked and the surface range recomputed.
     */
    public Variogram filterUnstable(int minPairs) {
        return new Variogram(
                isotropic.filterUnstable(minPairs),
                anisotropic.filterUnstable(minPairs),
                heat.filterUnstable(minPairs),
                perspective.filterUnstable(minPairs),
                plot,
                defaultMinPairs);
    }

    /** {@link #filterUnstable(int)} with the configured threshold. */
    public Variogram filterUnstable() {
        return filterUnstable(defaultMinPairs);
    }

    @Override
    public String toString() {
        return "Variogram{plot=" + plot
                + ", isotropic=" + isotropic
                + ", heat=" + heat
                + ", perspective=" + perspective
                + ", anisotropic=" + anisotropic + "}";
    }
}
