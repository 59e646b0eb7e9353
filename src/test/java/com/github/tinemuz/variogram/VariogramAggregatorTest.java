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

import com.github.tinemuz.variogram.VariogramSettings.CountFold;
import com.github.tinemuz.variogram.lag.RawVariogram;
import com.github.tinemuz.variogram.lag.RawVariogram.DistanceBin;
import com.github.tinemuz.variogram.lag.RawVariogram.LagEntry;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for deriving the four variogram representations from a raw lag
 * table, and for stability filtering.
 */
class VariogramAggregatorTest {

    private static final double SQRT2 = Math.sqrt(2);
    private static final double SQRT5 = Math.sqrt(5);

    // Lags (0,1), (1,0), (1,±1), (1,±2); (1,2) has no pair
    private static final RawVariogram RAW =
            new RawVariogram(
                    List.of(
                            new LagEntry(0, 1, 1, 2, 2, 10),
                            new LagEntry(1, 0, 1, 4, 4, 8),
                            new LagEntry(1, -1, SQRT2, 8, 8, 7),
                            new LagEntry(1, 1, SQRT2, 6, 6, 5),
                            new LagEntry(1, -2, SQRT5, 10, 10, 3),
                            new LagEntry(1, 2, SQRT5, Double.NaN, Double.NaN, 0)),
                    List.of(
                            new DistanceBin(1, 52.0 / 18.0, 18),
                            new DistanceBin(SQRT2, 86.0 / 12.0, 12),
                            new DistanceBin(SQRT5, 10, 3)));

    private final VariogramSettings settings = VariogramSettings.defaults();

    @Nested
    @DisplayName("Passthrough representations")
    class PassthroughTests {

        @Test
        @DisplayName("Anisotropic lags are scaled to physical units")
        void anisotropicScaled() {
            Variogram v = aggregate(settings, 2.0, 0.5);
            AnisotropicVariogram.Cell c = v.anisotropic().cells().get(4);

            assertEquals(6, v.anisotropic().size());
            assertEquals(1, c.rowLag());
            assertEquals(-2, c.colLag());
            assertEquals(2.0, c.x());
            assertEquals(-1.0, c.y());
            assertEquals(10.0, c.z());
            assertEquals(3, c.pairs());
        }

        @Test
        @DisplayName("Isotropic bins are taken as computed")
        void isotropicPassthrough() {
            IsotropicVariogram iso = aggregate(settings, 1, 1).isotropic();

            assertEquals(3, iso.size());
            assertEquals(SQRT2, iso.rows().get(1).distance());
            assertEquals(86.0 / 12.0, iso.rows().get(1).semivariance());
            assertEquals(12, iso.rows().get(1).pairs());
        }

        @Test
        @DisplayName("Views expose read-only lists")
        void readOnlyViews() {
            Variogram v = aggregate(settings, 1, 1);

            assertThrows(
                    UnsupportedOperationException.class,
                    () -> v.isotropic().rows().add(new IsotropicVariogram.Row(1, 1, 1)));
            assertThrows(UnsupportedOperationException.class, () -> v.anisotropic().cells().clear());
            assertThrows(UnsupportedOperationException.class, () -> v.heat().cells().remove(0));
            assertThrows(UnsupportedOperationException.class, () -> RAW.lags().clear());
            assertThrows(UnsupportedOperationException.class, () -> RAW.bins().clear());
        }
    }

    @Nested
    @DisplayName("Heat table")
    class HeatTests {

        @Test
        @DisplayName("Lags fold onto absolute displacement")
        void foldsQuadrants() {
            List<HeatVariogram.Cell> cells = aggregate(settings, 1, 1).heat().cells();

            assertEquals(4, cells.size());
            assertHeat(cells.get(0), 0, 1, 2.0, 10);
            assertHeat(cells.get(1), 1, 0, 4.0, 8);
            assertHeat(cells.get(2), 1, 1, 7.0, 12);
            // the member without pairs is ignored in the mean
            assertHeat(cells.get(3), 1, 2, 10.0, 3);
        }

        @Test
        @DisplayName("Folding neither loses nor double-counts pairs")
        void pairTotalsPreserved() {
            HeatVariogram heat = aggregate(settings, 1, 1).heat();

            assertEquals(RAW.totalPairs(), heat.totalPairs(), 1e-9);
            for (HeatVariogram.Cell cell : heat.cells()) {
                long expected = 0;
                for (LagEntry e : RAW.lags()) {
                    if (e.rowLag() == cell.rowLag() && Math.abs(e.colLag()) == cell.colLag()) {
                        expected += e.pairs();
                    }
                }
                assertEquals(expected, cell.pairs(), 1e-9);
            }
        }

        @Test
        @DisplayName("Mean count fold averages the folded counts")
        void meanCountFold() {
            List<HeatVariogram.Cell> cells =
                    aggregate(settings.withCountFold(CountFold.MEAN), 1, 1).heat().cells();

            assertEquals(6.0, cells.get(2).pairs());
            assertEquals(1.5, cells.get(3).pairs());
            assertEquals(7.0, cells.get(2).z());
        }

        @Test
        @DisplayName("Heat cells carry physical displacement")
        void physicalUnits() {
            HeatVariogram.Cell c = aggregate(settings, 2.0, 0.5).heat().cells().get(3);

            assertEquals(2.0, c.x());
            assertEquals(1.0, c.y());
        }
    }

    @Nested
    @DisplayName("Surface mesh")
    class SurfaceTests {

        @Test
        @DisplayName("Heat values are placed on their level grid")
        void surfaceLayout() {
            SurfaceVariogram s = aggregate(settings, 1, 1).perspective();

            assertArrayEquals(new double[] {0, 1}, s.x());
            assertArrayEquals(new double[] {0, 1, 2}, s.y());
            assertTrue(Double.isNaN(s.z(0, 0)));
            assertEquals(2.0, s.z(0, 1));
            assertTrue(Double.isNaN(s.z(0, 2)));
            assertEquals(4.0, s.z(1, 0));
            assertEquals(7.0, s.z(1, 1));
            assertEquals(10.0, s.z(1, 2));
            assertEquals(12.0, s.pairs()[1][1]);
            assertTrue(Double.isNaN(s.pairs()[0][0]));
        }

        @Test
        @DisplayName("Facets average their non-missing corners")
        void facetMeans() {
            double[][] facets = aggregate(settings, 1, 1).perspective().facetMeans();

            assertEquals(1, facets.length);
            assertEquals(2, facets[0].length);
            assertEquals(13.0 / 3.0, facets[0][0], 1e-12);
            assertEquals(19.0 / 3.0, facets[0][1], 1e-12);
        }

        @Test
        @DisplayName("Facet colours span the ramp")
        void facetColours() {
            SurfaceVariogram s = aggregate(settings, 1, 1).perspective();

            assertEquals(0, s.facetLevel(0, 0));
            assertEquals(settings.colorLevels() - 1, s.facetLevel(0, 1));
            assertEquals(settings.lowColor(), s.facetColors()[0][0]);
            assertEquals(settings.highColor(), s.facetColors()[0][1]);
        }

        @Test
        @DisplayName("Z range starts at 0 and ends at the largest value")
        void zLimits() {
            SurfaceVariogram s = aggregate(settings, 1, 1).perspective();

            assertTrue(s.hasStableCells());
            assertEquals(0.0, s.zLimits().orElseThrow().lower());
            assertEquals(10.0, s.zLimits().orElseThrow().upper());
        }
    }

    @Nested
    @DisplayName("Stability filter")
    class FilterTests {

        @Test
        @DisplayName("Threshold 0 leaves every representation untouched")
        void zeroThreshold() {
            Variogram v = aggregate(settings, 1, 1);
            Variogram f = v.filterUnstable(0);

            assertSame(v.isotropic(), f.isotropic());
            assertSame(v.anisotropic(), f.anisotropic());
            assertSame(v.heat(), f.heat());
            assertSame(v.perspective(), f.perspective());
        }

        @Test
        @DisplayName("Unstable cells are dropped or blanked")
        void filtersBelowThreshold() {
            Variogram v = aggregate(settings, 1, 1);
            Variogram f = v.filterUnstable(8);

            assertEquals(2, f.isotropic().size(), "the bin with 3 pairs is dropped");
            List<HeatVariogram.Cell> heat = f.heat().cells();
            assertEquals(4, heat.size(), "heat keeps its shape");
            assertEquals(4.0, heat.get(1).z(), "8 pairs is not below 8");
            assertTrue(Double.isNaN(heat.get(3).z()));
            assertTrue(Double.isNaN(f.anisotropic().cells().get(2).z()));
            assertEquals(2.0, f.anisotropic().cells().get(0).z());
            // the canonical result is unchanged
            assertEquals(10.0, v.heat().cells().get(3).z());
            assertEquals(3, v.isotropic().size());
        }

        @Test
        @DisplayName("Surface range and facets are recomputed after filtering")
        void surfaceRecomputed() {
            SurfaceVariogram s = aggregate(settings, 1, 1).perspective().filterUnstable(8);

            assertTrue(Double.isNaN(s.z(1, 2)));
            assertEquals(7.0, s.zLimits().orElseThrow().upper());
            assertEquals(4.5, s.facetMeans()[0][1], 1e-12);
            assertEquals(3, s.cols(), "shape is unchanged");
        }

        @Test
        @DisplayName("Filtering everything leaves no stable cell")
        void allFiltered() {
            Variogram f = aggregate(settings, 1, 1).filterUnstable(1000);

            assertEquals(0, f.isotropic().size());
            assertFalse(f.perspective().hasStableCells());
            assertTrue(f.perspective().zLimits().isEmpty());
            assertEquals(-1, f.perspective().facetLevel(0, 0));
            assertNull(f.perspective().facetColors()[0][1]);
        }

        @Test
        @DisplayName("Raising the threshold only removes cells")
        void monotone() {
            Variogram v = aggregate(settings, 1, 1);
            Set<String> previous = stableHeatCells(v.heat());
            for (int t = 1; t <= 15; t++) {
                Set<String> current = stableHeatCells(v.heat().filterUnstable(t));
                assertTrue(previous.containsAll(current), "threshold " + t);
                assertTrue(v.isotropic().filterUnstable(t).size() <= v.isotropic().filterUnstable(t - 1).size());
                previous = current;
            }
        }

        @Test
        @DisplayName("Default threshold comes from the settings")
        void defaultThreshold() {
            Variogram v = aggregate(settings.withMinPairs(13), 1, 1);
            Variogram f = v.filterUnstable();

            assertEquals(1, f.isotropic().size());
            assertTrue(Double.isNaN(f.heat().cells().get(1).z()));
            assertTrue(Double.isNaN(f.heat().cells().get(2).z()));
            assertEquals(2.0, f.heat().cells().get(0).z());
        }

        @Test
        @DisplayName("Negative threshold is rejected")
        void negativeThreshold() {
            Variogram v = aggregate(settings, 1, 1);
            assertThrows(IllegalArgumentException.class, () -> v.filterUnstable(-1));
        }
    }

    @Nested
    @DisplayName("View selection")
    class SelectionTests {

        @Test
        @DisplayName("Views are looked up by kind")
        void viewByKind() {
            Variogram v = aggregate(settings, 1, 1);

            for (VariogramKind kind : VariogramKind.values()) {
                assertEquals(kind, v.view(kind).kind());
            }
        }

        @Test
        @DisplayName("Each single plot includes exactly its own kind")
        void plotKinds() {
            assertTrue(Variogram.Plot.PERSPECTIVE.includes(VariogramKind.PERSPECTIVE));
            assertFalse(Variogram.Plot.PERSPECTIVE.includes(VariogramKind.HEAT));
            for (VariogramKind kind : VariogramKind.values()) {
                assertTrue(Variogram.Plot.ALL.includes(kind));
                assertFalse(Variogram.Plot.NONE.includes(kind));
                int including = 0;
                for (Variogram.Plot plot : Variogram.Plot.values()) {
                    if (plot != Variogram.Plot.ALL && plot.includes(kind)) including++;
                }
                assertEquals(1, including, kind + " has one dedicated plot");
            }
        }

        @Test
        @DisplayName("Views form a closed set, one per kind")
        void closedViewSet() {
            assertTrue(VariogramView.class.isSealed());
            assertEquals(VariogramKind.values().length, VariogramView.class.getPermittedSubclasses().length);
        }

        @Test
        @DisplayName("Plot selection picks the displayed views")
        void selected() {
            RawVariogram raw = RAW;
            VariogramAggregator aggregator = new VariogramAggregator(settings);

            assertEquals(4, aggregator.aggregate(raw, 1, 1, Variogram.Plot.ALL).selected().size());
            assertTrue(aggregator.aggregate(raw, 1, 1, Variogram.Plot.NONE).selected().isEmpty());
            List<VariogramView> heatOnly =
                    aggregator.aggregate(raw, 1, 1, Variogram.Plot.HEAT).selected();
            assertEquals(1, heatOnly.size());
            assertEquals(VariogramKind.HEAT, heatOnly.get(0).kind());
        }
    }

    @Test
    @DisplayName("An empty raw table yields empty representations")
    void emptyRaw() {
        Variogram v =
                new VariogramAggregator(settings)
                        .aggregate(new RawVariogram(List.of(), List.of()), 1, 1, Variogram.Plot.ALL);

        assertEquals(0, v.heat().size());
        assertEquals(0, v.perspective().rows());
        assertEquals(0, v.perspective().facetMeans().length);
        assertFalse(v.perspective().hasStableCells());
    }

    // Helper methods

    private static Variogram aggregate(VariogramSettings s, double dx, double dy) {
        return new VariogramAggregator(s).aggregate(RAW, dx, dy, Variogram.Plot.ALL);
    }

    private static void assertHeat(HeatVariogram.Cell c, int row, int col, double z, double pairs) {
        assertEquals(row, c.rowLag(), "row lag");
        assertEquals(col, c.colLag(), "col lag");
        assertEquals(z, c.z(), 1e-12, "value at (" + row + ", " + col + ")");
        assertEquals(pairs, c.pairs(), 1e-12, "pairs at (" + row + ", " + col + ")");
    }

    private static Set<String> stableHeatCells(HeatVariogram heat) {
        Set<String> out = new HashSet<>();
        for (HeatVariogram.Cell c : heat.cells()) {
            if (!Double.isNaN(c.z())) out.add(c.rowLag() + ":" + c.colLag());
        }
        return out;
    }
}
