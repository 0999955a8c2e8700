/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.engine;

import ai.evacortex.climagrid.core.CoordinateGrid;
import ai.evacortex.climagrid.core.CorrelationMatrix;
import ai.evacortex.climagrid.core.CorrelationResult;
import ai.evacortex.climagrid.core.ExtremePoint;
import ai.evacortex.climagrid.core.ExtremeType;
import ai.evacortex.climagrid.core.GeoBounds;
import ai.evacortex.climagrid.core.GradientField;
import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.GridAxis;
import ai.evacortex.climagrid.core.GridTestUtils;
import ai.evacortex.climagrid.core.StatisticsRecord;
import ai.evacortex.climagrid.core.exceptions.EmptyDataException;
import ai.evacortex.climagrid.core.exceptions.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

abstract class SpatialStatisticsContractTest {

    protected abstract SpatialStatistics statistics();

    protected static double[] ramp(int n) {
        return GridTestUtils.range(1, 1, n);
    }

    @Test
    void summary_skipsNaN() {
        double[] values = {1, 2, 3, Double.NaN, 4, 5, 6, 7, 8};
        StatisticsRecord s = statistics().summary("ramp", values);

        assertEquals("ramp", s.name());
        assertEquals(8, s.count());
        assertEquals(4.5, s.mean(), 1e-12);
        assertEquals(Math.sqrt(5.25), s.std(), 1e-12, "population std of 1..8");
        assertEquals(1.0, s.min());
        assertEquals(8.0, s.max());
        assertEquals(4.5, s.median(), 1e-12);
        assertEquals(2.75, s.q25(), 1e-12, "linear-interpolation quartile");
        assertEquals(6.25, s.q75(), 1e-12);
    }

    @Test
    void summary_withoutValidValues_fails() {
        assertThrows(EmptyDataException.class,
                () -> statistics().summary("empty", new double[]{Double.NaN, Double.NaN}));
        assertThrows(EmptyDataException.class, () -> statistics().summary("none", new double[0]));
    }

    @Test
    void summary_restrictedToRegion() {
        CoordinateGrid axes = GridTestUtils.axes(new double[]{0, 1, 2}, new double[]{0, 1, 2});
        Grid grid = GridTestUtils.field("f", axes, (lat, lon) -> lat * 10 + lon);

        StatisticsRecord all = statistics().summary(grid);
        assertEquals(9, all.count());
        assertEquals(11.0, all.mean(), 1e-12);

        StatisticsRecord corner = statistics().summary(grid, new GeoBounds(1, 2, 1, 2));
        assertEquals(4, corner.count());
        assertEquals(16.5, corner.mean(), 1e-12);
        assertEquals(11.0, corner.min());
        assertEquals(22.0, corner.max());
    }

    @Test
    void gradient_usesNonUniformSpacing() {
        double[] g = statistics().gradient(new double[]{0, 1, 9}, new double[]{0, 1, 3});
        assertArrayEquals(new double[]{1, 2, 4}, g, 1e-12);
    }

    @Test
    void gradient_ofIncreasingField_isPositiveInside() {
        double[] lats = {0, 1, 2.5, 3, 5};
        double[][] field = new double[lats.length][3];
        for (int i = 0; i < lats.length; i++) {
            Arrays.fill(field[i], lats[i] * lats[i] + 1);
        }
        double[][] g = statistics().gradient(field, lats, GridAxis.LATITUDE);
        for (int i = 1; i < lats.length - 1; i++) {
            for (int j = 0; j < 3; j++) {
                assertTrue(g[i][j] > 0, "interior gradient must be positive at (" + i + ", " + j + ")");
                assertEquals(2 * lats[i], g[i][j], 1e-9, "second-order scheme is exact for a quadratic");
            }
        }
    }

    @Test
    void gradient_alongLongitude() {
        double[][] field = {{0, 2, 4}, {1, 1, 1}};
        double[][] g = statistics().gradient(field, new double[]{0, 1, 2}, GridAxis.LONGITUDE);
        assertArrayEquals(new double[]{2, 2, 2}, g[0], 1e-12);
        assertArrayEquals(new double[]{0, 0, 0}, g[1], 1e-12);
    }

    @Test
    void gradient_rejectsMismatchedCoordinates() {
        assertThrows(InvalidArgumentException.class,
                () -> statistics().gradient(new double[]{1, 2, 3}, new double[]{0, 1}));
        assertThrows(InvalidArgumentException.class,
                () -> statistics().gradient(new double[]{1}, new double[]{0}));
    }

    @Test
    void gradientField_combinesBothAxes() {
        CoordinateGrid axes = GridTestUtils.axes(new double[]{0, 1, 2}, new double[]{0, 2, 4, 6});
        Grid plane = GridTestUtils.field("plane", axes, (lat, lon) -> 2 * lat + 3 * lon);

        GradientField g = statistics().gradientField(plane, 0);
        assertEquals(2.0, g.latGradient()[1][2], 1e-12);
        assertEquals(3.0, g.lonGradient()[1][2], 1e-12);
        assertEquals(Math.sqrt(13), g.magnitudeAt(0, 0), 1e-12);
    }

    @Test
    void extremes_listsMaximaThenMinima() {
        CoordinateGrid axes = GridTestUtils.axes(new double[]{0, 1, 2}, new double[]{0, 1, 2});
        Grid grid = Grid.of("f", "1", axes, new double[][]{{5, 9, 1}, {Double.NaN, 8, 3}, {2, 7, 5}});

        List<ExtremePoint> points = statistics().extremes(grid, 2);
        assertEquals(4, points.size());
        assertEquals(new ExtremePoint(ExtremeType.MAX, 9, 0, 1, 0, 1), points.get(0));
        assertEquals(new ExtremePoint(ExtremeType.MAX, 8, 1, 1, 1, 1), points.get(1));
        assertEquals(new ExtremePoint(ExtremeType.MIN, 1, 0, 2, 0, 2), points.get(2));
        assertEquals(new ExtremePoint(ExtremeType.MIN, 2, 2, 0, 2, 0), points.get(3));
    }

    @Test
    void extremes_tiesKeepEncounterOrder() {
        CoordinateGrid axes = GridTestUtils.axes(new double[]{0, 1}, new double[]{0, 1, 2});
        Grid grid = Grid.of("f", "1", axes, new double[][]{{4, 1, 4}, {1, 0, 2}});

        List<ExtremePoint> points = statistics().extremes(grid, 1);
        assertEquals(0, points.get(0).lonIndex(), "first 4 in row-major order wins");
        assertEquals(0.0, points.get(1).value());

        List<ExtremePoint> three = statistics().extremes(grid, 3);
        assertEquals(0, three.get(4).latIndex(), "first 1 is at (0, 1)");
        assertEquals(1, three.get(4).lonIndex());
        assertEquals(1, three.get(5).latIndex(), "second 1 is at (1, 0)");
        assertEquals(0, three.get(5).lonIndex());
    }

    @Test
    void extremes_reducesTimeAxisFirst() {
        CoordinateGrid axes = GridTestUtils.axes(new double[]{0, 1}, new double[]{0, 1});
        Grid grid = GridTestUtils.hourlyField("t", axes, 3, 10.0, (lat, lon) -> lat + 2 * lon);

        List<ExtremePoint> points = statistics().extremes(grid, 1);
        assertEquals(13.0, points.get(0).value(), 1e-12, "max cell (1, 1): 3 plus mean offset 10");
        assertEquals(10.0, points.get(1).value(), 1e-12);
    }

    @Test
    void extremes_rejectsInvalidCount() {
        CoordinateGrid axes = GridTestUtils.axes(new double[]{0, 1}, new double[]{0, 1});
        Grid grid = Grid.of("f", "1", axes, new double[][]{{1, 2}, {3, Double.NaN}});
        assertThrows(InvalidArgumentException.class, () -> statistics().extremes(grid, 0));
        assertThrows(InvalidArgumentException.class, () -> statistics().extremes(grid, 3),
                "n must stay below the 3 valid cells");
        assertEquals(4, statistics().extremes(grid, 2).size());
    }

    @Test
    void correlate_requiresTenValidPairs() {
        double[] a9 = ramp(9);
        double[] b9 = Arrays.stream(a9).map(v -> v * v).toArray();
        assertTrue(statistics().correlate("a", a9, "b", b9).isEmpty(), "9 pairs are not enough");

        double[] a10 = ramp(10);
        double[] b10 = Arrays.stream(a10).map(v -> v * v).toArray();
        Optional<CorrelationResult> r = statistics().correlate("a", a10, "b", b10);
        assertTrue(r.isPresent(), "10 pairs are enough");
        assertEquals(10, r.get().n());
        assertTrue(r.get().r() >= -1.0 && r.get().r() <= 1.0);
    }

    @Test
    void correlate_dropsNaNPairs() {
        double[] a = ramp(12);
        double[] b = Arrays.stream(a).map(v -> 2 * v + 1).toArray();
        a[3] = Double.NaN;
        b[7] = Double.NaN;

        CorrelationResult r = statistics().correlate("a", a, "b", b).orElseThrow();
        assertEquals(10, r.n());
        assertEquals(1.0, r.r(), 1e-12);
        assertEquals(2.0, r.slope(), 1e-12);
        assertEquals(1.0, r.intercept(), 1e-9);
        assertEquals("a", r.nameA());
        assertEquals("b", r.nameB());

        a[0] = Double.NaN;
        assertTrue(statistics().correlate("a", a, "b", b).isEmpty(), "only 9 pairs remain");
    }

    @Test
    void correlate_inverseRelation() {
        double[] a = ramp(20);
        double[] b = Arrays.stream(a).map(v -> 100 - 3 * v).toArray();
        CorrelationResult r = statistics().correlate("a", a, "b", b).orElseThrow();
        assertEquals(-1.0, r.r(), 1e-12);
        assertEquals(-3.0, r.slope(), 1e-12);
    }

    @Test
    void correlate_rejectsLengthMismatch() {
        assertThrows(InvalidArgumentException.class,
                () -> statistics().correlate("a", ramp(10), "b", ramp(11)));
    }

    @Test
    void correlate_zeroVariance_isEmpty() {
        double[] flat = new double[12];
        Arrays.fill(flat, 3.0);
        assertTrue(statistics().correlate("a", ramp(12), "flat", flat).isEmpty());
    }

    @Test
    void correlationMatrix_isSymmetric() {
        double[] a = ramp(15);
        Map<String, double[]> fields = new LinkedHashMap<>();
        fields.put("a", a);
        fields.put("b", Arrays.stream(a).map(v -> 2 * v).toArray());
        fields.put("c", Arrays.stream(a).map(v -> -v).toArray());
        double[] gaps = new double[15];
        Arrays.fill(gaps, Double.NaN);
        fields.put("gaps", gaps);

        CorrelationMatrix m = statistics().correlationMatrix(fields);
        assertEquals(List.of("a", "b", "c", "gaps"), m.labels());
        assertEquals(1.0, m.get(0, 0));
        assertEquals(1.0, m.get("a", "b"), 1e-12);
        assertEquals(-1.0, m.get("a", "c"), 1e-12);
        assertEquals(m.get("b", "c"), m.get("c", "b"));
        assertTrue(Double.isNaN(m.get("a", "gaps")));
        assertTrue(Double.isNaN(m.get("gaps", "gaps")));
    }

    @Test
    void correlationMatrix_fieldOfOtherLength_leavesOnlyItsCellsNaN() {
        Map<String, double[]> fields = new LinkedHashMap<>();
        fields.put("a", ramp(12));
        fields.put("b", Arrays.stream(ramp(12)).map(v -> 3 * v + 1).toArray());
        fields.put("c", ramp(15));

        CorrelationMatrix m = statistics().correlationMatrix(fields);
        assertEquals(1.0, m.get("a", "b"), 1e-12);
        assertTrue(Double.isNaN(m.get("a", "c")));
        assertTrue(Double.isNaN(m.get("c", "b")));
        assertEquals(1.0, m.get("c", "c"));
    }

    @Test
    void correlationMatrix_diagonalNeedsSamplesAndVariance() {
        double[] constant = new double[20];
        Arrays.fill(constant, 4.0);
        double[] sparse = ramp(20);
        for (int i = 0; i < 11; i++) sparse[i] = Double.NaN;
        Map<String, double[]> fields = new LinkedHashMap<>();
        fields.put("ramp", ramp(20));
        fields.put("constant", constant);
        fields.put("sparse", sparse);

        CorrelationMatrix m = statistics().correlationMatrix(fields);
        assertEquals(1.0, m.get("ramp", "ramp"));
        assertTrue(Double.isNaN(m.get("constant", "constant")));
        assertTrue(Double.isNaN(m.get("sparse", "sparse")), "9 valid values are below the minimum");
        assertTrue(Double.isNaN(m.get("ramp", "sparse")));
    }

    @Test
    void correlationMatrix_needsTwoFields() {
        assertThrows(InvalidArgumentException.class,
                () -> statistics().correlationMatrix(Map.of("a", ramp(10))));
    }
}
