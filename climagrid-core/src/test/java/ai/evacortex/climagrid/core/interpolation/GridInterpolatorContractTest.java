/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.interpolation;

import ai.evacortex.climagrid.core.CoordinateGrid;
import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.GridTestUtils;
import org.junit.jupiter.api.Test;

import java.util.function.DoubleBinaryOperator;

import static org.junit.jupiter.api.Assertions.*;

abstract class GridInterpolatorContractTest {

    protected static final double[] LATS = {0, 1, 2, 3, 4};
    protected static final double[] LONS = {10, 11, 12, 13, 14};
    protected static final DoubleBinaryOperator PLANE = (lat, lon) -> 2 * lat + 3 * lon;

    protected abstract GridInterpolator interpolator();

    protected static Grid planeSource() {
        return GridTestUtils.field("plane", GridTestUtils.axes(LATS, LONS), PLANE);
    }

    @Test
    void interiorNodes_areReproduced() {
        CoordinateGrid target = GridTestUtils.axes(new double[]{1, 2, 3}, new double[]{11, 12, 13});
        Grid result = interpolator().interpolate(planeSource(), target);

        assertSame(target, result.axes());
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                double expected = PLANE.applyAsDouble(target.latitudeAt(i), target.longitudeAt(j));
                assertEquals(expected, result.value(i, j), 1e-9, "node (" + i + ", " + j + ")");
            }
        }
    }

    @Test
    void pointsOutsideSourceHull_areNaN() {
        CoordinateGrid target = GridTestUtils.axes(new double[]{-1, 2}, new double[]{12, 20});
        Grid result = interpolator().interpolate(planeSource(), target);

        assertTrue(Double.isNaN(result.value(0, 0)), "latitude below the source range");
        assertTrue(Double.isNaN(result.value(0, 1)), "both coordinates outside");
        assertTrue(Double.isNaN(result.value(1, 1)), "longitude beyond the source range");
        assertEquals(PLANE.applyAsDouble(2, 12), result.value(1, 0), 1e-9);
    }

    @Test
    void descendingSourceAxes_areSupported() {
        double[] lats = {4, 3, 2, 1, 0};
        double[] lons = {14, 13, 12, 11, 10};
        Grid source = GridTestUtils.field("flipped", GridTestUtils.axes(lats, lons), PLANE);
        CoordinateGrid target = GridTestUtils.axes(new double[]{1, 3}, new double[]{11, 13});

        Grid result = interpolator().interpolate(source, target);
        assertEquals(PLANE.applyAsDouble(1, 11), result.value(0, 0), 1e-9);
        assertEquals(PLANE.applyAsDouble(3, 13), result.value(1, 1), 1e-9);
        assertEquals(PLANE.applyAsDouble(1, 13), result.value(0, 1), 1e-9);
    }

    @Test
    void everyTimeSliceIsResampled() {
        Grid source = GridTestUtils.hourlyField("t2m", GridTestUtils.axes(LATS, LONS), 3, 1.0, PLANE);
        CoordinateGrid target = GridTestUtils.axes(new double[]{2, 3}, new double[]{12, 13});

        Grid result = interpolator().interpolate(source, target);
        assertEquals(3, result.timeCount());
        assertArrayEquals(source.times(), result.times());
        assertEquals("t2m", result.name());
        assertEquals("K", result.unit());
        for (int t = 0; t < 3; t++) {
            assertEquals(PLANE.applyAsDouble(2, 12) + t, result.value(t, 0, 0), 1e-9, "slice " + t);
        }
    }

    @Test
    void sourceIsNotModified() {
        Grid source = planeSource();
        double[] before = source.values();
        interpolator().interpolate(source, GridTestUtils.axes(new double[]{1.5, 2.5}, new double[]{11.5, 12.5}));
        assertArrayEquals(before, source.values());
    }
}
