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
import ai.evacortex.climagrid.core.LongitudeConvention;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BilinearInterpolator")
class BilinearInterpolatorTest extends GridInterpolatorContractTest {

    @Override
    protected GridInterpolator interpolator() {
        return new BilinearInterpolator();
    }

    @Test
    void planeIsExactBetweenNodes() {
        CoordinateGrid target = GridTestUtils.axes(new double[]{1.5, 3.25}, new double[]{11.5, 13.9});
        Grid result = interpolator().interpolate(planeSource(), target);
        assertEquals(PLANE.applyAsDouble(1.5, 11.5), result.value(0, 0), 1e-9);
        assertEquals(PLANE.applyAsDouble(3.25, 13.9), result.value(1, 1), 1e-9);
    }

    @Test
    void bilinearWeightsOnUnitCell() {
        Grid source = Grid.of("cell", "1", GridTestUtils.axes(new double[]{0, 1}, new double[]{0, 1}),
                new double[][]{{0, 1}, {2, 4}});
        Grid result = interpolator().interpolate(source,
                GridTestUtils.axes(new double[]{0.5, 1.0}, new double[]{0.5, 1.0}));
        assertEquals(1.75, result.value(0, 0), 1e-12);
        assertEquals(4.0, result.value(1, 1), 1e-12, "upper edge of the source is inside the hull");
    }

    @Test
    void nanCorner_propagates() {
        double[][] values = planeSource().slice(0);
        values[1][1] = Double.NaN;
        Grid source = Grid.of("holey", "1", GridTestUtils.axes(LATS, LONS), values);

        Grid result = interpolator().interpolate(source,
                GridTestUtils.axes(new double[]{1.5, 3.5}, new double[]{11.5, 13.5}));
        assertTrue(Double.isNaN(result.value(0, 0)));
        assertEquals(PLANE.applyAsDouble(3.5, 13.5), result.value(1, 1), 1e-9);
    }

    @Test
    void conventionMismatch_isComputedAsIs() {
        Grid source = new Grid("plane", "1",
                new CoordinateGrid(LATS, LONS, LongitudeConvention.UNSIGNED_360), null, planeSource().values());
        Grid result = interpolator().interpolate(source, GridTestUtils.axes(new double[]{2, 3}, new double[]{12, 13}));
        assertEquals(LongitudeConvention.SIGNED_180, result.axes().convention());
        assertEquals(PLANE.applyAsDouble(2, 12), result.value(0, 0), 1e-9);
    }
}
