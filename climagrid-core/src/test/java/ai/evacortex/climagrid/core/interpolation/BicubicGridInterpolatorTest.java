/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.interpolation;

import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.GridTestUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BicubicGridInterpolator")
class BicubicGridInterpolatorTest extends GridInterpolatorContractTest {

    @Override
    protected GridInterpolator interpolator() {
        return new BicubicGridInterpolator();
    }

    @Test
    void planeIsReproducedInsideInteriorCells() {
        Grid result = interpolator().interpolate(planeSource(),
                GridTestUtils.axes(new double[]{1.5, 2.25}, new double[]{11.5, 12.75}));
        assertEquals(PLANE.applyAsDouble(1.5, 11.5), result.value(0, 0), 1e-9);
        assertEquals(PLANE.applyAsDouble(2.25, 12.75), result.value(1, 1), 1e-9);
    }

    @Test
    void outermostSourceRing_isUndefined() {
        Grid result = interpolator().interpolate(planeSource(),
                GridTestUtils.axes(new double[]{0.5, 2}, new double[]{12, 13.5}));
        assertTrue(Double.isNaN(result.value(0, 0)), "latitude between the first two nodes");
        assertTrue(Double.isNaN(result.value(1, 1)), "longitude between the last two nodes");
        assertFalse(Double.isNaN(result.value(1, 0)));
    }

    @Test
    void methodEnumBuildsEachInterpolator() {
        assertInstanceOf(BilinearInterpolator.class, InterpolationMethod.BILINEAR.interpolator());
        assertInstanceOf(NearestInterpolator.class, InterpolationMethod.NEAREST.interpolator());
        assertInstanceOf(BicubicGridInterpolator.class, InterpolationMethod.BICUBIC.interpolator());
    }
}
