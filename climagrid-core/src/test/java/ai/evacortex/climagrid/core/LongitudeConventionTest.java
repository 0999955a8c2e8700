/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core;

import ai.evacortex.climagrid.core.exceptions.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LongitudeConventionTest {

    @Test
    void signedToUnsignedAndBack_isLossless() {
        double unsigned = LongitudeConvention.UNSIGNED_360.normalize(-3.7);
        assertEquals(356.3, unsigned, 1e-9, "-3.7 must map to 356.3");

        double signed = LongitudeConvention.SIGNED_180.normalize(unsigned);
        assertEquals(-3.7, signed, 1e-9, "356.3 must map back to -3.7");
    }

    @Test
    void valuesInsideRange_areUnchanged() {
        assertEquals(180.0, LongitudeConvention.SIGNED_180.normalize(180.0));
        assertEquals(-180.0, LongitudeConvention.SIGNED_180.normalize(-180.0));
        assertEquals(0.0, LongitudeConvention.UNSIGNED_360.normalize(0.0));
        assertEquals(360.0, LongitudeConvention.UNSIGNED_360.normalize(360.0));
        assertEquals(42.5, LongitudeConvention.UNSIGNED_360.normalize(42.5));
    }

    @Test
    void wrapsValuesOutsideRange() {
        assertEquals(-170.0, LongitudeConvention.SIGNED_180.normalize(190.0), 1e-12);
        assertEquals(170.0, LongitudeConvention.UNSIGNED_360.normalize(-190.0), 1e-12);
        assertEquals(10.0, LongitudeConvention.UNSIGNED_360.normalize(730.0), 1e-12);
    }

    @Test
    void nonFiniteLongitude_isRejected() {
        assertThrows(InvalidArgumentException.class, () -> LongitudeConvention.SIGNED_180.normalize(Double.NaN));
        assertThrows(InvalidArgumentException.class,
                () -> LongitudeConvention.UNSIGNED_360.normalize(Double.POSITIVE_INFINITY));
    }

    @Test
    void infer_detectsUnsignedAxes() {
        assertEquals(LongitudeConvention.UNSIGNED_360, LongitudeConvention.infer(new double[]{350.0, 355.0, 359.75}));
        assertEquals(LongitudeConvention.SIGNED_180, LongitudeConvention.infer(new double[]{-10.0, 0.0, 10.0}));
        assertEquals(LongitudeConvention.SIGNED_180, LongitudeConvention.infer(new double[]{0.0, 90.0, 180.0}),
                "Ambiguous [0, 180] axes resolve to signed");
    }
}
