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

/**
 * The way a grid expresses longitude.
 * <ul>
 *     <li>{@code SIGNED_180}: degrees east in [-180, 180], the usual station/inventory convention</li>
 *     <li>{@code UNSIGNED_360}: degrees east in [0, 360], used by ERA5 and most reanalysis products</li>
 * </ul>
 *
 * <p>Conversion between the two is never implicit. Lookups compare raw numbers, so a
 * signed query against an unsigned axis silently lands on the wrong cell unless the
 * caller runs it through {@link #normalize(double)} first.</p>
 */
public enum LongitudeConvention {
    SIGNED_180(-180.0, 180.0),
    UNSIGNED_360(0.0, 360.0);

    private final double min;
    private final double max;

    LongitudeConvention(double min, double max) {
        this.min = min;
        this.max = max;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public boolean contains(double longitude) {
        return longitude >= min && longitude <= max;
    }

    /**
     * Re-expresses a longitude in this convention. Values already inside the range,
     * including both closed endpoints, are returned unchanged.
     *
     * @throws InvalidArgumentException if the longitude is not finite
     */
    public double normalize(double longitude) {
        if (!Double.isFinite(longitude)) {
            throw new InvalidArgumentException("longitude must be finite, got " + longitude);
        }
        if (contains(longitude)) return longitude;
        return switch (this) {
            case SIGNED_180 -> longitude - 360.0 * Math.floor((longitude + 180.0) / 360.0);
            case UNSIGNED_360 -> longitude - 360.0 * Math.floor(longitude / 360.0);
        };
    }

    /**
     * Guesses the convention of an axis: any value above 180 means unsigned, anything
     * else is treated as signed. Axes entirely inside [0, 180] are ambiguous and resolve
     * to {@code SIGNED_180}.
     */
    public static LongitudeConvention infer(double[] longitudes) {
        for (double lon : longitudes) {
            if (lon > 180.0) return UNSIGNED_360;
        }
        return SIGNED_180;
    }
}
