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
 * Closed latitude/longitude box. Longitudes are in whatever convention the grid it is
 * applied to uses; boxes crossing the antimeridian are not supported.
 */
public record GeoBounds(double minLatitude, double maxLatitude, double minLongitude, double maxLongitude) {

    public GeoBounds {
        if (!(minLatitude <= maxLatitude) || !(minLongitude <= maxLongitude)) {
            throw new InvalidArgumentException("bounds must satisfy min <= max, got lat ["
                    + minLatitude + ", " + maxLatitude + "], lon [" + minLongitude + ", " + maxLongitude + "]");
        }
    }

    public boolean contains(double latitude, double longitude) {
        return latitude >= minLatitude && latitude <= maxLatitude
                && longitude >= minLongitude && longitude <= maxLongitude;
    }
}
