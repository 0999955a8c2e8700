/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core;

/**
 * Outcome of a nearest-cell lookup. {@code snapDistance} is the Euclidean distance in
 * degrees between the requested and the resolved coordinate.
 */
public record ResolvedCell(int latIndex, int lonIndex, double latitude, double longitude, double snapDistance) {

    public static ResolvedCell of(int latIndex, int lonIndex, double resolvedLat, double resolvedLon,
                                  double requestedLat, double requestedLon) {
        double distance = Math.hypot(resolvedLat - requestedLat, resolvedLon - requestedLon);
        return new ResolvedCell(latIndex, lonIndex, resolvedLat, resolvedLon, distance);
    }
}
