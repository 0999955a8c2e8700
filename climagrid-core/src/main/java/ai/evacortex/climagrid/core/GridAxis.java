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
 * Spatial axes of a {@link Grid}. In a 2-D field, latitude is the row axis (0) and
 * longitude the column axis (1).
 */
public enum GridAxis {
    LATITUDE,
    LONGITUDE
}
