/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core;

public record ExtremePoint(ExtremeType type,
                           double value,
                           double latitude,
                           double longitude,
                           int latIndex,
                           int lonIndex) {
}
