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
 * Day/night split of a series. Means are NaN-aware and {@code NaN} for an empty partition;
 * {@code asymmetry} is {@code dayMean - nightMean}.
 */
public record DiurnalPartition(TimeSeries day,
                               TimeSeries night,
                               double dayMean,
                               double nightMean,
                               double asymmetry) {
}
