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
 * Summary statistics over the valid (non-NaN) values of a field. {@code std} is the
 * population standard deviation; quartiles use linear interpolation.
 */
public record StatisticsRecord(String name,
                               double mean,
                               double std,
                               double min,
                               double max,
                               double median,
                               double q25,
                               double q75,
                               int count) {
}
