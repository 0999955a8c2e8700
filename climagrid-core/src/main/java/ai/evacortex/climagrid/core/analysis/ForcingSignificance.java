/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.analysis;

/**
 * Size of an estimated forcing relative to the CO₂ reference.
 * <ul>
 *     <li>{@code VERY_LOW}: ratio below 0.001</li>
 *     <li>{@code LOW}: ratio below 0.01</li>
 *     <li>{@code MODERATE}: anything larger</li>
 * </ul>
 */
public enum ForcingSignificance {
    VERY_LOW,
    LOW,
    MODERATE;

    public static ForcingSignificance fromRatio(double ratio) {
        if (ratio < 0.001) return VERY_LOW;
        if (ratio < 0.01) return LOW;
        return MODERATE;
    }
}
