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
 * Classification of an urban-minus-rural mean difference, in the series' unit.
 */
public enum HeatIslandSignal {
    /** Above 0.5. */
    DETECTED,
    /** Above 0, up to 0.5. */
    MILD,
    /** Above -0.5, up to 0. */
    NONE,
    /** The rural site is warmer by 0.5 or more. */
    INVERTED;

    public static HeatIslandSignal fromDifference(double difference) {
        if (difference > 0.5) return DETECTED;
        if (difference > 0.0) return MILD;
        if (difference > -0.5) return NONE;
        return INVERTED;
    }
}
