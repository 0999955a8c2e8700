/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.analysis;

public enum ImpactLevel {
    SIGNIFICANT,
    MODERATE,
    NEGLIGIBLE;

    /** Thresholds 0.1 and 0.01 on the mean difference. */
    public static ImpactLevel fromMeanDifference(double meanDifference) {
        if (meanDifference > 0.1) return SIGNIFICANT;
        if (meanDifference > 0.01) return MODERATE;
        return NEGLIGIBLE;
    }
}
