/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.analysis;

import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.StatisticsRecord;

/**
 * Statistics of an experiment-minus-control field, with its 95th percentile and the
 * impact level implied by the mean.
 */
public record DifferenceSummary(Grid difference,
                                StatisticsRecord statistics,
                                double percentile95,
                                ImpactLevel impact) {
}
