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
 * Pearson correlation of two paired samples after NaN-pair removal, together with the
 * least-squares fit of {@code b} on {@code a}.
 *
 * @param r         Pearson coefficient in [-1, 1]
 * @param slope     slope of {@code b = slope * a + intercept}
 * @param intercept intercept of the same fit
 * @param n         number of pairs that survived NaN removal
 */
public record CorrelationResult(String nameA,
                                String nameB,
                                double r,
                                double slope,
                                double intercept,
                                int n,
                                double meanA,
                                double stdA,
                                double meanB,
                                double stdB) {
}
