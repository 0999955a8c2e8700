/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.interpolation;

import ai.evacortex.climagrid.core.CoordinateGrid;
import ai.evacortex.climagrid.core.Grid;

/**
 * Resamples a field onto another set of axes.
 *
 * <p>Implementations must satisfy the following contract:</p>
 * <ul>
 *     <li>Every time slice of the source is resampled independently; the time axis,
 *     name and unit are carried over unchanged.</li>
 *     <li>Target points outside the source axis range produce {@code NaN}. There is no
 *     extrapolation.</li>
 *     <li>Source axes may run ascending or descending.</li>
 *     <li>Longitude conventions are not reconciled. Source and target are compared as raw
 *     numbers, so callers convert with {@link Grid#toConvention} beforehand.</li>
 *     <li>The source grid is never modified.</li>
 * </ul>
 */
public interface GridInterpolator {

    /**
     * @param source field to resample
     * @param target axes of the result
     * @return a new grid on {@code target} with the same time axis as {@code source}
     * @throws NullPointerException if either argument is null
     */
    Grid interpolate(Grid source, CoordinateGrid target);
}
