/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.engine;

import ai.evacortex.climagrid.core.CorrelationMatrix;
import ai.evacortex.climagrid.core.CorrelationResult;
import ai.evacortex.climagrid.core.ExtremePoint;
import ai.evacortex.climagrid.core.GeoBounds;
import ai.evacortex.climagrid.core.GradientField;
import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.GridAxis;
import ai.evacortex.climagrid.core.StatisticsRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code SpatialStatistics} defines the statistical toolkit applied to gridded fields and
 * to paired samples drawn from them.
 *
 * <p>Missing values are encoded as {@code NaN} throughout. Every operation removes them
 * before computing:</p>
 * <ul>
 *     <li>summaries drop individual NaN values</li>
 *     <li>correlations drop a pair when either side is NaN (NaN-pair removal)</li>
 *     <li>extremes ignore NaN cells</li>
 * </ul>
 *
 * <p>Conventions:</p>
 * <pre>
 *     std         = sqrt( Σ (x - mean)² / n )          population form
 *     percentile  = linear interpolation between order statistics
 *     gradient    = second-order central differences on the real (possibly non-uniform)
 *                   spacing, first-order one-sided at both boundaries
 * </pre>
 *
 * <p>Implementations must be deterministic and free of side effects. Inputs are never
 * modified.</p>
 *
 * @see JavaSpatialStatistics
 */
public interface SpatialStatistics {

    /**
     * Minimum number of valid pairs below which a correlation is not reported.
     */
    int MIN_CORRELATION_SAMPLES = 10;

    /**
     * Summary statistics of the non-NaN values.
     *
     * @param name   label carried into the record
     * @param values any number of values, NaN allowed
     * @return statistics over the valid values
     * @throws ai.evacortex.climagrid.core.exceptions.EmptyDataException if no valid value remains
     * @throws NullPointerException if {@code values} is {@code null}
     */
    StatisticsRecord summary(String name, double[] values);

    /**
     * Summary over every cell and time step of a grid.
     */
    StatisticsRecord summary(Grid grid);

    /**
     * Summary restricted to the cells inside {@code region}.
     *
     * @throws ai.evacortex.climagrid.core.exceptions.EmptyDataException if the region holds no valid value
     */
    StatisticsRecord summary(Grid grid, GeoBounds region);

    /**
     * First derivative of a 1-D profile against its coordinates.
     *
     * @throws ai.evacortex.climagrid.core.exceptions.InvalidArgumentException if lengths differ or fewer than 2 points
     */
    double[] gradient(double[] values, double[] coordinates);

    /**
     * First derivative of a {@code [lat][lon]} field along one axis.
     *
     * @param field      2-D field, latitude rows and longitude columns
     * @param axisValues coordinates of the axis being differentiated
     * @param axis       {@link GridAxis#LATITUDE} (rows) or {@link GridAxis#LONGITUDE} (columns)
     * @return derivative with the same shape as {@code field}
     */
    double[][] gradient(double[][] field, double[] axisValues, GridAxis axis);

    /**
     * Both axis derivatives of one time slice and their magnitude.
     */
    GradientField gradientField(Grid grid, int timeIndex);

    /**
     * The {@code n} largest cells (descending) followed by the {@code n} smallest (ascending).
     * Time-varying grids are reduced by temporal mean first. Ties keep row-major encounter order.
     *
     * @throws ai.evacortex.climagrid.core.exceptions.InvalidArgumentException unless {@code 1 <= n < valid cell count}
     */
    List<ExtremePoint> extremes(Grid grid, int n);

    /**
     * Pearson correlation and least-squares fit of {@code b} on {@code a}.
     *
     * @return empty when fewer than {@link #MIN_CORRELATION_SAMPLES} valid pairs remain
     *         or either side has zero variance
     * @throws ai.evacortex.climagrid.core.exceptions.InvalidArgumentException if lengths differ
     * @throws NullPointerException if either array is {@code null}
     */
    Optional<CorrelationResult> correlate(String nameA, double[] a, String nameB, double[] b);

    /**
     * Pairwise correlation of every field, in map iteration order. Cells whose pair cannot be
     * correlated hold {@code NaN}, including pairs of different length; the rest of the matrix
     * is still filled. The diagonal is 1.0 for a field with at least
     * {@link #MIN_CORRELATION_SAMPLES} valid values and non-zero variance, else {@code NaN}.
     *
     * @throws ai.evacortex.climagrid.core.exceptions.InvalidArgumentException if fewer than 2 fields are given
     */
    CorrelationMatrix correlationMatrix(Map<String, double[]> fields);
}
