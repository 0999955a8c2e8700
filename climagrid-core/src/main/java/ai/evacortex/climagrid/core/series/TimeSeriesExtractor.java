/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.series;

import ai.evacortex.climagrid.core.DiurnalPartition;
import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.HourWindow;
import ai.evacortex.climagrid.core.ResolvedCell;
import ai.evacortex.climagrid.core.TimeSeries;
import ai.evacortex.climagrid.core.analysis.FieldOperations;
import ai.evacortex.climagrid.core.exceptions.InvalidArgumentException;
import ai.evacortex.climagrid.core.grid.NearestNeighborResolver;
import ai.evacortex.climagrid.core.math.NanStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Pulls single-location series out of time-varying grids and splits them by time of day.
 */
public final class TimeSeriesExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    /** Offset that turns Kelvin into degrees Celsius. */
    public static final double KELVIN_TO_CELSIUS = -273.15;

    private final NearestNeighborResolver resolver;

    public TimeSeriesExtractor() {
        this(new NearestNeighborResolver());
    }

    public TimeSeriesExtractor(NearestNeighborResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /**
     * Series at the cell nearest to {@code (latitude, longitude)}, shifted by {@code unitOffset}.
     * The query longitude may be in either convention; it is normalized into the grid's.
     *
     * @throws InvalidArgumentException if the grid has no time axis
     */
    public TimeSeries extractPointSeries(Grid grid, double latitude, double longitude, double unitOffset) {
        Objects.requireNonNull(grid, "grid must not be null");
        return extractPointSeries(grid, latitude, longitude, unitOffset, grid.unit());
    }

    public TimeSeries extractPointSeries(Grid grid, double latitude, double longitude,
                                         double unitOffset, String resultUnit) {
        Objects.requireNonNull(grid, "grid must not be null");
        Objects.requireNonNull(resultUnit, "resultUnit must not be null");
        if (!grid.hasTimeAxis()) {
            throw new InvalidArgumentException("'" + grid.name() + "' has no time axis to extract a series from");
        }
        double lon = grid.axes().convention().normalize(longitude);
        ResolvedCell cell = resolver.resolve(grid.axes(), latitude, lon);

        double[] values = grid.cellSeries(cell.latIndex(), cell.lonIndex());
        for (int t = 0; t < values.length; t++) {
            values[t] += unitOffset;
        }
        LOG.debug("Extracted '{}' at ({}, {}) -> cell ({}, {}), snap {}", grid.name(),
                latitude, longitude, cell.latitude(), cell.longitude(), cell.snapDistance());
        return new TimeSeries(grid.name(), resultUnit, grid.times(), values,
                latitude, longitude, cell.latitude(), cell.longitude(), cell.snapDistance());
    }

    /** Day [10, 18] and night [22, 6] in UTC. */
    public DiurnalPartition partitionDayNight(TimeSeries series) {
        return partitionDayNight(series, HourWindow.DEFAULT_DAY, HourWindow.DEFAULT_NIGHT, ZoneOffset.UTC);
    }

    /**
     * Splits a series by hour of day in {@code zone}. Hour windows are closed and may wrap
     * past midnight. An empty partition has a {@code NaN} mean.
     */
    public DiurnalPartition partitionDayNight(TimeSeries series, HourWindow day, HourWindow night, ZoneId zone) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(day, "day must not be null");
        Objects.requireNonNull(night, "night must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        TimeSeries daySeries = series.select(t -> day.contains(t.atZone(zone).getHour()));
        TimeSeries nightSeries = series.select(t -> night.contains(t.atZone(zone).getHour()));
        double dayMean = NanStatistics.mean(daySeries.values());
        double nightMean = NanStatistics.mean(nightSeries.values());
        if (daySeries.size() == 0 || nightSeries.size() == 0) {
            LOG.warn("Day/night split of '{}' left an empty partition (day={}, night={})",
                    series.name(), daySeries.size(), nightSeries.size());
        }
        return new DiurnalPartition(daySeries, nightSeries, dayMean, nightMean, dayMean - nightMean);
    }

    /**
     * Spatial mean of every time step.
     *
     * @throws InvalidArgumentException if the grid has no time axis
     */
    public TimeSeries regionalMeanSeries(Grid grid) {
        Objects.requireNonNull(grid, "grid must not be null");
        if (!grid.hasTimeAxis()) {
            throw new InvalidArgumentException("'" + grid.name() + "' has no time axis for a regional mean series");
        }
        return TimeSeries.unlocated(grid.name() + "_regional_mean", grid.unit(),
                grid.times(), FieldOperations.spatialMean(grid));
    }
}
