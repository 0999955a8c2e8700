/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.engine;

import ai.evacortex.climagrid.core.CoordinateGrid;
import ai.evacortex.climagrid.core.CorrelationMatrix;
import ai.evacortex.climagrid.core.CorrelationResult;
import ai.evacortex.climagrid.core.DiurnalPartition;
import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.PointSource;
import ai.evacortex.climagrid.core.ResolvedCell;
import ai.evacortex.climagrid.core.TimeSeries;
import ai.evacortex.climagrid.core.analysis.FieldOperations;
import ai.evacortex.climagrid.core.analysis.RadiativeForcingEstimate;
import ai.evacortex.climagrid.core.analysis.RadiativeForcingEstimator;
import ai.evacortex.climagrid.core.cache.RasterCache;
import ai.evacortex.climagrid.core.config.EngineConfig;
import ai.evacortex.climagrid.core.exceptions.InvalidArgumentException;
import ai.evacortex.climagrid.core.grid.CellAccumulator;
import ai.evacortex.climagrid.core.grid.NearestNeighborResolver;
import ai.evacortex.climagrid.core.grid.Rasterizer;
import ai.evacortex.climagrid.core.interpolation.InterpolationMethod;
import ai.evacortex.climagrid.core.series.TimeSeriesExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point that wires the components together with one {@link EngineConfig}.
 *
 * <p>The engine holds no data between calls: every grid and point set is passed in
 * explicitly, and results are new immutable values. A single instance may be shared
 * between threads.</p>
 */
public final class ClimaGridEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final EngineConfig config;
    private final SpatialStatistics statistics;
    private final NearestNeighborResolver resolver = new NearestNeighborResolver();
    private final Rasterizer rasterizer = new Rasterizer();
    private final TimeSeriesExtractor extractor = new TimeSeriesExtractor(resolver);
    private final RadiativeForcingEstimator forcingEstimator;

    public ClimaGridEngine() {
        this(EngineConfig.load());
    }

    public ClimaGridEngine(EngineConfig config) {
        this(config, new JavaSpatialStatistics());
    }

    public ClimaGridEngine(EngineConfig config, SpatialStatistics statistics) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.statistics = Objects.requireNonNull(statistics, "statistics must not be null");
        this.forcingEstimator = new RadiativeForcingEstimator(config.absorptionFraction(), config.co2ReferenceWm2());
    }

    /**
     * New cache sized by {@link EngineConfig#cacheMaxEntries()}. The engine never caches on
     * its own; callers that repeat rasterizations or interpolations keep one of these.
     */
    public RasterCache newRasterCache() {
        return new RasterCache(config);
    }

    public EngineConfig config() {
        return config;
    }

    public SpatialStatistics statistics() {
        return statistics;
    }

    public TimeSeriesExtractor timeSeries() {
        return extractor;
    }

    /** Nearest cell, after normalizing the query longitude into the grid's convention. */
    public ResolvedCell resolve(CoordinateGrid axes, double latitude, double longitude) {
        Objects.requireNonNull(axes, "axes must not be null");
        return resolver.resolve(axes, latitude, axes.convention().normalize(longitude));
    }

    public Grid rasterize(CoordinateGrid axes, Collection<PointSource> points) {
        return rasterizer.rasterize(axes, points);
    }

    public Grid rasterize(CoordinateGrid axes, Collection<PointSource> points, CellAccumulator accumulator) {
        return rasterizer.rasterize(axes, points, accumulator);
    }

    /** Power density on the global grid at the configured resolution and footprint. */
    public Grid rasterizePowerDensity(Collection<PointSource> transmitters) {
        return rasterizer.rasterizePowerDensity(config.resolutionDeg(), config.footprintAreaKm2(), transmitters);
    }

    public Grid interpolate(Grid source, CoordinateGrid target) {
        return interpolate(source, target, InterpolationMethod.BILINEAR);
    }

    public Grid interpolate(Grid source, CoordinateGrid target, InterpolationMethod method) {
        Objects.requireNonNull(method, "method must not be null");
        return method.interpolator().interpolate(source, target);
    }

    public RadiativeForcingEstimate estimateForcing(Grid powerDensity) {
        return forcingEstimator.estimate(powerDensity);
    }

    public TimeSeries extractPointSeries(Grid grid, double latitude, double longitude, double unitOffset) {
        return extractor.extractPointSeries(grid, latitude, longitude, unitOffset);
    }

    public DiurnalPartition partitionDayNight(TimeSeries series) {
        return extractor.partitionDayNight(series);
    }

    /**
     * Correlates a field with a reference field of different resolution. The source is
     * converted into the reference's longitude convention, resampled bilinearly onto the
     * reference axes, and both sides are reduced by temporal mean before cell-by-cell
     * correlation.
     *
     * @return empty when fewer than {@link SpatialStatistics#MIN_CORRELATION_SAMPLES} cells
     *         are valid on both sides
     */
    public Optional<CorrelationResult> correlateOnGrid(Grid source, Grid reference) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(reference, "reference must not be null");

        Grid aligned = source.toConvention(reference.axes().convention());
        Grid resampled = interpolate(aligned, reference.axes());
        double[] a = FieldOperations.temporalMean(resampled).values();
        double[] b = FieldOperations.temporalMean(reference).values();
        LOG.debug("Correlating '{}' against '{}' on {}", source.name(), reference.name(), reference.axes());
        return statistics.correlate(source.name(), a, reference.name(), b);
    }

    /**
     * Correlation matrix of the named grids in the order given. Each grid contributes its
     * full value array (every time step, every cell), so fields that only co-vary over time
     * still correlate. Grids of different shape leave their cells {@code NaN}.
     *
     * @throws InvalidArgumentException if a name is not in {@code grids}
     */
    public CorrelationMatrix correlationMatrix(Map<String, Grid> grids, List<String> names) {
        Objects.requireNonNull(grids, "grids must not be null");
        Objects.requireNonNull(names, "names must not be null");
        Map<String, double[]> fields = new LinkedHashMap<>();
        for (String name : names) {
            Grid grid = grids.get(name);
            if (grid == null) {
                throw new InvalidArgumentException("unknown field '" + name + "', available: " + grids.keySet());
            }
            fields.put(name, grid.values());
        }
        return statistics.correlationMatrix(fields);
    }
}
