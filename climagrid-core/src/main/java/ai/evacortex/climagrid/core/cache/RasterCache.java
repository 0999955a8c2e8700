/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.cache;

import ai.evacortex.climagrid.core.CoordinateGrid;
import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.PointSource;
import ai.evacortex.climagrid.core.config.EngineConfig;
import ai.evacortex.climagrid.core.exceptions.InvalidConfigException;
import ai.evacortex.climagrid.core.grid.CellAccumulator;
import ai.evacortex.climagrid.core.grid.Rasterizer;
import ai.evacortex.climagrid.core.interpolation.InterpolationMethod;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Collection;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Bounded memo of rasterizations and interpolations, keyed by content hash of the inputs.
 * Grids are immutable, so cached instances are handed out directly.
 */
public final class RasterCache {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Cache<String, Grid> cache;
    private final Rasterizer rasterizer;

    /** Capacity taken from {@link EngineConfig#cacheMaxEntries()}. */
    public RasterCache(EngineConfig config) {
        this(Objects.requireNonNull(config, "config must not be null").cacheMaxEntries());
    }

    public RasterCache(int maxEntries) {
        if (maxEntries < 1) {
            throw new InvalidConfigException("cache size must be >= 1, got " + maxEntries);
        }
        this.rasterizer = new Rasterizer();
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .build();
    }

    public Grid rasterize(CoordinateGrid axes, Collection<PointSource> points, CellAccumulator accumulator) {
        Objects.requireNonNull(axes, "axes must not be null");
        Objects.requireNonNull(points, "points must not be null");
        Objects.requireNonNull(accumulator, "accumulator must not be null");
        String key = "raster:" + accumulator + ':' + GridHashing.axesHash(axes) + ':' + GridHashing.pointsHash(points);
        return lookup(key, () -> rasterizer.rasterize(axes, points, accumulator));
    }

    public Grid rasterizePowerDensity(double resolutionDeg, double footprintAreaKm2, Collection<PointSource> points) {
        Objects.requireNonNull(points, "points must not be null");
        String key = "power:" + resolutionDeg + ':' + footprintAreaKm2 + ':' + GridHashing.pointsHash(points);
        return lookup(key, () -> rasterizer.rasterizePowerDensity(resolutionDeg, footprintAreaKm2, points));
    }

    public Grid interpolate(Grid source, CoordinateGrid target, InterpolationMethod method) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(method, "method must not be null");
        String key = "interp:" + method + ':' + GridHashing.gridHash(source) + ':' + GridHashing.axesHash(target);
        return lookup(key, () -> method.interpolator().interpolate(source, target));
    }

    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private Grid lookup(String key, Supplier<Grid> compute) {
        return cache.get(key, k -> {
            LOG.debug("Raster cache miss for {}", k);
            return compute.get();
        });
    }
}
