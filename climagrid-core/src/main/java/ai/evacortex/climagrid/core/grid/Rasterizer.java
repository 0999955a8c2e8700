/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.grid;

import ai.evacortex.climagrid.core.CoordinateGrid;
import ai.evacortex.climagrid.core.GeoBounds;
import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.LongitudeConvention;
import ai.evacortex.climagrid.core.PointSource;
import ai.evacortex.climagrid.core.exceptions.InvalidConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Collection;
import java.util.Objects;

/**
 * Bins irregular point sources onto a regular grid.
 *
 * <p>Each point's longitude is first normalized into the grid's convention, then the
 * point snaps to its nearest cell (see {@link NearestNeighborResolver}); points outside
 * the grid land on the edge cells. Cells that receive no point stay at exactly 0.</p>
 */
public final class Rasterizer {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String POWER_DENSITY_NAME = "rf_power_density";
    public static final String POWER_DENSITY_UNIT = "W/m²";

    private static final double M2_PER_KM2 = 1e6;

    public Grid rasterize(CoordinateGrid axes, Collection<PointSource> points) {
        return rasterize("rasterized", "", axes, points, CellAccumulator.SUM);
    }

    public Grid rasterize(CoordinateGrid axes, Collection<PointSource> points, CellAccumulator accumulator) {
        return rasterize("rasterized", "", axes, points, accumulator);
    }

    public Grid rasterize(String name, String unit, CoordinateGrid axes,
                          Collection<PointSource> points, CellAccumulator accumulator) {
        return bin(name, unit, axes, points, accumulator, 1.0);
    }

    /**
     * RF power density on the global grid at {@code resolutionDeg}: every transmitter's
     * power spread over a nominal footprint of {@code footprintAreaKm2}, summed per cell.
     *
     * @throws InvalidConfigException if the resolution or footprint is not positive
     */
    public Grid rasterizePowerDensity(double resolutionDeg, double footprintAreaKm2,
                                      Collection<PointSource> transmitters) {
        if (!Double.isFinite(footprintAreaKm2) || footprintAreaKm2 <= 0.0) {
            throw new InvalidConfigException("footprint area must be > 0 km², got " + footprintAreaKm2);
        }
        CoordinateGrid axes = CoordinateGrid.global(resolutionDeg, LongitudeConvention.SIGNED_180);
        double scale = 1.0 / (footprintAreaKm2 * M2_PER_KM2);
        return bin(POWER_DENSITY_NAME, POWER_DENSITY_UNIT, axes, transmitters, CellAccumulator.SUM, scale);
    }

    private Grid bin(String name, String unit, CoordinateGrid axes, Collection<PointSource> points,
                     CellAccumulator accumulator, double scale) {
        Objects.requireNonNull(axes, "axes must not be null");
        Objects.requireNonNull(points, "points must not be null");
        Objects.requireNonNull(accumulator, "accumulator must not be null");

        double[] lats = axes.latitudes();
        double[] lons = axes.longitudes();
        LongitudeConvention convention = axes.convention();
        int nLon = lons.length;
        double[] values = new double[lats.length * nLon];
        boolean[] touched = new boolean[values.length];

        GeoBounds bounds = axes.bounds();
        int clamped = 0;
        for (PointSource p : points) {
            Objects.requireNonNull(p, "point must not be null");
            double lon = convention.normalize(p.longitude());
            int i = NearestNeighborResolver.resolveIndex(lats, p.latitude());
            int j = NearestNeighborResolver.resolveIndex(lons, lon);
            int cell = i * nLon + j;
            values[cell] = accumulator.accumulate(values[cell], p.value() * scale, touched[cell]);
            touched[cell] = true;
            if (!bounds.contains(p.latitude(), lon)) clamped++;
        }

        LOG.info("Rasterized {} points onto {}x{} grid '{}' with {}", points.size(), lats.length, nLon, name, accumulator);
        if (clamped > 0) {
            LOG.debug("{} points of '{}' fell outside the grid and were clamped to edge cells", clamped, name);
        }
        return new Grid(name, unit, axes, null, values);
    }
}
