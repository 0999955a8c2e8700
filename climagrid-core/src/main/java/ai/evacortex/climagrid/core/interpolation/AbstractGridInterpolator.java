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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Objects;

/**
 * Slice-by-slice driver shared by the interpolators. Source axes are flipped to ascending
 * order before {@link #interpolateSlice} sees them.
 */
abstract class AbstractGridInterpolator implements GridInterpolator {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    @Override
    public final Grid interpolate(Grid source, CoordinateGrid target) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");

        CoordinateGrid axes = source.axes();
        if (axes.convention() != target.convention()) {
            LOG.warn("Interpolating '{}' from {} onto {} axes without conversion; longitudes are compared as-is",
                    source.name(), axes.convention(), target.convention());
        }

        boolean flipLat = !axes.latitudesAscending();
        boolean flipLon = !axes.longitudesAscending();
        double[] lat = flipLat ? reversed(axes.latitudes()) : axes.latitudes();
        double[] lon = flipLon ? reversed(axes.longitudes()) : axes.longitudes();
        double[] targetLat = target.latitudes();
        double[] targetLon = target.longitudes();

        int cells = targetLat.length * targetLon.length;
        double[] out = new double[source.timeCount() * cells];
        for (int t = 0; t < source.timeCount(); t++) {
            double[][] slice = oriented(source.slice(t), flipLat, flipLon);
            double[][] result = interpolateSlice(lat, lon, slice, targetLat, targetLon);
            for (int i = 0; i < targetLat.length; i++) {
                System.arraycopy(result[i], 0, out, t * cells + i * targetLon.length, targetLon.length);
            }
        }
        LOG.debug("Interpolated '{}' ({} slices) onto {}", source.name(), source.timeCount(), target);
        return new Grid(source.name(), source.unit(), target, source.times(), out);
    }

    /**
     * @param lat       ascending source latitudes
     * @param lon       ascending source longitudes
     * @param slice     source values as {@code [lat][lon]} in the same ascending order
     * @param targetLat target latitudes, any order
     * @param targetLon target longitudes, any order
     * @return values as {@code [targetLat][targetLon]}
     */
    protected abstract double[][] interpolateSlice(double[] lat, double[] lon, double[][] slice,
                                                   double[] targetLat, double[] targetLon);

    static boolean inside(double[] ascendingAxis, double value) {
        return value >= ascendingAxis[0] && value <= ascendingAxis[ascendingAxis.length - 1];
    }

    private static double[] reversed(double[] axis) {
        double[] out = new double[axis.length];
        for (int i = 0; i < axis.length; i++) {
            out[i] = axis[axis.length - 1 - i];
        }
        return out;
    }

    private static double[][] oriented(double[][] slice, boolean flipLat, boolean flipLon) {
        if (!flipLat && !flipLon) return slice;
        int rows = slice.length;
        int cols = slice[0].length;
        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            int si = flipLat ? rows - 1 - i : i;
            for (int j = 0; j < cols; j++) {
                out[i][j] = slice[si][flipLon ? cols - 1 - j : j];
            }
        }
        return out;
    }
}
