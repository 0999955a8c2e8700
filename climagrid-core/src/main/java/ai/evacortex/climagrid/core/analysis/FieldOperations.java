/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.analysis;

import ai.evacortex.climagrid.core.CoordinateGrid;
import ai.evacortex.climagrid.core.GeoBounds;
import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.GridAxis;
import ai.evacortex.climagrid.core.exceptions.EmptyDataException;
import ai.evacortex.climagrid.core.exceptions.InvalidArgumentException;
import ai.evacortex.climagrid.core.exceptions.InvalidGridException;
import ai.evacortex.climagrid.core.math.FiniteDifference;
import ai.evacortex.climagrid.core.math.NanStatistics;

import java.util.Arrays;
import java.util.Objects;

/**
 * Whole-field transforms: reductions over time or space, slicing, subsetting and
 * differencing. All reductions skip {@code NaN}; a reduction over only {@code NaN} yields
 * {@code NaN}.
 */
public final class FieldOperations {

    private FieldOperations() {
    }

    /** Mean over the time axis. A grid without a time axis is returned as-is. */
    public static Grid temporalMean(Grid grid) {
        Objects.requireNonNull(grid, "grid must not be null");
        if (!grid.hasTimeAxis()) return grid;

        int cells = grid.axes().cellCount();
        int nt = grid.timeCount();
        double[] values = grid.values();
        double[] mean = new double[cells];
        double[] column = new double[nt];
        for (int c = 0; c < cells; c++) {
            for (int t = 0; t < nt; t++) {
                column[t] = values[t * cells + c];
            }
            mean[c] = NanStatistics.mean(column);
        }
        return new Grid(grid.name(), grid.unit(), grid.axes(), null, mean);
    }

    public static Grid timeSlice(Grid grid, int timeIndex) {
        Objects.requireNonNull(grid, "grid must not be null");
        return Grid.of(grid.name(), grid.unit(), grid.axes(), grid.slice(timeIndex));
    }

    /**
     * Cell-wise {@code experiment - control}.
     *
     * @throws InvalidGridException if the grids do not share axes and time length
     */
    public static Grid difference(Grid experiment, Grid control) {
        Objects.requireNonNull(experiment, "experiment must not be null");
        Objects.requireNonNull(control, "control must not be null");
        if (!experiment.axes().sameAxes(control.axes())) {
            throw new InvalidGridException("cannot difference '" + experiment.name() + "' and '"
                    + control.name() + "': axes differ (" + experiment.axes() + " vs " + control.axes() + ")");
        }
        if (experiment.timeCount() != control.timeCount()) {
            throw new InvalidGridException("cannot difference '" + experiment.name() + "' and '"
                    + control.name() + "': " + experiment.timeCount() + " vs " + control.timeCount() + " time steps");
        }
        double[] a = experiment.values();
        double[] b = control.values();
        double[] out = new double[a.length];
        for (int k = 0; k < a.length; k++) {
            out[k] = a[k] - b[k];
        }
        return experiment.withValues(experiment.name() + "_minus_" + control.name(), experiment.unit(), out);
    }

    /** Mean over longitude and time for each latitude, in axis order. */
    public static double[] latitudinalProfile(Grid grid) {
        Objects.requireNonNull(grid, "grid must not be null");
        int nLat = grid.axes().latitudeCount();
        int nLon = grid.axes().longitudeCount();
        int nt = grid.timeCount();
        double[] values = grid.values();
        double[] profile = new double[nLat];
        double[] row = new double[nLon * nt];
        for (int i = 0; i < nLat; i++) {
            for (int t = 0; t < nt; t++) {
                System.arraycopy(values, (t * nLat + i) * nLon, row, t * nLon, nLon);
            }
            profile[i] = NanStatistics.mean(row);
        }
        return profile;
    }

    /** Mean over all cells for each time step. */
    public static double[] spatialMean(Grid grid) {
        Objects.requireNonNull(grid, "grid must not be null");
        int cells = grid.axes().cellCount();
        double[] values = grid.values();
        double[] out = new double[grid.timeCount()];
        for (int t = 0; t < out.length; t++) {
            out[t] = NanStatistics.mean(Arrays.copyOfRange(values, t * cells, (t + 1) * cells));
        }
        return out;
    }

    /** Every value, over all time steps, whose cell lies inside {@code region}. */
    public static double[] valuesWithin(Grid grid, GeoBounds region) {
        Objects.requireNonNull(grid, "grid must not be null");
        Objects.requireNonNull(region, "region must not be null");
        CoordinateGrid axes = grid.axes();
        int nLat = axes.latitudeCount();
        int nLon = axes.longitudeCount();
        double[] values = grid.values();
        double[] out = new double[values.length];
        int n = 0;
        for (int t = 0; t < grid.timeCount(); t++) {
            for (int i = 0; i < nLat; i++) {
                for (int j = 0; j < nLon; j++) {
                    if (region.contains(axes.latitudeAt(i), axes.longitudeAt(j))) {
                        out[n++] = values[(t * nLat + i) * nLon + j];
                    }
                }
            }
        }
        return Arrays.copyOf(out, n);
    }

    /**
     * Restricts a grid to the cells inside {@code region}, keeping axis order.
     *
     * @throws InvalidArgumentException if fewer than 2 latitudes or longitudes fall inside
     */
    public static Grid subset(Grid grid, GeoBounds region) {
        Objects.requireNonNull(grid, "grid must not be null");
        Objects.requireNonNull(region, "region must not be null");
        CoordinateGrid axes = grid.axes();
        int[] latIdx = indicesWithin(axes.latitudes(), region.minLatitude(), region.maxLatitude());
        int[] lonIdx = indicesWithin(axes.longitudes(), region.minLongitude(), region.maxLongitude());
        if (latIdx.length < 2 || lonIdx.length < 2) {
            throw new InvalidArgumentException("region " + region + " covers " + latIdx.length + "x"
                    + lonIdx.length + " cells of '" + grid.name() + "', need at least 2x2");
        }
        double[] lats = new double[latIdx.length];
        double[] lons = new double[lonIdx.length];
        for (int k = 0; k < latIdx.length; k++) lats[k] = axes.latitudeAt(latIdx[k]);
        for (int k = 0; k < lonIdx.length; k++) lons[k] = axes.longitudeAt(lonIdx[k]);

        double[] out = new double[grid.timeCount() * lats.length * lons.length];
        int n = 0;
        for (int t = 0; t < grid.timeCount(); t++) {
            for (int i : latIdx) {
                for (int j : lonIdx) {
                    out[n++] = grid.value(t, i, j);
                }
            }
        }
        return new Grid(grid.name(), grid.unit(),
                new CoordinateGrid(lats, lons, axes.convention()), grid.times(), out);
    }

    /**
     * Latitude at which the profile changes fastest, by absolute first derivative.
     *
     * @throws EmptyDataException if every derivative is NaN
     */
    public static double maxAbsGradient(double[] profile, double[] latitudes) {
        double[] gradient = FiniteDifference.derivative(profile, latitudes);
        int best = -1;
        for (int i = 0; i < gradient.length; i++) {
            if (Double.isNaN(gradient[i])) continue;
            if (best < 0 || Math.abs(gradient[i]) > Math.abs(gradient[best])) best = i;
        }
        if (best < 0) {
            throw new EmptyDataException("latitudinal gradient");
        }
        return latitudes[best];
    }

    /** Convenience for {@link #maxAbsGradient(double[], double[])} on a grid's own profile. */
    public static double latitudeOfSteepestChange(Grid grid) {
        return maxAbsGradient(latitudinalProfile(grid), grid.axes().axis(GridAxis.LATITUDE));
    }

    private static int[] indicesWithin(double[] axis, double min, double max) {
        int[] out = new int[axis.length];
        int n = 0;
        for (int k = 0; k < axis.length; k++) {
            if (axis[k] >= min && axis[k] <= max) out[n++] = k;
        }
        return Arrays.copyOf(out, n);
    }
}
