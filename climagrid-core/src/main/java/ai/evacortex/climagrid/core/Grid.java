/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core;

import ai.evacortex.climagrid.core.exceptions.InvalidArgumentException;
import ai.evacortex.climagrid.core.exceptions.InvalidGridException;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Named, unit-tagged field over a {@link CoordinateGrid}, with an optional time axis.
 *
 * <p>Values are stored flat in {@code [time][lat][lon]} order. A static field has no time
 * axis ({@link #times()} returns {@code null}) and behaves as a single slice. {@code NaN}
 * marks a missing value. Instances are immutable; every transform returns a new grid.</p>
 */
public record Grid(String name, String unit, CoordinateGrid axes, Instant[] times, double[] values) {

    public Grid {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(axes, "axes must not be null");
        Objects.requireNonNull(values, "values must not be null");

        if (times != null) {
            times = times.clone();
            if (times.length == 0) {
                throw new InvalidGridException("time axis of '" + name + "' is empty");
            }
            for (int t = 0; t < times.length; t++) {
                if (times[t] == null) {
                    throw new InvalidGridException("time axis of '" + name + "' has a null entry at " + t);
                }
            }
        }
        int slices = times == null ? 1 : times.length;
        long expected = (long) slices * axes.cellCount();
        if (values.length != expected) {
            throw new InvalidGridException("'" + name + "' holds " + values.length
                    + " values, expected " + expected + " (" + slices + "x"
                    + axes.latitudeCount() + "x" + axes.longitudeCount() + ")");
        }
        values = values.clone();
    }

    /**
     * Static 2-D field. {@code field[i][j]} is the value at latitude index {@code i}
     * and longitude index {@code j}.
     */
    public static Grid of(String name, String unit, CoordinateGrid axes, double[][] field) {
        Objects.requireNonNull(axes, "axes must not be null");
        Objects.requireNonNull(field, "field must not be null");
        return new Grid(name, unit, axes, null, flatten(name, axes, new double[][][]{field}));
    }

    /**
     * Time-varying field. {@code data[t][i][j]} follows the order of {@code times}.
     */
    public static Grid withTime(String name, String unit, CoordinateGrid axes,
                                Instant[] times, double[][][] data) {
        Objects.requireNonNull(axes, "axes must not be null");
        Objects.requireNonNull(times, "times must not be null");
        Objects.requireNonNull(data, "data must not be null");
        if (data.length != times.length) {
            throw new InvalidGridException("'" + name + "' has " + data.length
                    + " slices for " + times.length + " timestamps");
        }
        return new Grid(name, unit, axes, times, flatten(name, axes, data));
    }

    private static double[] flatten(String name, CoordinateGrid axes, double[][][] data) {
        int nLat = axes.latitudeCount();
        int nLon = axes.longitudeCount();
        double[] flat = new double[data.length * nLat * nLon];
        int k = 0;
        for (double[][] slice : data) {
            if (slice.length != nLat) {
                throw new InvalidGridException("'" + name + "' has " + slice.length + " rows, expected " + nLat);
            }
            for (double[] row : slice) {
                if (row.length != nLon) {
                    throw new InvalidGridException("'" + name + "' has a row of " + row.length
                            + " values, expected " + nLon);
                }
                System.arraycopy(row, 0, flat, k, nLon);
                k += nLon;
            }
        }
        return flat;
    }

    @Override
    public Instant[] times() {
        return times == null ? null : times.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public boolean hasTimeAxis() {
        return times != null;
    }

    public int timeCount() {
        return times == null ? 1 : times.length;
    }

    public Instant timeAt(int t) {
        if (times == null) {
            throw new InvalidArgumentException("'" + name + "' has no time axis");
        }
        return times[t];
    }

    public double value(int t, int latIndex, int lonIndex) {
        checkIndex(t, latIndex, lonIndex);
        return values[offset(t, latIndex, lonIndex)];
    }

    /** Value of the first (or only) time slice. */
    public double value(int latIndex, int lonIndex) {
        return value(0, latIndex, lonIndex);
    }

    /** Copy of one time slice as {@code [lat][lon]}. */
    public double[][] slice(int t) {
        if (t < 0 || t >= timeCount()) {
            throw new InvalidArgumentException("time index " + t + " out of range [0, " + timeCount() + ")");
        }
        int nLat = axes.latitudeCount();
        int nLon = axes.longitudeCount();
        double[][] out = new double[nLat][nLon];
        int base = t * nLat * nLon;
        for (int i = 0; i < nLat; i++) {
            System.arraycopy(values, base + i * nLon, out[i], 0, nLon);
        }
        return out;
    }

    /** Values at a single cell across the whole time axis. */
    public double[] cellSeries(int latIndex, int lonIndex) {
        checkIndex(0, latIndex, lonIndex);
        double[] out = new double[timeCount()];
        for (int t = 0; t < out.length; t++) {
            out[t] = values[offset(t, latIndex, lonIndex)];
        }
        return out;
    }

    /** Same axes and time axis, different content. */
    public Grid withValues(String newName, String newUnit, double[] newValues) {
        return new Grid(newName, newUnit, axes, times, newValues);
    }

    public Grid renamed(String newName, String newUnit) {
        return new Grid(newName, newUnit, axes, times, values);
    }

    /**
     * Re-expresses the longitude axis in {@code target}, reordering every slice so the
     * new axis is ascending. Values are carried along unchanged.
     */
    public Grid toConvention(LongitudeConvention target) {
        Objects.requireNonNull(target, "target must not be null");
        if (target == axes.convention()) return this;

        int[] order = axes.longitudeOrderIn(target);
        CoordinateGrid converted = axes.toConvention(target);
        int nLat = axes.latitudeCount();
        int nLon = axes.longitudeCount();
        int outLon = order.length;
        double[] out = new double[timeCount() * nLat * outLon];
        for (int t = 0; t < timeCount(); t++) {
            for (int i = 0; i < nLat; i++) {
                int src = (t * nLat + i) * nLon;
                int dst = (t * nLat + i) * outLon;
                for (int k = 0; k < outLon; k++) {
                    out[dst + k] = values[src + order[k]];
                }
            }
        }
        return new Grid(name, unit, converted, times, out);
    }

    private int offset(int t, int latIndex, int lonIndex) {
        return (t * axes.latitudeCount() + latIndex) * axes.longitudeCount() + lonIndex;
    }

    private void checkIndex(int t, int latIndex, int lonIndex) {
        if (t < 0 || t >= timeCount()
                || latIndex < 0 || latIndex >= axes.latitudeCount()
                || lonIndex < 0 || lonIndex >= axes.longitudeCount()) {
            throw new InvalidArgumentException("index (" + t + ", " + latIndex + ", " + lonIndex
                    + ") out of range for '" + name + "'");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid that)) return false;
        return name.equals(that.name)
                && unit.equals(that.unit)
                && axes.equals(that.axes)
                && Arrays.equals(times, that.times)
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, unit, axes, Arrays.hashCode(times), Arrays.hashCode(values));
    }

    @Override
    public String toString() {
        return "Grid[" + name + " (" + unit + "), " + timeCount() + " x " + axes + "]";
    }
}
