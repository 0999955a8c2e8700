/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core;

import ai.evacortex.climagrid.core.exceptions.InvalidConfigException;
import ai.evacortex.climagrid.core.exceptions.InvalidGridException;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Immutable pair of strictly monotonic latitude and longitude axes plus the longitude
 * convention they are expressed in.
 *
 * <p>Either axis may run ascending or descending (ERA5 latitudes run north to south).
 * Arrays are copied on the way in and on the way out; hot loops should read single
 * values through {@link #latitudeAt(int)} and {@link #longitudeAt(int)}.</p>
 */
public record CoordinateGrid(double[] latitudes, double[] longitudes, LongitudeConvention convention) {

    public CoordinateGrid {
        Objects.requireNonNull(latitudes, "latitudes must not be null");
        Objects.requireNonNull(longitudes, "longitudes must not be null");
        Objects.requireNonNull(convention, "convention must not be null");

        latitudes = latitudes.clone();
        longitudes = longitudes.clone();
        validateAxis("latitude", latitudes);
        validateAxis("longitude", longitudes);

        for (double lat : latitudes) {
            if (lat < -90.0 || lat > 90.0) {
                throw new InvalidGridException("latitude " + lat + " is outside [-90, 90]");
            }
        }
        for (double lon : longitudes) {
            if (!convention.contains(lon)) {
                throw new InvalidGridException("longitude " + lon + " is outside the " + convention
                        + " range [" + convention.min() + ", " + convention.max() + "]");
            }
        }
    }

    /**
     * Builds a regular grid with {@code arange(start, stop + step, step)} semantics: both
     * ends are included when the span is a multiple of the resolution.
     *
     * @throws InvalidConfigException if the resolution is not a positive finite number or a range is empty
     */
    public static CoordinateGrid regular(double minLatitude, double maxLatitude,
                                         double minLongitude, double maxLongitude,
                                         double resolution, LongitudeConvention convention) {
        if (!Double.isFinite(resolution) || resolution <= 0.0) {
            throw new InvalidConfigException("grid resolution must be > 0, got " + resolution);
        }
        if (!(minLatitude < maxLatitude) || !(minLongitude < maxLongitude)) {
            throw new InvalidConfigException("grid ranges must be non-empty, got lat ["
                    + minLatitude + ", " + maxLatitude + "], lon [" + minLongitude + ", " + maxLongitude + "]");
        }
        return new CoordinateGrid(
                arange(minLatitude, maxLatitude, resolution),
                arange(minLongitude, maxLongitude, resolution),
                convention);
    }

    /**
     * Whole-globe grid: latitudes -90..90 and longitudes spanning the full convention range.
     */
    public static CoordinateGrid global(double resolution, LongitudeConvention convention) {
        return regular(-90.0, 90.0, convention.min(), convention.max(), resolution, convention);
    }

    private static double[] arange(double start, double stop, double step) {
        int n = (int) Math.floor((stop - start) / step + 1e-9) + 1;
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = Math.min(start + i * step, stop);
        }
        return values;
    }

    private static void validateAxis(String name, double[] axis) {
        if (axis.length < 2) {
            throw new InvalidGridException(name + " axis needs at least 2 points, got " + axis.length);
        }
        for (int i = 0; i < axis.length; i++) {
            if (!Double.isFinite(axis[i])) {
                throw new InvalidGridException(name + " axis has non-finite value " + axis[i] + " at index " + i);
            }
        }
        boolean ascending = axis[1] > axis[0];
        for (int i = 1; i < axis.length; i++) {
            boolean step = ascending ? axis[i] > axis[i - 1] : axis[i] < axis[i - 1];
            if (!step) {
                throw new InvalidGridException(name + " axis is not strictly monotonic at index " + i);
            }
        }
    }

    @Override
    public double[] latitudes() {
        return latitudes.clone();
    }

    @Override
    public double[] longitudes() {
        return longitudes.clone();
    }

    public int latitudeCount() {
        return latitudes.length;
    }

    public int longitudeCount() {
        return longitudes.length;
    }

    public int cellCount() {
        return latitudes.length * longitudes.length;
    }

    public double latitudeAt(int index) {
        return latitudes[index];
    }

    public double longitudeAt(int index) {
        return longitudes[index];
    }

    public double[] axis(GridAxis axis) {
        return axis == GridAxis.LATITUDE ? latitudes() : longitudes();
    }

    public boolean latitudesAscending() {
        return latitudes[1] > latitudes[0];
    }

    public boolean longitudesAscending() {
        return longitudes[1] > longitudes[0];
    }

    public GeoBounds bounds() {
        int lastLat = latitudes.length - 1;
        int lastLon = longitudes.length - 1;
        return new GeoBounds(
                Math.min(latitudes[0], latitudes[lastLat]),
                Math.max(latitudes[0], latitudes[lastLat]),
                Math.min(longitudes[0], longitudes[lastLon]),
                Math.max(longitudes[0], longitudes[lastLon]));
    }

    /**
     * Returns, for the axis re-expressed in {@code target}, the source index of each
     * longitude in ascending order. Longitudes that collapse onto the same value (0 and 360,
     * or -180 and 180) keep only the first occurrence.
     */
    public int[] longitudeOrderIn(LongitudeConvention target) {
        Objects.requireNonNull(target, "target must not be null");
        double[] converted = new double[longitudes.length];
        for (int j = 0; j < longitudes.length; j++) {
            converted[j] = target.normalize(longitudes[j]);
        }
        int[] sorted = IntStream.range(0, converted.length)
                .boxed()
                .sorted(Comparator.comparingDouble(j -> converted[j]))
                .mapToInt(Integer::intValue)
                .toArray();

        int[] order = new int[sorted.length];
        int kept = 0;
        for (int idx : sorted) {
            if (kept > 0 && converted[order[kept - 1]] == converted[idx]) continue;
            order[kept++] = idx;
        }
        return Arrays.copyOf(order, kept);
    }

    /**
     * Re-expresses the longitude axis in another convention. The result is always
     * ascending in longitude. Returns {@code this} when the convention already matches.
     */
    public CoordinateGrid toConvention(LongitudeConvention target) {
        if (target == convention) return this;
        int[] order = longitudeOrderIn(target);
        double[] converted = new double[order.length];
        for (int k = 0; k < order.length; k++) {
            converted[k] = target.normalize(longitudes[order[k]]);
        }
        return new CoordinateGrid(latitudes, converted, target);
    }

    public boolean sameAxes(CoordinateGrid other) {
        return other != null
                && convention == other.convention
                && Arrays.equals(latitudes, other.latitudes)
                && Arrays.equals(longitudes, other.longitudes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoordinateGrid that)) return false;
        return sameAxes(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(latitudes), Arrays.hashCode(longitudes), convention);
    }

    @Override
    public String toString() {
        GeoBounds b = bounds();
        return String.format(Locale.ROOT, "CoordinateGrid[%dx%d, lat %.4f..%.4f, lon %.4f..%.4f, %s]",
                latitudes.length, longitudes.length,
                b.minLatitude(), b.maxLatitude(), b.minLongitude(), b.maxLongitude(), convention);
    }
}
