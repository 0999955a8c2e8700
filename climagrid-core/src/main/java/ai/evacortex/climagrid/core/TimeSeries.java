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

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Values of one grid cell over time, with the coordinate that was asked for and the cell
 * it resolved to.
 */
public record TimeSeries(String name,
                         String unit,
                         Instant[] times,
                         double[] values,
                         double requestedLatitude,
                         double requestedLongitude,
                         double resolvedLatitude,
                         double resolvedLongitude,
                         double snapDistance) {

    public TimeSeries {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(times, "times must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (times.length != values.length) {
            throw new InvalidArgumentException("series '" + name + "' has " + times.length
                    + " timestamps and " + values.length + " values");
        }
        times = times.clone();
        values = values.clone();
    }

    /** Series that is not tied to a single cell, e.g. a regional mean. */
    public static TimeSeries unlocated(String name, String unit, Instant[] times, double[] values) {
        return new TimeSeries(name, unit, times, values,
                Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }

    @Override
    public Instant[] times() {
        return times.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public Instant timeAt(int index) {
        return times[index];
    }

    public double valueAt(int index) {
        return values[index];
    }

    /** Sub-series of the samples whose timestamp matches, order preserved. */
    public TimeSeries select(Predicate<Instant> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        int[] keep = new int[values.length];
        int n = 0;
        for (int i = 0; i < values.length; i++) {
            if (predicate.test(times[i])) keep[n++] = i;
        }
        Instant[] t = new Instant[n];
        double[] v = new double[n];
        for (int k = 0; k < n; k++) {
            t[k] = times[keep[k]];
            v[k] = values[keep[k]];
        }
        return new TimeSeries(name, unit, t, v, requestedLatitude, requestedLongitude,
                resolvedLatitude, resolvedLongitude, snapDistance);
    }

    /** Same timestamps and location, different content. */
    public TimeSeries withValues(String newName, String newUnit, double[] newValues) {
        return new TimeSeries(newName, newUnit, times, newValues, requestedLatitude, requestedLongitude,
                resolvedLatitude, resolvedLongitude, snapDistance);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeries that)) return false;
        return name.equals(that.name) && unit.equals(that.unit)
                && Arrays.equals(times, that.times) && Arrays.equals(values, that.values)
                && Double.compare(requestedLatitude, that.requestedLatitude) == 0
                && Double.compare(requestedLongitude, that.requestedLongitude) == 0
                && Double.compare(resolvedLatitude, that.resolvedLatitude) == 0
                && Double.compare(resolvedLongitude, that.resolvedLongitude) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, unit, Arrays.hashCode(times), Arrays.hashCode(values),
                requestedLatitude, requestedLongitude, resolvedLatitude, resolvedLongitude);
    }

    @Override
    public String toString() {
        return "TimeSeries[" + name + " (" + unit + "), n=" + values.length
                + ", at (" + resolvedLatitude + ", " + resolvedLongitude + ")]";
    }
}
