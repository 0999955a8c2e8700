/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.ingest;

import ai.evacortex.climagrid.core.exceptions.InvalidGridException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A dataset variable as it arrives from a reader: named dimensions in arbitrary order,
 * coordinate values per spatial dimension, timestamps for the time dimension (if any) and
 * values flattened row-major over {@link #dimensions()}.
 */
public record LabeledArray(String name,
                           String unit,
                           List<String> dimensions,
                           Map<String, double[]> coordinates,
                           Instant[] times,
                           double[] values) {

    public LabeledArray {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(dimensions, "dimensions must not be null");
        Objects.requireNonNull(coordinates, "coordinates must not be null");
        Objects.requireNonNull(values, "values must not be null");
        dimensions = List.copyOf(dimensions);
        coordinates = Map.copyOf(coordinates);
        times = times == null ? null : times.clone();
        values = values.clone();
    }

    /** Length of a dimension: the timestamp count for a time dimension, else its coordinate count. */
    public int sizeOf(String dimension, boolean isTime) {
        if (isTime) {
            if (times == null) {
                throw new InvalidGridException("'" + name + "' has time dimension '" + dimension + "' but no timestamps");
            }
            return times.length;
        }
        double[] coords = coordinates.get(dimension);
        if (coords == null) {
            throw new InvalidGridException("'" + name + "' has no coordinates for dimension '" + dimension + "'");
        }
        return coords.length;
    }

    @Override
    public Instant[] times() {
        return times == null ? null : times.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "LabeledArray[" + name + " (" + unit + "), dims=" + dimensions + ", n=" + values.length + "]";
    }
}
