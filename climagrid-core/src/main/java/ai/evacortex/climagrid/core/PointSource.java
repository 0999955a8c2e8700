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

/**
 * A single measured point: an RF transmitter, a station reading, and so on.
 *
 * <p>The longitude may be in either convention. Duplicate coordinates and points outside
 * any particular grid are allowed. Optional attributes are {@code NaN} or {@code null}
 * when absent.</p>
 */
public record PointSource(double latitude, double longitude, double value,
                          double frequencyHz, double heightMeters, String category) {

    public PointSource {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new InvalidArgumentException("point coordinates must be finite, got ("
                    + latitude + ", " + longitude + ")");
        }
        if (!Double.isFinite(value)) {
            throw new InvalidArgumentException("point value must be finite, got " + value);
        }
    }

    public static PointSource of(double latitude, double longitude, double value) {
        return new PointSource(latitude, longitude, value, Double.NaN, Double.NaN, null);
    }

    public boolean hasFrequency() {
        return !Double.isNaN(frequencyHz);
    }

    public boolean hasHeight() {
        return !Double.isNaN(heightMeters);
    }
}
