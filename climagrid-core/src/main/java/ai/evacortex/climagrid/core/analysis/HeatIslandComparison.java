/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.analysis;

import ai.evacortex.climagrid.core.TimeSeries;
import ai.evacortex.climagrid.core.exceptions.EmptyDataException;
import ai.evacortex.climagrid.core.math.NanStatistics;

import java.util.Objects;

/**
 * Urban heat-island check between two point series, usually extracted from the same
 * temperature grid at a city and at a rural reference site.
 */
public final class HeatIslandComparison {

    private HeatIslandComparison() {
    }

    /**
     * @throws EmptyDataException if either series has no valid value
     */
    public static HeatIslandResult compare(TimeSeries urban, TimeSeries rural) {
        Objects.requireNonNull(urban, "urban must not be null");
        Objects.requireNonNull(rural, "rural must not be null");
        double urbanMean = NanStatistics.mean(urban.values());
        double ruralMean = NanStatistics.mean(rural.values());
        if (Double.isNaN(urbanMean)) throw new EmptyDataException(urban.name());
        if (Double.isNaN(ruralMean)) throw new EmptyDataException(rural.name());

        double difference = urbanMean - ruralMean;
        return new HeatIslandResult(urbanMean, ruralMean, difference, HeatIslandSignal.fromDifference(difference));
    }
}
