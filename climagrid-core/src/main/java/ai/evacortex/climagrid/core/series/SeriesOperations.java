/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.series;

import ai.evacortex.climagrid.core.TimeSeries;
import ai.evacortex.climagrid.core.exceptions.InvalidArgumentException;

import java.util.Objects;

/**
 * Smoothing and decomposition of series.
 *
 * <p>The rolling mean is centered: for window {@code w} the value at {@code i} averages
 * {@code [i - w/2, i + (w-1)/2]} (integer division), so even windows lean one sample to the
 * past. A window that runs off either end or holds a {@code NaN} produces {@code NaN}.</p>
 */
public final class SeriesOperations {

    private SeriesOperations() {
    }

    public static double[] rollingMean(double[] values, int window) {
        Objects.requireNonNull(values, "values must not be null");
        if (window < 1) {
            throw new InvalidArgumentException("rolling window must be >= 1, got " + window);
        }
        int ahead = (window - 1) / 2;
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int end = i + ahead;
            int start = end - window + 1;
            if (start < 0 || end >= values.length) {
                out[i] = Double.NaN;
                continue;
            }
            double sum = 0.0;
            for (int k = start; k <= end; k++) {
                sum += values[k];
            }
            out[i] = sum / window;
        }
        return out;
    }

    public static TimeSeries rollingMean(TimeSeries series, int window) {
        Objects.requireNonNull(series, "series must not be null");
        return series.withValues(series.name() + "_rolling_" + window, series.unit(),
                rollingMean(series.values(), window));
    }

    /** {@code series - rollingMean(series, window)}; NaN wherever the trend is undefined. */
    public static TimeSeries residual(TimeSeries series, int window) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = series.values();
        double[] trend = rollingMean(values, window);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] - trend[i];
        }
        return series.withValues(series.name() + "_residual_" + window, series.unit(), out);
    }
}
