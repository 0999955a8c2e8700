/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core;

/**
 * Per-cell gradients of a 2-D field along both axes, in value units per degree, and the
 * magnitude {@code sqrt(gLat^2 + gLon^2)}. All arrays are {@code [lat][lon]}.
 */
public record GradientField(double[][] latGradient, double[][] lonGradient, double[][] magnitude) {

    public double magnitudeAt(int latIndex, int lonIndex) {
        return magnitude[latIndex][lonIndex];
    }
}
