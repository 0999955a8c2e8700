/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.interpolation;

import ai.evacortex.climagrid.core.grid.NearestNeighborResolver;

import java.util.Arrays;

/**
 * Takes the value of the nearest source node. Points outside the source hull are
 * {@code NaN} rather than clamped.
 */
public final class NearestInterpolator extends AbstractGridInterpolator {

    @Override
    protected double[][] interpolateSlice(double[] lat, double[] lon, double[][] slice,
                                          double[] targetLat, double[] targetLon) {
        double[][] out = new double[targetLat.length][targetLon.length];
        for (int i = 0; i < targetLat.length; i++) {
            if (!inside(lat, targetLat[i])) {
                Arrays.fill(out[i], Double.NaN);
                continue;
            }
            int si = NearestNeighborResolver.resolveIndex(lat, targetLat[i]);
            for (int j = 0; j < targetLon.length; j++) {
                out[i][j] = inside(lon, targetLon[j])
                        ? slice[si][NearestNeighborResolver.resolveIndex(lon, targetLon[j])]
                        : Double.NaN;
            }
        }
        return out;
    }
}
