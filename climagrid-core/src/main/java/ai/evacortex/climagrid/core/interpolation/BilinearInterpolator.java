/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.interpolation;

import java.util.Arrays;

/**
 * Bilinear resampling. A {@code NaN} at any of the four surrounding nodes makes the
 * result {@code NaN}.
 */
public final class BilinearInterpolator extends AbstractGridInterpolator {

    @Override
    protected double[][] interpolateSlice(double[] lat, double[] lon, double[][] slice,
                                          double[] targetLat, double[] targetLon) {
        double[][] out = new double[targetLat.length][targetLon.length];
        int[] lonCell = new int[targetLon.length];
        double[] lonWeight = new double[targetLon.length];
        for (int j = 0; j < targetLon.length; j++) {
            if (inside(lon, targetLon[j])) {
                lonCell[j] = lowerCell(lon, targetLon[j]);
                lonWeight[j] = weight(lon, lonCell[j], targetLon[j]);
            } else {
                lonCell[j] = -1;
            }
        }

        for (int i = 0; i < targetLat.length; i++) {
            if (!inside(lat, targetLat[i])) {
                Arrays.fill(out[i], Double.NaN);
                continue;
            }
            int k = lowerCell(lat, targetLat[i]);
            double u = weight(lat, k, targetLat[i]);
            for (int j = 0; j < targetLon.length; j++) {
                int m = lonCell[j];
                if (m < 0) {
                    out[i][j] = Double.NaN;
                    continue;
                }
                double v = lonWeight[j];
                out[i][j] = (1 - u) * (1 - v) * slice[k][m]
                        + (1 - u) * v * slice[k][m + 1]
                        + u * (1 - v) * slice[k + 1][m]
                        + u * v * slice[k + 1][m + 1];
            }
        }
        return out;
    }

    /** Index {@code k} with {@code axis[k] <= value <= axis[k + 1]}; the value must be inside the axis. */
    static int lowerCell(double[] axis, double value) {
        int idx = Arrays.binarySearch(axis, value);
        int k = idx >= 0 ? idx : -idx - 2;
        return Math.max(0, Math.min(k, axis.length - 2));
    }

    private static double weight(double[] axis, int k, double value) {
        return (value - axis[k]) / (axis[k + 1] - axis[k]);
    }
}
