/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.interpolation;

import org.apache.commons.math3.analysis.interpolation.BicubicInterpolatingFunction;
import org.apache.commons.math3.analysis.interpolation.BicubicInterpolator;

import java.util.Arrays;

/**
 * Bicubic surface from commons-math3. The surface is only defined away from the outermost
 * ring of source nodes, where derivatives cannot be estimated; points there are {@code NaN}
 * along with everything outside the hull.
 */
public final class BicubicGridInterpolator extends AbstractGridInterpolator {

    @Override
    protected double[][] interpolateSlice(double[] lat, double[] lon, double[][] slice,
                                          double[] targetLat, double[] targetLon) {
        double[][] out = new double[targetLat.length][targetLon.length];
        if (lat.length < 3 || lon.length < 3) {
            for (double[] row : out) Arrays.fill(row, Double.NaN);
            return out;
        }
        BicubicInterpolatingFunction surface = new BicubicInterpolator().interpolate(lat, lon, slice);
        for (int i = 0; i < targetLat.length; i++) {
            for (int j = 0; j < targetLon.length; j++) {
                out[i][j] = surface.isValidPoint(targetLat[i], targetLon[j])
                        ? surface.value(targetLat[i], targetLon[j])
                        : Double.NaN;
            }
        }
        return out;
    }
}
