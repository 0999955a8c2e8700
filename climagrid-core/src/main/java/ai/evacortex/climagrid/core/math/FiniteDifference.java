/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.math;

import ai.evacortex.climagrid.core.GridAxis;
import ai.evacortex.climagrid.core.exceptions.InvalidArgumentException;

import java.util.Objects;

/**
 * Finite differences on possibly non-uniform coordinates.
 *
 * <p>Interior points use the second-order accurate non-uniform central scheme; the two
 * boundary points use one-sided first-order differences. NaN inputs propagate into every
 * derivative that touches them.</p>
 */
public final class FiniteDifference {

    private FiniteDifference() {
    }

    public static double[] derivative(double[] f, double[] x) {
        Objects.requireNonNull(f, "f must not be null");
        Objects.requireNonNull(x, "x must not be null");
        if (f.length != x.length) {
            throw new InvalidArgumentException("values (" + f.length + ") and coordinates ("
                    + x.length + ") differ in length");
        }
        int n = f.length;
        if (n < 2) {
            throw new InvalidArgumentException("at least 2 points are required for a derivative, got " + n);
        }
        double[] out = new double[n];
        out[0] = (f[1] - f[0]) / (x[1] - x[0]);
        out[n - 1] = (f[n - 1] - f[n - 2]) / (x[n - 1] - x[n - 2]);
        for (int i = 1; i < n - 1; i++) {
            double h1 = x[i] - x[i - 1];
            double h2 = x[i + 1] - x[i];
            double a = -h2 / (h1 * (h1 + h2));
            double b = (h2 - h1) / (h1 * h2);
            double c = h1 / (h2 * (h1 + h2));
            out[i] = a * f[i - 1] + b * f[i] + c * f[i + 1];
        }
        return out;
    }

    /**
     * Derivative of a {@code [lat][lon]} field along one axis.
     *
     * @param coordinates coordinate values of the differentiated axis
     */
    public static double[][] derivative(double[][] field, double[] coordinates, GridAxis axis) {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(axis, "axis must not be null");
        int rows = field.length;
        if (rows == 0) {
            throw new InvalidArgumentException("field is empty");
        }
        int cols = field[0].length;
        double[][] out = new double[rows][cols];

        if (axis == GridAxis.LONGITUDE) {
            for (int i = 0; i < rows; i++) {
                if (field[i].length != cols) {
                    throw new InvalidArgumentException("field row " + i + " has " + field[i].length + " values, expected " + cols);
                }
                out[i] = derivative(field[i], coordinates);
            }
            return out;
        }

        double[] column = new double[rows];
        for (int j = 0; j < cols; j++) {
            for (int i = 0; i < rows; i++) {
                column[i] = field[i][j];
            }
            double[] d = derivative(column, coordinates);
            for (int i = 0; i < rows; i++) {
                out[i][j] = d[i];
            }
        }
        return out;
    }
}
