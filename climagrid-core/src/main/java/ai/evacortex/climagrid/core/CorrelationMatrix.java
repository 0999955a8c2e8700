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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Square, symmetric matrix of pairwise Pearson coefficients. Cells whose pair had too
 * few valid samples hold {@code NaN}.
 */
public final class CorrelationMatrix {

    private final List<String> labels;
    private final double[][] values;

    public CorrelationMatrix(List<String> labels, double[][] values) {
        Objects.requireNonNull(labels, "labels must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (values.length != labels.size()) {
            throw new InvalidArgumentException("matrix has " + values.length + " rows for " + labels.size() + " labels");
        }
        this.labels = List.copyOf(labels);
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != labels.size()) {
                throw new InvalidArgumentException("matrix row " + i + " is not square");
            }
            this.values[i] = values[i].clone();
        }
    }

    public List<String> labels() {
        return labels;
    }

    public int size() {
        return labels.size();
    }

    public double get(int i, int j) {
        return values[i][j];
    }

    public double get(String a, String b) {
        return values[indexOf(a)][indexOf(b)];
    }

    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    private int indexOf(String label) {
        int idx = labels.indexOf(label);
        if (idx < 0) {
            throw new InvalidArgumentException("unknown label '" + label + "'");
        }
        return idx;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorrelationMatrix that)) return false;
        return labels.equals(that.labels) && Arrays.deepEquals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * labels.hashCode() + Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "CorrelationMatrix" + labels + Arrays.deepToString(values);
    }
}
