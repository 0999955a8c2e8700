/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.grid;

/**
 * How point values that land in the same cell are combined. Every cell starts at 0.
 */
public enum CellAccumulator {

    /** Additive binning: co-located contributions sum. */
    SUM {
        @Override
        double accumulate(double current, double value, boolean touched) {
            return current + value;
        }
    },

    /** Largest contribution per cell. */
    MAX {
        @Override
        double accumulate(double current, double value, boolean touched) {
            return touched ? Math.max(current, value) : value;
        }
    },

    /** Number of points per cell; values are ignored. */
    COUNT {
        @Override
        double accumulate(double current, double value, boolean touched) {
            return current + 1.0;
        }
    };

    abstract double accumulate(double current, double value, boolean touched);
}
