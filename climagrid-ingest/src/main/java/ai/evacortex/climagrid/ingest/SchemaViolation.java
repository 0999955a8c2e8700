/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.ingest;

/**
 * One problem found while validating a point table. Data rows are numbered from 1;
 * {@link #HEADER_ROW} marks a problem with the column set itself.
 */
public record SchemaViolation(int row, String column, String reason) {

    public static final int HEADER_ROW = -1;

    public boolean isHeader() {
        return row == HEADER_ROW;
    }

    @Override
    public String toString() {
        return (isHeader() ? "header" : "row " + row) + ", column '" + column + "': " + reason;
    }
}
