/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.exceptions;

/**
 * Raised when no finite value is left after NaN filtering.
 */
public class EmptyDataException extends RuntimeException {
    public EmptyDataException(String what) {
        super("No valid values in '" + what + "' after NaN filtering.");
    }
}
