/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.exceptions;

public class InvalidConfigException extends RuntimeException {
    public InvalidConfigException(String message) {
        super("Invalid configuration: " + message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super("Invalid configuration: " + message, cause);
    }
}
