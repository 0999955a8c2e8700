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

/**
 * Closed interval of hours of day. When {@code startHour > endHour} the window wraps past
 * midnight, so {@code (22, 6)} covers 22, 23, 0, ..., 6.
 */
public record HourWindow(int startHour, int endHour) {

    public static final HourWindow DEFAULT_DAY = new HourWindow(10, 18);
    public static final HourWindow DEFAULT_NIGHT = new HourWindow(22, 6);

    public HourWindow {
        if (startHour < 0 || startHour > 23 || endHour < 0 || endHour > 23) {
            throw new InvalidArgumentException("hours must be in [0, 23], got " + startHour + ".." + endHour);
        }
    }

    public boolean contains(int hour) {
        if (startHour <= endHour) {
            return hour >= startHour && hour <= endHour;
        }
        return hour >= startHour || hour <= endHour;
    }

    public boolean wrapsMidnight() {
        return startHour > endHour;
    }
}
