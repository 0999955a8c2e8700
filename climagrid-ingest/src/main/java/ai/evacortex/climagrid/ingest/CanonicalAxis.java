/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.ingest;

import java.util.List;
import java.util.Locale;

/**
 * Dimensions a labeled array can carry, with the names each one goes by in the wild.
 * Aliases are listed in priority order and compared case-insensitively.
 */
public enum CanonicalAxis {
    TIME(List.of("valid_time", "time", "t", "date", "xtime")),
    LATITUDE(List.of("latitude", "lat", "lats", "xlat")),
    LONGITUDE(List.of("longitude", "lon", "long", "lons", "xlong"));

    private final List<String> aliases;

    CanonicalAxis(List<String> aliases) {
        this.aliases = aliases;
    }

    public List<String> aliases() {
        return aliases;
    }

    /** Position of {@code name} in the alias list, or -1. */
    public int priorityOf(String name) {
        return aliases.indexOf(name.trim().toLowerCase(Locale.ROOT));
    }

    public boolean matches(String name) {
        return priorityOf(name) >= 0;
    }
}
