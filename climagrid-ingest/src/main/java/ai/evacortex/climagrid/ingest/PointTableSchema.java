/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.ingest;

import ai.evacortex.climagrid.core.exceptions.InvalidConfigException;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Columns a point-source table must (latitude, longitude, value) or may (frequency,
 * height, category) carry. Latitude and longitude accept a list of aliases; the other
 * columns are matched by exact name. All matching ignores case.
 */
public record PointTableSchema(List<String> latitudeAliases,
                               List<String> longitudeAliases,
                               String valueColumn,
                               String frequencyColumn,
                               String heightColumn,
                               String categoryColumn) {

    public static final String DEFAULT_VALUE_COLUMN = "power_w";

    public PointTableSchema {
        Objects.requireNonNull(valueColumn, "valueColumn must not be null");
        if (latitudeAliases == null || latitudeAliases.isEmpty()
                || longitudeAliases == null || longitudeAliases.isEmpty()) {
            throw new InvalidConfigException("latitude and longitude need at least one column name");
        }
        latitudeAliases = lower(latitudeAliases);
        longitudeAliases = lower(longitudeAliases);
        valueColumn = valueColumn.toLowerCase(Locale.ROOT);
        frequencyColumn = frequencyColumn == null ? null : frequencyColumn.toLowerCase(Locale.ROOT);
        heightColumn = heightColumn == null ? null : heightColumn.toLowerCase(Locale.ROOT);
        categoryColumn = categoryColumn == null ? null : categoryColumn.toLowerCase(Locale.ROOT);
    }

    /** RF inventory layout: {@code power_w} plus optional {@code frequency_hz}, {@code height_m}, {@code type}. */
    public static PointTableSchema defaults() {
        return new PointTableSchema(
                List.of("latitude", "lat"),
                List.of("longitude", "lon", "long", "lng"),
                DEFAULT_VALUE_COLUMN,
                "frequency_hz",
                "height_m",
                "type");
    }

    public PointTableSchema withValueColumn(String column) {
        return new PointTableSchema(latitudeAliases, longitudeAliases, column,
                frequencyColumn, heightColumn, categoryColumn);
    }

    /** First latitude alias present in {@code columns}. */
    public Optional<String> latitudeColumnIn(Collection<String> columns) {
        return firstPresent(latitudeAliases, columns);
    }

    public Optional<String> longitudeColumnIn(Collection<String> columns) {
        return firstPresent(longitudeAliases, columns);
    }

    private static Optional<String> firstPresent(List<String> aliases, Collection<String> columns) {
        for (String alias : aliases) {
            if (columns.contains(alias)) return Optional.of(alias);
        }
        return Optional.empty();
    }

    private static List<String> lower(List<String> names) {
        return names.stream().map(n -> n.trim().toLowerCase(Locale.ROOT)).toList();
    }
}
