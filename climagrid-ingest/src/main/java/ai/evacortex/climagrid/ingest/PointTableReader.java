/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.ingest;

import ai.evacortex.climagrid.core.PointSource;
import ai.evacortex.climagrid.core.exceptions.InvalidArgumentException;
import ai.evacortex.climagrid.ingest.exceptions.SchemaValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loads point sources from CSV or JSON tables and validates them against a
 * {@link PointTableSchema}.
 *
 * <p>A CSV table has a header row followed by one source per line. A JSON table is an
 * array of objects. Validation collects every problem before failing, so a single
 * {@link SchemaValidationException} reports all missing columns and bad cells at once.
 * Nothing is returned from a table with any violation.</p>
 */
public final class PointTableReader {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final PointTableSchema schema;
    private final CsvMapper csvMapper;
    private final ObjectMapper jsonMapper;

    public PointTableReader() {
        this(PointTableSchema.defaults());
    }

    public PointTableReader(PointTableSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.jsonMapper = new ObjectMapper();
    }

    public PointTableSchema schema() {
        return schema;
    }

    /** Picks the format from the file extension ({@code .csv} or {@code .json}). */
    public List<PointSource> read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String file = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (file.endsWith(".csv")) return readCsv(path);
        if (file.endsWith(".json")) return readJson(path);
        throw new InvalidArgumentException("unsupported point table format: " + path.getFileName());
    }

    public List<PointSource> readCsv(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readCsv(reader, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read point table " + path, e);
        }
    }

    public List<PointSource> readCsv(Reader reader, String source) {
        Objects.requireNonNull(reader, "reader must not be null");
        List<String[]> lines = new ArrayList<>();
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .with(CsvParser.Feature.TRIM_SPACES)
                .readValues(reader)) {
            while (it.hasNextValue()) {
                lines.add(it.nextValue());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse CSV point table " + source, e);
        }
        if (lines.isEmpty()) {
            throw new SchemaValidationException(source,
                    List.of(new SchemaViolation(SchemaViolation.HEADER_ROW, schema.valueColumn(), "table is empty")));
        }

        String[] header = lines.get(0);
        Set<String> columns = new LinkedHashSet<>();
        for (String name : header) {
            columns.add(name.trim().toLowerCase(Locale.ROOT));
        }
        List<Map<String, String>> rows = new ArrayList<>(lines.size() - 1);
        for (int r = 1; r < lines.size(); r++) {
            String[] cells = lines.get(r);
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < header.length; c++) {
                row.put(header[c].trim().toLowerCase(Locale.ROOT), c < cells.length ? cells[c] : null);
            }
            rows.add(row);
        }
        return toPoints(source, columns, rows);
    }

    public List<PointSource> readJson(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return readJson(in, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read point table " + path, e);
        }
    }

    public List<PointSource> readJson(InputStream in, String source) {
        Objects.requireNonNull(in, "in must not be null");
        JsonNode root;
        try {
            root = jsonMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse JSON point table " + source, e);
        }
        if (root == null || !root.isArray()) {
            throw new SchemaValidationException(source, List.of(new SchemaViolation(
                    SchemaViolation.HEADER_ROW, schema.valueColumn(), "expected a JSON array of objects")));
        }

        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, String>> rows = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            Map<String, String> row = new LinkedHashMap<>();
            if (node.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    String column = field.getKey().trim().toLowerCase(Locale.ROOT);
                    JsonNode cell = field.getValue();
                    columns.add(column);
                    row.put(column, cell == null || cell.isNull() ? null : cell.asText());
                }
            }
            rows.add(row);
        }
        return toPoints(source, columns, rows);
    }

    private List<PointSource> toPoints(String source, Set<String> columns, List<Map<String, String>> rows) {
        List<SchemaViolation> violations = new ArrayList<>();

        String latColumn = schema.latitudeColumnIn(columns).orElse(null);
        String lonColumn = schema.longitudeColumnIn(columns).orElse(null);
        String valueColumn = columns.contains(schema.valueColumn()) ? schema.valueColumn() : null;
        if (latColumn == null) {
            violations.add(missingColumn(schema.latitudeAliases().get(0)));
        }
        if (lonColumn == null) {
            violations.add(missingColumn(schema.longitudeAliases().get(0)));
        }
        if (valueColumn == null) {
            violations.add(missingColumn(schema.valueColumn()));
        }
        String freqColumn = present(columns, schema.frequencyColumn());
        String heightColumn = present(columns, schema.heightColumn());
        String categoryColumn = present(columns, schema.categoryColumn());

        List<PointSource> points = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            int rowNumber = r + 1;
            Map<String, String> row = rows.get(r);
            int before = violations.size();

            double lat = latColumn == null ? Double.NaN : required(row, latColumn, rowNumber, violations);
            double lon = lonColumn == null ? Double.NaN : required(row, lonColumn, rowNumber, violations);
            double value = valueColumn == null ? Double.NaN : required(row, valueColumn, rowNumber, violations);
            double freq = optional(row, freqColumn, rowNumber, violations);
            double height = optional(row, heightColumn, rowNumber, violations);
            String category = categoryColumn == null ? null : blankToNull(row.get(categoryColumn));

            if (violations.size() == before && latColumn != null && lonColumn != null && valueColumn != null) {
                points.add(new PointSource(lat, lon, value, freq, height, category));
            }
        }

        if (!violations.isEmpty()) {
            LOG.warn("Point table {} rejected with {} violation(s)", source, violations.size());
            throw new SchemaValidationException(source, violations);
        }
        LOG.info("Loaded {} point sources from {}", points.size(), source);
        return points;
    }

    private static SchemaViolation missingColumn(String column) {
        return new SchemaViolation(SchemaViolation.HEADER_ROW, column, "required column is missing");
    }

    private static String present(Set<String> columns, String column) {
        return column != null && columns.contains(column) ? column : null;
    }

    private static double required(Map<String, String> row, String column, int rowNumber,
                                   List<SchemaViolation> violations) {
        String cell = blankToNull(row.get(column));
        if (cell == null) {
            violations.add(new SchemaViolation(rowNumber, column, "missing value"));
            return Double.NaN;
        }
        return parse(cell, column, rowNumber, violations);
    }

    private static double optional(Map<String, String> row, String column, int rowNumber,
                                   List<SchemaViolation> violations) {
        if (column == null) return Double.NaN;
        String cell = blankToNull(row.get(column));
        return cell == null ? Double.NaN : parse(cell, column, rowNumber, violations);
    }

    private static double parse(String cell, String column, int rowNumber, List<SchemaViolation> violations) {
        double parsed;
        try {
            parsed = Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            violations.add(new SchemaViolation(rowNumber, column, "not a number: '" + cell + "'"));
            return Double.NaN;
        }
        if (!Double.isFinite(parsed)) {
            violations.add(new SchemaViolation(rowNumber, column, "not a finite number: '" + cell + "'"));
            return Double.NaN;
        }
        return parsed;
    }

    private static String blankToNull(String cell) {
        if (cell == null) return null;
        String trimmed = cell.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
