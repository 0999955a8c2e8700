/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.ingest.exceptions;

import ai.evacortex.climagrid.ingest.SchemaViolation;

import java.util.List;
import java.util.stream.Collectors;

public class SchemaValidationException extends RuntimeException {

    private final List<SchemaViolation> violations;

    public SchemaValidationException(String source, List<SchemaViolation> violations) {
        super("Schema validation failed for " + source + ": " + violations.size() + " violation(s)\n  "
                + violations.stream().map(SchemaViolation::toString).collect(Collectors.joining("\n  ")));
        this.violations = List.copyOf(violations);
    }

    public List<SchemaViolation> violations() {
        return violations;
    }
}
