/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.ingest;

import ai.evacortex.climagrid.core.exceptions.InvalidGridException;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps the dimension names of an incoming dataset onto {@link CanonicalAxis} values. This
 * is done once at ingestion so nothing downstream has to guess whether a dimension is
 * called {@code lat} or {@code latitude}.
 */
public final class AxisNameResolver {

    /**
     * Resolves every dimension name to its canonical axis and returns each axis' position
     * in {@code dimensions}.
     *
     * @throws InvalidGridException if a name is unknown, two names map to the same axis, or
     *                              latitude or longitude is missing
     */
    public Map<CanonicalAxis, Integer> resolveDimensions(List<String> dimensions) {
        Objects.requireNonNull(dimensions, "dimensions must not be null");
        Map<CanonicalAxis, Integer> positions = new EnumMap<>(CanonicalAxis.class);
        for (int d = 0; d < dimensions.size(); d++) {
            String name = dimensions.get(d);
            CanonicalAxis axis = canonicalOf(name)
                    .orElseThrow(() -> new InvalidGridException("unknown dimension '" + name + "'"));
            Integer previous = positions.put(axis, d);
            if (previous != null) {
                throw new InvalidGridException("dimensions '" + dimensions.get(previous) + "' and '"
                        + name + "' both map to " + axis);
            }
        }
        if (!positions.containsKey(CanonicalAxis.LATITUDE) || !positions.containsKey(CanonicalAxis.LONGITUDE)) {
            throw new InvalidGridException("dimensions " + dimensions + " lack a latitude or longitude axis");
        }
        return positions;
    }

    public Optional<CanonicalAxis> canonicalOf(String name) {
        Objects.requireNonNull(name, "name must not be null");
        for (CanonicalAxis axis : CanonicalAxis.values()) {
            if (axis.matches(name)) return Optional.of(axis);
        }
        return Optional.empty();
    }

    /**
     * Among {@code available} names, the one with the highest alias priority for {@code axis}.
     * The name is returned as given.
     */
    public Optional<String> pickName(Collection<String> available, CanonicalAxis axis) {
        Objects.requireNonNull(available, "available must not be null");
        Objects.requireNonNull(axis, "axis must not be null");
        String best = null;
        int bestPriority = Integer.MAX_VALUE;
        for (String name : available) {
            int priority = axis.priorityOf(name);
            if (priority >= 0 && priority < bestPriority) {
                best = name;
                bestPriority = priority;
            }
        }
        return Optional.ofNullable(best);
    }
}
