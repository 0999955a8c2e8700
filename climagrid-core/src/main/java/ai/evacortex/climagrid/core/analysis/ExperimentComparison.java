/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.analysis;

import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.StatisticsRecord;
import ai.evacortex.climagrid.core.math.NanStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Objects;

/**
 * Compares an experiment run against its control, e.g. a simulation with an added
 * anthropogenic heat flux against the baseline.
 */
public final class ExperimentComparison {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private ExperimentComparison() {
    }

    /**
     * @throws ai.evacortex.climagrid.core.exceptions.InvalidGridException if the grids are not aligned
     * @throws ai.evacortex.climagrid.core.exceptions.EmptyDataException if the difference has no valid value
     */
    public static DifferenceSummary assess(Grid experiment, Grid control) {
        Objects.requireNonNull(experiment, "experiment must not be null");
        Objects.requireNonNull(control, "control must not be null");

        Grid difference = FieldOperations.difference(experiment, control);
        double[] values = difference.values();
        StatisticsRecord stats = NanStatistics.summarize(difference.name(), values);
        double p95 = NanStatistics.percentile(values, 95.0);
        ImpactLevel impact = ImpactLevel.fromMeanDifference(stats.mean());

        LOG.info("'{}': mean difference {} {}, p95 {}, impact {}",
                difference.name(), stats.mean(), difference.unit(), p95, impact);
        return new DifferenceSummary(difference, stats, p95, impact);
    }
}
