/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.math;

import ai.evacortex.climagrid.core.StatisticsRecord;
import ai.evacortex.climagrid.core.exceptions.EmptyDataException;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.Arrays;

/**
 * NaN-skipping descriptive statistics on top of commons-math3.
 *
 * <p>Standard deviation is the population form (divisor {@code n}). Percentiles use
 * linear interpolation between order statistics ({@link EstimationType#R_7}).</p>
 */
public final class NanStatistics {

    private NanStatistics() {
    }

    public static double[] finiteValues(double[] values) {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
    }

    public static int validCount(double[] values) {
        int n = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) n++;
        }
        return n;
    }

    /** Mean of the non-NaN values, or {@code NaN} when there are none. */
    public static double mean(double[] values) {
        double sum = 0.0;
        int n = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                sum += v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    public static double populationStd(double[] values) {
        double[] valid = finiteValues(values);
        return valid.length == 0 ? Double.NaN : new StandardDeviation(false).evaluate(valid);
    }

    /**
     * @param p percentile in (0, 100]
     */
    public static double percentile(double[] values, double p) {
        double[] valid = finiteValues(values);
        if (valid.length == 0) return Double.NaN;
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(valid, p);
    }

    /**
     * @throws EmptyDataException if nothing is left after dropping NaN
     */
    public static StatisticsRecord summarize(String name, double[] values) {
        double[] valid = finiteValues(values);
        if (valid.length == 0) {
            throw new EmptyDataException(name);
        }
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(valid);

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : valid) {
            if (v < min) min = v;
            if (v > max) max = v;
        }
        return new StatisticsRecord(
                name,
                new Mean().evaluate(valid),
                new StandardDeviation(false).evaluate(valid),
                min,
                max,
                percentile.evaluate(50.0),
                percentile.evaluate(25.0),
                percentile.evaluate(75.0),
                valid.length);
    }
}
