/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.engine;

import ai.evacortex.climagrid.core.CoordinateGrid;
import ai.evacortex.climagrid.core.CorrelationMatrix;
import ai.evacortex.climagrid.core.CorrelationResult;
import ai.evacortex.climagrid.core.ExtremePoint;
import ai.evacortex.climagrid.core.ExtremeType;
import ai.evacortex.climagrid.core.GeoBounds;
import ai.evacortex.climagrid.core.GradientField;
import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.GridAxis;
import ai.evacortex.climagrid.core.StatisticsRecord;
import ai.evacortex.climagrid.core.analysis.FieldOperations;
import ai.evacortex.climagrid.core.exceptions.InvalidArgumentException;
import ai.evacortex.climagrid.core.math.FiniteDifference;
import ai.evacortex.climagrid.core.math.NanStatistics;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class JavaSpatialStatistics implements SpatialStatistics {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    @Override
    public StatisticsRecord summary(String name, double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        return NanStatistics.summarize(name, values);
    }

    @Override
    public StatisticsRecord summary(Grid grid) {
        Objects.requireNonNull(grid, "grid must not be null");
        return NanStatistics.summarize(grid.name(), grid.values());
    }

    @Override
    public StatisticsRecord summary(Grid grid, GeoBounds region) {
        Objects.requireNonNull(grid, "grid must not be null");
        return NanStatistics.summarize(grid.name() + " " + describe(region), FieldOperations.valuesWithin(grid, region));
    }

    @Override
    public double[] gradient(double[] values, double[] coordinates) {
        return FiniteDifference.derivative(values, coordinates);
    }

    @Override
    public double[][] gradient(double[][] field, double[] axisValues, GridAxis axis) {
        return FiniteDifference.derivative(field, axisValues, axis);
    }

    @Override
    public GradientField gradientField(Grid grid, int timeIndex) {
        Objects.requireNonNull(grid, "grid must not be null");
        double[][] slice = grid.slice(timeIndex);
        CoordinateGrid axes = grid.axes();
        double[][] gLat = FiniteDifference.derivative(slice, axes.latitudes(), GridAxis.LATITUDE);
        double[][] gLon = FiniteDifference.derivative(slice, axes.longitudes(), GridAxis.LONGITUDE);
        double[][] magnitude = new double[gLat.length][gLat[0].length];
        for (int i = 0; i < gLat.length; i++) {
            for (int j = 0; j < gLat[i].length; j++) {
                magnitude[i][j] = Math.sqrt(gLat[i][j] * gLat[i][j] + gLon[i][j] * gLon[i][j]);
            }
        }
        return new GradientField(gLat, gLon, magnitude);
    }

    @Override
    public List<ExtremePoint> extremes(Grid grid, int n) {
        Objects.requireNonNull(grid, "grid must not be null");
        Grid field = FieldOperations.temporalMean(grid);
        CoordinateGrid axes = field.axes();
        int nLon = axes.longitudeCount();
        double[] values = field.values();

        List<Integer> valid = new ArrayList<>();
        for (int c = 0; c < values.length; c++) {
            if (!Double.isNaN(values[c])) valid.add(c);
        }
        if (n < 1 || n >= valid.size()) {
            throw new InvalidArgumentException("extremes count must satisfy 1 <= n < " + valid.size()
                    + " (valid cells of '" + grid.name() + "'), got " + n);
        }

        // List.sort is stable, so equal values keep row-major order
        List<Integer> descending = new ArrayList<>(valid);
        descending.sort(Comparator.comparingDouble((Integer c) -> values[c]).reversed());
        List<Integer> ascending = new ArrayList<>(valid);
        ascending.sort(Comparator.comparingDouble(c -> values[c]));

        List<ExtremePoint> out = new ArrayList<>(2 * n);
        for (int k = 0; k < n; k++) {
            out.add(point(ExtremeType.MAX, descending.get(k), values, axes, nLon));
        }
        for (int k = 0; k < n; k++) {
            out.add(point(ExtremeType.MIN, ascending.get(k), values, axes, nLon));
        }
        return out;
    }

    @Override
    public Optional<CorrelationResult> correlate(String nameA, double[] a, String nameB, double[] b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        if (a.length != b.length) {
            throw new InvalidArgumentException("cannot correlate '" + nameA + "' (" + a.length
                    + " values) with '" + nameB + "' (" + b.length + " values)");
        }

        double[] x = new double[a.length];
        double[] y = new double[b.length];
        int n = 0;
        for (int i = 0; i < a.length; i++) {
            if (Double.isNaN(a[i]) || Double.isNaN(b[i])) continue;
            x[n] = a[i];
            y[n] = b[i];
            n++;
        }
        if (n < MIN_CORRELATION_SAMPLES) {
            LOG.warn("Only {} valid pairs between '{}' and '{}', need {}; correlation skipped",
                    n, nameA, nameB, MIN_CORRELATION_SAMPLES);
            return Optional.empty();
        }
        x = Arrays.copyOf(x, n);
        y = Arrays.copyOf(y, n);

        double r = new PearsonsCorrelation().correlation(x, y);
        if (Double.isNaN(r)) {
            LOG.warn("Correlation between '{}' and '{}' is undefined (zero variance)", nameA, nameB);
            return Optional.empty();
        }
        r = Math.max(-1.0, Math.min(1.0, r));

        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(x[i], y[i]);
        }
        StandardDeviation std = new StandardDeviation(false);
        Mean mean = new Mean();
        CorrelationResult result = new CorrelationResult(nameA, nameB, r,
                regression.getSlope(), regression.getIntercept(), n,
                mean.evaluate(x), std.evaluate(x), mean.evaluate(y), std.evaluate(y));
        LOG.debug("Correlated '{}' with '{}': r={} over {} pairs", nameA, nameB, r, n);
        return Optional.of(result);
    }

    @Override
    public CorrelationMatrix correlationMatrix(Map<String, double[]> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        if (fields.size() < 2) {
            throw new InvalidArgumentException("a correlation matrix needs at least 2 fields, got " + fields.size());
        }
        List<String> labels = new ArrayList<>(fields.keySet());
        int k = labels.size();
        double[][] matrix = new double[k][k];
        for (int i = 0; i < k; i++) {
            double[] fi = Objects.requireNonNull(fields.get(labels.get(i)), "field values must not be null");
            matrix[i][i] = selfCorrelated(fi) ? 1.0 : Double.NaN;
            for (int j = i + 1; j < k; j++) {
                double[] fj = Objects.requireNonNull(fields.get(labels.get(j)), "field values must not be null");
                double r;
                if (fi.length != fj.length) {
                    LOG.warn("'{}' ({} values) and '{}' ({} values) differ in length; matrix cell left NaN",
                            labels.get(i), fi.length, labels.get(j), fj.length);
                    r = Double.NaN;
                } else {
                    r = correlate(labels.get(i), fi, labels.get(j), fj)
                            .map(CorrelationResult::r)
                            .orElse(Double.NaN);
                }
                matrix[i][j] = r;
                matrix[j][i] = r;
            }
        }
        return new CorrelationMatrix(labels, matrix);
    }

    // same acceptance rule as correlate(), applied to one field
    private static boolean selfCorrelated(double[] values) {
        return NanStatistics.validCount(values) >= MIN_CORRELATION_SAMPLES
                && NanStatistics.populationStd(values) > 0.0;
    }

    private static ExtremePoint point(ExtremeType type, int cell, double[] values, CoordinateGrid axes, int nLon) {
        int i = cell / nLon;
        int j = cell % nLon;
        return new ExtremePoint(type, values[cell], axes.latitudeAt(i), axes.longitudeAt(j), i, j);
    }

    private static String describe(GeoBounds region) {
        Objects.requireNonNull(region, "region must not be null");
        return String.format(Locale.ROOT, "[%.2f..%.2f, %.2f..%.2f]",
                region.minLatitude(), region.maxLatitude(), region.minLongitude(), region.maxLongitude());
    }
}
