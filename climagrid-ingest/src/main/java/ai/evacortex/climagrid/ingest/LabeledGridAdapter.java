/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.ingest;

import ai.evacortex.climagrid.core.CoordinateGrid;
import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.LongitudeConvention;
import ai.evacortex.climagrid.core.exceptions.InvalidGridException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a {@link LabeledArray} into a {@link Grid}: dimension names are resolved through
 * {@link AxisNameResolver} and the values are transposed into {@code [time][lat][lon]}.
 */
public final class LabeledGridAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final AxisNameResolver resolver;

    public LabeledGridAdapter() {
        this(new AxisNameResolver());
    }

    public LabeledGridAdapter(AxisNameResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /** Convention inferred from the longitude values. */
    public Grid toGrid(LabeledArray array) {
        Objects.requireNonNull(array, "array must not be null");
        Map<CanonicalAxis, Integer> positions = resolver.resolveDimensions(array.dimensions());
        double[] lons = array.coordinates().get(array.dimensions().get(positions.get(CanonicalAxis.LONGITUDE)));
        if (lons == null) {
            throw new InvalidGridException("'" + array.name() + "' has no longitude coordinates");
        }
        return toGrid(array, LongitudeConvention.infer(lons));
    }

    /**
     * @throws InvalidGridException if dimensions cannot be resolved, sizes disagree, or the
     *                              coordinates do not form a valid grid in {@code convention}
     */
    public Grid toGrid(LabeledArray array, LongitudeConvention convention) {
        Objects.requireNonNull(array, "array must not be null");
        Objects.requireNonNull(convention, "convention must not be null");

        List<String> dims = array.dimensions();
        Map<CanonicalAxis, Integer> positions = resolver.resolveDimensions(dims);
        Integer timePos = positions.get(CanonicalAxis.TIME);
        int latPos = positions.get(CanonicalAxis.LATITUDE);
        int lonPos = positions.get(CanonicalAxis.LONGITUDE);

        int[] sizes = new int[dims.size()];
        long expected = 1;
        for (int d = 0; d < dims.size(); d++) {
            sizes[d] = array.sizeOf(dims.get(d), timePos != null && timePos == d);
            expected *= sizes[d];
        }
        double[] source = array.values();
        if (source.length != expected) {
            throw new InvalidGridException("'" + array.name() + "' holds " + source.length
                    + " values for dimension sizes " + Arrays.toString(sizes));
        }

        // row-major strides in the incoming dimension order
        int[] strides = new int[dims.size()];
        int stride = 1;
        for (int d = dims.size() - 1; d >= 0; d--) {
            strides[d] = stride;
            stride *= sizes[d];
        }

        CoordinateGrid axes = new CoordinateGrid(
                array.coordinates().get(dims.get(latPos)),
                array.coordinates().get(dims.get(lonPos)),
                convention);
        int nt = timePos == null ? 1 : sizes[timePos];
        int nLat = sizes[latPos];
        int nLon = sizes[lonPos];
        double[] out = new double[nt * nLat * nLon];
        int k = 0;
        for (int t = 0; t < nt; t++) {
            int tOffset = timePos == null ? 0 : t * strides[timePos];
            for (int i = 0; i < nLat; i++) {
                for (int j = 0; j < nLon; j++) {
                    out[k++] = source[tOffset + i * strides[latPos] + j * strides[lonPos]];
                }
            }
        }
        LOG.debug("Adapted {} with dims {} into {}x{}x{} grid ({})", array.name(), dims, nt, nLat, nLon, convention);
        return new Grid(array.name(), array.unit(), axes, timePos == null ? null : array.times(), out);
    }
}
