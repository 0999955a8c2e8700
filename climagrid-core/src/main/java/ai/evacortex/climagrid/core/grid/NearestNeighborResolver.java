/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.grid;

import ai.evacortex.climagrid.core.CoordinateGrid;
import ai.evacortex.climagrid.core.ResolvedCell;
import ai.evacortex.climagrid.core.exceptions.InvalidArgumentException;

import java.util.Objects;

/**
 * Nearest-cell lookup on a {@link CoordinateGrid}.
 *
 * <p>Each axis is searched independently for the value with the smallest absolute
 * difference. Ties go to the lower index. Queries beyond either end of an axis clamp to
 * the edge index; they are never rejected.</p>
 *
 * <p>No longitude conversion happens here. A signed longitude looked up on an unsigned
 * axis resolves to whatever is numerically closest, which is usually the wrong cell.
 * Normalize the query with {@link ai.evacortex.climagrid.core.LongitudeConvention#normalize(double)}
 * first.</p>
 */
public final class NearestNeighborResolver {

    public ResolvedCell resolve(CoordinateGrid axes, double latitude, double longitude) {
        Objects.requireNonNull(axes, "axes must not be null");
        double[] lats = axes.latitudes();
        double[] lons = axes.longitudes();
        int i = resolveIndex(lats, latitude);
        int j = resolveIndex(lons, longitude);
        return ResolvedCell.of(i, j, lats[i], lons[j], latitude, longitude);
    }

    /**
     * Index of the axis value nearest to {@code value}. The axis must be strictly monotonic,
     * ascending or descending.
     *
     * @throws InvalidArgumentException if {@code value} is NaN
     */
    public static int resolveIndex(double[] axis, double value) {
        Objects.requireNonNull(axis, "axis must not be null");
        if (axis.length == 0) {
            throw new InvalidArgumentException("axis is empty");
        }
        if (Double.isNaN(value)) {
            throw new InvalidArgumentException("lookup value must not be NaN");
        }
        int n = axis.length;
        if (n == 1) return 0;
        boolean ascending = axis[1] > axis[0];

        // first index whose value lies at or beyond the query in axis order
        int lo = 0;
        int hi = n;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            boolean beyond = ascending ? axis[mid] >= value : axis[mid] <= value;
            if (beyond) hi = mid;
            else lo = mid + 1;
        }
        if (lo == 0) return 0;
        if (lo == n) return n - 1;
        double before = Math.abs(value - axis[lo - 1]);
        double after = Math.abs(axis[lo] - value);
        return after < before ? lo : lo - 1;
    }
}
