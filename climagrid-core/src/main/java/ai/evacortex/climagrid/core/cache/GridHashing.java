/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.cache;

import ai.evacortex.climagrid.core.CoordinateGrid;
import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.PointSource;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Collection;
import java.util.HexFormat;

/**
 * MD5 content hashes used as cache keys. Doubles are hashed by their exact bit pattern.
 */
public final class GridHashing {

    private static final ThreadLocal<MessageDigest> MD5_DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("MD5 algorithm not available", e);
        }
    });

    private GridHashing() {
    }

    public static String axesHash(CoordinateGrid axes) {
        MessageDigest digest = MD5_DIGEST.get();
        digest.reset();
        updateAxes(digest, axes);
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String gridHash(Grid grid) {
        MessageDigest digest = MD5_DIGEST.get();
        digest.reset();
        digest.update(grid.name().getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        digest.update(grid.unit().getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        updateAxes(digest, grid.axes());

        Instant[] times = grid.times();
        if (times != null) {
            ByteBuffer buffer = ByteBuffer.allocate(times.length * 12);
            for (Instant t : times) {
                buffer.putLong(t.getEpochSecond());
                buffer.putInt(t.getNano());
            }
            digest.update(buffer.array());
        }
        digest.update(doubles(grid.values()));
        return HexFormat.of().formatHex(digest.digest());
    }

    /** Order-sensitive hash of the coordinates and values of a point set. */
    public static String pointsHash(Collection<PointSource> points) {
        MessageDigest digest = MD5_DIGEST.get();
        digest.reset();
        ByteBuffer buffer = ByteBuffer.allocate(points.size() * 24);
        for (PointSource p : points) {
            buffer.putDouble(p.latitude());
            buffer.putDouble(p.longitude());
            buffer.putDouble(p.value());
        }
        return HexFormat.of().formatHex(digest.digest(buffer.array()));
    }

    private static void updateAxes(MessageDigest digest, CoordinateGrid axes) {
        digest.update(axes.convention().name().getBytes(StandardCharsets.UTF_8));
        digest.update(doubles(axes.latitudes()));
        digest.update((byte) 0);
        digest.update(doubles(axes.longitudes()));
    }

    private static byte[] doubles(double[] values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * 8);
        for (double v : values) {
            buffer.putDouble(v);
        }
        return buffer.array();
    }
}
