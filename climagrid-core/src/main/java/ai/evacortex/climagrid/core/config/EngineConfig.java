/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.config;

import ai.evacortex.climagrid.core.exceptions.InvalidConfigException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Tunable parameters of the engine.
 */
public record EngineConfig(
        double resolutionDeg,       // rasterization grid spacing, degrees
        double footprintAreaKm2,    // nominal transmitter footprint for power density
        double absorptionFraction,  // share of RF power assumed absorbed
        double co2ReferenceWm2,     // CO2 forcing used as the comparison baseline
        int cacheMaxEntries         // raster cache capacity
) {

    public static final String RESOURCE = "climagrid.properties";

    public static final String RESOLUTION_KEY = "climagrid.raster.resolutionDeg";
    public static final String FOOTPRINT_KEY = "climagrid.raster.footprintAreaKm2";
    public static final String ABSORPTION_KEY = "climagrid.forcing.absorptionFraction";
    public static final String CO2_KEY = "climagrid.forcing.co2ReferenceWm2";
    public static final String CACHE_KEY = "climagrid.cache.maxEntries";

    public EngineConfig {
        if (!Double.isFinite(resolutionDeg) || resolutionDeg <= 0.0) {
            throw new InvalidConfigException(RESOLUTION_KEY + " must be > 0, got " + resolutionDeg);
        }
        if (!Double.isFinite(footprintAreaKm2) || footprintAreaKm2 <= 0.0) {
            throw new InvalidConfigException(FOOTPRINT_KEY + " must be > 0, got " + footprintAreaKm2);
        }
        if (!(absorptionFraction > 0.0 && absorptionFraction <= 1.0)) {
            throw new InvalidConfigException(ABSORPTION_KEY + " must be in (0, 1], got " + absorptionFraction);
        }
        if (!Double.isFinite(co2ReferenceWm2) || co2ReferenceWm2 <= 0.0) {
            throw new InvalidConfigException(CO2_KEY + " must be > 0, got " + co2ReferenceWm2);
        }
        if (cacheMaxEntries < 1) {
            throw new InvalidConfigException(CACHE_KEY + " must be >= 1, got " + cacheMaxEntries);
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(0.1, 1.0, 0.01, 2.7, 64);
    }

    /**
     * Defaults, overlaid by {@value #RESOURCE} from the classpath, overlaid by system properties.
     */
    public static EngineConfig load() {
        Properties p = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                p.load(in);
            }
        } catch (IOException e) {
            throw new InvalidConfigException("failed to read " + RESOURCE, e);
        }
        for (String key : new String[]{RESOLUTION_KEY, FOOTPRINT_KEY, ABSORPTION_KEY, CO2_KEY, CACHE_KEY}) {
            String override = System.getProperty(key);
            if (override != null) {
                p.setProperty(key, override);
            }
        }
        return fromProperties(p);
    }

    /** Missing keys fall back to {@link #defaults()}. */
    public static EngineConfig fromProperties(Properties p) {
        EngineConfig d = defaults();
        return new EngineConfig(
                parseDouble(p, RESOLUTION_KEY, d.resolutionDeg()),
                parseDouble(p, FOOTPRINT_KEY, d.footprintAreaKm2()),
                parseDouble(p, ABSORPTION_KEY, d.absorptionFraction()),
                parseDouble(p, CO2_KEY, d.co2ReferenceWm2()),
                parseInt(p, CACHE_KEY, d.cacheMaxEntries()));
    }

    public EngineConfig withResolution(double resolutionDeg) {
        return new EngineConfig(resolutionDeg, footprintAreaKm2, absorptionFraction, co2ReferenceWm2, cacheMaxEntries);
    }

    public EngineConfig withFootprintArea(double footprintAreaKm2) {
        return new EngineConfig(resolutionDeg, footprintAreaKm2, absorptionFraction, co2ReferenceWm2, cacheMaxEntries);
    }

    public EngineConfig withAbsorptionFraction(double absorptionFraction) {
        return new EngineConfig(resolutionDeg, footprintAreaKm2, absorptionFraction, co2ReferenceWm2, cacheMaxEntries);
    }

    private static double parseDouble(Properties p, String key, double fallback) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigException(key + " is not a number: '" + raw + "'", e);
        }
    }

    private static int parseInt(Properties p, String key, int fallback) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigException(key + " is not an integer: '" + raw + "'", e);
        }
    }
}
