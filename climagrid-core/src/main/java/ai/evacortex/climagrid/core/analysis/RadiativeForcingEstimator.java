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
import ai.evacortex.climagrid.core.exceptions.EmptyDataException;
import ai.evacortex.climagrid.core.exceptions.InvalidConfigException;
import ai.evacortex.climagrid.core.math.NanStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Objects;

/**
 * First-order estimate of the radiative forcing of RF emissions: a fixed fraction of the
 * mean power density is assumed absorbed by the atmosphere, and the result is compared
 * with the anthropogenic CO₂ forcing. This is an order-of-magnitude check, not a
 * propagation model.
 */
public final class RadiativeForcingEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final double absorptionFraction;
    private final double co2ReferenceWm2;

    public RadiativeForcingEstimator(double absorptionFraction, double co2ReferenceWm2) {
        if (!(absorptionFraction > 0.0 && absorptionFraction <= 1.0)) {
            throw new InvalidConfigException("absorption fraction must be in (0, 1], got " + absorptionFraction);
        }
        if (!Double.isFinite(co2ReferenceWm2) || co2ReferenceWm2 <= 0.0) {
            throw new InvalidConfigException("CO2 reference forcing must be > 0, got " + co2ReferenceWm2);
        }
        this.absorptionFraction = absorptionFraction;
        this.co2ReferenceWm2 = co2ReferenceWm2;
    }

    /**
     * @param powerDensity power density grid in W/m², typically from
     *                     {@link ai.evacortex.climagrid.core.grid.Rasterizer#rasterizePowerDensity}
     * @throws EmptyDataException if the grid holds no valid value
     */
    public RadiativeForcingEstimate estimate(Grid powerDensity) {
        Objects.requireNonNull(powerDensity, "powerDensity must not be null");
        double mean = NanStatistics.mean(powerDensity.values());
        if (Double.isNaN(mean)) {
            throw new EmptyDataException(powerDensity.name());
        }
        double forcing = mean * absorptionFraction;
        double ratio = forcing / co2ReferenceWm2;
        ForcingSignificance significance = ForcingSignificance.fromRatio(ratio);
        LOG.info("Estimated RF forcing {} W/m² ({} of CO2 reference), {}", forcing, ratio, significance);
        return new RadiativeForcingEstimate(mean, absorptionFraction, forcing, ratio, significance);
    }
}
