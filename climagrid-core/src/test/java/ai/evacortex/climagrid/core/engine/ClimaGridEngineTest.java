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
import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.GridTestUtils;
import ai.evacortex.climagrid.core.LongitudeConvention;
import ai.evacortex.climagrid.core.PointSource;
import ai.evacortex.climagrid.core.ResolvedCell;
import ai.evacortex.climagrid.core.analysis.ForcingSignificance;
import ai.evacortex.climagrid.core.analysis.RadiativeForcingEstimate;
import ai.evacortex.climagrid.core.cache.RasterCache;
import ai.evacortex.climagrid.core.config.EngineConfig;
import ai.evacortex.climagrid.core.exceptions.InvalidArgumentException;
import ai.evacortex.climagrid.core.grid.CellAccumulator;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClimaGridEngineTest {

    private final ClimaGridEngine engine = new ClimaGridEngine(EngineConfig.defaults());

    private static Grid unsignedSource() {
        CoordinateGrid axes = new CoordinateGrid(GridTestUtils.range(0, 1, 11), GridTestUtils.range(350, 1, 11),
                LongitudeConvention.UNSIGNED_360);
        return GridTestUtils.hourlyField("rf", axes, 2, 0.0, Double::sum);
    }

    private static Grid signedReference() {
        CoordinateGrid axes = GridTestUtils.axes(new double[]{2, 4, 6, 8}, new double[]{-8, -6, -4, -2});
        return GridTestUtils.field("t2m", axes, (lat, lon) -> 2 * (lat + lon + 360) + 1);
    }

    @Test
    void correlateOnGrid_convertsAndResamplesSource() {
        CorrelationResult r = engine.correlateOnGrid(unsignedSource(), signedReference()).orElseThrow();

        assertEquals("rf", r.nameA());
        assertEquals("t2m", r.nameB());
        assertEquals(16, r.n());
        assertEquals(1.0, r.r(), 1e-9);
        assertEquals(2.0, r.slope(), 1e-9);
        assertEquals(1.0, r.intercept(), 1e-6);
    }

    @Test
    void correlateOnGrid_withTooFewOverlappingCells_isEmpty() {
        CoordinateGrid small = GridTestUtils.axes(new double[]{2, 4, 6}, new double[]{-8, -6, -4});
        Grid reference = GridTestUtils.field("t2m", small, (lat, lon) -> lat - lon);
        assertTrue(engine.correlateOnGrid(unsignedSource(), reference).isEmpty(), "3x3 cells are below the minimum");
    }

    @Test
    void correlationMatrix_overNamedGrids() {
        Grid reference = signedReference();
        Grid negated = reference.withValues("neg", "1",
                Arrays.stream(reference.values()).map(v -> -v).toArray());
        Map<String, Grid> grids = Map.of("t2m", reference, "neg", negated);

        CorrelationMatrix m = engine.correlationMatrix(grids, List.of("t2m", "neg"));
        assertEquals(List.of("t2m", "neg"), m.labels());
        assertEquals(-1.0, m.get(0, 1), 1e-12);

        assertThrows(InvalidArgumentException.class,
                () -> engine.correlationMatrix(grids, List.of("t2m", "missing")));
    }

    @Test
    void correlationMatrix_keepsEveryTimeStep() {
        CoordinateGrid axes = GridTestUtils.axes(new double[]{0, 1, 2}, new double[]{0, 1, 2});
        Grid a = GridTestUtils.hourlyField("a", axes, 4, 1.0, (lat, lon) -> 0.0);
        Grid b = GridTestUtils.hourlyField("b", axes, 4, 2.0, (lat, lon) -> 0.0);
        Grid other = GridTestUtils.hourlyField("other",
                GridTestUtils.axes(new double[]{0, 1}, new double[]{0, 1}), 4, 1.0, Double::sum);

        CorrelationMatrix m = engine.correlationMatrix(Map.of("a", a, "b", b, "other", other),
                List.of("a", "b", "other"));
        assertEquals(1.0, m.get("a", "b"), 1e-12);
        assertTrue(Double.isNaN(m.get("a", "other")), "grids of different shape do not pair");
        assertEquals(1.0, m.get("other", "other"));
    }

    @Test
    void newRasterCache_isSizedFromConfiguration() {
        ClimaGridEngine single = new ClimaGridEngine(new EngineConfig(0.1, 1.0, 0.01, 2.7, 1));
        RasterCache cache = single.newRasterCache();
        CoordinateGrid axes = GridTestUtils.axes(new double[]{0, 1, 2}, new double[]{0, 1, 2});

        Grid first = cache.rasterize(axes, List.of(PointSource.of(1, 1, 5)), CellAccumulator.SUM);
        assertSame(first, cache.rasterize(axes, List.of(PointSource.of(1, 1, 5)), CellAccumulator.SUM));
        cache.rasterize(axes, List.of(PointSource.of(0, 0, 2)), CellAccumulator.SUM);
        assertEquals(1, cache.estimatedSize());
        assertNotSame(single.newRasterCache(), cache);
    }

    @Test
    void resolve_normalizesQueryLongitude() {
        CoordinateGrid era5 = new CoordinateGrid(new double[]{40, 41}, GridTestUtils.range(0, 1, 360),
                LongitudeConvention.UNSIGNED_360);
        ResolvedCell cell = engine.resolve(era5, 40.4, -3.7);
        assertEquals(356, cell.lonIndex());
        assertEquals(0, cell.latIndex());
    }

    @Test
    void powerDensity_followsConfiguration() {
        ClimaGridEngine coarse = new ClimaGridEngine(EngineConfig.defaults().withResolution(1.0).withFootprintArea(2.0));
        Grid grid = coarse.rasterizePowerDensity(List.of(PointSource.of(40.4, -3.7, 1000)));
        assertEquals(5e-4, grid.value(130, 176), 1e-15);

        RadiativeForcingEstimate estimate = coarse.estimateForcing(grid);
        assertEquals(ForcingSignificance.VERY_LOW, estimate.significance());
    }

    @Test
    void extractPointSeries_delegatesToExtractor() {
        Grid source = unsignedSource();
        assertEquals(2, engine.extractPointSeries(source, 5, -5, 0.0).size());
        assertSame(engine.statistics(), engine.statistics());
        assertEquals(EngineConfig.defaults(), engine.config());
    }
}
