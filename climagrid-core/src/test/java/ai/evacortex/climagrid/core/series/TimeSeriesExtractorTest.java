/*
 * ClimaGrid — Geospatial Grid Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.climagrid.core.series;

import ai.evacortex.climagrid.core.CoordinateGrid;
import ai.evacortex.climagrid.core.DiurnalPartition;
import ai.evacortex.climagrid.core.Grid;
import ai.evacortex.climagrid.core.GridTestUtils;
import ai.evacortex.climagrid.core.HourWindow;
import ai.evacortex.climagrid.core.LongitudeConvention;
import ai.evacortex.climagrid.core.TimeSeries;
import ai.evacortex.climagrid.core.exceptions.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TimeSeriesExtractorTest {

    private final TimeSeriesExtractor extractor = new TimeSeriesExtractor();

    private static Grid kelvinGrid() {
        CoordinateGrid axes = new CoordinateGrid(new double[]{40, 41}, new double[]{355, 356, 357, 358},
                LongitudeConvention.UNSIGNED_360);
        return GridTestUtils.hourlyField("t2m", axes, 24, 1.0,
                (lat, lon) -> 273.15 + (lat - 40) * 100 + (lon - 355) * 10);
    }

    private static TimeSeries hourOfDaySeries() {
        double[] values = GridTestUtils.range(0, 1, 24);
        return TimeSeries.unlocated("hour", "h", GridTestUtils.hourly(24), values);
    }

    @Test
    void extractsKelvinSeriesAsCelsius() {
        Grid grid = kelvinGrid();
        double[] before = grid.values();

        TimeSeries series = extractor.extractPointSeries(grid, 40.2, -3.7, TimeSeriesExtractor.KELVIN_TO_CELSIUS, "°C");

        assertEquals(24, series.size());
        assertEquals("°C", series.unit());
        for (int t = 0; t < 24; t++) {
            assertEquals(10.0 + t, series.valueAt(t), 1e-9, "hour " + t);
        }
        assertEquals(40.0, series.resolvedLatitude());
        assertEquals(356.0, series.resolvedLongitude());
        assertEquals(-3.7, series.requestedLongitude());
        assertEquals(Math.hypot(0.2, 0.3), series.snapDistance(), 1e-9);
        assertArrayEquals(before, grid.values(), "source grid must be untouched");
    }

    @Test
    void keepsGridUnitByDefault() {
        TimeSeries series = extractor.extractPointSeries(kelvinGrid(), 41, 358, 0.0);
        assertEquals("K", series.unit());
        assertEquals(273.15 + 130, series.valueAt(0), 1e-9);
    }

    @Test
    void staticGrid_isRejected() {
        CoordinateGrid axes = GridTestUtils.axes(new double[]{0, 1}, new double[]{0, 1});
        Grid flat = Grid.of("x", "1", axes, new double[][]{{1, 2}, {3, 4}});
        assertThrows(InvalidArgumentException.class, () -> extractor.extractPointSeries(flat, 0, 0, 0.0));
        assertThrows(InvalidArgumentException.class, () -> extractor.regionalMeanSeries(flat));
    }

    @Test
    void dayNightPartition_usesClosedWrappingWindows() {
        DiurnalPartition p = extractor.partitionDayNight(hourOfDaySeries());

        assertEquals(9, p.day().size(), "hours 10..18");
        assertEquals(9, p.night().size(), "hours 22..23 and 0..6");
        assertEquals(14.0, p.dayMean(), 1e-12);
        assertEquals(66.0 / 9.0, p.nightMean(), 1e-12);
        assertEquals(14.0 - 66.0 / 9.0, p.asymmetry(), 1e-12);
    }

    @Test
    void dayNightPartition_inOtherZone() {
        DiurnalPartition p = extractor.partitionDayNight(hourOfDaySeries(),
                new HourWindow(12, 12), new HourWindow(0, 0), ZoneOffset.ofHours(2));
        assertEquals(1, p.day().size());
        assertEquals(10.0, p.dayMean(), "12:00 at UTC+2 is 10:00 UTC");
        assertEquals(22.0, p.nightMean());
    }

    @Test
    void emptyPartition_hasNaNMean() {
        TimeSeries afternoon = hourOfDaySeries().select(t -> {
            int hour = t.atZone(ZoneOffset.UTC).getHour();
            return hour >= 12 && hour <= 14;
        });
        DiurnalPartition p = extractor.partitionDayNight(afternoon);
        assertEquals(0, p.night().size());
        assertTrue(Double.isNaN(p.nightMean()));
        assertTrue(Double.isNaN(p.asymmetry()));
        assertEquals(13.0, p.dayMean(), 1e-12);
    }

    @Test
    void regionalMeanSeries_averagesEachStep() {
        TimeSeries mean = extractor.regionalMeanSeries(kelvinGrid());
        assertEquals(24, mean.size());
        assertEquals(273.15 + 50 + 15, mean.valueAt(0), 1e-9);
        assertEquals(mean.valueAt(0) + 5, mean.valueAt(5), 1e-9);
        Instant[] times = mean.times();
        assertEquals(GridTestUtils.START, times[0]);
    }
}
