package com.stockscan.indicator;

import com.stockscan.model.BarDaily;
import com.stockscan.model.IndicatorRow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.stockscan.indicator.IndicatorEngineTest.buildBars;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OscillatorIndicatorsTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final IndicatorEngine ENGINE = new IndicatorEngine(IndicatorRegistry.builtIns());

    @Test
    void kdj_shouldSettleOnRsvOfSteadyTrend() {
        // close sits 8.5 above a 9-bar range of 9, so RSV = 850/9 on every bar
        List<BarDaily> bars = buildBars("A", 80, 10.0, 1.0);
        IndicatorRow row = ENGINE.compute(bars, last(bars));

        assertEquals(850.0 / 9.0, row.value("kdjk").getAsDouble(), 1e-4);
        assertEquals(850.0 / 9.0, row.value("kdjd").getAsDouble(), 1e-4);
        assertEquals(850.0 / 9.0, row.value("kdjj").getAsDouble(), 1e-4);
    }

    @Test
    void kdj_shouldStayNeutralOnFlatRange() {
        List<BarDaily> bars = List.of(
                bar(0, 10, 10, 10, 10, 100),
                bar(1, 10, 10, 10, 10, 100),
                bar(2, 10, 10, 10, 10, 100));
        IndicatorEngine engine = new IndicatorEngine(IndicatorRegistry.of(
                new StochasticKdj("k", 2, 1, StochasticKdj.Line.K),
                new StochasticKdj("j", 2, 1, StochasticKdj.Line.J)));

        IndicatorRow row = engine.compute(bars, bars.get(2).tradeDate);

        assertEquals(50.0, row.value("k").getAsDouble(), 1e-12);
        assertEquals(50.0, row.value("j").getAsDouble(), 1e-12);
    }

    @Test
    void macd_shouldTrackEmaSpreadOfLinearTrend() {
        List<BarDaily> rising = buildBars("A", 200, 10.0, 1.0);
        IndicatorRow row = ENGINE.compute(rising, last(rising));

        // EMA lag on a unit slope is (n-1)/2, so DIF -> 12.5 - 5.5
        assertEquals(7.0, row.value("macd").getAsDouble(), 1e-2);
        assertEquals(7.0, row.value("macds").getAsDouble(), 1e-2);
        assertEquals(0.0, row.value("macdh").getAsDouble(), 1e-2);

        List<BarDaily> flat = buildBars("B", 200, 10.0, 0.0);
        assertEquals(0.0, ENGINE.compute(flat, last(flat)).value("macd").getAsDouble(), 1e-12);
    }

    @Test
    void macd_shouldBeUndefinedWithoutFullLookback() {
        List<BarDaily> bars = buildBars("A", 100, 10.0, 1.0);

        IndicatorRow row = ENGINE.compute(bars, last(bars));

        assertFalse(row.isDefined("macd"));
        assertTrue(row.isDefined("kdjk"));
    }

    @Test
    void energyRatio_shouldCompareHighsAndLowsAgainstPreviousTypicalPrice() {
        List<BarDaily> bars = List.of(
                bar(0, 10, 12, 8, 10, 100),
                bar(1, 10, 13, 9, 11, 100),
                bar(2, 11, 12, 10, 11, 100));
        IndicatorEngine engine = new IndicatorEngine(IndicatorRegistry.of(new EnergyRatio("cr", 2)));

        // up = 3 + 1, down = 1 + 1
        assertEquals(200.0, engine.compute(bars, bars.get(2).tradeDate).value("cr").getAsDouble(), 1e-9);
    }

    @Test
    void volumeVariation_shouldSplitFlatVolumeBetweenSides() {
        List<BarDaily> bars = List.of(
                bar(0, 10, 10, 10, 10, 100),
                bar(1, 11, 11, 11, 11, 300),
                bar(2, 10, 10, 10, 10, 100),
                bar(3, 10, 10, 10, 10, 200));
        IndicatorEngine engine = new IndicatorEngine(IndicatorRegistry.of(new VolumeVariation("vr", 3)));

        // (300 + 100) / (100 + 100) * 100
        assertEquals(200.0, engine.compute(bars, bars.get(3).tradeDate).value("vr").getAsDouble(), 1e-9);
    }

    @Test
    void volumeVariation_shouldBeUndefinedWhenEveryDayRises() {
        List<BarDaily> bars = buildBars("A", 40, 10.0, 1.0);

        assertFalse(ENGINE.compute(bars, last(bars)).isDefined("vr"));
    }

    @Test
    void bias_shouldMeasureDistanceFromMean() {
        List<BarDaily> bars = List.of(
                bar(0, 10, 10, 10, 10, 1), bar(1, 10, 10, 10, 10, 1), bar(2, 10, 10, 10, 10, 1),
                bar(3, 10, 10, 10, 10, 1), bar(4, 10, 10, 10, 10, 1), bar(5, 16, 16, 16, 16, 1));
        IndicatorEngine engine = new IndicatorEngine(IndicatorRegistry.of(new Bias("bias_6", 6)));

        assertEquals(500.0 / 11.0, engine.compute(bars, bars.get(5).tradeDate).value("bias_6").getAsDouble(), 1e-9);
    }

    private static BarDaily bar(int day, double open, double high, double low, double close, double volume) {
        return new BarDaily("A", START.plusDays(day), open, high, low, close, volume);
    }

    private static LocalDate last(List<BarDaily> bars) {
        return bars.get(bars.size() - 1).tradeDate;
    }
}
