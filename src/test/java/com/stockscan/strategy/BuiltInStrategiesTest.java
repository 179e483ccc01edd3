package com.stockscan.strategy;

import com.stockscan.config.Config;
import com.stockscan.indicator.IndicatorEngine;
import com.stockscan.indicator.IndicatorRegistry;
import com.stockscan.model.BarDaily;
import com.stockscan.model.IndicatorRow;
import com.stockscan.model.Instrument;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuiltInStrategiesTest {

    private static final LocalDate START = LocalDate.of(2023, 1, 2);
    private static final IndicatorEngine ENGINE = new IndicatorEngine(IndicatorRegistry.builtIns());

    @Test
    void turtleTrade_shouldMatchNewSixtyDayHigh() {
        InstrumentWindow window = window(buildBars(90, 10.0, 0.1), 1);

        Optional<StrategyMatch> match = new TurtleTradeStrategy().evaluate(window, snapshot(window));

        assertTrue(match.isPresent());
        assertEquals(window.latestBar().close, match.get().params.get("close"), 1e-9);
    }

    @Test
    void turtleTrade_shouldNotMatchFallingSeries() {
        InstrumentWindow window = window(buildBars(90, 30.0, -0.1), 1);

        assertFalse(new TurtleTradeStrategy().evaluate(window, snapshot(window)).isPresent());
    }

    @Test
    void keepIncreasing_shouldMatchSteadyUptrend() {
        KeepIncreasingStrategy strategy = new KeepIncreasingStrategy();
        InstrumentWindow window = window(buildBars(90, 10.0, 1.0), strategy.historyRows());

        Optional<StrategyMatch> match = strategy.evaluate(window, snapshot(window));

        assertTrue(match.isPresent());
        assertTrue(match.get().score > 1.2);
    }

    @Test
    void keepIncreasing_shouldNotMatchFlatSeries() {
        KeepIncreasingStrategy strategy = new KeepIncreasingStrategy();
        InstrumentWindow window = window(buildBars(90, 10.0, 0.0), strategy.historyRows());

        assertFalse(strategy.evaluate(window, snapshot(window)).isPresent());
    }

    @Test
    void volumeSurge_shouldMatchAtTwiceAverageVolume() {
        List<BarDaily> bars = flat(60, 100.0, 1000.0);
        bars.add(bar(60, 100.0, 102.0, 2000.0));
        InstrumentWindow window = handWindow(bars, Map.of("vol_ma5", 1000.0));

        Optional<StrategyMatch> match = new VolumeSurgeStrategy(200_000.0).evaluate(window, snapshot(window));

        assertTrue(match.isPresent());
        assertEquals(2.0, match.get().params.get("vol_ratio"), 1e-9);
    }

    @Test
    void volumeSurge_shouldNotMatchJustBelowTwiceAverageVolume() {
        List<BarDaily> bars = flat(60, 100.0, 1000.0);
        bars.add(bar(60, 100.0, 102.0, 1999.0));
        InstrumentWindow window = handWindow(bars, Map.of("vol_ma5", 1000.0));

        assertFalse(new VolumeSurgeStrategy(200_000.0).evaluate(window, snapshot(window)).isPresent());
    }

    @Test
    void climaxLimitDown_shouldMatchLimitDownOnFourfoldVolume() {
        List<BarDaily> bars = flat(60, 100.0, 1000.0);
        bars.add(bar(60, 100.0, 90.0, 4000.0));
        InstrumentWindow window = handWindow(bars, Map.of("vol_ma5", 1000.0));

        Optional<StrategyMatch> match = new ClimaxLimitDownStrategy(0.0).evaluate(window, snapshot(window));

        assertTrue(match.isPresent());
        assertEquals(4.0, match.get().score, 1e-9);
    }

    @Test
    void climaxLimitDown_shouldNotMatchShallowDropOrThinVolume() {
        List<BarDaily> shallow = flat(60, 100.0, 1000.0);
        shallow.add(bar(60, 100.0, 91.0, 5000.0));
        List<BarDaily> thin = flat(60, 100.0, 1000.0);
        thin.add(bar(60, 100.0, 90.0, 3999.0));
        ClimaxLimitDownStrategy strategy = new ClimaxLimitDownStrategy(0.0);

        InstrumentWindow shallowWindow = handWindow(shallow, Map.of("vol_ma5", 1000.0));
        InstrumentWindow thinWindow = handWindow(thin, Map.of("vol_ma5", 1000.0));

        assertFalse(strategy.evaluate(shallowWindow, snapshot(shallowWindow)).isPresent());
        assertFalse(strategy.evaluate(thinWindow, snapshot(thinWindow)).isPresent());
    }

    @Test
    void lowAtrGrowth_shouldMatchCalmCompoundingRun() {
        InstrumentWindow window = handWindow(compounding(1.09), Map.of());

        Optional<StrategyMatch> match = new LowAtrGrowthStrategy().evaluate(window, snapshot(window));

        assertTrue(match.isPresent());
        assertEquals(Math.pow(1.09, 9) - 1.0, match.get().params.get("range_ratio"), 1e-9);
    }

    @Test
    void lowAtrGrowth_shouldNotMatchNarrowRangeOrWildDays() {
        InstrumentWindow narrow = handWindow(compounding(1.08), Map.of());
        InstrumentWindow wild = handWindow(compounding(1.11), Map.of());
        LowAtrGrowthStrategy strategy = new LowAtrGrowthStrategy();

        // 1.08^9 - 1 is just under the 110% range
        assertFalse(strategy.evaluate(narrow, snapshot(narrow)).isPresent());
        // 11% a day averages above the 10% ceiling
        assertFalse(strategy.evaluate(wild, snapshot(wild)).isPresent());
    }

    @Test
    void lowBacktraceIncrease_shouldMatchSmoothSixtyPercentRise() {
        InstrumentWindow window = handWindow(steadyRise(-1, 1.0), Map.of());

        Optional<StrategyMatch> match = new LowBacktraceIncreaseStrategy().evaluate(window, snapshot(window));

        assertTrue(match.isPresent());
        assertEquals((220.0 - 102.0) / 102.0, match.get().score, 1e-9);
    }

    @Test
    void lowBacktraceIncrease_shouldNotMatchAfterEightPercentDrop() {
        InstrumentWindow window = handWindow(steadyRise(30, 0.92), Map.of());

        assertFalse(new LowBacktraceIncreaseStrategy().evaluate(window, snapshot(window)).isPresent());
    }

    @Test
    void parkingApron_shouldMatchLimitUpFollowedByTightSessions() {
        InstrumentWindow window = handWindow(apron(11.0), Map.of());

        Optional<StrategyMatch> match = new ParkingApronStrategy().evaluate(window, snapshot(window));

        assertTrue(match.isPresent());
        assertEquals(11.0, match.get().params.get("limitup_close"), 1e-9);
        assertEquals(3.0, match.get().params.get("limitup_offset"), 1e-9);
    }

    @Test
    void parkingApron_shouldNotMatchNineAndHalfPercentOrLess() {
        InstrumentWindow window = handWindow(apron(10.9), Map.of());

        assertFalse(new ParkingApronStrategy().evaluate(window, snapshot(window)).isPresent());
    }

    @Test
    void breakthroughPlatform_shouldMatchSurgeThroughFlatMa60() {
        InstrumentWindow window = handWindow(platform(100.0), Map.of("ma60", 101.0, "vol_ma5", 1000.0));

        Optional<StrategyMatch> match = new BreakthroughPlatformStrategy(0.0).evaluate(window, snapshot(window));

        assertTrue(match.isPresent());
        assertEquals(0.0, match.get().params.get("breakthrough_offset"), 1e-9);
        assertEquals(2.5, match.get().params.get("vol_ratio"), 1e-9);
    }

    @Test
    void breakthroughPlatform_shouldNotMatchWhenPlatformSagsTwentyPercentBelowMa60() {
        InstrumentWindow window = handWindow(platform(80.0), Map.of("ma60", 101.0, "vol_ma5", 1000.0));

        assertFalse(new BreakthroughPlatformStrategy(0.0).evaluate(window, snapshot(window)).isPresent());
    }

    @Test
    void backtraceMa250_shouldMatchPullbackOnDryingVolume() {
        InstrumentWindow window = handWindow(peakAndPullback(5000.0), Map.of("ma250", 100.0));

        Optional<StrategyMatch> match = new BacktraceMa250Strategy().evaluate(window, snapshot(window));

        assertTrue(match.isPresent());
        assertEquals(5.0, match.get().params.get("vol_ratio"), 1e-9);
        assertEquals(102.0 / 160.0, match.get().params.get("back_ratio"), 1e-9);
        assertEquals(29.0, match.get().params.get("pullback_days"), 1e-9);
    }

    @Test
    void backtraceMa250_shouldNotMatchWhenPeakVolumeOnlyDoubles() {
        InstrumentWindow window = handWindow(peakAndPullback(2000.0), Map.of("ma250", 100.0));

        assertFalse(new BacktraceMa250Strategy().evaluate(window, snapshot(window)).isPresent());
    }

    @Test
    void overboughtMomentum_shouldMatchWithEveryOscillatorOnItsThreshold() {
        InstrumentWindow window = handWindow(flat(2, 10.0, 1000.0), overbought());

        Optional<StrategyMatch> match = new OverboughtMomentumStrategy().evaluate(window, snapshot(window));

        assertTrue(match.isPresent());
        assertEquals(80.0, match.get().score, 1e-9);
        assertEquals(300.0, match.get().params.get("cr"), 1e-9);
    }

    @Test
    void overboughtMomentum_shouldNotMatchWhenOneOscillatorFallsShort() {
        Map<String, Double> values = overbought();
        values.put("vr", 159.9);
        InstrumentWindow window = handWindow(flat(2, 10.0, 1000.0), values);

        assertFalse(new OverboughtMomentumStrategy().evaluate(window, snapshot(window)).isPresent());
    }

    @Test
    void oversoldReversal_shouldMatchJustBelowEveryThreshold() {
        InstrumentWindow window = handWindow(flat(2, 10.0, 1000.0), oversold());

        Optional<StrategyMatch> match = new OversoldReversalStrategy().evaluate(window, snapshot(window));

        assertTrue(match.isPresent());
        assertEquals(80.1, match.get().score, 1e-9);
    }

    @Test
    void oversoldReversal_shouldNotMatchOnThresholdItself() {
        Map<String, Double> values = oversold();
        values.put("kdjk", 20.0);
        InstrumentWindow window = handWindow(flat(2, 10.0, 1000.0), values);

        assertFalse(new OversoldReversalStrategy().evaluate(window, snapshot(window)).isPresent());
    }

    @Test
    void relativeStrength_shouldMatchWhenBeatingMarketByMargin() {
        InstrumentWindow window = handWindow(flat(2, 10.0, 1000.0), Map.of("return_20", 15.0, "ma20", 9.5));
        MarketSnapshot market = new MarketSnapshot(window.date, 10, 5, 5, 0.0, 5.0);

        Optional<StrategyMatch> match = new RelativeStrengthStrategy(10.0).evaluate(window, market);

        assertTrue(match.isPresent());
        assertEquals(10.0, match.get().score, 1e-9);
    }

    @Test
    void relativeStrength_shouldNotMatchBelowMarginOrAtMa20() {
        MarketSnapshot market = new MarketSnapshot(LocalDate.MIN, 10, 5, 5, 0.0, 5.0);
        RelativeStrengthStrategy strategy = new RelativeStrengthStrategy(10.0);

        InstrumentWindow weak = handWindow(flat(2, 10.0, 1000.0), Map.of("return_20", 14.9, "ma20", 9.5));
        InstrumentWindow atAverage = handWindow(flat(2, 10.0, 1000.0), Map.of("return_20", 15.0, "ma20", 10.0));

        assertFalse(strategy.evaluate(weak, market).isPresent());
        assertFalse(strategy.evaluate(atAverage, market).isPresent());
    }

    @Test
    void builtIns_shouldOnlyRequireRegisteredIndicators() {
        StrategyRegistry registry = StrategyRegistry.builtIns(Config.of(Path.of("."), Map.of()));

        registry.validateAgainst(IndicatorRegistry.builtIns());
        assertEquals(12, registry.size());
        assertTrue(registry.names().contains("turtle_trade"));
        assertTrue(registry.maxHistoryRows() >= 30);
    }

    @Test
    void fromConfig_shouldNarrowToEnabledStrategies() {
        Config config = Config.of(Path.of("."), Map.of("strategy.enabled", "turtle_trade, keep_increasing"));

        assertEquals(List.of("keep_increasing", "turtle_trade"), StrategyRegistry.fromConfig(config).names());
        Config unknown = Config.of(Path.of("."), Map.of("strategy.enabled", "no_such_rule"));
        assertThrows(IllegalArgumentException.class, () -> StrategyRegistry.fromConfig(unknown));
    }

    private static InstrumentWindow handWindow(List<BarDaily> bars, Map<String, Double> values) {
        List<IndicatorRow> rows = new ArrayList<>(bars.size());
        for (BarDaily bar : bars) {
            rows.add(new IndicatorRow(bar.code, bar.tradeDate, values));
        }
        LocalDate date = bars.get(bars.size() - 1).tradeDate;
        return new InstrumentWindow(Instrument.active("600000", "test"), date, bars, rows);
    }

    private static BarDaily bar(int day, double open, double close, double volume) {
        return new BarDaily("600000", START.plusDays(day), open, Math.max(open, close), Math.min(open, close), close, volume);
    }

    private static List<BarDaily> flat(int count, double close, double volume) {
        List<BarDaily> bars = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            bars.add(bar(i, close, close, volume));
        }
        return bars;
    }

    /**
     * 100, then ten closes each {@code factor} times the previous one.
     */
    private static List<BarDaily> compounding(double factor) {
        List<BarDaily> bars = new ArrayList<>();
        double close = 100.0;
        bars.add(bar(0, close, close, 1000.0));
        for (int i = 1; i <= 10; i++) {
            close *= factor;
            bars.add(bar(i, close, close, 1000.0));
        }
        return bars;
    }

    /**
     * 61 closes of 100 + 2i; the bar at {@code dropDay} closes at {@code dropFactor} of the previous close instead.
     */
    private static List<BarDaily> steadyRise(int dropDay, double dropFactor) {
        List<BarDaily> bars = new ArrayList<>();
        for (int i = 0; i <= 60; i++) {
            double close = i == dropDay ? (100.0 + 2 * (i - 1)) * dropFactor : 100.0 + 2 * i;
            bars.add(bar(i, close, close, 1000.0));
        }
        return bars;
    }

    /**
     * Sixteen flat sessions at 10, a jump to {@code jumpClose}, then three sessions at 11.1 -> 11.2.
     */
    private static List<BarDaily> apron(double jumpClose) {
        List<BarDaily> bars = flat(16, 10.0, 1000.0);
        bars.add(bar(16, 10.0, jumpClose, 3000.0));
        for (int i = 17; i <= 19; i++) {
            bars.add(bar(i, 11.1, 11.2, 1000.0));
        }
        return bars;
    }

    /**
     * Sixty sessions at 100 (day 30 closing at {@code day30Close}), then a 2% up day from 99 to 102 on 2.5x volume.
     */
    private static List<BarDaily> platform(double day30Close) {
        List<BarDaily> bars = flat(60, 100.0, 1000.0);
        bars.set(30, bar(30, 100.0, day30Close, 1000.0));
        bars.add(bar(60, 99.0, 102.0, 2500.0));
        return bars;
    }

    /**
     * Starts under ma250 at 95, climbs 2 a day to a 160 peak on day 30, then gives back 2 a day to 102.
     */
    private static List<BarDaily> peakAndPullback(double peakVolume) {
        List<BarDaily> bars = new ArrayList<>();
        bars.add(bar(0, 95.0, 95.0, 1000.0));
        for (int i = 1; i <= 30; i++) {
            double close = 100.0 + 2 * i;
            bars.add(bar(i, close, close, i == 30 ? peakVolume : 1000.0));
        }
        for (int i = 31; i < 60; i++) {
            double close = 160.0 - 2 * (i - 30);
            bars.add(bar(i, close, close, 1000.0));
        }
        return bars;
    }

    private static Map<String, Double> overbought() {
        Map<String, Double> values = new HashMap<>();
        values.put("kdjk", 80.0);
        values.put("kdjd", 70.0);
        values.put("kdjj", 100.0);
        values.put("rsi_6", 80.0);
        values.put("cci_14", 100.0);
        values.put("cr", 300.0);
        values.put("wr_6", -20.0);
        values.put("vr", 160.0);
        return values;
    }

    private static Map<String, Double> oversold() {
        Map<String, Double> values = new HashMap<>();
        values.put("kdjk", 19.9);
        values.put("kdjd", 29.9);
        values.put("kdjj", 9.9);
        values.put("rsi_6", 19.9);
        values.put("cci_14", -100.1);
        values.put("cr", 39.9);
        values.put("wr_6", -80.1);
        values.put("vr", 39.9);
        return values;
    }

    private static InstrumentWindow window(List<BarDaily> bars, int rows) {
        LocalDate date = bars.get(bars.size() - 1).tradeDate;
        return new InstrumentWindow(Instrument.active("600000", "test"), date, bars, ENGINE.computeSeries(bars, date, rows));
    }

    private static MarketSnapshot snapshot(InstrumentWindow window) {
        return MarketSnapshot.from(window.date, List.of(window));
    }

    private static List<BarDaily> buildBars(int count, double startClose, double step) {
        List<BarDaily> bars = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double close = startClose + step * i;
            bars.add(new BarDaily("600000", START.plusDays(i), close, close + 0.2, close - 0.2, close, 5_000_000.0));
        }
        return bars;
    }
}
