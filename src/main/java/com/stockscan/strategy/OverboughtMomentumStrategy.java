package com.stockscan.strategy;

import java.util.List;
import java.util.Optional;

/**
 * Every oscillator in overbought territory at once:
 * kdjk >= 80, kdjd >= 70, kdjj >= 100, rsi_6 >= 80, cci_14 >= 100, cr >= 300, wr_6 >= -20, vr >= 160.
 */
public final class OverboughtMomentumStrategy implements Strategy {
    static final List<String> INDICATORS = List.of("kdjk", "kdjd", "kdjj", "rsi_6", "cci_14", "cr", "wr_6", "vr");

    @Override
    public String name() {
        return "overbought_momentum";
    }

    @Override
    public List<String> requiredIndicators() {
        return INDICATORS;
    }

    @Override
    public Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market) {
        boolean hit = window.indicator("kdjk") >= 80.0
                && window.indicator("kdjd") >= 70.0
                && window.indicator("kdjj") >= 100.0
                && window.indicator("rsi_6") >= 80.0
                && window.indicator("cci_14") >= 100.0
                && window.indicator("cr") >= 300.0
                && window.indicator("wr_6") >= -20.0
                && window.indicator("vr") >= 160.0;
        if (!hit) {
            return Optional.empty();
        }
        return Optional.of(withIndicators(StrategyMatch.of(window.indicator("rsi_6")), window));
    }

    static StrategyMatch withIndicators(StrategyMatch match, InstrumentWindow window) {
        StrategyMatch out = match;
        for (String name : INDICATORS) {
            out = out.with(name, window.indicator(name));
        }
        return out;
    }
}
