package com.stockscan.strategy;

import java.util.List;
import java.util.Optional;

/**
 * Mirror of {@link OverboughtMomentumStrategy}: kdjk < 20, kdjd < 30, kdjj < 10, rsi_6 < 20,
 * cci_14 < -100, cr < 40, wr_6 < -80, vr < 40.
 */
public final class OversoldReversalStrategy implements Strategy {

    @Override
    public String name() {
        return "oversold_reversal";
    }

    @Override
    public List<String> requiredIndicators() {
        return OverboughtMomentumStrategy.INDICATORS;
    }

    @Override
    public Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market) {
        boolean hit = window.indicator("kdjk") < 20.0
                && window.indicator("kdjd") < 30.0
                && window.indicator("kdjj") < 10.0
                && window.indicator("rsi_6") < 20.0
                && window.indicator("cci_14") < -100.0
                && window.indicator("cr") < 40.0
                && window.indicator("wr_6") < -80.0
                && window.indicator("vr") < 40.0;
        if (!hit) {
            return Optional.empty();
        }
        double rsi = window.indicator("rsi_6");
        return Optional.of(OverboughtMomentumStrategy.withIndicators(StrategyMatch.of(100.0 - rsi), window));
    }
}
