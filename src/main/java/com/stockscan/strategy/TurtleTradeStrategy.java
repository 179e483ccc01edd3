package com.stockscan.strategy;

import java.util.List;
import java.util.Optional;

/**
 * Donchian breakout: today's close is the highest close of the last 60 bars.
 */
public final class TurtleTradeStrategy implements Strategy {
    private static final int THRESHOLD = 60;

    @Override
    public String name() {
        return "turtle_trade";
    }

    @Override
    public List<String> requiredIndicators() {
        return List.of("high_60", "low_60");
    }

    @Override
    public List<EligibilityFilter> filters() {
        return List.of(EligibilityFilter.minBars(THRESHOLD));
    }

    @Override
    public Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market) {
        double close = window.latestBar().close;
        double high = window.indicator("high_60");
        double low = window.indicator("low_60");
        if (close < high || low <= 0.0) {
            return Optional.empty();
        }
        double range = close / low;
        return Optional.of(StrategyMatch.of(range)
                .with("close", close)
                .with("high_60", high)
                .with("low_60", low));
    }
}
