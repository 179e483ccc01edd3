package com.stockscan.strategy;

import java.util.List;
import java.util.Optional;

/**
 * 20-day return beats the market-wide average by at least {@code margin} percentage points,
 * with the close above its 20-day average.
 */
public final class RelativeStrengthStrategy implements Strategy {
    private final double margin;

    public RelativeStrengthStrategy(double margin) {
        this.margin = margin;
    }

    @Override
    public String name() {
        return "relative_strength";
    }

    @Override
    public List<String> requiredIndicators() {
        return List.of("return_20", "ma20");
    }

    @Override
    public Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market) {
        if (Double.isNaN(market.avgReturn20)) {
            return Optional.empty();
        }
        double ret = window.indicator("return_20");
        double excess = ret - market.avgReturn20;
        if (excess < margin || window.latestBar().close <= window.indicator("ma20")) {
            return Optional.empty();
        }
        return Optional.of(StrategyMatch.of(excess)
                .with("return_20", ret)
                .with("market_return_20", market.avgReturn20));
    }
}
