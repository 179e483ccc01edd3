package com.stockscan.strategy;

import java.util.List;
import java.util.Optional;

/**
 * Seasoned instrument whose last 10 bars move calmly on average yet span more than a 110% close range.
 */
public final class LowAtrGrowthStrategy implements Strategy {
    private static final int MIN_LISTED_BARS = 250;
    private static final int THRESHOLD = 10;

    @Override
    public String name() {
        return "low_atr_growth";
    }

    @Override
    public List<EligibilityFilter> filters() {
        return List.of(EligibilityFilter.minBars(MIN_LISTED_BARS));
    }

    @Override
    public Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market) {
        double totalChange = 0.0;
        double highest = Double.NEGATIVE_INFINITY;
        double lowest = Double.POSITIVE_INFINITY;
        for (int k = 0; k < THRESHOLD; k++) {
            double pct = window.pctChange(k);
            if (Double.isNaN(pct)) {
                return Optional.empty();
            }
            totalChange += Math.abs(pct);
            double close = window.bar(k).close;
            highest = Math.max(highest, close);
            lowest = Math.min(lowest, close);
        }
        double avgAbsChange = totalChange / THRESHOLD;
        if (avgAbsChange > 10.0 || lowest <= 0.0) {
            return Optional.empty();
        }
        double ratio = (highest - lowest) / lowest;
        if (ratio <= 1.1) {
            return Optional.empty();
        }
        return Optional.of(StrategyMatch.of(ratio)
                .with("avg_abs_change", avgAbsChange)
                .with("range_ratio", ratio));
    }
}
