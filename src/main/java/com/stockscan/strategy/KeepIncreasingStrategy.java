package com.stockscan.strategy;

import java.util.List;
import java.util.Optional;

/**
 * 30-day average rising at each third of the last 30 bars and up more than 20% overall.
 */
public final class KeepIncreasingStrategy implements Strategy {
    private static final int THRESHOLD = 30;

    @Override
    public String name() {
        return "keep_increasing";
    }

    @Override
    public List<String> requiredIndicators() {
        return List.of("ma30");
    }

    @Override
    public List<EligibilityFilter> filters() {
        return List.of(EligibilityFilter.minBars(THRESHOLD));
    }

    @Override
    public int historyRows() {
        return THRESHOLD;
    }

    @Override
    public Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market) {
        int step1 = Math.round(THRESHOLD / 3.0f);
        int step2 = Math.round(THRESHOLD * 2 / 3.0f);
        double first = window.indicator("ma30", THRESHOLD - 1);
        double mid1 = window.indicator("ma30", THRESHOLD - 1 - step1);
        double mid2 = window.indicator("ma30", THRESHOLD - 1 - step2);
        double last = window.indicator("ma30", 0);
        if (Double.isNaN(first) || Double.isNaN(mid1) || Double.isNaN(mid2) || Double.isNaN(last)) {
            return Optional.empty();
        }
        if (!(first < mid1 && mid1 < mid2 && mid2 < last && last > 1.2 * first)) {
            return Optional.empty();
        }
        double growth = last / first;
        return Optional.of(StrategyMatch.of(growth)
                .with("ma30_start", first)
                .with("ma30_end", last));
    }
}
