package com.stockscan.strategy;

import java.util.List;
import java.util.Optional;

/**
 * Up day of at least 2% on a bullish candle with volume at least twice the prior 5-day average.
 */
public final class VolumeSurgeStrategy implements Strategy {
    static final int THRESHOLD = 60;

    private final double minAmount;

    public VolumeSurgeStrategy(double minAmount) {
        this.minAmount = minAmount;
    }

    @Override
    public String name() {
        return "volume_surge";
    }

    @Override
    public List<String> requiredIndicators() {
        return List.of("vol_ma5");
    }

    @Override
    public List<EligibilityFilter> filters() {
        return List.of(EligibilityFilter.minBars(THRESHOLD + 1), EligibilityFilter.minAmount(minAmount));
    }

    @Override
    public int historyRows() {
        return 2;
    }

    @Override
    public Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market) {
        double ratio = Signals.volumeSurge(window, 0, THRESHOLD, 2.0, true, minAmount, 2.0);
        if (Double.isNaN(ratio)) {
            return Optional.empty();
        }
        return Optional.of(StrategyMatch.of(ratio)
                .with("vol_ratio", ratio)
                .with("pct_change", window.pctChange(0))
                .with("amount", window.latestBar().amount()));
    }
}
