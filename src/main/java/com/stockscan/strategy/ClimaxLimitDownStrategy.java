package com.stockscan.strategy;

import com.stockscan.model.BarDaily;

import java.util.List;
import java.util.Optional;

/**
 * Limit-down day (-9.5% or worse) on volume at least four times the prior 5-day average.
 */
public final class ClimaxLimitDownStrategy implements Strategy {
    private static final int THRESHOLD = 60;

    private final double minAmount;

    public ClimaxLimitDownStrategy(double minAmount) {
        this.minAmount = minAmount;
    }

    @Override
    public String name() {
        return "climax_limitdown";
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
        double pct = window.pctChange(0);
        if (Double.isNaN(pct) || pct > -9.5) {
            return Optional.empty();
        }
        double prevVolMa5 = window.indicator("vol_ma5", 1);
        if (Double.isNaN(prevVolMa5) || prevVolMa5 <= 0.0) {
            return Optional.empty();
        }
        BarDaily bar = window.latestBar();
        double ratio = bar.volume / prevVolMa5;
        if (ratio < 4.0) {
            return Optional.empty();
        }
        return Optional.of(StrategyMatch.of(ratio)
                .with("vol_ratio", ratio)
                .with("pct_change", pct)
                .with("amount", bar.amount()));
    }
}
