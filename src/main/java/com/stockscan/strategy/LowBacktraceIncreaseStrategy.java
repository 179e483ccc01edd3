package com.stockscan.strategy;

import com.stockscan.model.BarDaily;

import java.util.List;
import java.util.Optional;

/**
 * Up at least 60% over 60 bars without a single- or two-day drawdown deeper than 7% / 10%.
 */
public final class LowBacktraceIncreaseStrategy implements Strategy {
    private static final int THRESHOLD = 60;

    @Override
    public String name() {
        return "low_backtrace_increase";
    }

    @Override
    public List<EligibilityFilter> filters() {
        return List.of(EligibilityFilter.minBars(THRESHOLD + 1));
    }

    @Override
    public Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market) {
        double startClose = window.bar(THRESHOLD - 1).close;
        double endClose = window.latestBar().close;
        if (startClose <= 0.0) {
            return Optional.empty();
        }
        double increase = (endClose - startClose) / startClose;
        if (increase < 0.6) {
            return Optional.empty();
        }
        double previousPct = Double.NaN;
        double previousOpen = Double.NaN;
        for (int k = THRESHOLD - 1; k >= 0; k--) {
            BarDaily bar = window.bar(k);
            double pct = window.pctChange(k);
            if (Double.isNaN(pct) || bar.open <= 0.0) {
                return Optional.empty();
            }
            if (pct < -7.0 || (bar.close - bar.open) / bar.open * 100.0 < -7.0) {
                return Optional.empty();
            }
            if (!Double.isNaN(previousPct)) {
                if (previousPct + pct < -10.0 || (bar.close - previousOpen) / previousOpen * 100.0 < -10.0) {
                    return Optional.empty();
                }
            }
            previousPct = pct;
            previousOpen = bar.open;
        }
        return Optional.of(StrategyMatch.of(increase).with("increase", increase));
    }
}
