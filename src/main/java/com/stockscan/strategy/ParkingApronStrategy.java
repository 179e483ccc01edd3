package com.stockscan.strategy;

import com.stockscan.model.BarDaily;

import java.util.List;
import java.util.Optional;

/**
 * Limit-up breakout within the last 15 bars followed by three tight sessions holding above the limit-up close.
 */
public final class ParkingApronStrategy implements Strategy {
    private static final int THRESHOLD = 15;
    private static final int CONSOLIDATION_DAYS = 3;

    @Override
    public String name() {
        return "parking_apron";
    }

    @Override
    public List<EligibilityFilter> filters() {
        return List.of(EligibilityFilter.minBars(THRESHOLD + 1));
    }

    @Override
    public Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market) {
        for (int k = THRESHOLD - 1; k >= CONSOLIDATION_DAYS; k--) {
            double pct = window.pctChange(k);
            if (Double.isNaN(pct) || pct <= 9.5) {
                continue;
            }
            if (!Signals.turtleEnter(window, k, THRESHOLD)) {
                continue;
            }
            double limitUpClose = window.bar(k).close;
            if (holdsAbove(window, k, limitUpClose)) {
                double score = window.latestBar().close / limitUpClose;
                return Optional.of(StrategyMatch.of(score)
                        .with("limitup_close", limitUpClose)
                        .with("limitup_offset", k));
            }
        }
        return Optional.empty();
    }

    private boolean holdsAbove(InstrumentWindow window, int limitUpOffset, double limitUpClose) {
        for (int day = 1; day <= CONSOLIDATION_DAYS; day++) {
            int offset = limitUpOffset - day;
            BarDaily bar = window.bar(offset);
            if (bar.open <= 0.0 || bar.close <= limitUpClose || bar.open <= limitUpClose) {
                return false;
            }
            double body = bar.close / bar.open;
            if (!(body > 0.97 && body < 1.03)) {
                return false;
            }
            if (day > 1) {
                double pct = window.pctChange(offset);
                if (!(pct > -5.0 && pct < 5.0)) {
                    return false;
                }
            }
        }
        return true;
    }
}
