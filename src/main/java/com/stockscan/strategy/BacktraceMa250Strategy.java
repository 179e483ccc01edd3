package com.stockscan.strategy;

import com.stockscan.model.BarDaily;

import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Crossed above the 250-day average, peaked, then pulled back 20%+ on shrinking volume
 * 10 to 50 days after the peak without closing below the average.
 */
public final class BacktraceMa250Strategy implements Strategy {
    private static final int MIN_LISTED_BARS = 250;
    private static final int THRESHOLD = 60;

    @Override
    public String name() {
        return "backtrace_ma250";
    }

    @Override
    public List<String> requiredIndicators() {
        return List.of("ma250");
    }

    @Override
    public List<EligibilityFilter> filters() {
        return List.of(EligibilityFilter.minBars(MIN_LISTED_BARS));
    }

    @Override
    public int historyRows() {
        return THRESHOLD;
    }

    @Override
    public Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market) {
        int highOffset = -1;
        double highClose = 0.0;
        double highVolume = 0.0;
        double lowClose = Double.MAX_VALUE;
        double lowVolume = 0.0;
        for (int k = THRESHOLD - 1; k >= 0; k--) {
            BarDaily bar = window.bar(k);
            if (bar.close > highClose) {
                highClose = bar.close;
                highVolume = bar.volume;
                highOffset = k;
            } else if (bar.close < lowClose) {
                lowClose = bar.close;
                lowVolume = bar.volume;
            }
        }
        if (highOffset < 0 || lowVolume == 0.0 || highVolume == 0.0) {
            return Optional.empty();
        }
        int frontOldest = THRESHOLD - 1;
        int frontNewest = highOffset + 1;
        if (frontNewest > frontOldest) {
            return Optional.empty();
        }
        if (!(window.bar(frontOldest).close < window.indicator("ma250", frontOldest)
                && window.bar(frontNewest).close > window.indicator("ma250", frontNewest))) {
            return Optional.empty();
        }

        int recentLowOffset = -1;
        double recentLowClose = Double.MAX_VALUE;
        double recentLowVolume = 0.0;
        for (int k = highOffset; k >= 0; k--) {
            BarDaily bar = window.bar(k);
            if (bar.close < window.indicator("ma250", k)) {
                return Optional.empty();
            }
            if (bar.close < recentLowClose) {
                recentLowClose = bar.close;
                recentLowVolume = bar.volume;
                recentLowOffset = k;
            }
        }
        long days = ChronoUnit.DAYS.between(window.bar(highOffset).tradeDate, window.bar(recentLowOffset).tradeDate);
        if (days < 10 || days > 50 || recentLowVolume <= 0.0) {
            return Optional.empty();
        }
        double volRatio = highVolume / recentLowVolume;
        double backRatio = recentLowClose / highClose;
        if (!(volRatio > 2.0 && backRatio < 0.8)) {
            return Optional.empty();
        }
        return Optional.of(StrategyMatch.of(volRatio)
                .with("vol_ratio", volRatio)
                .with("back_ratio", backRatio)
                .with("pullback_days", days));
    }
}
