package com.stockscan.strategy;

import com.stockscan.model.BarDaily;

import java.util.List;
import java.util.Optional;

/**
 * Within the last 60 bars, a volume-surge day opening below and closing at or above the 60-day average,
 * preceded by a flat platform hugging that average (-5% .. 20% deviation).
 */
public final class BreakthroughPlatformStrategy implements Strategy {
    private static final int THRESHOLD = 60;

    private final double minAmount;

    public BreakthroughPlatformStrategy(double minAmount) {
        this.minAmount = minAmount;
    }

    @Override
    public String name() {
        return "breakthrough_platform";
    }

    @Override
    public List<String> requiredIndicators() {
        return List.of("ma60");
    }

    @Override
    public List<EligibilityFilter> filters() {
        return List.of(EligibilityFilter.minBars(THRESHOLD));
    }

    @Override
    public int historyRows() {
        return THRESHOLD + 1;
    }

    @Override
    public Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market) {
        int breakthrough = -1;
        double surgeRatio = Double.NaN;
        for (int k = THRESHOLD - 1; k >= 0; k--) {
            BarDaily bar = window.bar(k);
            double ma60 = window.indicator("ma60", k);
            if (Double.isNaN(ma60) || !(bar.open < ma60 && ma60 <= bar.close)) {
                continue;
            }
            double ratio = Signals.volumeSurge(window, k, THRESHOLD, 2.0, true, minAmount, 2.0);
            if (!Double.isNaN(ratio)) {
                breakthrough = k;
                surgeRatio = ratio;
                break;
            }
        }
        if (breakthrough < 0) {
            return Optional.empty();
        }
        for (int k = THRESHOLD - 1; k > breakthrough; k--) {
            double ma60 = window.indicator("ma60", k);
            if (Double.isNaN(ma60) || ma60 <= 0.0) {
                continue;
            }
            double deviation = (ma60 - window.bar(k).close) / ma60;
            if (!(deviation > -0.05 && deviation < 0.2)) {
                return Optional.empty();
            }
        }
        return Optional.of(StrategyMatch.of(surgeRatio)
                .with("breakthrough_offset", breakthrough)
                .with("vol_ratio", surgeRatio));
    }
}
