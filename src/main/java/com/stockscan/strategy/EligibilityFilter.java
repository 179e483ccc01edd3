package com.stockscan.strategy;

/**
 * Checked before a strategy's predicate; an instrument that does not pass is left out of the results.
 */
public interface EligibilityFilter {

    boolean accepts(InstrumentWindow window, MarketSnapshot market);

    static EligibilityFilter minBars(int bars) {
        return (window, market) -> window.barCount() >= bars;
    }

    /**
     * Turnover (close * volume) on the evaluation date at or above {@code amount}.
     */
    static EligibilityFilter minAmount(double amount) {
        return (window, market) -> window.latestBar().amount() >= amount;
    }

    /**
     * Mean turnover over the last {@code days} bars at or above {@code amount}.
     */
    static EligibilityFilter minAverageAmount(double amount, int days) {
        return (window, market) -> {
            if (window.barCount() < days) {
                return false;
            }
            double sum = 0.0;
            for (int k = 0; k < days; k++) {
                sum += window.bar(k).amount();
            }
            return sum / days >= amount;
        };
    }
}
