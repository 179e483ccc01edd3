package com.stockscan.strategy;

import java.util.List;
import java.util.Optional;

/**
 * A named screening rule over one instrument's indicator history.
 * Implementations must be stateless; anything market-wide comes in through {@link MarketSnapshot}.
 */
public interface Strategy {

    String name();

    /**
     * Indicators that must be defined on the evaluation date. If one is undefined the
     * instrument is a non-match and {@link #evaluate} is not called.
     */
    default List<String> requiredIndicators() {
        return List.of();
    }

    default List<EligibilityFilter> filters() {
        return List.of();
    }

    /**
     * Indicator rows needed, the evaluation date included.
     */
    default int historyRows() {
        return 1;
    }

    Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market);
}
