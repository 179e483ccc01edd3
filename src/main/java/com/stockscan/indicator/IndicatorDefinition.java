package com.stockscan.indicator;

import java.util.OptionalDouble;

/**
 * One named indicator, computed from a bounded window of bars ending at the evaluation date.
 */
public interface IndicatorDefinition {

    String name();

    /**
     * Number of bars the window must contain, the current bar included.
     */
    int lookback();

    /**
     * Called only with windows of exactly {@link #lookback()} bars. Empty means undefined.
     */
    OptionalDouble compute(BarWindow window);
}
