package com.stockscan.indicator;

import java.util.OptionalDouble;

/**
 * Simple moving average of one price field. A period of 1 yields the raw field value.
 */
public final class MovingAverage extends AbstractIndicator {
    private final PriceField field;

    public MovingAverage(String name, PriceField field, int period) {
        super(name, period);
        this.field = field;
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        return defined(mean(window, field, 0, window.size()));
    }
}
