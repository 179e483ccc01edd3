package com.stockscan.indicator;

import java.util.OptionalDouble;

/**
 * Close change in percent over {@code days} bars; {@code days = 1} is the daily change.
 */
public final class PercentChange extends AbstractIndicator {

    public PercentChange(String name, int days) {
        super(name, days + 1);
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        double base = window.close(0);
        if (base == 0.0) {
            return OptionalDouble.empty();
        }
        return defined((window.close(window.last()) - base) / base * 100.0);
    }
}
