package com.stockscan.indicator;

import java.util.OptionalDouble;

/**
 * Distance of the close from its {@code period}-day mean, in %.
 */
public final class Bias extends AbstractIndicator {

    public Bias(String name, int period) {
        super(name, period);
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        double ma = mean(window, PriceField.CLOSE, 0, window.size());
        if (ma == 0.0) {
            return OptionalDouble.empty();
        }
        return defined((window.close(window.last()) - ma) / ma * 100.0);
    }
}
