package com.stockscan.indicator;

import java.util.OptionalDouble;

/**
 * RSI with simple averages of gains and losses over {@code period} changes.
 */
public final class RelativeStrengthIndex extends AbstractIndicator {

    public RelativeStrengthIndex(String name, int period) {
        super(name, period + 1);
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i < window.size(); i++) {
            double diff = window.close(i) - window.close(i - 1);
            if (diff >= 0) {
                gain += diff;
            } else {
                loss -= diff;
            }
        }
        if (loss == 0.0) {
            return gain == 0.0 ? OptionalDouble.of(50.0) : OptionalDouble.of(100.0);
        }
        double rs = gain / loss;
        return defined(100.0 - (100.0 / (1.0 + rs)));
    }
}
