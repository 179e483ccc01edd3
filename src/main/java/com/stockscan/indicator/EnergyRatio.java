package com.stockscan.indicator;

import java.util.OptionalDouble;

/**
 * CR energy: over {@code period} days, the sum of highs above the previous day's typical price
 * against the sum of lows below it, times 100.
 */
public final class EnergyRatio extends AbstractIndicator {

    public EnergyRatio(String name, int period) {
        super(name, period + 1);
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        double up = 0.0;
        double down = 0.0;
        for (int i = 1; i < window.size(); i++) {
            double mid = (window.high(i - 1) + window.low(i - 1) + window.close(i - 1)) / 3.0;
            up += Math.max(0.0, window.high(i) - mid);
            down += Math.max(0.0, mid - window.low(i));
        }
        if (down <= 0.0) {
            return OptionalDouble.empty();
        }
        return defined(up / down * 100.0);
    }
}
