package com.stockscan.indicator;

import java.util.OptionalDouble;

/**
 * Williams %R in [-100, 0]; values near 0 are overbought.
 */
public final class WilliamsR extends AbstractIndicator {

    public WilliamsR(String name, int period) {
        super(name, period);
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        double hh = Double.NEGATIVE_INFINITY;
        double ll = Double.POSITIVE_INFINITY;
        for (int i = 0; i < window.size(); i++) {
            hh = Math.max(hh, window.high(i));
            ll = Math.min(ll, window.low(i));
        }
        double range = hh - ll;
        if (range <= 0.0) {
            return OptionalDouble.empty();
        }
        return defined((window.close(window.last()) - hh) / range * 100.0);
    }
}
