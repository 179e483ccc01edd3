package com.stockscan.indicator;

import java.util.OptionalDouble;

public final class BollingerBand extends AbstractIndicator {
    public enum Side {
        UPPER,
        LOWER
    }

    private final double k;
    private final Side side;

    public BollingerBand(String name, int period, double k, Side side) {
        super(name, period);
        this.k = k;
        this.side = side;
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        double mid = mean(window, PriceField.CLOSE, 0, window.size());
        double sumSq = 0.0;
        for (int i = 0; i < window.size(); i++) {
            double d = window.close(i) - mid;
            sumSq += d * d;
        }
        double stdev = Math.sqrt(sumSq / window.size());
        return defined(side == Side.UPPER ? mid + k * stdev : mid - k * stdev);
    }
}
