package com.stockscan.indicator;

import java.util.OptionalDouble;

public final class AverageTrueRange extends AbstractIndicator {

    public AverageTrueRange(String name, int period) {
        super(name, period + 1);
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        double sum = 0.0;
        for (int i = 1; i < window.size(); i++) {
            double prevClose = window.close(i - 1);
            double tr1 = window.high(i) - window.low(i);
            double tr2 = Math.abs(window.high(i) - prevClose);
            double tr3 = Math.abs(window.low(i) - prevClose);
            sum += Math.max(tr1, Math.max(tr2, tr3));
        }
        return defined(sum / (window.size() - 1));
    }
}
