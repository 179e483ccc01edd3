package com.stockscan.indicator;

import java.util.OptionalDouble;

public final class CommodityChannelIndex extends AbstractIndicator {

    public CommodityChannelIndex(String name, int period) {
        super(name, period);
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        int n = window.size();
        double[] typical = new double[n];
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            typical[i] = (window.high(i) + window.low(i) + window.close(i)) / 3.0;
            sum += typical[i];
        }
        double mean = sum / n;
        double dev = 0.0;
        for (double tp : typical) {
            dev += Math.abs(tp - mean);
        }
        dev /= n;
        if (dev == 0.0) {
            return OptionalDouble.empty();
        }
        return defined((typical[n - 1] - mean) / (0.015 * dev));
    }
}
