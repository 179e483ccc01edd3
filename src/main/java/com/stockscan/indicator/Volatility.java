package com.stockscan.indicator;

import java.util.OptionalDouble;

/**
 * Annualized standard deviation of daily log returns, in percent.
 */
public final class Volatility extends AbstractIndicator {

    public Volatility(String name, int period) {
        super(name, period + 1);
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        int count = window.size() - 1;
        double[] returns = new double[count];
        for (int i = 0; i < count; i++) {
            double prev = window.close(i);
            double next = window.close(i + 1);
            if (prev <= 0 || next <= 0) {
                return OptionalDouble.empty();
            }
            returns[i] = Math.log(next / prev);
        }
        double mean = 0.0;
        for (double r : returns) {
            mean += r;
        }
        mean /= count;
        double var = 0.0;
        for (double r : returns) {
            double d = r - mean;
            var += d * d;
        }
        var /= count;
        return defined(Math.sqrt(var) * Math.sqrt(252.0) * 100.0);
    }
}
