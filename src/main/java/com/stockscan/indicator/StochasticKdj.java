package com.stockscan.indicator;

import java.util.OptionalDouble;

/**
 * KDJ stochastic. RSV over {@code period} bars is smoothed twice with weight 1/3, both lines seeded at 50,
 * and J = 3K - 2D. The window carries {@code warmup} extra bars so the seed has decayed by D.
 */
public final class StochasticKdj extends AbstractIndicator {
    public enum Line {
        K,
        D,
        J
    }

    static final int DEFAULT_WARMUP = 50;

    private final int period;
    private final Line line;

    public StochasticKdj(String name, int period, Line line) {
        this(name, period, DEFAULT_WARMUP, line);
    }

    public StochasticKdj(String name, int period, int warmup, Line line) {
        super(name, period + warmup);
        if (period <= 0 || warmup < 0) {
            throw new IllegalArgumentException("bad kdj period/warmup: " + period + "/" + warmup);
        }
        this.period = period;
        this.line = line;
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        double k = 50.0;
        double d = 50.0;
        for (int end = period - 1; end < window.size(); end++) {
            double hh = Double.NEGATIVE_INFINITY;
            double ll = Double.POSITIVE_INFINITY;
            for (int i = end - period + 1; i <= end; i++) {
                hh = Math.max(hh, window.high(i));
                ll = Math.min(ll, window.low(i));
            }
            // flat range: neutral RSV
            double rsv = hh > ll ? (window.close(end) - ll) / (hh - ll) * 100.0 : 50.0;
            k = k * 2.0 / 3.0 + rsv / 3.0;
            d = d * 2.0 / 3.0 + k / 3.0;
        }
        switch (line) {
            case K:
                return defined(k);
            case D:
                return defined(d);
            case J:
            default:
                return defined(3.0 * k - 2.0 * d);
        }
    }
}
