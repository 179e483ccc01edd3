package com.stockscan.indicator;

import java.util.OptionalDouble;

/**
 * MACD of close: DIF = EMA(fast) - EMA(slow), DEA = EMA(signal) of DIF, histogram = DIF - DEA.
 * Every EMA is seeded with its first input, so the window has to be long enough for the seed to fade.
 */
public final class MovingAverageConvergence extends AbstractIndicator {
    public enum Line {
        DIF,
        DEA,
        HISTOGRAM
    }

    static final int DEFAULT_LOOKBACK = 150;

    private final int fast;
    private final int slow;
    private final int signal;
    private final Line line;

    public MovingAverageConvergence(String name, int fast, int slow, int signal, Line line) {
        this(name, fast, slow, signal, DEFAULT_LOOKBACK, line);
    }

    public MovingAverageConvergence(String name, int fast, int slow, int signal, int lookback, Line line) {
        super(name, lookback);
        if (fast <= 0 || slow <= fast || signal <= 0 || lookback < slow + signal) {
            throw new IllegalArgumentException("bad macd setup " + fast + "/" + slow + "/" + signal + " lookback=" + lookback);
        }
        this.fast = fast;
        this.slow = slow;
        this.signal = signal;
        this.line = line;
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        double fastAlpha = 2.0 / (fast + 1);
        double slowAlpha = 2.0 / (slow + 1);
        double signalAlpha = 2.0 / (signal + 1);
        double emaFast = window.close(0);
        double emaSlow = window.close(0);
        double dea = 0.0;
        double dif = 0.0;
        for (int i = 0; i < window.size(); i++) {
            double close = window.close(i);
            emaFast += fastAlpha * (close - emaFast);
            emaSlow += slowAlpha * (close - emaSlow);
            dif = emaFast - emaSlow;
            dea = i == 0 ? dif : dea + signalAlpha * (dif - dea);
        }
        switch (line) {
            case DIF:
                return defined(dif);
            case DEA:
                return defined(dea);
            case HISTOGRAM:
            default:
                return defined(dif - dea);
        }
    }
}
