package com.stockscan.strategy;

import com.stockscan.model.BarDaily;

/**
 * Bar patterns shared by several strategies, evaluated at a given offset back from the window's date.
 */
final class Signals {
    private Signals() {
    }

    /**
     * Volume-to-prior-5-day-average ratio if the bar at {@code offset} is a volume surge, NaN otherwise.
     * The average is taken from the {@code vol_ma5} row of the previous bar.
     */
    static double volumeSurge(
            InstrumentWindow window,
            int offset,
            int threshold,
            double minPctChange,
            boolean requireUpCandle,
            double minAmount,
            double minRatio
    ) {
        if (window.barsUpTo(offset) < threshold + 1) {
            return Double.NaN;
        }
        BarDaily bar = window.bar(offset);
        double pct = window.pctChange(offset);
        if (Double.isNaN(pct) || pct < minPctChange) {
            return Double.NaN;
        }
        if (requireUpCandle && bar.close < bar.open) {
            return Double.NaN;
        }
        if (bar.amount() < minAmount) {
            return Double.NaN;
        }
        double prevVolMa5 = window.indicator("vol_ma5", offset + 1);
        if (Double.isNaN(prevVolMa5) || prevVolMa5 <= 0.0) {
            return Double.NaN;
        }
        double ratio = bar.volume / prevVolMa5;
        return ratio >= minRatio ? ratio : Double.NaN;
    }

    /**
     * Close at {@code offset} is the highest close of the {@code threshold} bars ending there.
     */
    static boolean turtleEnter(InstrumentWindow window, int offset, int threshold) {
        if (window.barsUpTo(offset) < threshold) {
            return false;
        }
        return window.bar(offset).close >= window.maxClose(offset, threshold);
    }
}
