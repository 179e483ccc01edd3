package com.stockscan.indicator;

import com.stockscan.model.BarDaily;

import java.time.LocalDate;
import java.util.List;

/**
 * Column view of an ascending bar history, shared by every window cut from it.
 */
final class BarSeries {
    final LocalDate[] dates;
    final double[] opens;
    final double[] highs;
    final double[] lows;
    final double[] closes;
    final double[] volumes;

    BarSeries(List<BarDaily> bars) {
        int size = bars.size();
        dates = new LocalDate[size];
        opens = new double[size];
        highs = new double[size];
        lows = new double[size];
        closes = new double[size];
        volumes = new double[size];
        for (int i = 0; i < size; i++) {
            BarDaily bar = bars.get(i);
            dates[i] = bar.tradeDate;
            opens[i] = bar.open;
            highs[i] = bar.high;
            lows[i] = bar.low;
            closes[i] = bar.close;
            volumes[i] = bar.volume;
        }
    }

    int size() {
        return closes.length;
    }

    BarWindow window(int endInclusive, int length) {
        return new BarWindow(this, endInclusive - length + 1, length);
    }
}
