package com.stockscan.indicator;

import java.time.LocalDate;

/**
 * Read-only slice of a bar history. Index 0 is the oldest bar, {@code size() - 1} the evaluation date.
 * Bars after the evaluation date are not reachable.
 */
public final class BarWindow {
    private final BarSeries series;
    private final int start;
    private final int length;

    BarWindow(BarSeries series, int start, int length) {
        if (start < 0 || length <= 0 || start + length > series.size()) {
            throw new IllegalArgumentException("window out of range: start=" + start + ", length=" + length);
        }
        this.series = series;
        this.start = start;
        this.length = length;
    }

    public int size() {
        return length;
    }

    public int last() {
        return length - 1;
    }

    public LocalDate date(int i) {
        return series.dates[index(i)];
    }

    public double open(int i) {
        return series.opens[index(i)];
    }

    public double high(int i) {
        return series.highs[index(i)];
    }

    public double low(int i) {
        return series.lows[index(i)];
    }

    public double close(int i) {
        return series.closes[index(i)];
    }

    public double volume(int i) {
        return series.volumes[index(i)];
    }

    public double value(PriceField field, int i) {
        switch (field) {
            case OPEN:
                return open(i);
            case HIGH:
                return high(i);
            case LOW:
                return low(i);
            case VOLUME:
                return volume(i);
            case AMOUNT:
                return close(i) * volume(i);
            case CLOSE:
            default:
                return close(i);
        }
    }

    private int index(int i) {
        if (i < 0 || i >= length) {
            throw new IndexOutOfBoundsException("bar index " + i + " outside window of " + length);
        }
        return start + i;
    }
}
