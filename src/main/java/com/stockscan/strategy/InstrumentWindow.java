package com.stockscan.strategy;

import com.stockscan.model.BarDaily;
import com.stockscan.model.IndicatorRow;
import com.stockscan.model.Instrument;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything a strategy may look at for one instrument on one date: bars and indicator rows
 * up to and including that date, oldest first. Offsets count back from the evaluation date (0 = today).
 */
public final class InstrumentWindow {
    public final Instrument instrument;
    public final LocalDate date;
    private final List<BarDaily> bars;
    private final List<IndicatorRow> rows;

    public InstrumentWindow(Instrument instrument, LocalDate date, List<BarDaily> bars, List<IndicatorRow> rows) {
        if (bars.isEmpty() || !bars.get(bars.size() - 1).tradeDate.equals(date)) {
            throw new IllegalArgumentException("window for " + instrument.code + " must end with a bar on " + date);
        }
        if (rows.isEmpty() || !rows.get(rows.size() - 1).tradeDate.equals(date)) {
            throw new IllegalArgumentException("window for " + instrument.code + " must end with a row on " + date);
        }
        if (rows.size() > bars.size()) {
            throw new IllegalArgumentException("more indicator rows than bars for " + instrument.code);
        }
        this.instrument = instrument;
        this.date = date;
        this.bars = List.copyOf(bars);
        this.rows = List.copyOf(rows);
    }

    public String code() {
        return instrument.code;
    }

    public int barCount() {
        return bars.size();
    }

    public int rowCount() {
        return rows.size();
    }

    public BarDaily bar(int offset) {
        return bars.get(bars.size() - 1 - offset);
    }

    public BarDaily latestBar() {
        return bar(0);
    }

    public IndicatorRow latestRow() {
        return rows.get(rows.size() - 1);
    }

    /**
     * Indicator value {@code offset} rows back, NaN when undefined or before the first row.
     */
    public double indicator(String name, int offset) {
        int idx = rows.size() - 1 - offset;
        if (offset < 0 || idx < 0) {
            return Double.NaN;
        }
        return rows.get(idx).valueOrNaN(name);
    }

    public double indicator(String name) {
        return indicator(name, 0);
    }

    /**
     * Close-to-close change in percent for the bar {@code offset} back, NaN for the oldest bar.
     */
    public double pctChange(int offset) {
        int idx = bars.size() - 1 - offset;
        if (idx <= 0 || idx >= bars.size()) {
            return Double.NaN;
        }
        double prev = bars.get(idx - 1).close;
        if (prev == 0.0) {
            return Double.NaN;
        }
        return (bars.get(idx).close - prev) / prev * 100.0;
    }

    /**
     * Number of bars up to and including the bar {@code offset} back.
     */
    public int barsUpTo(int offset) {
        return Math.max(0, bars.size() - offset);
    }

    public double maxClose(int fromOffset, int count) {
        double max = Double.NEGATIVE_INFINITY;
        for (int k = fromOffset; k < fromOffset + count; k++) {
            max = Math.max(max, bar(k).close);
        }
        return max;
    }
}
