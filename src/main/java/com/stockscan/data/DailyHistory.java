package com.stockscan.data;

import com.stockscan.model.BarDaily;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Bars returned by one upstream call, ascending and none after the requested date.
 */
public final class DailyHistory {
    public final String code;
    public final List<BarDaily> bars;

    public DailyHistory(String code, List<BarDaily> bars) {
        this.code = code;
        this.bars = List.copyOf(bars);
    }

    public Optional<BarDaily> barOn(LocalDate date) {
        for (int i = bars.size() - 1; i >= 0; i--) {
            BarDaily bar = bars.get(i);
            if (bar.tradeDate.equals(date)) {
                return Optional.of(bar);
            }
            if (bar.tradeDate.isBefore(date)) {
                break;
            }
        }
        return Optional.empty();
    }
}
