package com.stockscan.strategy;

import java.time.LocalDate;
import java.util.Collection;

/**
 * Market-wide aggregates for one date, computed once before evaluation and shared read-only.
 */
public final class MarketSnapshot {
    public final LocalDate date;
    public final int instrumentCount;
    public final int advancers;
    public final int decliners;
    public final double avgPctChange;
    public final double avgReturn20;

    public MarketSnapshot(
            LocalDate date,
            int instrumentCount,
            int advancers,
            int decliners,
            double avgPctChange,
            double avgReturn20
    ) {
        this.date = date;
        this.instrumentCount = instrumentCount;
        this.advancers = advancers;
        this.decliners = decliners;
        this.avgPctChange = avgPctChange;
        this.avgReturn20 = avgReturn20;
    }

    public static MarketSnapshot from(LocalDate date, Collection<InstrumentWindow> windows) {
        int advancers = 0;
        int decliners = 0;
        double pctSum = 0.0;
        int pctCount = 0;
        double retSum = 0.0;
        int retCount = 0;
        for (InstrumentWindow window : windows) {
            double pct = window.pctChange(0);
            if (!Double.isNaN(pct)) {
                pctSum += pct;
                pctCount++;
                if (pct > 0) {
                    advancers++;
                } else if (pct < 0) {
                    decliners++;
                }
            }
            double ret = window.indicator("return_20");
            if (!Double.isNaN(ret)) {
                retSum += ret;
                retCount++;
            }
        }
        return new MarketSnapshot(
                date,
                windows.size(),
                advancers,
                decliners,
                pctCount == 0 ? Double.NaN : pctSum / pctCount,
                retCount == 0 ? Double.NaN : retSum / retCount
        );
    }
}
