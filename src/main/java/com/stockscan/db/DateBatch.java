package com.stockscan.db;

import com.stockscan.model.BarDaily;
import com.stockscan.model.DateRunRecord;
import com.stockscan.model.IndicatorRow;
import com.stockscan.model.StrategyResult;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything committed for one trading date: bars, indicator rows, strategy results and the run record.
 * The store replaces the whole date partition with this batch.
 */
public final class DateBatch {
    public final LocalDate date;
    public final List<BarDaily> bars;
    public final List<IndicatorRow> indicatorRows;
    public final List<StrategyResult> results;
    public final DateRunRecord run;

    public DateBatch(
            LocalDate date,
            List<BarDaily> bars,
            List<IndicatorRow> indicatorRows,
            List<StrategyResult> results,
            DateRunRecord run
    ) {
        this.date = date;
        this.bars = List.copyOf(bars);
        this.indicatorRows = List.copyOf(indicatorRows);
        this.results = List.copyOf(results);
        this.run = run;
    }

    /**
     * Rejects rows dated elsewhere and duplicate keys before anything is written.
     */
    public void validate() throws StoreException {
        if (run == null || !date.equals(run.tradeDate)) {
            throw violation("run record must be dated " + date);
        }
        Set<String> barKeys = new HashSet<>();
        for (BarDaily bar : bars) {
            if (!date.equals(bar.tradeDate)) {
                throw violation("bar " + bar.code + " dated " + bar.tradeDate + " in batch for " + date);
            }
            if (!barKeys.add(bar.code)) {
                throw violation("duplicate bar (" + bar.code + ", " + date + ")");
            }
        }
        Set<String> rowKeys = new HashSet<>();
        for (IndicatorRow row : indicatorRows) {
            if (!date.equals(row.tradeDate)) {
                throw violation("indicator row " + row.code + " dated " + row.tradeDate + " in batch for " + date);
            }
            if (!rowKeys.add(row.code)) {
                throw violation("duplicate indicator row (" + row.code + ", " + date + ")");
            }
        }
        Set<String> resultKeys = new HashSet<>();
        for (StrategyResult result : results) {
            if (!date.equals(result.tradeDate)) {
                throw violation("result " + result.strategy + "/" + result.code + " dated " + result.tradeDate);
            }
            if (!resultKeys.add(result.strategy + "\u0000" + result.code)) {
                throw violation("duplicate strategy result (" + result.strategy + ", " + result.code + ", " + date + ")");
            }
        }
    }

    private static StoreException violation(String message) {
        return new StoreException(StoreError.CONSTRAINT_VIOLATION, message);
    }
}
