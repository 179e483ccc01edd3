package com.stockscan.db;

import com.stockscan.model.BarDaily;
import com.stockscan.model.DateRunRecord;
import com.stockscan.model.IndicatorRow;
import com.stockscan.model.Instrument;
import com.stockscan.model.OrchestrationError;
import com.stockscan.model.StrategyResult;

import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 模块说明：MarketStore（interface）。
 * 主要职责：按交易日分区保存行情、指标、策略结果；同一交易日的提交是整体覆盖的单个事务。
 * 使用建议：查询接口只读，供看板和自动交易模块消费。
 */
public interface MarketStore {

    /**
     * Replaces the date partition with the batch, atomically. A retried commit of the same batch is a no-op in effect.
     */
    void commitDate(DateBatch batch) throws StoreException;

    /**
     * Records a date that did not commit. Data already committed for that date is left untouched.
     */
    void recordFailedDate(LocalDate date, OrchestrationError cause, String message) throws StoreException;

    /**
     * Ascending bars with {@code from <= tradeDate <= to}.
     */
    List<BarDaily> getBars(String code, LocalDate from, LocalDate to) throws StoreException;

    /**
     * Up to {@code limit} most recent bars strictly before {@code before}, ascending.
     */
    List<BarDaily> getRecentBars(String code, LocalDate before, int limit) throws StoreException;

    default Map<String, List<BarDaily>> getRecentBars(Collection<String> codes, LocalDate before, int limit)
            throws StoreException {
        Map<String, List<BarDaily>> out = new LinkedHashMap<>();
        for (String code : codes) {
            out.put(code, getRecentBars(code, before, limit));
        }
        return out;
    }

    Optional<IndicatorRow> getIndicators(String code, LocalDate date) throws StoreException;

    /**
     * Results for the date, sorted by strategy name then code; optionally one strategy only.
     */
    List<StrategyResult> getStrategyResults(LocalDate date, Optional<String> strategy) throws StoreException;

    /**
     * Results committed within {@code [from, to]}, sorted by date, strategy, code.
     */
    List<StrategyResult> getStrategyResults(LocalDate from, LocalDate to) throws StoreException;

    default List<StrategyResult> listMatches(LocalDate date) throws StoreException {
        return getStrategyResults(date, Optional.empty());
    }

    Optional<DateRunRecord> getDateRun(LocalDate date) throws StoreException;

    List<Instrument> listUniverse() throws StoreException;

    void replaceUniverse(List<Instrument> instruments) throws StoreException;
}
