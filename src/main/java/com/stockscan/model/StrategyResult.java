package com.stockscan.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.TreeMap;

/**
 * A named strategy matched an instrument on a date; unique on (strategy, code, tradeDate).
 */
@EqualsAndHashCode
@ToString
public final class StrategyResult {
    public static final Comparator<StrategyResult> REPORT_ORDER = Comparator
            .comparing((StrategyResult r) -> r.strategy)
            .thenComparing(r -> r.code);

    public final String strategy;
    public final String code;
    public final LocalDate tradeDate;
    public final double score;
    public final Map<String, Double> params;

    public StrategyResult(String strategy, String code, LocalDate tradeDate, double score, Map<String, Double> params) {
        this.strategy = strategy;
        this.code = code;
        this.tradeDate = tradeDate;
        this.score = score;
        this.params = Collections.unmodifiableMap(new TreeMap<>(params == null ? Map.of() : params));
    }
}
