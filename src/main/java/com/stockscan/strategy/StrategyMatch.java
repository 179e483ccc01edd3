package com.stockscan.strategy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Score and parameter values that produced a match.
 */
public final class StrategyMatch {
    public final double score;
    public final Map<String, Double> params;

    private StrategyMatch(double score, Map<String, Double> params) {
        this.score = score;
        this.params = Collections.unmodifiableMap(params);
    }

    public static StrategyMatch of(double score) {
        return new StrategyMatch(score, new LinkedHashMap<>());
    }

    public StrategyMatch with(String name, double value) {
        Map<String, Double> next = new LinkedHashMap<>(params);
        next.put(name, value);
        return new StrategyMatch(score, next);
    }
}
