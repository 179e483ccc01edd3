package com.stockscan.strategy;

import com.stockscan.model.StrategyResult;

import java.time.LocalDate;
import java.util.List;

public final class StrategyEvaluation {
    public final LocalDate date;
    public final List<StrategyResult> results;
    public final List<StrategyFailure> failures;
    public final int evaluatedPairs;
    public final int filteredPairs;

    public StrategyEvaluation(
            LocalDate date,
            List<StrategyResult> results,
            List<StrategyFailure> failures,
            int evaluatedPairs,
            int filteredPairs
    ) {
        this.date = date;
        this.results = List.copyOf(results);
        this.failures = List.copyOf(failures);
        this.evaluatedPairs = evaluatedPairs;
        this.filteredPairs = filteredPairs;
    }
}
