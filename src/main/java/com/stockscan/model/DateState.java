package com.stockscan.model;

/**
 * Per trading date lifecycle inside a job run.
 */
public enum DateState {
    PENDING,
    FETCHING,
    COMPUTING,
    EVALUATING,
    COMMITTED,
    FAILED,
    /** Requested explicitly but not a trading day; never fetched. */
    SKIPPED;

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED || this == SKIPPED;
    }
}
