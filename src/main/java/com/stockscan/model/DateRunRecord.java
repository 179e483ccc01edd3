package com.stockscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;

/**
 * Persisted status of a trading date, as read back from the store.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class DateRunRecord {
    public final LocalDate tradeDate;
    public final DateState state;
    public final String cause;
    public final int universeSize;
    public final int fetched;
    public final int fetchFailed;
    public final int matches;
    public final int strategyFailures;
    public final String message;

    public static DateRunRecord of(DateOutcome outcome) {
        return new DateRunRecord(
                outcome.date,
                outcome.state,
                outcome.cause == null ? null : outcome.cause.name(),
                outcome.universeSize,
                outcome.fetched,
                outcome.fetchFailed(),
                outcome.matches,
                outcome.strategyFailures,
                outcome.message == null ? "" : outcome.message
        );
    }
}
