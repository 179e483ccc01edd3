package com.stockscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result of driving one trading date through the pipeline.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class DateOutcome {
    public final LocalDate date;
    public final DateState state;
    public final OrchestrationError cause;
    public final String message;
    public final int universeSize;
    public final int fetched;
    public final Map<FetchFailure, Integer> fetchFailures;
    public final int indicatorRows;
    public final int matches;
    public final int strategyFailures;
    public final long elapsedMs;

    public static DateOutcome pending(LocalDate date) {
        return builder().date(date).state(DateState.PENDING).message("not_started").build();
    }

    public static DateOutcome skipped(LocalDate date, String reason) {
        return builder().date(date).state(DateState.SKIPPED).message(reason).build();
    }

    public static DateOutcome failed(LocalDate date, OrchestrationError cause, String message, long elapsedMs) {
        return builder()
                .date(date)
                .state(DateState.FAILED)
                .cause(cause)
                .message(message)
                .elapsedMs(elapsedMs)
                .build();
    }

    public boolean isFailed() {
        return state == DateState.FAILED;
    }

    public boolean isCommitted() {
        return state == DateState.COMMITTED;
    }

    public int fetchFailed() {
        if (fetchFailures == null) {
            return 0;
        }
        int total = 0;
        for (Integer count : fetchFailures.values()) {
            total += count == null ? 0 : count;
        }
        return total;
    }

    public int failureCount(FetchFailure kind) {
        if (fetchFailures == null) {
            return 0;
        }
        Integer count = fetchFailures.get(kind);
        return count == null ? 0 : count;
    }

    public Map<FetchFailure, Integer> fetchFailuresView() {
        if (fetchFailures == null || fetchFailures.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new EnumMap<>(fetchFailures));
    }

    public String summaryLine() {
        StringBuilder sb = new StringBuilder();
        sb.append(date).append(' ').append(state);
        if (cause != null) {
            sb.append(" cause=").append(cause);
        }
        if (state == DateState.COMMITTED) {
            sb.append(" universe=").append(universeSize)
                    .append(" fetched=").append(fetched)
                    .append(" fetch_failed=").append(fetchFailed())
                    .append(" indicator_rows=").append(indicatorRows)
                    .append(" matches=").append(matches)
                    .append(" strategy_failures=").append(strategyFailures);
        }
        if (message != null && !message.isEmpty()) {
            sb.append(" msg=").append(message);
        }
        if (elapsedMs > 0) {
            sb.append(" elapsed_ms=").append(elapsedMs);
        }
        return sb.toString();
    }
}
