package com.stockscan.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered {date: outcome} summary of a job run. Failed dates are never folded into success counts.
 */
public final class BackfillReport {
    private final Map<LocalDate, DateOutcome> outcomes;
    public final boolean cancelled;

    public BackfillReport(List<DateOutcome> outcomes, boolean cancelled) {
        Map<LocalDate, DateOutcome> ordered = new LinkedHashMap<>();
        for (DateOutcome outcome : outcomes) {
            ordered.put(outcome.date, outcome);
        }
        this.outcomes = Collections.unmodifiableMap(ordered);
        this.cancelled = cancelled;
    }

    public Map<LocalDate, DateOutcome> outcomes() {
        return outcomes;
    }

    public DateOutcome outcome(LocalDate date) {
        return outcomes.get(date);
    }

    public List<DateOutcome> failedDates() {
        List<DateOutcome> out = new ArrayList<>();
        for (DateOutcome outcome : outcomes.values()) {
            if (outcome.isFailed()) {
                out.add(outcome);
            }
        }
        return out;
    }

    public int count(DateState state) {
        int n = 0;
        for (DateOutcome outcome : outcomes.values()) {
            if (outcome.state == state) {
                n++;
            }
        }
        return n;
    }

    public boolean hasFailures() {
        return count(DateState.FAILED) > 0;
    }

    /**
     * True when every requested date either committed or was skipped as a non-trading day.
     */
    public boolean isSuccessful() {
        return !cancelled && count(DateState.COMMITTED) + count(DateState.SKIPPED) == outcomes.size();
    }

    public String summaryText() {
        StringBuilder sb = new StringBuilder();
        sb.append("BACKFILL dates=").append(outcomes.size())
                .append(" committed=").append(count(DateState.COMMITTED))
                .append(" failed=").append(count(DateState.FAILED))
                .append(" skipped=").append(count(DateState.SKIPPED))
                .append(" pending=").append(count(DateState.PENDING));
        if (cancelled) {
            sb.append(" cancelled=true");
        }
        sb.append('\n');
        for (DateOutcome outcome : outcomes.values()) {
            sb.append(" - ").append(outcome.summaryLine()).append('\n');
        }
        List<DateOutcome> failed = failedDates();
        if (!failed.isEmpty()) {
            sb.append("FAILED dates:\n");
            for (DateOutcome outcome : failed) {
                sb.append(" - ").append(outcome.date).append(" cause=").append(outcome.cause)
                        .append(" msg=").append(outcome.message).append('\n');
            }
        }
        return sb.toString();
    }
}
