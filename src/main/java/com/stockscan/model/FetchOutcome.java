package com.stockscan.model;

import java.util.List;

/**
 * Exactly one per instrument per fetch run: either a bar for the requested date or a classified failure.
 */
public final class FetchOutcome {
    public final Instrument instrument;
    public final BarDaily bar;
    public final List<BarDaily> history;
    public final FetchFailure failure;
    public final String message;
    public final int attempts;

    private FetchOutcome(
            Instrument instrument,
            BarDaily bar,
            List<BarDaily> history,
            FetchFailure failure,
            String message,
            int attempts
    ) {
        this.instrument = instrument;
        this.bar = bar;
        this.history = history == null ? List.of() : List.copyOf(history);
        this.failure = failure;
        this.message = message == null ? "" : message;
        this.attempts = Math.max(0, attempts);
    }

    /**
     * @param history upstream look-back bars up to and including the bar's date, ascending
     */
    public static FetchOutcome success(Instrument instrument, BarDaily bar, List<BarDaily> history, int attempts) {
        if (bar == null) {
            throw new IllegalArgumentException("successful fetch requires a bar");
        }
        return new FetchOutcome(instrument, bar, history, null, "", attempts);
    }

    public static FetchOutcome failed(Instrument instrument, FetchFailure failure, String message, int attempts) {
        if (failure == null) {
            throw new IllegalArgumentException("failed fetch requires a failure kind");
        }
        return new FetchOutcome(instrument, null, List.of(), failure, message, attempts);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "FetchOutcome{" + instrument.code + " ok attempts=" + attempts + "}";
        }
        return "FetchOutcome{" + instrument.code + " " + failure.label() + " attempts=" + attempts + " msg=" + message + "}";
    }
}
