package com.stockscan.model;

import java.util.Locale;

/**
 * Classified reason a per-instrument fetch did not produce a bar.
 */
public enum FetchFailure {
    NOT_FOUND("not_found", false),
    RATE_LIMITED("rate_limited", true),
    TRANSIENT("transient", true),
    MALFORMED_PAYLOAD("malformed_payload", false);

    private final String label;
    private final boolean retryable;

    FetchFailure(String label, boolean retryable) {
        this.label = label;
        this.retryable = retryable;
    }

    public String label() {
        return label;
    }

    public boolean retryable() {
        return retryable;
    }

    public static FetchFailure fromLabel(String value) {
        if (value == null) {
            return TRANSIENT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FetchFailure failure : values()) {
            if (failure.label.equals(normalized)) {
                return failure;
            }
        }
        return TRANSIENT;
    }
}
