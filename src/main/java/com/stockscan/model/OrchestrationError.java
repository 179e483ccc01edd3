package com.stockscan.model;

public enum OrchestrationError {
    /** Date committed while some instruments failed to fetch. Not a failure. */
    PARTIAL_DATE_FAILURE,
    STORE_COMMIT_FAILURE,
    STORE_UNAVAILABLE,
    UNEXPECTED
}
