package com.stockscan.data;

import com.stockscan.model.FetchFailure;

/**
 * Upstream call failed with a classified reason.
 */
public class UpstreamException extends Exception {
    private final FetchFailure failure;

    public UpstreamException(FetchFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public UpstreamException(FetchFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public FetchFailure failure() {
        return failure;
    }
}
