package com.stockscan.data;

import com.stockscan.model.FetchFailure;

/**
 * Retry state of one instrument's fetch. Transitions are driven only by classified failures,
 * so the policy is testable without a network.
 */
public final class FetchAttempt {
    public enum State {
        ATTEMPTING,
        BACKOFF,
        ROTATING_CREDENTIAL,
        EXHAUSTED,
        SUCCEEDED
    }

    private final FetchPolicy policy;
    private State state = State.ATTEMPTING;
    private int attempts;
    private int consecutiveRateLimits;
    private long delayMs;
    private FetchFailure lastFailure;

    public FetchAttempt(FetchPolicy policy) {
        this.policy = policy;
    }

    public State onSuccess() {
        requireState(State.ATTEMPTING);
        attempts++;
        delayMs = 0L;
        state = State.SUCCEEDED;
        return state;
    }

    public State onFailure(FetchFailure failure) {
        requireState(State.ATTEMPTING);
        attempts++;
        lastFailure = failure;
        if (!failure.retryable() || attempts >= policy.maxAttempts) {
            delayMs = 0L;
            state = State.EXHAUSTED;
            return state;
        }
        delayMs = policy.backoffMs(attempts);
        if (failure == FetchFailure.RATE_LIMITED) {
            consecutiveRateLimits++;
            if (consecutiveRateLimits >= policy.rotateAfterRateLimits) {
                consecutiveRateLimits = 0;
                state = State.ROTATING_CREDENTIAL;
                return state;
            }
        } else {
            consecutiveRateLimits = 0;
        }
        state = State.BACKOFF;
        return state;
    }

    /**
     * Leaves BACKOFF or ROTATING_CREDENTIAL for the next attempt.
     */
    public void resume() {
        if (state != State.BACKOFF && state != State.ROTATING_CREDENTIAL) {
            throw new IllegalStateException("cannot resume from " + state);
        }
        state = State.ATTEMPTING;
    }

    public State state() {
        return state;
    }

    public int attempts() {
        return attempts;
    }

    public long delayMs() {
        return delayMs;
    }

    public FetchFailure lastFailure() {
        return lastFailure;
    }

    private void requireState(State expected) {
        if (state != expected) {
            throw new IllegalStateException("expected " + expected + " but was " + state);
        }
    }
}
