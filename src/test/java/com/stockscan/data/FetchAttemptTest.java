package com.stockscan.data;

import com.stockscan.model.FetchFailure;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FetchAttemptTest {

    private final FetchPolicy policy = new FetchPolicy(4, 100L, 250L, 2);

    @Test
    void onFailure_shouldBackOffExponentiallyUpToCap() {
        FetchAttempt attempt = new FetchAttempt(policy);

        assertEquals(FetchAttempt.State.BACKOFF, attempt.onFailure(FetchFailure.TRANSIENT));
        assertEquals(100L, attempt.delayMs());
        attempt.resume();
        assertEquals(FetchAttempt.State.BACKOFF, attempt.onFailure(FetchFailure.TRANSIENT));
        assertEquals(200L, attempt.delayMs());
        attempt.resume();
        assertEquals(FetchAttempt.State.BACKOFF, attempt.onFailure(FetchFailure.TRANSIENT));
        assertEquals(250L, attempt.delayMs());
        attempt.resume();
        assertEquals(FetchAttempt.State.EXHAUSTED, attempt.onFailure(FetchFailure.TRANSIENT));
        assertEquals(4, attempt.attempts());
    }

    @Test
    void onFailure_shouldExhaustImmediatelyOnNonRetryable() {
        FetchAttempt notFound = new FetchAttempt(policy);
        FetchAttempt malformed = new FetchAttempt(policy);

        assertEquals(FetchAttempt.State.EXHAUSTED, notFound.onFailure(FetchFailure.NOT_FOUND));
        assertEquals(FetchAttempt.State.EXHAUSTED, malformed.onFailure(FetchFailure.MALFORMED_PAYLOAD));
        assertEquals(1, notFound.attempts());
        assertEquals(FetchFailure.MALFORMED_PAYLOAD, malformed.lastFailure());
    }

    @Test
    void onFailure_shouldRotateAfterConsecutiveRateLimits() {
        FetchAttempt attempt = new FetchAttempt(policy);

        assertEquals(FetchAttempt.State.BACKOFF, attempt.onFailure(FetchFailure.RATE_LIMITED));
        attempt.resume();
        assertEquals(FetchAttempt.State.ROTATING_CREDENTIAL, attempt.onFailure(FetchFailure.RATE_LIMITED));
        attempt.resume();
        assertEquals(FetchAttempt.State.SUCCEEDED, attempt.onSuccess());
        assertEquals(3, attempt.attempts());
    }

    @Test
    void onFailure_shouldResetRateLimitStreakOnOtherFailure() {
        FetchAttempt attempt = new FetchAttempt(new FetchPolicy(10, 0L, 0L, 2));

        attempt.onFailure(FetchFailure.RATE_LIMITED);
        attempt.resume();
        attempt.onFailure(FetchFailure.TRANSIENT);
        attempt.resume();

        assertEquals(FetchAttempt.State.BACKOFF, attempt.onFailure(FetchFailure.RATE_LIMITED));
    }

    @Test
    void transitions_shouldRejectOutOfOrderCalls() {
        FetchAttempt attempt = new FetchAttempt(policy);

        assertThrows(IllegalStateException.class, attempt::resume);
        attempt.onFailure(FetchFailure.TRANSIENT);
        assertThrows(IllegalStateException.class, attempt::onSuccess);
    }
}
