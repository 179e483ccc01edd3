package com.stockscan.data;

import com.stockscan.config.Config;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class FetchPolicy {
    public final int maxAttempts;
    public final long backoffBaseMs;
    public final long backoffMaxMs;
    public final int rotateAfterRateLimits;

    public static FetchPolicy fromConfig(Config config) {
        return new FetchPolicy(
                Math.max(1, config.getInt("fetch.max_attempts", 4)),
                Math.max(0L, config.getLong("fetch.backoff_base_ms", 500L)),
                Math.max(0L, config.getLong("fetch.backoff_max_ms", 8_000L)),
                Math.max(1, config.getInt("fetch.rotate_after_rate_limits", 2))
        );
    }

    /**
     * min(max, base * 2^(attempt-1)) for the 1-based attempt that just failed.
     */
    public long backoffMs(int attempt) {
        int shift = Math.min(Math.max(0, attempt - 1), 30);
        long delay = backoffBaseMs << shift;
        if (delay < 0 || delay > backoffMaxMs) {
            return backoffMaxMs;
        }
        return delay;
    }
}
