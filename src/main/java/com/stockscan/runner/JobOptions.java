package com.stockscan.runner;

import com.stockscan.config.Config;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class JobOptions {
    public final int dateWorkers;
    public final boolean commitInOrder;
    public final int commitMaxRetries;
    public final long commitRetrySleepMs;
    public final int indicatorThreads;
    /** Extra bars loaded beyond what indicators and strategies strictly need. */
    public final int historyMargin;

    public static JobOptions fromConfig(Config config) {
        return new JobOptions(
                Math.max(1, config.getInt("job.date_workers", 1)),
                config.getBoolean("job.commit_in_order", true),
                Math.max(0, config.getInt("store.commit.max_retries", 2)),
                Math.max(0L, config.getLong("store.commit.retry_sleep_ms", 500L)),
                Math.max(1, config.getInt("indicator.threads", 4)),
                Math.max(0, config.getInt("job.history_margin", 5))
        );
    }

    public static JobOptions defaults() {
        return new JobOptions(1, true, 2, 0L, 2, 5);
    }
}
