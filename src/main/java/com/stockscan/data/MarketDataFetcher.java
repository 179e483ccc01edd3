package com.stockscan.data;

import com.stockscan.config.Config;
import com.stockscan.model.BarDaily;
import com.stockscan.model.FetchFailure;
import com.stockscan.model.FetchOutcome;
import com.stockscan.model.Instrument;
import com.stockscan.utils.Progress;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 模块说明：MarketDataFetcher（class）。
 * 主要职责：并发抓取整个标的池在某一交易日的日线，每个标的恰好产出一个 FetchOutcome。
 * 使用建议：单个标的失败只记录分类结果，不会中断整批抓取。
 */
public final class MarketDataFetcher {
    private static final Logger LOG = LogManager.getLogger(MarketDataFetcher.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final UpstreamSource source;
    private final CredentialPool pool;
    private final FetchPolicy policy;
    private final int workers;
    private final long checkoutTimeoutMs;
    private final int logEvery;
    private final Sleeper sleeper;

    public MarketDataFetcher(
            UpstreamSource source,
            CredentialPool pool,
            FetchPolicy policy,
            int workers,
            long checkoutTimeoutMs,
            int logEvery,
            Sleeper sleeper
    ) {
        this.source = source;
        this.pool = pool;
        this.policy = policy;
        this.workers = Math.max(1, workers);
        this.checkoutTimeoutMs = Math.max(0L, checkoutTimeoutMs);
        this.logEvery = logEvery;
        this.sleeper = sleeper == null ? Thread::sleep : sleeper;
    }

    public static MarketDataFetcher fromConfig(Config config, UpstreamSource source, CredentialPool pool) {
        return new MarketDataFetcher(
                source,
                pool,
                FetchPolicy.fromConfig(config),
                config.getInt("fetch.workers", 8),
                config.getLong("fetch.credential.checkout_timeout_ms", 30_000L),
                config.getInt("job.progress.log_every", 200),
                Thread::sleep
        );
    }

    /**
     * Fetches {@code date} for every instrument. The result holds one outcome per distinct code,
     * in universe order.
     */
    public Map<Instrument, FetchOutcome> fetch(Collection<Instrument> universe, LocalDate date)
            throws InterruptedException {
        Map<String, Instrument> distinct = new LinkedHashMap<>();
        for (Instrument instrument : universe) {
            distinct.putIfAbsent(instrument.code, instrument);
        }
        int total = distinct.size();
        Map<String, FetchOutcome> byCode = new HashMap<>();
        if (total == 0) {
            return new LinkedHashMap<>();
        }

        long startedNanos = System.nanoTime();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, total));
        CompletionService<FetchOutcome> completion = new ExecutorCompletionService<>(executor);
        Map<Future<FetchOutcome>, Instrument> submitted = new HashMap<>();
        Map<FetchFailure, Integer> failures = new EnumMap<>(FetchFailure.class);
        try {
            for (Instrument instrument : distinct.values()) {
                submitted.put(completion.submit(new InstrumentTask(instrument, date)), instrument);
            }
            for (int i = 0; i < total; i++) {
                Future<FetchOutcome> future = completion.take();
                Instrument instrument = submitted.get(future);
                FetchOutcome outcome;
                try {
                    outcome = future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.error("fetch crashed code={} err={}", instrument.code, cause.toString());
                    outcome = FetchOutcome.failed(instrument, FetchFailure.TRANSIENT, "unexpected: " + cause, 0);
                }
                byCode.put(instrument.code, outcome);
                if (!outcome.isSuccess()) {
                    failures.merge(outcome.failure, 1, Integer::sum);
                }
                int completed = i + 1;
                if (Progress.shouldLog(completed, total, logEvery)) {
                    LOG.info("Fetch date={} {} failed={}", date, Progress.describe(completed, total, startedNanos), failures);
                }
            }
        } finally {
            executor.shutdownNow();
        }

        Map<Instrument, FetchOutcome> out = new LinkedHashMap<>();
        for (Instrument instrument : distinct.values()) {
            out.put(instrument, byCode.get(instrument.code));
        }
        return out;
    }

    /**
     * Runs the retry loop for one instrument. Never throws for upstream failures.
     */
    FetchOutcome fetchOne(Instrument instrument, LocalDate date) throws InterruptedException {
        if (!instrument.isEligible()) {
            return FetchOutcome.failed(instrument, FetchFailure.NOT_FOUND, "listing_status=" + instrument.status.label(), 0);
        }
        FetchAttempt attempt = new FetchAttempt(policy);
        String avoidId = null;
        while (true) {
            FetchFailure failure;
            String message;
            String usedId = null;
            Optional<CredentialPool.Lease> lease = pool.checkout(avoidId, checkoutTimeoutMs);
            if (lease.isEmpty()) {
                failure = FetchFailure.TRANSIENT;
                message = "credential_checkout_timeout";
            } else {
                Credential credential = lease.get().credential();
                usedId = credential.id;
                CredentialPool.Signal signal = CredentialPool.Signal.FAILED;
                try {
                    DailyHistory history = source.fetchDaily(instrument, date, credential);
                    signal = CredentialPool.Signal.OK;
                    attempt.onSuccess();
                    Optional<BarDaily> bar = history.barOn(date);
                    if (bar.isEmpty()) {
                        return FetchOutcome.failed(instrument, FetchFailure.NOT_FOUND, "no_bar_for_date", attempt.attempts());
                    }
                    return FetchOutcome.success(instrument, bar.get(), history.bars, attempt.attempts());
                } catch (UpstreamException e) {
                    failure = e.failure();
                    message = e.getMessage();
                    if (failure == FetchFailure.RATE_LIMITED) {
                        signal = CredentialPool.Signal.RATE_LIMITED;
                    }
                } finally {
                    pool.release(lease.get(), signal);
                }
            }

            switch (attempt.onFailure(failure)) {
                case EXHAUSTED:
                    if (failure == FetchFailure.MALFORMED_PAYLOAD) {
                        LOG.warn("malformed upstream payload code={} msg={}", instrument.code, message);
                    } else {
                        LOG.debug("fetch gave up code={} failure={} attempts={} msg={}",
                                instrument.code, failure.label(), attempt.attempts(), message);
                    }
                    return FetchOutcome.failed(instrument, failure, message, attempt.attempts());
                case ROTATING_CREDENTIAL:
                    avoidId = usedId;
                    LOG.info("rotating credential code={} away_from={}", instrument.code, usedId);
                    sleeper.sleep(attempt.delayMs());
                    attempt.resume();
                    break;
                default:
                    sleeper.sleep(attempt.delayMs());
                    attempt.resume();
                    break;
            }
        }
    }

    private final class InstrumentTask implements Callable<FetchOutcome> {
        private final Instrument instrument;
        private final LocalDate date;

        private InstrumentTask(Instrument instrument, LocalDate date) {
            this.instrument = instrument;
            this.date = date;
        }

        @Override
        public FetchOutcome call() throws Exception {
            try {
                return fetchOne(instrument, date);
            } catch (RuntimeException e) {
                LOG.error("fetch failed unexpectedly code={}", instrument.code, e);
                return FetchOutcome.failed(instrument, FetchFailure.TRANSIENT, "unexpected: " + e, 0);
            }
        }
    }
}
