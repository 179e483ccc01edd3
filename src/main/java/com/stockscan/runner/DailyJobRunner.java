package com.stockscan.runner;

import com.stockscan.config.Config;
import com.stockscan.data.MarketDataFetcher;
import com.stockscan.db.DateBatch;
import com.stockscan.db.MarketStore;
import com.stockscan.db.StoreError;
import com.stockscan.db.StoreException;
import com.stockscan.indicator.IndicatorEngine;
import com.stockscan.indicator.IndicatorRegistry;
import com.stockscan.model.BackfillReport;
import com.stockscan.model.BarDaily;
import com.stockscan.model.DateOutcome;
import com.stockscan.model.DateRunRecord;
import com.stockscan.model.DateState;
import com.stockscan.model.FetchFailure;
import com.stockscan.model.FetchOutcome;
import com.stockscan.model.IndicatorRow;
import com.stockscan.model.Instrument;
import com.stockscan.model.OrchestrationError;
import com.stockscan.strategy.InstrumentWindow;
import com.stockscan.strategy.MarketSnapshot;
import com.stockscan.strategy.StrategyEngine;
import com.stockscan.strategy.StrategyEvaluation;
import com.stockscan.strategy.StrategyRegistry;
import com.stockscan.utils.StepTimer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 模块说明：DailyJobRunner（class）。
 * 主要职责：按交易日驱动 抓取 -> 指标 -> 策略 -> 提交；每个交易日整体提交或整体失败。
 * 使用建议：回补时单个交易日失败不会中断区间；cancel() 只在交易日之间生效。
 */
public final class DailyJobRunner {
    private static final Logger LOG = LogManager.getLogger(DailyJobRunner.class);

    static final String STEP_FETCH = "FETCH";
    static final String STEP_COMPUTE = "COMPUTE";
    static final String STEP_EVALUATE = "EVALUATE";
    static final String STEP_COMMIT = "COMMIT";

    private final MarketDataFetcher fetcher;
    private final IndicatorEngine indicators;
    private final StrategyEngine strategies;
    private final MarketStore store;
    private final TradingCalendar calendar;
    private final JobOptions options;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Map<LocalDate, DateState> states = new ConcurrentHashMap<>();

    public DailyJobRunner(
            MarketDataFetcher fetcher,
            IndicatorEngine indicators,
            StrategyEngine strategies,
            MarketStore store,
            TradingCalendar calendar,
            JobOptions options
    ) {
        this.fetcher = fetcher;
        this.indicators = indicators;
        this.strategies = strategies;
        this.store = store;
        this.calendar = calendar;
        this.options = options;
        strategies.registry().validateAgainst(indicators.registry());
    }

    public static DailyJobRunner fromConfig(
            Config config,
            MarketDataFetcher fetcher,
            MarketStore store,
            TradingCalendar calendar
    ) {
        IndicatorRegistry indicatorRegistry = IndicatorRegistry.fromConfig(config);
        StrategyRegistry strategyRegistry = StrategyRegistry.fromConfig(config);
        LOG.info("registries indicators={} strategies={}", indicatorRegistry.names(), strategyRegistry.names());
        return new DailyJobRunner(
                fetcher,
                new IndicatorEngine(indicatorRegistry),
                new StrategyEngine(strategyRegistry, config.getInt("strategy.threads", 4)),
                store,
                calendar,
                JobOptions.fromConfig(config)
        );
    }

    /**
     * Stops the run before the next date starts. Dates already in flight finish or fail as a whole.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOG.warn("cancellation requested; no new dates will start");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * State of a date in the current or most recent run; dates outside it read as PENDING.
     */
    public DateState stateOf(LocalDate date) {
        return states.getOrDefault(date, DateState.PENDING);
    }

    public DateOutcome runDate(LocalDate date, List<Instrument> universe) {
        return run(List.of(date), universe).outcome(date);
    }

    /**
     * Runs the dates in ascending order. A failed date never aborts the others.
     */
    public BackfillReport run(List<LocalDate> dates, List<Instrument> universe) {
        List<LocalDate> ordered = new ArrayList<>(new TreeSet<>(dates));
        Map<LocalDate, DateOutcome> outcomes = new TreeMap<>();
        states.clear();
        for (LocalDate date : ordered) {
            outcomes.put(date, DateOutcome.pending(date));
            states.put(date, DateState.PENDING);
        }
        LOG.info("job start dates={} universe={} date_workers={} commit_in_order={}",
                ordered.size(), universe.size(), options.dateWorkers, options.commitInOrder);

        ExecutorService dateWorkers = Executors.newFixedThreadPool(options.dateWorkers);
        Deque<InFlight> inFlight = new ArrayDeque<>();
        try {
            int next = 0;
            while (next < ordered.size() || !inFlight.isEmpty()) {
                while (next < ordered.size() && inFlight.size() < options.dateWorkers && !cancelled.get()) {
                    LocalDate date = ordered.get(next++);
                    if (!calendar.isTradingDay(date)) {
                        LOG.info("date={} is not a trading day, skipped", date);
                        states.put(date, DateState.SKIPPED);
                        outcomes.put(date, DateOutcome.skipped(date, "not_a_trading_day"));
                        continue;
                    }
                    boolean commitInTask = !options.commitInOrder;
                    inFlight.addLast(new InFlight(date, dateWorkers.submit(new DateTask(date, universe, commitInTask))));
                }
                if (inFlight.isEmpty()) {
                    break;
                }
                InFlight head = inFlight.removeFirst();
                DateOutcome outcome = await(head);
                outcomes.put(head.date, outcome);
                states.put(head.date, outcome.state);
                LOG.info("date done {}", outcome.summaryLine());
            }
        } finally {
            dateWorkers.shutdownNow();
        }

        BackfillReport report = new BackfillReport(new ArrayList<>(outcomes.values()), cancelled.get());
        LOG.info(report.summaryText());
        return report;
    }

    private DateOutcome await(InFlight head) {
        Prepared prepared;
        try {
            prepared = head.future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            head.future.cancel(true);
            return DateOutcome.failed(head.date, OrchestrationError.UNEXPECTED, "interrupted", 0L);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.error("date={} crashed", head.date, cause);
            return DateOutcome.failed(head.date, OrchestrationError.UNEXPECTED, cause.toString(), 0L);
        }
        if (prepared.outcome != null) {
            return prepared.outcome;
        }
        try {
            return commit(prepared);
        } catch (RuntimeException e) {
            LOG.error("date={} commit crashed", head.date, e);
            return DateOutcome.failed(head.date, OrchestrationError.UNEXPECTED, e.toString(), elapsedMs(prepared.startedNanos));
        }
    }

    /**
     * Fetch, compute and evaluate one date. Returns a batch ready to commit, or a failed outcome.
     */
    Prepared prepare(LocalDate date, List<Instrument> universe) throws InterruptedException {
        long startedNanos = System.nanoTime();
        StepTimer timer = new StepTimer();

        states.put(date, DateState.FETCHING);
        timer.start(STEP_FETCH);
        Map<Instrument, FetchOutcome> fetched = fetcher.fetch(universe, date);
        timer.end(STEP_FETCH);

        Map<FetchFailure, Integer> failures = new EnumMap<>(FetchFailure.class);
        List<FetchOutcome> successes = new ArrayList<>();
        for (FetchOutcome outcome : fetched.values()) {
            if (outcome.isSuccess()) {
                successes.add(outcome);
            } else {
                failures.merge(outcome.failure, 1, Integer::sum);
            }
        }
        LOG.info("date={} fetched ok={} failed={}", date, successes.size(), failures);

        states.put(date, DateState.COMPUTING);
        timer.start(STEP_COMPUTE);
        int rowsNeeded = strategies.registry().maxHistoryRows();
        int historyLimit = indicators.registry().maxLookback() + rowsNeeded + options.historyMargin;
        List<String> codes = new ArrayList<>(successes.size());
        for (FetchOutcome outcome : successes) {
            codes.add(outcome.instrument.code);
        }
        Map<String, List<BarDaily>> stored;
        try {
            stored = store.getRecentBars(codes, date, historyLimit);
        } catch (StoreException e) {
            LOG.error("date={} history load failed: {}", date, e.getMessage());
            return Prepared.decided(DateOutcome.failed(date, OrchestrationError.STORE_UNAVAILABLE, e.getMessage(), elapsedMs(startedNanos)));
        }
        List<InstrumentWindow> windows = computeWindows(date, successes, stored, historyLimit, rowsNeeded);
        timer.end(STEP_COMPUTE);

        states.put(date, DateState.EVALUATING);
        timer.start(STEP_EVALUATE);
        MarketSnapshot market = MarketSnapshot.from(date, windows);
        StrategyEvaluation evaluation = strategies.evaluate(date, windows, market);
        timer.end(STEP_EVALUATE);

        List<BarDaily> bars = new ArrayList<>(successes.size());
        for (FetchOutcome outcome : successes) {
            bars.add(outcome.bar);
        }
        List<IndicatorRow> rows = new ArrayList<>(windows.size());
        for (InstrumentWindow window : windows) {
            rows.add(window.latestRow());
        }
        int fetchFailed = fetched.size() - successes.size();
        DateOutcome committed = DateOutcome.builder()
                .date(date)
                .state(DateState.COMMITTED)
                .cause(fetchFailed > 0 ? OrchestrationError.PARTIAL_DATE_FAILURE : null)
                .message(fetchFailed > 0 ? fetchFailed + " instruments not fetched" : "")
                .universeSize(fetched.size())
                .fetched(successes.size())
                .fetchFailures(failures)
                .indicatorRows(rows.size())
                .matches(evaluation.results.size())
                .strategyFailures(evaluation.failures.size())
                .build();
        DateBatch batch = new DateBatch(date, bars, rows, evaluation.results, DateRunRecord.of(committed));
        return new Prepared(date, batch, committed, timer, startedNanos);
    }

    private List<InstrumentWindow> computeWindows(
            LocalDate date,
            List<FetchOutcome> successes,
            Map<String, List<BarDaily>> stored,
            int historyLimit,
            int rowsNeeded
    ) throws InterruptedException {
        List<InstrumentWindow> windows = new ArrayList<>(successes.size());
        if (successes.isEmpty()) {
            return windows;
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(options.indicatorThreads, successes.size()));
        try {
            List<Future<InstrumentWindow>> futures = new ArrayList<>(successes.size());
            for (FetchOutcome outcome : successes) {
                List<BarDaily> history = mergeHistory(
                        date, outcome, stored.getOrDefault(outcome.instrument.code, List.of()), historyLimit);
                futures.add(pool.submit(() -> new InstrumentWindow(
                        outcome.instrument,
                        date,
                        history,
                        indicators.computeSeries(history, date, rowsNeeded)
                )));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    windows.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.error("date={} code={} indicator computation failed: {}",
                            date, successes.get(i).instrument.code, cause.toString());
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return windows;
    }

    /**
     * Store bars before D win over upstream look-back bars; D's fetched bar is appended last.
     */
    static List<BarDaily> mergeHistory(LocalDate date, FetchOutcome outcome, List<BarDaily> stored, int limit) {
        TreeMap<LocalDate, BarDaily> byDate = new TreeMap<>();
        for (BarDaily bar : outcome.history) {
            if (bar.tradeDate.isBefore(date)) {
                byDate.put(bar.tradeDate, bar);
            }
        }
        for (BarDaily bar : stored) {
            if (bar.tradeDate.isBefore(date)) {
                byDate.put(bar.tradeDate, bar);
            }
        }
        byDate.put(date, outcome.bar);
        List<BarDaily> all = new ArrayList<>(byDate.values());
        if (all.size() <= limit) {
            return all;
        }
        return new ArrayList<>(all.subList(all.size() - limit, all.size()));
    }

    /**
     * Commits with bounded retries on UNAVAILABLE only. Overwrite semantics make a retried commit safe.
     */
    DateOutcome commit(Prepared prepared) {
        LocalDate date = prepared.date;
        prepared.timer.start(STEP_COMMIT);
        StoreException last = null;
        int attempts = 0;
        while (attempts <= options.commitMaxRetries) {
            attempts++;
            try {
                store.commitDate(prepared.batch);
                last = null;
                break;
            } catch (StoreException e) {
                last = e;
                LOG.warn("date={} commit attempt {} failed kind={} err={}", date, attempts, e.error(), e.getMessage());
                if (e.error() == StoreError.CONSTRAINT_VIOLATION || attempts > options.commitMaxRetries) {
                    break;
                }
                if (!sleepBeforeRetry()) {
                    break;
                }
            }
        }
        prepared.timer.end(STEP_COMMIT);
        long elapsed = elapsedMs(prepared.startedNanos);
        LOG.info("date={} {}", date, prepared.timer.summaryText());

        if (last == null) {
            return prepared.committed.toBuilder().elapsedMs(elapsed).build();
        }
        String message = last.error() + " after " + attempts + " attempt(s): " + last.getMessage();
        try {
            store.recordFailedDate(date, OrchestrationError.STORE_COMMIT_FAILURE, message);
        } catch (StoreException recordError) {
            LOG.error("date={} could not record failure: {}", date, recordError.getMessage());
        }
        return DateOutcome.failed(date, OrchestrationError.STORE_COMMIT_FAILURE, message, elapsed);
    }

    private boolean sleepBeforeRetry() {
        if (options.commitRetrySleepMs <= 0L) {
            return true;
        }
        try {
            Thread.sleep(options.commitRetrySleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static long elapsedMs(long startedNanos) {
        return Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
    }

    static final class Prepared {
        final LocalDate date;
        final DateBatch batch;
        final DateOutcome committed;
        final StepTimer timer;
        final long startedNanos;
        /** Set when the date is already decided (failed, or committed inside the worker). */
        final DateOutcome outcome;

        Prepared(LocalDate date, DateBatch batch, DateOutcome committed, StepTimer timer, long startedNanos) {
            this.date = date;
            this.batch = batch;
            this.committed = committed;
            this.timer = timer;
            this.startedNanos = startedNanos;
            this.outcome = null;
        }

        private Prepared(DateOutcome outcome) {
            this.date = outcome.date;
            this.batch = null;
            this.committed = null;
            this.timer = null;
            this.startedNanos = 0L;
            this.outcome = outcome;
        }

        static Prepared decided(DateOutcome outcome) {
            return new Prepared(outcome);
        }
    }

    private static final class InFlight {
        final LocalDate date;
        final Future<Prepared> future;

        InFlight(LocalDate date, Future<Prepared> future) {
            this.date = date;
            this.future = future;
        }
    }

    private final class DateTask implements Callable<Prepared> {
        private final LocalDate date;
        private final List<Instrument> universe;
        private final boolean commitInTask;

        private DateTask(LocalDate date, List<Instrument> universe, boolean commitInTask) {
            this.date = date;
            this.universe = universe;
            this.commitInTask = commitInTask;
        }

        @Override
        public Prepared call() throws Exception {
            long startedNanos = System.nanoTime();
            Prepared prepared;
            try {
                prepared = prepare(date, universe);
            } catch (RuntimeException e) {
                LOG.error("date={} failed unexpectedly", date, e);
                return Prepared.decided(DateOutcome.failed(date, OrchestrationError.UNEXPECTED, e.toString(), elapsedMs(startedNanos)));
            }
            if (commitInTask && prepared.outcome == null) {
                return Prepared.decided(commit(prepared));
            }
            return prepared;
        }
    }
}
