package com.stockscan.strategy;

import com.stockscan.model.IndicatorRow;
import com.stockscan.model.StrategyResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs every (strategy, instrument) pair for one date on a bounded pool. A failing pair is recorded
 * and does not affect the others.
 */
public final class StrategyEngine {
    private static final Logger LOG = LogManager.getLogger(StrategyEngine.class);

    private final StrategyRegistry registry;
    private final int threads;

    public StrategyEngine(StrategyRegistry registry, int threads) {
        this.registry = registry;
        this.threads = Math.max(1, threads);
    }

    public StrategyRegistry registry() {
        return registry;
    }

    public StrategyEvaluation evaluate(LocalDate date, List<InstrumentWindow> windows, MarketSnapshot market)
            throws InterruptedException {
        List<PairTask> tasks = new ArrayList<>();
        for (Strategy strategy : registry.strategies()) {
            for (InstrumentWindow window : windows) {
                if (!window.date.equals(date)) {
                    throw new IllegalArgumentException("window for " + window.code() + " is dated " + window.date
                            + ", expected " + date);
                }
                tasks.add(new PairTask(strategy, window, market));
            }
        }

        List<StrategyResult> results = new ArrayList<>();
        List<StrategyFailure> failures = new ArrayList<>();
        int filtered = 0;
        if (!tasks.isEmpty()) {
            ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, tasks.size()));
            List<Future<PairResult>> futures = new ArrayList<>(tasks.size());
            try {
                for (PairTask task : tasks) {
                    futures.add(pool.submit(task));
                }
                for (int i = 0; i < tasks.size(); i++) {
                    PairResult pair;
                    try {
                        pair = futures.get(i).get();
                    } catch (ExecutionException e) {
                        PairTask task = tasks.get(i);
                        Throwable cause = e.getCause() == null ? e : e.getCause();
                        LOG.error("strategy={} code={} crashed: {}", task.strategy.name(), task.window.code(), cause.toString());
                        failures.add(new StrategyFailure(task.strategy.name(), task.window.code(), cause.toString()));
                        continue;
                    }
                    if (pair.filtered) {
                        filtered++;
                    } else if (pair.failure != null) {
                        failures.add(pair.failure);
                    } else if (pair.result != null) {
                        results.add(pair.result);
                    }
                }
            } finally {
                pool.shutdownNow();
            }
        }

        results.sort(StrategyResult.REPORT_ORDER);
        failures.sort(Comparator.comparing((StrategyFailure f) -> f.strategy).thenComparing(f -> f.code));
        if (!failures.isEmpty()) {
            LOG.warn("strategy failures date={} count={} first={}", date, failures.size(), failures.get(0));
        }
        return new StrategyEvaluation(date, results, failures, tasks.size(), filtered);
    }

    /**
     * Single pair, same rules as the pooled path. Visible for callers that evaluate one instrument.
     */
    public static PairResult evaluatePair(Strategy strategy, InstrumentWindow window, MarketSnapshot market) {
        for (EligibilityFilter filter : strategy.filters()) {
            if (!filter.accepts(window, market)) {
                return PairResult.filteredOut();
            }
        }
        IndicatorRow latest = window.latestRow();
        for (String name : strategy.requiredIndicators()) {
            if (!latest.isDefined(name)) {
                return PairResult.noMatch();
            }
        }
        Optional<StrategyMatch> match = strategy.evaluate(window, market);
        if (match.isEmpty()) {
            return PairResult.noMatch();
        }
        StrategyMatch m = match.get();
        return PairResult.matched(new StrategyResult(strategy.name(), window.code(), window.date, m.score, m.params));
    }

    public static final class PairResult {
        public final StrategyResult result;
        public final StrategyFailure failure;
        public final boolean filtered;

        private PairResult(StrategyResult result, StrategyFailure failure, boolean filtered) {
            this.result = result;
            this.failure = failure;
            this.filtered = filtered;
        }

        static PairResult matched(StrategyResult result) {
            return new PairResult(result, null, false);
        }

        static PairResult noMatch() {
            return new PairResult(null, null, false);
        }

        static PairResult filteredOut() {
            return new PairResult(null, null, true);
        }

        static PairResult failed(StrategyFailure failure) {
            return new PairResult(null, failure, false);
        }
    }

    private static final class PairTask implements Callable<PairResult> {
        private final Strategy strategy;
        private final InstrumentWindow window;
        private final MarketSnapshot market;

        private PairTask(Strategy strategy, InstrumentWindow window, MarketSnapshot market) {
            this.strategy = strategy;
            this.window = window;
            this.market = market;
        }

        @Override
        public PairResult call() {
            try {
                return evaluatePair(strategy, window, market);
            } catch (RuntimeException e) {
                LOG.warn("strategy={} code={} failed: {}", strategy.name(), window.code(), e.toString());
                return PairResult.failed(new StrategyFailure(strategy.name(), window.code(), e.toString()));
            }
        }
    }
}
