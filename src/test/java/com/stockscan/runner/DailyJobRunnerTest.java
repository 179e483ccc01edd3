package com.stockscan.runner;

import com.stockscan.data.CredentialPool;
import com.stockscan.data.DailyHistory;
import com.stockscan.data.FetchPolicy;
import com.stockscan.data.MarketDataFetcher;
import com.stockscan.data.UpstreamException;
import com.stockscan.data.UpstreamSource;
import com.stockscan.db.DateBatch;
import com.stockscan.db.InMemoryMarketStore;
import com.stockscan.db.StoreError;
import com.stockscan.db.StoreException;
import com.stockscan.indicator.IndicatorEngine;
import com.stockscan.indicator.IndicatorRegistry;
import com.stockscan.indicator.MovingAverage;
import com.stockscan.indicator.PriceField;
import com.stockscan.model.BackfillReport;
import com.stockscan.model.BarDaily;
import com.stockscan.model.DateOutcome;
import com.stockscan.model.DateState;
import com.stockscan.model.FetchFailure;
import com.stockscan.model.FetchOutcome;
import com.stockscan.model.IndicatorRow;
import com.stockscan.model.Instrument;
import com.stockscan.model.OrchestrationError;
import com.stockscan.model.StrategyResult;
import com.stockscan.strategy.InstrumentWindow;
import com.stockscan.strategy.MarketSnapshot;
import com.stockscan.strategy.Strategy;
import com.stockscan.strategy.StrategyEngine;
import com.stockscan.strategy.StrategyMatch;
import com.stockscan.strategy.StrategyRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class DailyJobRunnerTest {

    private static final LocalDate D1 = LocalDate.of(2024, 6, 11);
    private static final LocalDate D2 = LocalDate.of(2024, 6, 12);
    private static final LocalDate D3 = LocalDate.of(2024, 6, 13);
    private static final LocalDate SATURDAY = LocalDate.of(2024, 6, 15);

    private static final Instrument A = Instrument.active("A", "Alpha");
    private static final Instrument B = Instrument.active("B", "Beta");

    @Test
    void runDate_shouldCommitBarAndUndefinedRowWithoutMatches() throws Exception {
        UpstreamSource source = (instrument, date, credential) -> {
            if (instrument.code.equals("B")) {
                throw new UpstreamException(FetchFailure.NOT_FOUND, "no_data code=B");
            }
            return new DailyHistory("A", List.of(new BarDaily("A", date, 9.8, 10.2, 9.7, 10.0, 5000.0)));
        };
        InMemoryMarketStore store = new InMemoryMarketStore();
        DailyJobRunner runner = runner(source, store, JobOptions.defaults());

        DateOutcome outcome = runner.runDate(D1, List.of(A, B));

        assertEquals(DateState.COMMITTED, outcome.state);
        assertEquals(OrchestrationError.PARTIAL_DATE_FAILURE, outcome.cause);
        assertEquals(1, outcome.failureCount(FetchFailure.NOT_FOUND));
        assertEquals(1, store.barCount(D1));
        assertEquals(1, store.indicatorRowCount(D1));
        IndicatorRow row = store.getIndicators("A", D1).orElseThrow();
        assertTrue(row.hasIndicator("ma5"));
        assertFalse(row.isDefined("ma5"));
        assertTrue(store.getIndicators("B", D1).isEmpty());
        assertTrue(store.getStrategyResults(D1, Optional.empty()).isEmpty());
        assertEquals(DateState.COMMITTED, store.getDateRun(D1).orElseThrow().state);
    }

    @Test
    void runDate_shouldMatchOnceHistoryIsLongEnough() throws Exception {
        InMemoryMarketStore store = new InMemoryMarketStore();
        DailyJobRunner runner = runner(risingSource(10), store, JobOptions.defaults());

        DateOutcome outcome = runner.runDate(D3, List.of(A, B));

        assertEquals(DateState.COMMITTED, outcome.state);
        assertNull(outcome.cause);
        assertEquals(2, outcome.matches);
        List<StrategyResult> results = store.getStrategyResults(D3, Optional.of("close_above_ma5"));
        assertEquals(List.of("A", "B"), List.of(results.get(0).code, results.get(1).code));
        assertTrue(results.get(0).params.containsKey("ma5"));
    }

    @Test
    void run_shouldIsolateCommitFailureAndAllowRerun() throws Exception {
        InMemoryMarketStore store = spy(new InMemoryMarketStore());
        doThrow(new StoreException(StoreError.UNAVAILABLE, "connection refused"))
                .when(store).commitDate(argThat((DateBatch batch) -> batch != null && batch.date.equals(D2)));
        DailyJobRunner runner = runner(risingSource(10), store, JobOptions.defaults());

        BackfillReport report = runner.run(List.of(D3, D1, D2), List.of(A, B));

        assertEquals(DateState.COMMITTED, report.outcome(D1).state);
        assertEquals(DateState.COMMITTED, report.outcome(D3).state);
        DateOutcome failed = report.outcome(D2);
        assertEquals(DateState.FAILED, failed.state);
        assertEquals(OrchestrationError.STORE_COMMIT_FAILURE, failed.cause);
        assertFalse(report.isSuccessful());
        assertEquals(List.of(failed), report.failedDates());
        assertEquals(0, store.barCount(D2));
        assertEquals(DateState.FAILED, store.getDateRun(D2).orElseThrow().state);

        List<StrategyResult> d1Before = store.getStrategyResults(D1, Optional.empty());
        List<StrategyResult> d3Before = store.getStrategyResults(D3, Optional.empty());
        doCallRealMethod().when(store).commitDate(any());

        DateOutcome rerun = runner.runDate(D2, List.of(A, B));

        assertEquals(DateState.COMMITTED, rerun.state);
        assertEquals(2, store.barCount(D2));
        assertEquals(DateState.COMMITTED, store.getDateRun(D2).orElseThrow().state);
        assertEquals(d1Before, store.getStrategyResults(D1, Optional.empty()));
        assertEquals(d3Before, store.getStrategyResults(D3, Optional.empty()));
        assertEquals(2, store.barCount(D1));
        assertEquals(2, store.barCount(D3));
    }

    @Test
    void run_shouldNotRetryConstraintViolation() throws Exception {
        InMemoryMarketStore store = spy(new InMemoryMarketStore());
        AtomicInteger commits = new AtomicInteger();
        doAnswer(invocation -> {
            commits.incrementAndGet();
            throw new StoreException(StoreError.CONSTRAINT_VIOLATION, "duplicate key");
        }).when(store).commitDate(any());
        DailyJobRunner runner = runner(risingSource(10), store, JobOptions.defaults());

        DateOutcome outcome = runner.runDate(D1, List.of(A));

        assertEquals(OrchestrationError.STORE_COMMIT_FAILURE, outcome.cause);
        assertEquals(1, commits.get());
    }

    @Test
    void run_shouldFailDateWhenHistoryCannotBeLoaded() throws Exception {
        InMemoryMarketStore store = spy(new InMemoryMarketStore());
        doThrow(new StoreException(StoreError.UNAVAILABLE, "timeout"))
                .when(store).getRecentBars(anyCollection(), any(), anyInt());
        DailyJobRunner runner = runner(risingSource(10), store, JobOptions.defaults());

        DateOutcome outcome = runner.runDate(D1, List.of(A));

        assertEquals(DateState.FAILED, outcome.state);
        assertEquals(OrchestrationError.STORE_UNAVAILABLE, outcome.cause);
        assertEquals(0, store.barCount(D1));
    }

    @Test
    void run_shouldSkipNonTradingDateWithoutFetching() {
        AtomicInteger calls = new AtomicInteger();
        UpstreamSource source = (instrument, date, credential) -> {
            calls.incrementAndGet();
            return risingHistory(instrument.code, date, 10);
        };
        InMemoryMarketStore store = new InMemoryMarketStore();
        DailyJobRunner runner = runner(source, store, JobOptions.defaults());

        BackfillReport report = runner.run(List.of(SATURDAY), List.of(A));

        assertEquals(DateState.SKIPPED, report.outcome(SATURDAY).state);
        assertEquals(0, calls.get());
        assertTrue(report.isSuccessful());
    }

    @Test
    void cancel_shouldLeaveRemainingDatesPending() {
        AtomicReference<DailyJobRunner> ref = new AtomicReference<>();
        UpstreamSource source = (instrument, date, credential) -> {
            ref.get().cancel();
            return risingHistory(instrument.code, date, 10);
        };
        InMemoryMarketStore store = new InMemoryMarketStore();
        DailyJobRunner runner = runner(source, store, JobOptions.defaults());
        ref.set(runner);

        BackfillReport report = runner.run(List.of(D1, D2, D3), List.of(A));

        assertTrue(report.cancelled);
        assertEquals(DateState.COMMITTED, report.outcome(D1).state);
        assertEquals(DateState.PENDING, report.outcome(D2).state);
        assertEquals(DateState.PENDING, report.outcome(D3).state);
        assertEquals(0, store.barCount(D2));
        assertFalse(report.isSuccessful());
        assertEquals(DateState.PENDING, runner.stateOf(D3));
    }

    @Test
    void run_shouldProduceSameResultsWithParallelDates() {
        InMemoryMarketStore sequential = new InMemoryMarketStore();
        InMemoryMarketStore parallel = new InMemoryMarketStore();
        JobOptions parallelOptions = JobOptions.defaults().toBuilder().dateWorkers(3).commitInOrder(false).build();

        runner(risingSource(12), sequential, JobOptions.defaults()).run(List.of(D1, D2, D3), List.of(A, B));
        BackfillReport report = runner(risingSource(12), parallel, parallelOptions).run(List.of(D1, D2, D3), List.of(A, B));

        assertTrue(report.isSuccessful());
        for (LocalDate date : List.of(D1, D2, D3)) {
            assertEquals(sequential.getStrategyResults(date, Optional.empty()), parallel.getStrategyResults(date, Optional.empty()));
            assertEquals(sequential.getIndicators("A", date), parallel.getIndicators("A", date));
        }
    }

    @Test
    void runDate_shouldBeIdempotentOnRerun() throws Exception {
        InMemoryMarketStore store = new InMemoryMarketStore();
        DailyJobRunner runner = runner(risingSource(10), store, JobOptions.defaults());

        runner.runDate(D1, List.of(A, B));
        List<StrategyResult> first = store.getStrategyResults(D1, Optional.empty());
        Optional<IndicatorRow> firstRow = store.getIndicators("A", D1);
        runner.runDate(D1, List.of(A, B));

        assertEquals(first, store.getStrategyResults(D1, Optional.empty()));
        assertEquals(firstRow, store.getIndicators("A", D1));
        assertEquals(2, store.barCount(D1));
    }

    @Test
    void stateOf_shouldOnlyTrackDatesOfLatestRun() {
        DailyJobRunner runner = runner(risingSource(10), new InMemoryMarketStore(), JobOptions.defaults());

        runner.runDate(D1, List.of(A, B));
        assertEquals(DateState.COMMITTED, runner.stateOf(D1));

        runner.runDate(D2, List.of(A, B));
        assertEquals(DateState.COMMITTED, runner.stateOf(D2));
        assertEquals(DateState.PENDING, runner.stateOf(D1));
    }

    @Test
    void mergeHistory_shouldPreferStoredBarsAndEndWithFetchedBar() {
        BarDaily fetched = new BarDaily("A", D3, 1, 1, 1, 30.0, 1);
        FetchOutcome outcome = FetchOutcome.success(A, fetched, List.of(
                new BarDaily("A", D1, 1, 1, 1, 10.0, 1),
                new BarDaily("A", D2, 1, 1, 1, 20.0, 1),
                fetched), 1);
        List<BarDaily> stored = List.of(new BarDaily("A", D2, 1, 1, 1, 21.0, 1));

        List<BarDaily> merged = DailyJobRunner.mergeHistory(D3, outcome, stored, 10);
        List<BarDaily> limited = DailyJobRunner.mergeHistory(D3, outcome, stored, 2);

        assertEquals(3, merged.size());
        assertEquals(21.0, merged.get(1).close, 1e-9);
        assertEquals(fetched, merged.get(2));
        assertEquals(List.of(D2, D3), List.of(limited.get(0).tradeDate, limited.get(1).tradeDate));
    }

    @Test
    void constructor_shouldRejectStrategyWithUnknownIndicator() {
        Strategy needsRsi = new Strategy() {
            @Override
            public String name() {
                return "needs_rsi";
            }

            @Override
            public List<String> requiredIndicators() {
                return List.of("rsi_6");
            }

            @Override
            public Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market) {
                return Optional.empty();
            }
        };

        assertThrows(IllegalStateException.class, () -> new DailyJobRunner(
                fetcher(risingSource(1)),
                new IndicatorEngine(IndicatorRegistry.of(new MovingAverage("ma5", PriceField.CLOSE, 5))),
                new StrategyEngine(StrategyRegistry.of(needsRsi), 1),
                new InMemoryMarketStore(),
                TradingCalendar.weekdays(),
                JobOptions.defaults()));
    }

    private static DailyJobRunner runner(UpstreamSource source, InMemoryMarketStore store, JobOptions options) {
        return new DailyJobRunner(
                fetcher(source),
                new IndicatorEngine(IndicatorRegistry.of(new MovingAverage("ma5", PriceField.CLOSE, 5))),
                new StrategyEngine(StrategyRegistry.of(new CloseAboveMa5()), 2),
                store,
                new TradingCalendar(Set.of()),
                options
        );
    }

    private static MarketDataFetcher fetcher(UpstreamSource source) {
        CredentialPool pool = new CredentialPool(List.of(), 3, 1_000L, Clock.systemUTC());
        return new MarketDataFetcher(source, pool, new FetchPolicy(2, 0L, 0L, 2), 4, 1_000L, 0, millis -> { });
    }

    private static UpstreamSource risingSource(int bars) {
        return (instrument, date, credential) -> risingHistory(instrument.code, date, bars);
    }

    private static DailyHistory risingHistory(String code, LocalDate last, int bars) {
        double base = code.equals("A") ? 10.0 : 50.0;
        List<BarDaily> out = new ArrayList<>();
        for (int i = bars - 1; i >= 0; i--) {
            LocalDate date = last.minusDays(i);
            double close = base + date.getDayOfYear() * 0.5;
            out.add(new BarDaily(code, date, close - 0.1, close + 0.3, close - 0.3, close, 10_000.0));
        }
        return new DailyHistory(code, out);
    }

    private static final class CloseAboveMa5 implements Strategy {
        @Override
        public String name() {
            return "close_above_ma5";
        }

        @Override
        public List<String> requiredIndicators() {
            return List.of("ma5");
        }

        @Override
        public Optional<StrategyMatch> evaluate(InstrumentWindow window, MarketSnapshot market) {
            double close = window.latestBar().close;
            double ma5 = window.indicator("ma5");
            if (close <= ma5) {
                return Optional.empty();
            }
            return Optional.of(StrategyMatch.of(close / ma5).with("close", close).with("ma5", ma5));
        }
    }
}
