package com.stockscan.backtest;

import com.stockscan.config.Config;
import com.stockscan.db.MarketStore;
import com.stockscan.db.StoreException;
import com.stockscan.model.BacktestReport;
import com.stockscan.model.BarDaily;
import com.stockscan.model.StrategyResult;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Forward returns of committed strategy matches, measured from stored closes.
 */
public final class BacktestRunner {
    private final MarketStore store;
    private final List<Integer> horizons;
    private final int lookbackDays;

    public BacktestRunner(MarketStore store, List<Integer> horizons, int lookbackDays) {
        if (horizons.isEmpty()) {
            throw new IllegalArgumentException("backtest needs at least one horizon");
        }
        this.store = store;
        this.horizons = List.copyOf(new TreeSet<>(horizons));
        this.lookbackDays = Math.max(1, lookbackDays);
    }

    public static BacktestRunner fromConfig(Config config, MarketStore store) {
        List<Integer> horizons = new ArrayList<>();
        for (String item : config.getList("backtest.horizons")) {
            int h;
            try {
                h = Integer.parseInt(item);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("backtest.horizons has a non-integer entry: " + item, e);
            }
            if (h <= 0) {
                throw new IllegalArgumentException("backtest.horizons must be positive: " + item);
            }
            horizons.add(h);
        }
        return new BacktestRunner(store, horizons, config.getInt("backtest.lookback_days", 90));
    }

    /**
     * Matches dated within {@code lookbackDays} before {@code asOf}; a match contributes to horizon h
     * only once h later bars are stored.
     */
    public BacktestReport run(LocalDate asOf) throws StoreException {
        LocalDate from = asOf.minusDays(lookbackDays);
        List<StrategyResult> results = store.getStrategyResults(from, asOf);

        Map<String, LocalDate> earliestByCode = new HashMap<>();
        for (StrategyResult result : results) {
            earliestByCode.merge(result.code, result.tradeDate, (a, b) -> a.isBefore(b) ? a : b);
        }
        Map<String, List<BarDaily>> barsByCode = new HashMap<>();
        for (Map.Entry<String, LocalDate> e : earliestByCode.entrySet()) {
            barsByCode.put(e.getKey(), store.getBars(e.getKey(), e.getValue(), asOf));
        }

        Map<String, Map<Integer, List<Double>>> samples = new TreeMap<>();
        for (StrategyResult result : results) {
            Map<Integer, List<Double>> byHorizon = samples.computeIfAbsent(result.strategy, k -> new TreeMap<>());
            List<BarDaily> bars = barsByCode.getOrDefault(result.code, List.of());
            int entryIndex = indexOf(bars, result.tradeDate);
            for (int h : horizons) {
                List<Double> values = byHorizon.computeIfAbsent(h, k -> new ArrayList<>());
                if (entryIndex < 0 || entryIndex + h >= bars.size()) {
                    continue;
                }
                double entry = bars.get(entryIndex).close;
                if (entry <= 0.0) {
                    continue;
                }
                double exit = bars.get(entryIndex + h).close;
                values.add((exit - entry) / entry * 100.0);
            }
        }

        List<BacktestReport.Line> lines = new ArrayList<>();
        for (Map.Entry<String, Map<Integer, List<Double>>> strategy : samples.entrySet()) {
            for (Map.Entry<Integer, List<Double>> horizon : strategy.getValue().entrySet()) {
                lines.add(summarize(strategy.getKey(), horizon.getKey(), horizon.getValue()));
            }
        }
        return new BacktestReport(results.size(), lines);
    }

    public String toSummaryText(BacktestReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.US, "BACKTEST results=%d lookback_days=%d", report.resultCount, lookbackDays));
        for (BacktestReport.Line line : report.lines) {
            sb.append('\n').append(String.format(
                    Locale.US,
                    " - strategy=%s horizon=%dd samples=%d avg=%.2f%% median=%.2f%% win_rate=%.2f%%",
                    line.strategy,
                    line.horizonDays,
                    line.sampleCount,
                    line.avgReturnPct,
                    line.medianReturnPct,
                    line.winRatePct
            ));
        }
        return sb.toString();
    }

    private static int indexOf(List<BarDaily> bars, LocalDate date) {
        for (int i = 0; i < bars.size(); i++) {
            if (bars.get(i).tradeDate.equals(date)) {
                return i;
            }
        }
        return -1;
    }

    private static BacktestReport.Line summarize(String strategy, int horizon, List<Double> returns) {
        if (returns.isEmpty()) {
            return new BacktestReport.Line(strategy, horizon, 0, 0.0, 0.0, 0.0);
        }
        List<Double> sorted = new ArrayList<>(returns);
        Collections.sort(sorted);
        double sum = 0.0;
        int wins = 0;
        for (double value : sorted) {
            sum += value;
            if (value > 0.0) {
                wins++;
            }
        }
        double median;
        if (sorted.size() % 2 == 0) {
            int right = sorted.size() / 2;
            median = (sorted.get(right - 1) + sorted.get(right)) / 2.0;
        } else {
            median = sorted.get(sorted.size() / 2);
        }
        return new BacktestReport.Line(
                strategy,
                horizon,
                sorted.size(),
                round2(sum / sorted.size()),
                round2(median),
                round2(wins * 100.0 / sorted.size())
        );
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
