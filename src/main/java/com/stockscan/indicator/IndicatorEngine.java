package com.stockscan.indicator;

import com.stockscan.model.BarDaily;
import com.stockscan.model.IndicatorRow;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 模块说明：IndicatorEngine（class）。
 * 主要职责：按注册的指标定义，从截至交易日 D 的日线序列计算 IndicatorRow。
 * 使用建议：引擎无可变状态，可在多线程间共享；历史不足时对应指标为未定义（null），不是 0。
 */
public final class IndicatorEngine {
    private final IndicatorRegistry registry;

    public IndicatorEngine(IndicatorRegistry registry) {
        this.registry = registry;
    }

    public IndicatorRegistry registry() {
        return registry;
    }

    /**
     * IndicatorRow for {@code date}. Bars dated after {@code date} are ignored; the history
     * must contain a bar for {@code date} itself.
     */
    public IndicatorRow compute(List<BarDaily> history, LocalDate date) {
        List<IndicatorRow> rows = computeSeries(history, date, 1);
        return rows.get(0);
    }

    /**
     * Rows for the last {@code rows} bars ending at {@code date}, oldest first. Each row only sees
     * bars up to its own date.
     */
    public List<IndicatorRow> computeSeries(List<BarDaily> history, LocalDate date, int rows) {
        List<BarDaily> bars = cutAt(history, date);
        if (bars.isEmpty() || !bars.get(bars.size() - 1).tradeDate.equals(date)) {
            throw new IllegalArgumentException("history has no bar for " + date);
        }
        String code = bars.get(bars.size() - 1).code;
        BarSeries series = new BarSeries(bars);
        int count = Math.min(Math.max(1, rows), series.size());
        List<IndicatorRow> out = new ArrayList<>(count);
        for (int end = series.size() - count; end < series.size(); end++) {
            out.add(computeAt(code, series, end));
        }
        return out;
    }

    private IndicatorRow computeAt(String code, BarSeries series, int end) {
        Map<String, Double> values = new LinkedHashMap<>();
        int available = end + 1;
        for (IndicatorDefinition definition : registry.definitions()) {
            Double value = null;
            if (available >= definition.lookback()) {
                OptionalDouble computed = definition.compute(series.window(end, definition.lookback()));
                if (computed.isPresent() && Double.isFinite(computed.getAsDouble())) {
                    value = computed.getAsDouble();
                }
            }
            values.put(definition.name(), value);
        }
        return new IndicatorRow(code, series.dates[end], values);
    }

    private static List<BarDaily> cutAt(List<BarDaily> history, LocalDate date) {
        if (history == null || history.isEmpty()) {
            return Collections.emptyList();
        }
        List<BarDaily> out = new ArrayList<>(history.size());
        LocalDate previous = null;
        for (BarDaily bar : history) {
            if (bar.tradeDate.isAfter(date)) {
                continue;
            }
            if (previous != null && !bar.tradeDate.isAfter(previous)) {
                throw new IllegalArgumentException("history must be strictly ascending: "
                        + previous + " then " + bar.tradeDate + " for " + bar.code);
            }
            previous = bar.tradeDate;
            out.add(bar);
        }
        return out;
    }
}
