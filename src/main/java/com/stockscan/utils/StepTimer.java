package com.stockscan.utils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wall-clock timing of the named stages of one date's run. Durations accumulate when a step repeats.
 */
public class StepTimer {
    private final Map<String, Long> start = new LinkedHashMap<>();
    private final Map<String, Long> durMs = new LinkedHashMap<>();

    public synchronized void start(String step) {
        start.put(step, System.currentTimeMillis());
    }

    public synchronized void end(String step) {
        Long s = start.remove(step);
        if (s != null) {
            durMs.merge(step, System.currentTimeMillis() - s, Long::sum);
        }
    }

    public synchronized Map<String, Long> snapshot() {
        return new LinkedHashMap<>(durMs);
    }

    public synchronized long millis(String step) {
        return durMs.getOrDefault(step, 0L);
    }

    public synchronized String summaryText() {
        StringBuilder sb = new StringBuilder();
        sb.append("耗时统计");
        for (Map.Entry<String, Long> e : durMs.entrySet()) {
            sb.append(' ').append(stepZh(e.getKey())).append('=').append(e.getValue()).append("ms");
        }
        return sb.toString();
    }

    private static String stepZh(String step) {
        if (step == null) return "";
        switch (step) {
            case "TOTAL":
                return "总耗时";
            case "FETCH":
                return "行情抓取";
            case "COMPUTE":
                return "指标计算";
            case "EVALUATE":
                return "策略评估";
            case "COMMIT":
                return "数据库写入";
            default:
                return step;
        }
    }
}
