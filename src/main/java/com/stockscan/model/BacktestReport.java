package com.stockscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class BacktestReport {
    public final int resultCount;
    public final List<Line> lines;

    @Value
    @AllArgsConstructor(access = AccessLevel.PUBLIC)
    @Builder(toBuilder = true)
    public static class Line {
        public final String strategy;
        public final int horizonDays;
        public final int sampleCount;
        public final double avgReturnPct;
        public final double medianReturnPct;
        public final double winRatePct;
    }
}
