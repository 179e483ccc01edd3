package com.stockscan.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;

/**
 * 模块说明：BarDaily（class）。
 * 主要职责：一只标的在一个交易日的 OHLCV 记录，提交后不再修改。
 * 使用建议：同一 (code, tradeDate) 至多一条。
 */
@EqualsAndHashCode
@ToString
public final class BarDaily {
    public final String code;
    public final LocalDate tradeDate;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final double volume;

    public BarDaily(String code, LocalDate tradeDate, double open, double high, double low, double close, double volume) {
        this.code = code;
        this.tradeDate = tradeDate;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    public double amount() {
        return close * volume;
    }
}
