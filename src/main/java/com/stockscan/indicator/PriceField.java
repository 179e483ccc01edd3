package com.stockscan.indicator;

public enum PriceField {
    OPEN,
    HIGH,
    LOW,
    CLOSE,
    VOLUME,
    /** close * volume */
    AMOUNT
}
