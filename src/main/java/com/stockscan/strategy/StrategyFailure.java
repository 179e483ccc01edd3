package com.stockscan.strategy;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class StrategyFailure {
    public final String strategy;
    public final String code;
    public final String error;
}
