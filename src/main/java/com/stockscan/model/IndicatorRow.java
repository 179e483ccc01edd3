package com.stockscan.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Indicator values of one instrument on one trading date.
 * A name mapped to {@code null} is undefined (not enough history), which is not the same as zero.
 */
@EqualsAndHashCode
@ToString
public final class IndicatorRow {
    public final String code;
    public final LocalDate tradeDate;
    private final Map<String, Double> values;

    public IndicatorRow(String code, LocalDate tradeDate, Map<String, Double> values) {
        this.code = code;
        this.tradeDate = tradeDate;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values == null ? Map.of() : values));
    }

    public OptionalDouble value(String name) {
        Double v = values.get(name);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public boolean isDefined(String name) {
        return values.get(name) != null;
    }

    public boolean hasIndicator(String name) {
        return values.containsKey(name);
    }

    /**
     * Value or NaN when undefined; handy for series math.
     */
    public double valueOrNaN(String name) {
        Double v = values.get(name);
        return v == null ? Double.NaN : v;
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Double> asMap() {
        return values;
    }
}
