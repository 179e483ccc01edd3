package com.stockscan.indicator;

import java.util.OptionalDouble;

abstract class AbstractIndicator implements IndicatorDefinition {
    private final String name;
    private final int lookback;

    AbstractIndicator(String name, int lookback) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("indicator name must not be empty");
        }
        if (lookback <= 0) {
            throw new IllegalArgumentException("lookback must be positive: " + name);
        }
        this.name = name.trim();
        this.lookback = lookback;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final int lookback() {
        return lookback;
    }

    /**
     * NaN and infinities (a zero denominator, for example) are reported as undefined.
     */
    static OptionalDouble defined(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(value);
    }

    static double mean(BarWindow window, PriceField field, int from, int toExclusive) {
        double sum = 0.0;
        for (int i = from; i < toExclusive; i++) {
            sum += window.value(field, i);
        }
        return sum / (toExclusive - from);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + ", lookback=" + lookback + "}";
    }
}
