package com.stockscan.indicator;

import java.util.OptionalDouble;

public final class RollingExtreme extends AbstractIndicator {
    private final PriceField field;
    private final boolean max;

    private RollingExtreme(String name, PriceField field, int period, boolean max) {
        super(name, period);
        this.field = field;
        this.max = max;
    }

    public static RollingExtreme highest(String name, PriceField field, int period) {
        return new RollingExtreme(name, field, period, true);
    }

    public static RollingExtreme lowest(String name, PriceField field, int period) {
        return new RollingExtreme(name, field, period, false);
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        double out = window.value(field, 0);
        for (int i = 1; i < window.size(); i++) {
            double v = window.value(field, i);
            out = max ? Math.max(out, v) : Math.min(out, v);
        }
        return defined(out);
    }
}
