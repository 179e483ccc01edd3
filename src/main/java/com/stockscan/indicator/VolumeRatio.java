package com.stockscan.indicator;

import java.util.OptionalDouble;

/**
 * Current volume over the average of the preceding {@code period} volumes.
 */
public final class VolumeRatio extends AbstractIndicator {

    public VolumeRatio(String name, int period) {
        super(name, period + 1);
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        double prior = mean(window, PriceField.VOLUME, 0, window.last());
        if (prior <= 0.0) {
            return OptionalDouble.empty();
        }
        return defined(window.volume(window.last()) / prior);
    }
}
