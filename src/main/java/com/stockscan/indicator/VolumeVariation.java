package com.stockscan.indicator;

import java.util.OptionalDouble;

/**
 * VR: volume on up days plus half the unchanged-day volume, over volume on down days plus the other half, times 100.
 */
public final class VolumeVariation extends AbstractIndicator {

    public VolumeVariation(String name, int period) {
        super(name, period + 1);
    }

    @Override
    public OptionalDouble compute(BarWindow window) {
        double up = 0.0;
        double down = 0.0;
        double flat = 0.0;
        for (int i = 1; i < window.size(); i++) {
            double change = window.close(i) - window.close(i - 1);
            if (change > 0.0) {
                up += window.volume(i);
            } else if (change < 0.0) {
                down += window.volume(i);
            } else {
                flat += window.volume(i);
            }
        }
        double denominator = down + flat / 2.0;
        if (denominator <= 0.0) {
            return OptionalDouble.empty();
        }
        return defined((up + flat / 2.0) / denominator * 100.0);
    }
}
