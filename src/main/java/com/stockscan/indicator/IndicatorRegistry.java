package com.stockscan.indicator;

import com.stockscan.config.Config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable, name-ordered set of indicator definitions. Adding one returns a new registry.
 */
public final class IndicatorRegistry {
    private final Map<String, IndicatorDefinition> definitions;

    private IndicatorRegistry(Map<String, IndicatorDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    public static IndicatorRegistry of(Collection<? extends IndicatorDefinition> definitions) {
        Map<String, IndicatorDefinition> map = new TreeMap<>();
        for (IndicatorDefinition definition : definitions) {
            if (map.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("duplicate indicator name: " + definition.name());
            }
        }
        return new IndicatorRegistry(map);
    }

    public static IndicatorRegistry of(IndicatorDefinition... definitions) {
        return of(List.of(definitions));
    }

    public static IndicatorRegistry builtIns() {
        List<IndicatorDefinition> defs = new ArrayList<>();
        for (int period : new int[]{5, 10, 20, 30, 60, 250}) {
            defs.add(new MovingAverage("ma" + period, PriceField.CLOSE, period));
        }
        defs.add(new MovingAverage("vol_ma5", PriceField.VOLUME, 5));
        defs.add(new MovingAverage("amount", PriceField.AMOUNT, 1));
        defs.add(new PercentChange("pct_change", 1));
        defs.add(new PercentChange("return_20", 20));
        defs.add(new RelativeStrengthIndex("rsi_6", 6));
        defs.add(new RelativeStrengthIndex("rsi_14", 14));
        defs.add(new AverageTrueRange("atr_14", 14));
        defs.add(new BollingerBand("boll_upper_20", 20, 2.0, BollingerBand.Side.UPPER));
        defs.add(new BollingerBand("boll_lower_20", 20, 2.0, BollingerBand.Side.LOWER));
        defs.add(new WilliamsR("wr_6", 6));
        defs.add(new WilliamsR("wr_10", 10));
        defs.add(new CommodityChannelIndex("cci_14", 14));
        defs.add(RollingExtreme.highest("high_60", PriceField.CLOSE, 60));
        defs.add(RollingExtreme.lowest("low_60", PriceField.CLOSE, 60));
        defs.add(new Volatility("volatility_20", 20));
        defs.add(new VolumeRatio("vol_ratio_5", 5));
        defs.add(new StochasticKdj("kdjk", 9, StochasticKdj.Line.K));
        defs.add(new StochasticKdj("kdjd", 9, StochasticKdj.Line.D));
        defs.add(new StochasticKdj("kdjj", 9, StochasticKdj.Line.J));
        defs.add(new MovingAverageConvergence("macd", 12, 26, 9, MovingAverageConvergence.Line.DIF));
        defs.add(new MovingAverageConvergence("macds", 12, 26, 9, MovingAverageConvergence.Line.DEA));
        defs.add(new MovingAverageConvergence("macdh", 12, 26, 9, MovingAverageConvergence.Line.HISTOGRAM));
        defs.add(new EnergyRatio("cr", 26));
        defs.add(new VolumeVariation("vr", 26));
        defs.add(new Bias("bias_6", 6));
        return of(defs);
    }

    public static IndicatorRegistry fromConfig(Config config) {
        return builtIns().select(config.getList("indicator.enabled"));
    }

    /**
     * Keeps only the named definitions; an empty list keeps everything.
     */
    public IndicatorRegistry select(List<String> names) {
        if (names == null || names.isEmpty()) {
            return this;
        }
        Map<String, IndicatorDefinition> picked = new TreeMap<>();
        for (String name : names) {
            IndicatorDefinition definition = definitions.get(name);
            if (definition == null) {
                throw new IllegalArgumentException("unknown indicator: " + name);
            }
            picked.put(name, definition);
        }
        return new IndicatorRegistry(picked);
    }

    public IndicatorRegistry with(IndicatorDefinition definition) {
        List<IndicatorDefinition> next = new ArrayList<>(definitions.values());
        next.add(definition);
        return of(next);
    }

    public Collection<IndicatorDefinition> definitions() {
        return definitions.values();
    }

    public List<String> names() {
        return List.copyOf(definitions.keySet());
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    public int maxLookback() {
        int max = 1;
        for (IndicatorDefinition definition : definitions.values()) {
            max = Math.max(max, definition.lookback());
        }
        return max;
    }

    public int size() {
        return definitions.size();
    }
}
