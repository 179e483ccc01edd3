package com.stockscan.strategy;

import com.stockscan.config.Config;
import com.stockscan.indicator.IndicatorRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable, name-ordered snapshot of the strategies for one run.
 */
public final class StrategyRegistry {
    private final Map<String, Strategy> strategies;

    private StrategyRegistry(Map<String, Strategy> strategies) {
        this.strategies = Collections.unmodifiableMap(strategies);
    }

    public static StrategyRegistry of(Collection<? extends Strategy> strategies) {
        Map<String, Strategy> map = new TreeMap<>();
        for (Strategy strategy : strategies) {
            if (map.putIfAbsent(strategy.name(), strategy) != null) {
                throw new IllegalArgumentException("duplicate strategy name: " + strategy.name());
            }
        }
        return new StrategyRegistry(map);
    }

    public static StrategyRegistry of(Strategy... strategies) {
        return of(List.of(strategies));
    }

    public static StrategyRegistry builtIns(Config config) {
        double minAmount = config.getDouble("strategy.min_amount");
        double margin = config.getDouble("strategy.relative_strength.margin", 10.0);
        List<Strategy> list = new ArrayList<>();
        list.add(new VolumeSurgeStrategy(minAmount));
        list.add(new ClimaxLimitDownStrategy(minAmount));
        list.add(new TurtleTradeStrategy());
        list.add(new KeepIncreasingStrategy());
        list.add(new LowAtrGrowthStrategy());
        list.add(new LowBacktraceIncreaseStrategy());
        list.add(new ParkingApronStrategy());
        list.add(new BreakthroughPlatformStrategy(minAmount));
        list.add(new BacktraceMa250Strategy());
        list.add(new OverboughtMomentumStrategy());
        list.add(new OversoldReversalStrategy());
        list.add(new RelativeStrengthStrategy(margin));
        return of(list);
    }

    /**
     * Built-ins narrowed to {@code strategy.enabled}; an empty setting enables all.
     */
    public static StrategyRegistry fromConfig(Config config) {
        StrategyRegistry all = builtIns(config);
        List<String> enabled = config.getList("strategy.enabled");
        if (enabled.isEmpty()) {
            return all;
        }
        List<Strategy> picked = new ArrayList<>();
        for (String name : enabled) {
            Strategy strategy = all.strategies.get(name);
            if (strategy == null) {
                throw new IllegalArgumentException("unknown strategy: " + name);
            }
            picked.add(strategy);
        }
        return of(picked);
    }

    /**
     * Fails fast when a strategy depends on an indicator that is not registered.
     */
    public void validateAgainst(IndicatorRegistry indicators) {
        for (Strategy strategy : strategies.values()) {
            for (String name : strategy.requiredIndicators()) {
                if (!indicators.contains(name)) {
                    throw new IllegalStateException("strategy " + strategy.name() + " requires indicator " + name
                            + " which is not enabled");
                }
            }
        }
    }

    public Collection<Strategy> strategies() {
        return strategies.values();
    }

    public List<String> names() {
        return List.copyOf(strategies.keySet());
    }

    public int size() {
        return strategies.size();
    }

    public int maxHistoryRows() {
        int max = 1;
        for (Strategy strategy : strategies.values()) {
            max = Math.max(max, strategy.historyRows());
        }
        return max;
    }
}
