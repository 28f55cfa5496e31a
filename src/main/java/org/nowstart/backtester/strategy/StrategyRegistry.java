package org.nowstart.backtester.strategy;

import jakarta.annotation.PostConstruct;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.nowstart.backtester.strategy.core.StrategyParams;
import org.nowstart.backtester.strategy.core.TradingStrategyEngine;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StrategyRegistry {

    private final List<TradingStrategyEngine<? extends StrategyParams>> engines;
    private Map<String, TradingStrategyEngine<? extends StrategyParams>> enginesByName = Map.of();

    @PostConstruct
    void init() {
        Map<String, TradingStrategyEngine<? extends StrategyParams>> byName = new HashMap<>();
        for (TradingStrategyEngine<? extends StrategyParams> engine : engines) {
            String name = normalize(engine.name());
            TradingStrategyEngine<? extends StrategyParams> previous = byName.put(name, engine);
            if (previous != null) {
                throw new IllegalStateException("Duplicate strategy engine registered for name=" + name);
            }
        }
        enginesByName = Map.copyOf(byName);
    }

    public TradingStrategyEngine<? extends StrategyParams> getRequired(String strategyName) {
        TradingStrategyEngine<? extends StrategyParams> engine = enginesByName.get(normalize(strategyName));
        if (engine == null) {
            throw new IllegalStateException(
                    "No strategy engine registered for name=" + strategyName + ", available=" + names()
            );
        }
        return engine;
    }

    public Set<String> names() {
        return new TreeSet<>(enginesByName.keySet());
    }

    public static <P extends StrategyParams> P castParams(TradingStrategyEngine<P> engine, StrategyParams params) {
        if (!engine.parameterType().isInstance(params)) {
            throw new IllegalArgumentException(
                    "Invalid params type for strategy name=" + engine.name()
                            + ", required=" + engine.parameterType().getSimpleName()
                            + ", actual=" + (params == null ? "null" : params.getClass().getSimpleName())
            );
        }
        return engine.parameterType().cast(params);
    }

    static String normalize(String strategyName) {
        if (strategyName == null || strategyName.isBlank()) {
            throw new IllegalArgumentException("strategyName is required");
        }
        return strategyName.trim().toLowerCase(Locale.ROOT);
    }
}
