package org.nowstart.backtester.strategy;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.backtester.data.property.BacktestProperties;
import org.nowstart.backtester.strategy.core.StrategyParams;
import org.nowstart.backtester.strategy.core.TradingStrategyEngine;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StrategyParamResolver {

    private final BacktestProperties backtestProperties;
    private final StrategyRegistry strategyRegistry;

    public ActiveStrategy resolveActive() {
        return resolve(backtestProperties.strategy(), backtestProperties.strategyParameters());
    }

    public ActiveStrategy resolve(String strategyName, Map<String, Double> overrides) {
        TradingStrategyEngine<? extends StrategyParams> engine = strategyRegistry.getRequired(strategyName);
        StrategyParams params = engine.bindParams(overrides == null ? Map.of() : overrides);
        return new ActiveStrategy(engine.name(), params);
    }

    public record ActiveStrategy(String name, StrategyParams params) {
    }
}
