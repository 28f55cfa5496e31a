package org.nowstart.backtester.strategy.core;

import java.util.Map;
import org.nowstart.backtester.indicator.IndicatorSet;

/**
 * Strategy contract driven by the simulation loop.
 *
 * <p>Implementations are stateless: everything a decision needs arrives through {@link StrategyInput}.
 * One engine instance can serve any number of concurrent runs.
 *
 * @param <P> parameter type consumed by the strategy
 */
public interface TradingStrategyEngine<P extends StrategyParams> {

    /**
     * Returns the registry key (for example {@code macd}, {@code rsi}).
     */
    String name();

    Class<P> parameterType();

    P defaultParams();

    /**
     * Binds a strategy-specific mapping of parameter names to values on top of {@link #defaultParams()}.
     *
     * @throws IllegalArgumentException for unknown names or values the parameter record rejects
     */
    P bindParams(Map<String, Double> overrides);

    /**
     * Returns the minimum bar count before the strategy can evaluate a signal.
     */
    int requiredWarmupCandles(P params);

    /**
     * Computes and registers every indicator the strategy reads. Called once per run.
     */
    IndicatorSet initialize(BarSeries series, P params);

    /**
     * Evaluates the bar at {@link StrategyInput#signalIndex()} and returns at most one action.
     */
    StrategyEvaluation evaluate(StrategyInput<P> input);
}
