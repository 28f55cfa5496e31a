package org.nowstart.backtester.strategy.core;

/**
 * Marker for strategy-specific parameter records.
 */
public interface StrategyParams {
}
