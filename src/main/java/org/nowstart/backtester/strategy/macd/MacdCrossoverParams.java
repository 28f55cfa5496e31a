package org.nowstart.backtester.strategy.macd;

import org.nowstart.backtester.strategy.core.StrategyParams;

public record MacdCrossoverParams(
        int fastPeriod,
        int slowPeriod,
        int signalPeriod
) implements StrategyParams {

    public static final MacdCrossoverParams DEFAULTS = new MacdCrossoverParams(12, 26, 9);

    public MacdCrossoverParams {
        if (fastPeriod <= 0 || slowPeriod <= 0 || signalPeriod <= 0) {
            throw new IllegalArgumentException("MACD periods must be > 0");
        }
        if (fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException(
                    "fastPeriod must be < slowPeriod, got fast=" + fastPeriod + ", slow=" + slowPeriod
            );
        }
    }
}
