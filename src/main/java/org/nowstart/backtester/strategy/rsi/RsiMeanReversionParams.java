package org.nowstart.backtester.strategy.rsi;

import org.nowstart.backtester.strategy.core.StrategyParams;

public record RsiMeanReversionParams(
        int rsiPeriod,
        double oversold,
        double overbought,
        double exitLevel
) implements StrategyParams {

    public static final RsiMeanReversionParams DEFAULTS = new RsiMeanReversionParams(14, 30.0, 70.0, 50.0);

    public RsiMeanReversionParams {
        if (rsiPeriod <= 0) {
            throw new IllegalArgumentException("rsiPeriod must be > 0");
        }
        if (!(0.0 < oversold && oversold < exitLevel && exitLevel < overbought && overbought < 100.0)) {
            throw new IllegalArgumentException(
                    "RSI levels must satisfy 0 < oversold < exitLevel < overbought < 100, got oversold="
                            + oversold + ", exitLevel=" + exitLevel + ", overbought=" + overbought
            );
        }
    }
}
