package org.nowstart.backtester.strategy.trendrsi;

import org.nowstart.backtester.strategy.core.StrategyParams;

public record TrendFilteredRsiParams(
        int rsiPeriod,
        int emaPeriod,
        int atrPeriod,
        double oversold,
        double overbought,
        double exitLevel,
        double stopAtrMultiplier
) implements StrategyParams {

    public static final TrendFilteredRsiParams DEFAULTS = new TrendFilteredRsiParams(
            14,
            200,
            14,
            30.0,
            70.0,
            50.0,
            2.0
    );

    public TrendFilteredRsiParams {
        if (rsiPeriod <= 0 || emaPeriod <= 0 || atrPeriod <= 0) {
            throw new IllegalArgumentException("rsiPeriod, emaPeriod and atrPeriod must be > 0");
        }
        if (!(0.0 < oversold && oversold < exitLevel && exitLevel < overbought && overbought < 100.0)) {
            throw new IllegalArgumentException(
                    "RSI levels must satisfy 0 < oversold < exitLevel < overbought < 100, got oversold="
                            + oversold + ", exitLevel=" + exitLevel + ", overbought=" + overbought
            );
        }
        if (!Double.isFinite(stopAtrMultiplier) || stopAtrMultiplier <= 0.0) {
            throw new IllegalArgumentException("stopAtrMultiplier must be > 0");
        }
    }
}
