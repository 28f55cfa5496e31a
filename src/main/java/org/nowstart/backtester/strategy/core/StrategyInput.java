package org.nowstart.backtester.strategy.core;

import org.nowstart.backtester.indicator.IndicatorSet;

public record StrategyInput<P extends StrategyParams>(
        BarSeries series,
        IndicatorSet indicators,
        int signalIndex,
        PositionSnapshot position,
        P params
) {

    public StrategyInput {
        if (series == null || indicators == null || params == null) {
            throw new IllegalArgumentException("series, indicators, and params are required");
        }
        if (signalIndex < 0 || signalIndex >= series.size()) {
            throw new IllegalArgumentException("signalIndex must be in [0, series.size()-1]");
        }
        position = position == null ? PositionSnapshot.FLAT : position;
    }

    public OhlcvCandle bar() {
        return series.get(signalIndex);
    }
}
