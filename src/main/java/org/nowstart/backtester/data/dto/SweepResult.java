package org.nowstart.backtester.data.dto;

import java.util.Map;
import org.nowstart.backtester.strategy.core.StrategyParams;

public record SweepResult(
        Map<String, Double> overrides,
        StrategyParams params,
        double calmarRatio,
        double returnPct,
        double maxDrawdownPct,
        double sharpeRatio,
        double winRatePct,
        double finalEquity,
        int tradeCount
) {

    public SweepResult {
        overrides = overrides == null ? Map.of() : overrides;
    }

    public static SweepResult of(Map<String, Double> overrides, BacktestResult result) {
        PerformanceMetrics metrics = result.metrics();
        return new SweepResult(
                overrides,
                result.params(),
                metrics.calmarRatio(),
                metrics.returnPct(),
                metrics.maxDrawdownPct(),
                metrics.sharpeRatio(),
                metrics.winRatePct(),
                metrics.finalEquity(),
                metrics.tradeCount()
        );
    }
}
