package org.nowstart.backtester.data.dto;

import java.util.List;
import org.nowstart.backtester.strategy.core.PositionSnapshot;
import org.nowstart.backtester.strategy.core.StrategyParams;

public record BacktestResult(
        String strategy,
        StrategyParams params,
        BacktestSettings settings,
        int warmupBars,
        PerformanceMetrics metrics,
        List<TradeRecord> trades,
        List<EquityPoint> equityCurve,
        List<BacktestDiagnostic> diagnostics,
        PositionSnapshot finalPosition,
        int ignoredSignals
) {

    public BacktestResult {
        trades = trades == null ? List.of() : List.copyOf(trades);
        equityCurve = equityCurve == null ? List.of() : List.copyOf(equityCurve);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public double finalCash() {
        return equityCurve.isEmpty() ? settings.initialCash() : equityCurve.get(equityCurve.size() - 1).cash();
    }

    public String range() {
        if (equityCurve.isEmpty()) {
            return "";
        }
        return equityCurve.get(0).timestamp() + " -> " + equityCurve.get(equityCurve.size() - 1).timestamp();
    }
}
