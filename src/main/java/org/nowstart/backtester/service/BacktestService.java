package org.nowstart.backtester.service;

import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.dto.BacktestDiagnostic;
import org.nowstart.backtester.data.dto.BacktestResult;
import org.nowstart.backtester.data.dto.BacktestSettings;
import org.nowstart.backtester.data.dto.PerformanceMetrics;
import org.nowstart.backtester.data.dto.TradeRecord;
import org.nowstart.backtester.data.exception.DataInsufficientException;
import org.nowstart.backtester.data.exception.RunInterruptedException;
import org.nowstart.backtester.data.type.StrategyAction;
import org.nowstart.backtester.indicator.IndicatorSet;
import org.nowstart.backtester.strategy.StrategyRegistry;
import org.nowstart.backtester.strategy.core.BarSeries;
import org.nowstart.backtester.strategy.core.OhlcvCandle;
import org.nowstart.backtester.strategy.core.StrategyDiagnostic;
import org.nowstart.backtester.strategy.core.StrategyEvaluation;
import org.nowstart.backtester.strategy.core.StrategyInput;
import org.nowstart.backtester.strategy.core.StrategyParams;
import org.nowstart.backtester.strategy.core.StrategySignalDecision;
import org.nowstart.backtester.strategy.core.TradingStrategyEngine;
import org.springframework.stereotype.Service;

/**
 * Bar-by-bar simulation of one strategy over one series.
 *
 * <p>For each bar: fill the pending order at the open, check the stop against the bar's range, evaluate the
 * strategy once warmed up (skipped when the stop fired on that bar), then mark equity at the close.
 * Stateless; every run owns a fresh {@link SimulationState}. An interrupted thread aborts the run at the next bar.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestService {

    private final StrategyRegistry strategyRegistry;
    private final PerformanceMetricsService performanceMetricsService;

    public BacktestResult run(BarSeries series, String strategyName, StrategyParams params, BacktestSettings settings) {
        return runUnchecked(series, strategyRegistry.getRequired(strategyName), params, settings);
    }

    public <P extends StrategyParams> BacktestResult run(
            BarSeries series,
            TradingStrategyEngine<P> engine,
            P params,
            BacktestSettings settings
    ) {
        if (series == null || engine == null || params == null || settings == null) {
            throw new IllegalArgumentException("series, engine, params, and settings are required");
        }

        int strategyWarmup = Math.max(1, engine.requiredWarmupCandles(params));
        if (series.isEmpty()) {
            throw new DataInsufficientException(strategyWarmup, 0);
        }

        IndicatorSet indicators = engine.initialize(series, params);
        int warmup = Math.max(strategyWarmup, indicators.maxWarmupBars());
        int n = series.size();
        if (n < warmup) {
            throw new DataInsufficientException(warmup, n);
        }

        log.debug("[Backtest][RUN] strategy={} bars={} warmup={} params={}", engine.name(), n, warmup, params);

        SimulationState state = new SimulationState(settings);
        PositionManager positions = state.positionManager();
        for (int i = 0; i < n; i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new RunInterruptedException(engine.name(), i);
            }
            state.advanceTo(i);
            OhlcvCandle bar = series.get(i);

            positions.fillPending(bar, i);
            Optional<TradeRecord> stopped = positions.checkStopLoss(bar, i);

            if (stopped.isEmpty() && i + 1 >= warmup) {
                StrategyEvaluation evaluation = engine.evaluate(
                        new StrategyInput<>(series, indicators, i, positions.position(), params)
                );
                StrategySignalDecision decision = evaluation.decision();
                if (decision.isRejection()) {
                    recordRejection(state, engine.name(), i, bar, evaluation);
                } else if (decision.action() != StrategyAction.NONE) {
                    logSignal(engine.name(), i, bar, evaluation);
                }
                positions.submit(decision.action(), decision.stopLoss(), i, bar);
            }

            state.markEquity(bar);
        }

        OhlcvCandle lastBar = series.last();
        positions.discardPending(lastBar, n - 1);
        if (settings.closeOpenPositionAtEnd() && positions.closeAtEnd(lastBar, n - 1).isPresent()) {
            state.remarkLast(lastBar);
        }

        List<TradeRecord> trades = List.copyOf(positions.trades());
        PerformanceMetrics metrics = performanceMetricsService.calculate(
                trades,
                state.equityCurve(),
                series,
                settings,
                positions.commissionsPaid()
        );
        BacktestResult result = new BacktestResult(
                engine.name(),
                params,
                settings,
                warmup,
                metrics,
                trades,
                state.equityCurve(),
                state.diagnostics(),
                positions.position(),
                positions.ignoredSignals()
        );
        state.finish();

        log.debug(
                "[Backtest][DONE] strategy={} trades={} returnPct={} maxDrawdownPct={} ignoredSignals={}",
                engine.name(),
                trades.size(),
                metrics.returnPct(),
                metrics.maxDrawdownPct(),
                positions.ignoredSignals()
        );
        return result;
    }

    private <P extends StrategyParams> BacktestResult runUnchecked(
            BarSeries series,
            TradingStrategyEngine<P> engine,
            StrategyParams params,
            BacktestSettings settings
    ) {
        return run(series, engine, StrategyRegistry.castParams(engine, params), settings);
    }

    private void logSignal(String strategy, int index, OhlcvCandle bar, StrategyEvaluation evaluation) {
        if (!log.isDebugEnabled()) {
            return;
        }
        StrategySignalDecision decision = evaluation.decision();
        log.debug(
                "[Backtest][SIGNAL] strategy={} index={} ts={} close={} action={} reason={} stop={} diagnostics={}",
                strategy,
                index,
                bar.timestamp(),
                bar.close(),
                decision.action(),
                decision.signalReason(),
                decision.stopLoss(),
                formatDiagnostics(evaluation.diagnostics())
        );
    }

    static String formatDiagnostics(List<StrategyDiagnostic> diagnostics) {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (StrategyDiagnostic diagnostic : diagnostics) {
            joiner.add(diagnostic.key() + "=" + diagnostic.value());
        }
        return joiner.toString();
    }

    private void recordRejection(
            SimulationState state,
            String strategy,
            int index,
            OhlcvCandle bar,
            StrategyEvaluation evaluation
    ) {
        String stop = evaluation.diagnostic("stop.price")
                .map(StrategyDiagnostic::value)
                .map(String::valueOf)
                .orElse("n/a");
        log.warn(
                "[Backtest] rejected non-protective stop strategy={} index={} close={} stop={} diagnostics={}",
                strategy,
                index,
                bar.close(),
                stop,
                formatDiagnostics(evaluation.diagnostics())
        );
        state.diagnostic(
                index,
                bar.timestamp(),
                BacktestDiagnostic.STOP_REJECTED,
                "stop=" + stop + " is on the wrong side of close=" + bar.close()
        );
    }
}
