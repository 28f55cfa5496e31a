package org.nowstart.backtester.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.nowstart.backtester.data.dto.BacktestDiagnostic;
import org.nowstart.backtester.data.dto.BacktestResult;
import org.nowstart.backtester.data.dto.BacktestSettings;
import org.nowstart.backtester.data.dto.EquityPoint;
import org.nowstart.backtester.data.dto.TradeRecord;
import org.nowstart.backtester.data.exception.DataInsufficientException;
import org.nowstart.backtester.data.exception.RunInterruptedException;
import org.nowstart.backtester.data.type.ExitReason;
import org.nowstart.backtester.data.type.FillPriceConvention;
import org.nowstart.backtester.data.type.PositionSide;
import org.nowstart.backtester.data.type.StrategyAction;
import org.nowstart.backtester.strategy.StrategyRegistry;
import org.nowstart.backtester.strategy.TestRegistries;
import org.nowstart.backtester.strategy.core.BarSeries;
import org.nowstart.backtester.strategy.core.StrategySignalDecision;
import org.nowstart.backtester.strategy.macd.MacdCrossoverParams;
import org.nowstart.backtester.strategy.rsi.RsiMeanReversionParams;
import org.nowstart.backtester.support.TestBars;
import org.slf4j.LoggerFactory;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith(OutputCaptureExtension.class)
class BacktestServiceTest {

    private final StrategyRegistry registry = registry();
    private final BacktestService backtestService = new BacktestService(registry, new PerformanceMetricsService());

    @Test
    void run_throwsDataInsufficientBeforeSimulating() {
        BarSeries tenBars = TestBars.fromCloses(TestBars.linear(10, 100.0, 1.0));

        assertThatThrownBy(() -> backtestService.run(tenBars, "rsi", RsiMeanReversionParams.DEFAULTS, BacktestSettings.defaults()))
                .isInstanceOf(DataInsufficientException.class)
                .hasMessageContaining("At least 14 bars are required, got 10")
                .hasFieldOrPropertyWithValue("code", DataInsufficientException.CODE)
                .hasFieldOrPropertyWithValue("requiredBars", 14);
        assertThatThrownBy(() -> backtestService.run(
                BarSeries.of(List.of()),
                "macd",
                MacdCrossoverParams.DEFAULTS,
                BacktestSettings.defaults()
        )).isInstanceOf(DataInsufficientException.class);
    }

    @Test
    void run_risingSeriesWithRsiOpensNoLongAndAtMostOneShort() {
        BarSeries rising = TestBars.fromCloses(TestBars.linear(300, 100.0, 1.0));

        BacktestResult result = backtestService.run(rising, "rsi", RsiMeanReversionParams.DEFAULTS, BacktestSettings.defaults());

        assertThat(result.trades()).noneMatch(trade -> trade.side() == PositionSide.LONG);
        long shortEntries = result.trades().stream().filter(trade -> trade.side() == PositionSide.SHORT).count()
                + (result.finalPosition().isShort() ? 1 : 0);
        assertThat(shortEntries).isLessThanOrEqualTo(1);
        assertThat(result.finalPosition().side()).isNotEqualTo(PositionSide.LONG);
        assertThat(result.equityCurve()).hasSize(300);
        assertThat(result.warmupBars()).isEqualTo(14);
    }

    @Test
    void run_macdRiseThenFallClosesExactlyOneLong() {
        double[] closes = new double[60];
        for (int i = 0; i < 20; i++) {
            closes[i] = 150.0 - i;
        }
        for (int i = 20; i < 40; i++) {
            closes[i] = closes[i - 1] + 2.0;
        }
        for (int i = 40; i < 60; i++) {
            closes[i] = closes[i - 1] - 3.0;
        }
        BarSeries series = TestBars.fromCloses(closes);

        BacktestResult result = backtestService.run(
                series,
                "macd",
                new MacdCrossoverParams(3, 6, 3),
                BacktestSettings.defaults()
        );

        List<TradeRecord> longCloses = result.trades().stream()
                .filter(trade -> trade.side() == PositionSide.LONG && trade.exitReason() == ExitReason.SIGNAL)
                .toList();
        assertThat(longCloses).hasSize(1);
        assertThat(longCloses.get(0).entryIndex()).isBetween(20, 39);
        assertThat(longCloses.get(0).exitIndex()).isBetween(40, 59);
    }

    @Test
    void run_keepsAccountingIdentityAndExclusivity() {
        double[] closes = new double[300];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = 100.0 + 10.0 * Math.sin(i / 5.0);
        }
        BacktestSettings settings = BacktestSettings.defaults()
                .withCommission(0.001, 0.5)
                .withCloseOpenPositionAtEnd(true);

        BacktestResult result = backtestService.run(
                TestBars.fromCloses(closes),
                "rsi",
                RsiMeanReversionParams.DEFAULTS,
                settings
        );

        List<TradeRecord> trades = result.trades();
        assertThat(trades).isNotEmpty();
        double netSum = trades.stream().mapToDouble(TradeRecord::netProfit).sum();
        double grossSum = trades.stream().mapToDouble(TradeRecord::grossProfit).sum();
        double commissionSum = trades.stream().mapToDouble(TradeRecord::commission).sum();
        double cashDelta = result.finalCash() - settings.initialCash();
        assertThat(netSum).isCloseTo(cashDelta, within(1e-6));
        assertThat(grossSum - commissionSum).isCloseTo(cashDelta, within(1e-6));
        assertThat(result.metrics().commissionsPaid()).isCloseTo(commissionSum, within(1e-9));

        for (int i = 1; i < trades.size(); i++) {
            assertThat(trades.get(i).entryIndex()).isGreaterThanOrEqualTo(trades.get(i - 1).exitIndex());
        }
        assertThat(result.finalPosition().hasPosition()).isFalse();
        EquityPoint last = result.equityCurve().get(result.equityCurve().size() - 1);
        assertThat(last.equity()).isCloseTo(last.cash(), within(1e-9));
        assertThat(result.metrics().maxDrawdownPct()).isLessThanOrEqualTo(0.0);
        assertThat(result.metrics().winRatePct()).isBetween(0.0, 100.0);
    }

    @Test
    void run_stopOnBarLowExitsAtStopAndSkipsEvaluationThatBar() {
        BarSeries series = TestBars.of(
                TestBars.candle(0, 100, 101, 99, 100),
                TestBars.candle(1, 100, 101, 99, 100),
                TestBars.candle(2, 100, 101, 95, 96),
                TestBars.candle(3, 96, 97, 95.5, 96)
        );
        ScriptedStrategyEngine engine = new ScriptedStrategyEngine();
        ScriptedStrategyEngine.Script script = new ScriptedStrategyEngine.Script(1, Map.of(
                0, new StrategySignalDecision(StrategyAction.ENTER_LONG, 95.0, "ENTER"),
                2, new StrategySignalDecision(StrategyAction.ENTER_LONG, 90.0, "REENTER")
        ));

        BacktestResult result = backtestService.run(series, engine, script, BacktestSettings.defaults());

        assertThat(result.trades()).hasSize(1);
        TradeRecord trade = result.trades().get(0);
        assertThat(trade.exitReason()).isEqualTo(ExitReason.STOP_LOSS);
        assertThat(trade.exitPrice()).isEqualTo(95.0);
        assertThat(trade.exitIndex()).isEqualTo(2);
        assertThat(engine.evaluatedIndexes).containsExactly(0, 1, 3);
        assertThat(result.finalPosition().hasPosition()).isFalse();
    }

    @Test
    void run_evaluatesOnlyAfterWarmup() {
        ScriptedStrategyEngine engine = new ScriptedStrategyEngine();

        backtestService.run(
                TestBars.fromCloses(100, 101, 102, 103),
                engine,
                new ScriptedStrategyEngine.Script(3, Map.of()),
                BacktestSettings.defaults()
        );

        assertThat(engine.evaluatedIndexes).containsExactly(2, 3);
    }

    @Test
    void run_recordsRejectedStopsAndDiscardedOrders() {
        ScriptedStrategyEngine engine = new ScriptedStrategyEngine();
        ScriptedStrategyEngine.Script script = new ScriptedStrategyEngine.Script(1, Map.of(
                0, StrategySignalDecision.none(StrategySignalDecision.REASON_REJECTED_STOP),
                2, StrategySignalDecision.of(StrategyAction.ENTER_SHORT, "LATE")
        ));

        BacktestResult result = backtestService.run(
                TestBars.fromCloses(100, 101, 102),
                engine,
                script,
                BacktestSettings.defaults()
        );

        assertThat(result.diagnostics()).extracting(BacktestDiagnostic::code).containsExactly(
                BacktestDiagnostic.STOP_REJECTED,
                BacktestDiagnostic.ORDER_DISCARDED_END_OF_DATA
        );
        assertThat(result.trades()).isEmpty();
        assertThat(result.metrics().returnPct()).isZero();
    }

    @Test
    void run_signalCloseConventionFillsOnSignalBarAndClosesAtEnd() {
        ScriptedStrategyEngine engine = new ScriptedStrategyEngine();
        ScriptedStrategyEngine.Script script = new ScriptedStrategyEngine.Script(1, Map.of(
                0, StrategySignalDecision.of(StrategyAction.ENTER_LONG, "ENTER")
        ));
        BacktestSettings settings = BacktestSettings.defaults()
                .withFillPriceConvention(FillPriceConvention.SIGNAL_CLOSE)
                .withCloseOpenPositionAtEnd(true);

        BacktestResult result = backtestService.run(TestBars.fromCloses(100, 110, 120), engine, script, settings);

        TradeRecord trade = result.trades().get(0);
        assertThat(trade.entryIndex()).isZero();
        assertThat(trade.entryPrice()).isEqualTo(100.0);
        assertThat(trade.exitPrice()).isEqualTo(120.0);
        assertThat(trade.exitReason()).isEqualTo(ExitReason.END_OF_DATA);
        assertThat(trade.returnPct()).isCloseTo(20.0, within(1e-9));
        assertThat(result.equityCurve().get(0).side()).isEqualTo(PositionSide.LONG);
        assertThat(result.equityCurve().get(2).side()).isEqualTo(PositionSide.FLAT);
    }

    @Test
    void run_marksOpenPositionToMarketByDefault() {
        ScriptedStrategyEngine engine = new ScriptedStrategyEngine();
        ScriptedStrategyEngine.Script script = new ScriptedStrategyEngine.Script(1, Map.of(
                0, StrategySignalDecision.of(StrategyAction.ENTER_LONG, "ENTER")
        ));

        BacktestResult result = backtestService.run(
                TestBars.fromCloses(100, 100, 110),
                engine,
                script,
                BacktestSettings.defaults()
        );

        assertThat(result.trades()).isEmpty();
        assertThat(result.finalPosition().isLong()).isTrue();
        assertThat(result.metrics().finalEquity()).isGreaterThan(result.finalCash());
        assertThat(result.metrics().exposureTimePct()).isCloseTo(200.0 / 3.0, within(1e-9));
    }

    @Test
    void run_logsActionableSignalsWithStrategyDiagnostics(CapturedOutput output) {
        Logger logger = (Logger) LoggerFactory.getLogger(BacktestService.class);
        Level previous = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        try {
            backtestService.run(
                    TestBars.fromCloses(TestBars.linear(300, 100.0, 1.0)),
                    "rsi",
                    RsiMeanReversionParams.DEFAULTS,
                    BacktestSettings.defaults()
            );
        } finally {
            logger.setLevel(previous);
        }

        assertThat(output).containsPattern(
                "\\[Backtest]\\[SIGNAL] strategy=rsi index=13 [^\\n]*action=ENTER_SHORT reason=ENTER_SHORT_RSI_OVERBOUGHT"
                        + "[^\\n]*diagnostics=\\{[^\\n]*rsi\\.value=100\\.0"
        );
        assertThat(output).doesNotContain("action=NONE");
    }

    @Test
    void run_abortsWhenThreadIsInterrupted() {
        ScriptedStrategyEngine engine = new ScriptedStrategyEngine();
        BarSeries series = TestBars.fromCloses(100, 101, 102);

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> backtestService.run(series, engine, engine.defaultParams(), BacktestSettings.defaults()))
                    .isInstanceOf(RunInterruptedException.class)
                    .hasFieldOrPropertyWithValue("code", RunInterruptedException.CODE)
                    .hasFieldOrPropertyWithValue("barIndex", 0);
            assertThat(engine.evaluatedIndexes).isEmpty();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void run_byNameRejectsParamsOfAnotherStrategy() {
        assertThatThrownBy(() -> backtestService.run(
                TestBars.fromCloses(TestBars.linear(30, 100.0, 1.0)),
                "rsi",
                MacdCrossoverParams.DEFAULTS,
                BacktestSettings.defaults()
        )).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid params type");
    }

    private static StrategyRegistry registry() {
        return TestRegistries.builtIn();
    }
}
