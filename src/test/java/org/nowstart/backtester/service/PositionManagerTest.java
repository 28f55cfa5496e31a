package org.nowstart.backtester.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.nowstart.backtester.data.dto.BacktestDiagnostic;
import org.nowstart.backtester.data.dto.BacktestSettings;
import org.nowstart.backtester.data.dto.TradeRecord;
import org.nowstart.backtester.data.type.ExitReason;
import org.nowstart.backtester.data.type.FillPriceConvention;
import org.nowstart.backtester.data.type.PositionSide;
import org.nowstart.backtester.data.type.StrategyAction;
import org.nowstart.backtester.strategy.core.OhlcvCandle;
import org.nowstart.backtester.support.TestBars;

class PositionManagerTest {

    private static final BacktestSettings FULL_SIZE = new BacktestSettings(
            10_000.0,
            0.0,
            0.0,
            1.0,
            252,
            FillPriceConvention.NEXT_OPEN,
            false
    );

    private final List<BacktestDiagnostic> diagnostics = new ArrayList<>();

    @Test
    void submit_nextOpenFillsAtFollowingBarOpen() {
        PositionManager manager = new PositionManager(BacktestSettings.defaults(), diagnostics);
        OhlcvCandle signalBar = TestBars.candle(0, 99, 101, 98, 100);
        OhlcvCandle fillBar = TestBars.candle(1, 102, 104, 101, 103);

        assertThat(manager.submit(StrategyAction.ENTER_LONG, Double.NaN, 0, signalBar)).isTrue();
        assertThat(manager.position().hasPosition()).isFalse();
        assertThat(manager.hasPendingOrder()).isTrue();

        manager.fillPending(fillBar, 1);

        assertThat(manager.position().side()).isEqualTo(PositionSide.LONG);
        assertThat(manager.position().entryPrice()).isEqualTo(102.0);
        assertThat(manager.position().entryIndex()).isEqualTo(1);
        assertThat(manager.position().size()).isCloseTo(10_000.0 * 0.9999 / 102.0, within(1e-9));
        assertThat(manager.hasPendingOrder()).isFalse();
    }

    @Test
    void submit_signalCloseFillsImmediatelyAtClose() {
        PositionManager manager = new PositionManager(
                FULL_SIZE.withFillPriceConvention(FillPriceConvention.SIGNAL_CLOSE),
                diagnostics
        );

        manager.submit(StrategyAction.ENTER_SHORT, Double.NaN, 0, TestBars.candle(0, 99, 101, 98, 100));

        assertThat(manager.position().side()).isEqualTo(PositionSide.SHORT);
        assertThat(manager.position().entryPrice()).isEqualTo(100.0);
        assertThat(manager.position().size()).isEqualTo(100.0);
    }

    @Test
    void submit_ignoresEntriesWhilePositionedAndCountsThem() {
        PositionManager manager = openLong(Double.NaN);

        boolean accepted = manager.submit(StrategyAction.ENTER_SHORT, Double.NaN, 1, TestBars.candle(1, 100, 101, 99, 100));

        assertThat(accepted).isFalse();
        assertThat(manager.ignoredSignals()).isEqualTo(1);
        assertThat(manager.position().side()).isEqualTo(PositionSide.LONG);
        assertThat(manager.hasPendingOrder()).isFalse();
    }

    @Test
    void submit_closeWhileFlatIsIgnoredWithoutCounting() {
        PositionManager manager = new PositionManager(FULL_SIZE, diagnostics);

        assertThat(manager.submit(StrategyAction.CLOSE, Double.NaN, 0, TestBars.candle(0, 100, 101, 99, 100))).isFalse();
        assertThat(manager.submit(StrategyAction.NONE, Double.NaN, 0, TestBars.candle(0, 100, 101, 99, 100))).isFalse();
        assertThat(manager.ignoredSignals()).isZero();
    }

    @Test
    void checkStopLoss_exitsAtStopWhenLowTouchesItExactly() {
        PositionManager manager = openLong(95.0);

        Optional<TradeRecord> trade = manager.checkStopLoss(TestBars.candle(2, 99, 100, 95, 97), 2);

        assertThat(trade).isPresent();
        assertThat(trade.get().exitPrice()).isEqualTo(95.0);
        assertThat(trade.get().exitReason()).isEqualTo(ExitReason.STOP_LOSS);
        assertThat(trade.get().grossProfit()).isCloseTo(-500.0, within(1e-9));
        assertThat(manager.position().hasPosition()).isFalse();
        assertThat(manager.cash()).isCloseTo(9_500.0, within(1e-9));
    }

    @Test
    void checkStopLoss_fillsAtOpenWhenBarGapsThroughStop() {
        PositionManager manager = openLong(95.0);

        Optional<TradeRecord> trade = manager.checkStopLoss(TestBars.candle(2, 90, 92, 88, 91), 2);

        assertThat(trade).map(TradeRecord::exitPrice).contains(90.0);
    }

    @Test
    void checkStopLoss_shortTriggersOnHigh() {
        PositionManager manager = new PositionManager(FULL_SIZE, diagnostics);
        manager.submit(StrategyAction.ENTER_SHORT, 105.0, 0, TestBars.candle(0, 100, 101, 99, 100));
        manager.fillPending(TestBars.candle(1, 100, 101, 99, 100), 1);

        assertThat(manager.checkStopLoss(TestBars.candle(2, 101, 104.9, 99, 102), 2)).isEmpty();
        Optional<TradeRecord> trade = manager.checkStopLoss(TestBars.candle(3, 103, 106, 102, 104), 3);

        assertThat(trade).isPresent();
        assertThat(trade.get().exitPrice()).isEqualTo(105.0);
        assertThat(trade.get().returnPct()).isCloseTo(-5.0, within(1e-9));
    }

    @Test
    void isProtective_requiresPositiveStopOnLossSide() {
        assertThat(PositionManager.isProtective(PositionSide.LONG, 100.0, 95.0)).isTrue();
        assertThat(PositionManager.isProtective(PositionSide.LONG, 100.0, 0.0)).isFalse();
        assertThat(PositionManager.isProtective(PositionSide.LONG, 100.0, -5.0)).isFalse();
        assertThat(PositionManager.isProtective(PositionSide.LONG, 100.0, 100.0)).isFalse();
        assertThat(PositionManager.isProtective(PositionSide.SHORT, 100.0, 105.0)).isTrue();
        assertThat(PositionManager.isProtective(PositionSide.SHORT, 100.0, 95.0)).isFalse();
    }

    @Test
    void fillPending_rejectsStopThatIsNotProtectiveAtFill() {
        PositionManager manager = new PositionManager(FULL_SIZE, diagnostics);
        manager.submit(StrategyAction.ENTER_LONG, 97.0, 0, TestBars.candle(0, 100, 101, 99, 100));

        manager.fillPending(TestBars.candle(1, 96, 98, 95, 97), 1);

        assertThat(manager.position().hasPosition()).isFalse();
        assertThat(diagnostics).extracting(BacktestDiagnostic::code)
                .containsExactly(BacktestDiagnostic.STOP_NOT_PROTECTIVE_AT_FILL);
    }

    @Test
    void close_chargesCommissionOnBothNotionals() {
        PositionManager manager = new PositionManager(FULL_SIZE.withCommission(0.001, 1.0), diagnostics);
        manager.submit(StrategyAction.ENTER_LONG, Double.NaN, 0, TestBars.candle(0, 100, 101, 99, 100));
        manager.fillPending(TestBars.candle(1, 100, 101, 99, 100), 1);
        manager.submit(StrategyAction.CLOSE, Double.NaN, 1, TestBars.candle(1, 100, 101, 99, 100));

        manager.fillPending(TestBars.candle(2, 110, 111, 109, 110), 2);

        TradeRecord trade = manager.trades().get(0);
        assertThat(trade.size()).isEqualTo(100.0);
        assertThat(trade.grossProfit()).isCloseTo(1_000.0, within(1e-9));
        assertThat(trade.commission()).isCloseTo(1.0 + 0.001 * (10_000.0 + 11_000.0), within(1e-9));
        assertThat(trade.netProfit()).isCloseTo(978.0, within(1e-9));
        assertThat(trade.exitReason()).isEqualTo(ExitReason.SIGNAL);
        assertThat(manager.cash()).isCloseTo(10_978.0, within(1e-9));
        assertThat(manager.commissionsPaid()).isCloseTo(22.0, within(1e-9));
    }

    @Test
    void equity_marksOpenPositionToPrice() {
        PositionManager manager = openLong(Double.NaN);

        assertThat(manager.equity(110.0)).isCloseTo(11_000.0, within(1e-9));
        assertThat(manager.cash()).isEqualTo(10_000.0);
    }

    @Test
    void discardPending_recordsDiagnostic() {
        PositionManager manager = new PositionManager(FULL_SIZE, diagnostics);
        OhlcvCandle last = TestBars.candle(0, 100, 101, 99, 100);
        manager.submit(StrategyAction.ENTER_LONG, Double.NaN, 0, last);

        manager.discardPending(last, 0);

        assertThat(manager.hasPendingOrder()).isFalse();
        assertThat(diagnostics).extracting(BacktestDiagnostic::code)
                .containsExactly(BacktestDiagnostic.ORDER_DISCARDED_END_OF_DATA);
    }

    @Test
    void closeAtEnd_closesAtLastCloseWithEndOfDataReason() {
        PositionManager manager = openLong(Double.NaN);

        Optional<TradeRecord> trade = manager.closeAtEnd(TestBars.candle(2, 100, 106, 99, 105), 2);

        assertThat(trade).map(TradeRecord::exitReason).contains(ExitReason.END_OF_DATA);
        assertThat(trade).map(TradeRecord::exitPrice).contains(105.0);
        assertThat(manager.closeAtEnd(TestBars.candle(3, 100, 106, 99, 105), 3)).isEmpty();
    }

    private PositionManager openLong(double stop) {
        PositionManager manager = new PositionManager(FULL_SIZE, diagnostics);
        manager.submit(StrategyAction.ENTER_LONG, stop, 0, TestBars.candle(0, 100, 101, 99, 100));
        manager.fillPending(TestBars.candle(1, 100, 101, 99, 100), 1);
        return manager;
    }
}
