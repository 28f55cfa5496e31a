package org.nowstart.backtester.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.dto.BacktestDiagnostic;
import org.nowstart.backtester.data.dto.BacktestSettings;
import org.nowstart.backtester.data.dto.TradeRecord;
import org.nowstart.backtester.data.type.ExitReason;
import org.nowstart.backtester.data.type.FillPriceConvention;
import org.nowstart.backtester.data.type.PositionSide;
import org.nowstart.backtester.data.type.StrategyAction;
import org.nowstart.backtester.strategy.core.OhlcvCandle;
import org.nowstart.backtester.strategy.core.PositionSnapshot;

/**
 * Single-position order book of one run. Always exactly one of flat, long or short.
 *
 * <p>Entries submitted while a position is open are ignored and counted. Cash only changes when a
 * position closes, by the trade's net profit.
 */
@Slf4j
public class PositionManager {

    private final BacktestSettings settings;
    private final List<BacktestDiagnostic> diagnostics;
    private final List<TradeRecord> trades = new ArrayList<>();

    private double cash;
    private double commissionsPaid;
    private int ignoredSignals;
    private PositionSnapshot position = PositionSnapshot.FLAT;
    private PendingOrder pending;

    public PositionManager(BacktestSettings settings, List<BacktestDiagnostic> diagnostics) {
        if (settings == null || diagnostics == null) {
            throw new IllegalArgumentException("settings and diagnostics are required");
        }
        this.settings = settings;
        this.diagnostics = diagnostics;
        this.cash = settings.initialCash();
    }

    /**
     * Accepts the action decided at {@code signalIndex}. With {@link FillPriceConvention#SIGNAL_CLOSE} the
     * order executes immediately at the signal bar's close, otherwise it waits for {@link #fillPending}.
     *
     * @return whether the order was accepted
     */
    public boolean submit(StrategyAction action, double stopLoss, int signalIndex, OhlcvCandle signalBar) {
        if (action == null || action == StrategyAction.NONE) {
            return false;
        }
        if (action.isEntry() && (position.hasPosition() || pending != null)) {
            ignoredSignals++;
            log.debug("[Position] ignored entry index={}, action={}, side={}", signalIndex, action, position.side());
            return false;
        }
        if (action == StrategyAction.CLOSE && !position.hasPosition()) {
            return false;
        }
        if (pending != null) {
            ignoredSignals++;
            return false;
        }

        PendingOrder order = new PendingOrder(action, stopLoss, signalIndex);
        if (settings.fillPriceConvention() == FillPriceConvention.SIGNAL_CLOSE) {
            execute(order, signalBar, signalIndex, signalBar.close());
        } else {
            pending = order;
        }
        return true;
    }

    /**
     * Executes the pending order, if any, at {@code bar}'s open.
     */
    public void fillPending(OhlcvCandle bar, int index) {
        if (pending == null) {
            return;
        }
        PendingOrder order = pending;
        pending = null;
        execute(order, bar, index, bar.open());
    }

    /**
     * Closes the position when {@code bar} trades through its stop. Fills at the stop price, or at the open
     * when the bar gapped beyond the stop.
     */
    public Optional<TradeRecord> checkStopLoss(OhlcvCandle bar, int index) {
        if (!position.hasStopLoss()) {
            return Optional.empty();
        }
        double stop = position.stopLoss();
        if (position.isLong() && bar.low() <= stop) {
            double exitPrice = bar.open() < stop ? bar.open() : stop;
            return Optional.of(closePosition(exitPrice, bar, index, ExitReason.STOP_LOSS));
        }
        if (position.isShort() && bar.high() >= stop) {
            double exitPrice = bar.open() > stop ? bar.open() : stop;
            return Optional.of(closePosition(exitPrice, bar, index, ExitReason.STOP_LOSS));
        }
        return Optional.empty();
    }

    public Optional<TradeRecord> closeAtEnd(OhlcvCandle bar, int index) {
        if (!position.hasPosition()) {
            return Optional.empty();
        }
        return Optional.of(closePosition(bar.close(), bar, index, ExitReason.END_OF_DATA));
    }

    /**
     * Drops an order that never got a bar to fill on.
     */
    public void discardPending(OhlcvCandle lastBar, int lastIndex) {
        if (pending == null) {
            return;
        }
        log.warn("[Position] discarded unfilled order action={}, signalIndex={}", pending.action(), pending.signalIndex());
        diagnostics.add(new BacktestDiagnostic(
                lastIndex,
                lastBar.timestamp(),
                BacktestDiagnostic.ORDER_DISCARDED_END_OF_DATA,
                pending.action() + " decided at bar " + pending.signalIndex() + " had no bar left to fill"
        ));
        pending = null;
    }

    public double equity(double markPrice) {
        return cash + position.unrealizedProfit(markPrice);
    }

    public double cash() {
        return cash;
    }

    public double commissionsPaid() {
        return commissionsPaid;
    }

    public int ignoredSignals() {
        return ignoredSignals;
    }

    public PositionSnapshot position() {
        return position;
    }

    public boolean hasPendingOrder() {
        return pending != null;
    }

    public List<TradeRecord> trades() {
        return Collections.unmodifiableList(trades);
    }

    private void execute(PendingOrder order, OhlcvCandle bar, int index, double price) {
        if (order.action() == StrategyAction.CLOSE) {
            if (position.hasPosition()) {
                closePosition(price, bar, index, ExitReason.SIGNAL);
            }
            return;
        }
        open(order, bar, index, price);
    }

    private void open(PendingOrder order, OhlcvCandle bar, int index, double price) {
        PositionSide side = order.action() == StrategyAction.ENTER_LONG ? PositionSide.LONG : PositionSide.SHORT;
        double size = cash * settings.positionSizeFraction() / price;
        if (!Double.isFinite(size) || size <= 0.0) {
            log.warn("[Position] entry rejected, non-positive size index={}, cash={}, price={}", index, cash, price);
            diagnostics.add(new BacktestDiagnostic(
                    index,
                    bar.timestamp(),
                    BacktestDiagnostic.ENTRY_SIZE_NOT_POSITIVE,
                    "size=" + size + " at price=" + price + " with cash=" + cash
            ));
            return;
        }

        double stop = order.stopLoss();
        if (Double.isFinite(stop) && !isProtective(side, price, stop)) {
            log.warn("[Position] entry rejected, stop not protective at fill index={}, side={}, fill={}, stop={}",
                    index, side, price, stop);
            diagnostics.add(new BacktestDiagnostic(
                    index,
                    bar.timestamp(),
                    BacktestDiagnostic.STOP_NOT_PROTECTIVE_AT_FILL,
                    side + " stop=" + stop + " is not protective at fill=" + price
            ));
            return;
        }

        position = new PositionSnapshot(side, price, size, stop, bar.timestamp(), index);
        log.debug("[Position] opened index={}, side={}, price={}, size={}, stop={}", index, side, price, size, stop);
    }

    private TradeRecord closePosition(double exitPrice, OhlcvCandle bar, int index, ExitReason reason) {
        PositionSnapshot closing = position;
        double grossProfit = closing.unrealizedProfit(exitPrice);
        double commission = settings.commission(closing.entryPrice() * closing.size(), exitPrice * closing.size());
        double netProfit = grossProfit - commission;
        double returnPct = closing.isLong()
                ? (exitPrice / closing.entryPrice() - 1.0) * 100.0
                : (1.0 - exitPrice / closing.entryPrice()) * 100.0;

        TradeRecord trade = new TradeRecord(
                closing.side(),
                closing.entryTime(),
                bar.timestamp(),
                closing.entryIndex(),
                index,
                closing.entryPrice(),
                exitPrice,
                closing.size(),
                grossProfit,
                commission,
                netProfit,
                returnPct,
                reason
        );
        trades.add(trade);
        cash += netProfit;
        commissionsPaid += commission;
        position = PositionSnapshot.FLAT;
        log.debug("[Position] closed index={}, side={}, exit={}, net={}, reason={}",
                index, closing.side(), exitPrice, netProfit, reason);
        return trade;
    }

    static boolean isProtective(PositionSide side, double price, double stop) {
        if (stop <= 0.0) {
            return false;
        }
        return side == PositionSide.LONG ? stop < price : stop > price;
    }

    private record PendingOrder(StrategyAction action, double stopLoss, int signalIndex) {
    }
}
