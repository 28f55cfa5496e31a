package org.nowstart.backtester.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.backtester.data.dto.BacktestDiagnostic;
import org.nowstart.backtester.data.dto.BacktestSettings;
import org.nowstart.backtester.data.dto.EquityPoint;
import org.nowstart.backtester.strategy.core.OhlcvCandle;

/**
 * Mutable state of one run: bar cursor, position manager, equity curve and diagnostics.
 *
 * <p>Created per run and never shared between threads or reused after {@link #finish()}.
 */
public final class SimulationState {

    private final List<BacktestDiagnostic> diagnostics = new ArrayList<>();
    private final List<EquityPoint> equityCurve = new ArrayList<>();
    private final PositionManager positionManager;

    private int barIndex = -1;
    private boolean finished;

    public SimulationState(BacktestSettings settings) {
        this.positionManager = new PositionManager(settings, diagnostics);
    }

    public void advanceTo(int index) {
        ensureActive();
        if (index != barIndex + 1) {
            throw new IllegalStateException("bars must be visited in order: expected " + (barIndex + 1) + ", got " + index);
        }
        barIndex = index;
    }

    public void markEquity(OhlcvCandle bar) {
        ensureActive();
        equityCurve.add(snapshot(bar));
    }

    /**
     * Replaces the last equity point after an end-of-data close.
     */
    public void remarkLast(OhlcvCandle bar) {
        ensureActive();
        if (equityCurve.isEmpty()) {
            throw new IllegalStateException("no equity point to re-mark");
        }
        equityCurve.set(equityCurve.size() - 1, snapshot(bar));
    }

    public void diagnostic(int index, Instant timestamp, String code, String message) {
        ensureActive();
        diagnostics.add(new BacktestDiagnostic(index, timestamp, code, message));
    }

    public void finish() {
        ensureActive();
        finished = true;
    }

    public PositionManager positionManager() {
        return positionManager;
    }

    public int barIndex() {
        return barIndex;
    }

    public List<EquityPoint> equityCurve() {
        return List.copyOf(equityCurve);
    }

    public List<BacktestDiagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    private EquityPoint snapshot(OhlcvCandle bar) {
        return new EquityPoint(
                bar.timestamp(),
                positionManager.cash(),
                positionManager.equity(bar.close()),
                positionManager.position().side()
        );
    }

    private void ensureActive() {
        if (finished) {
            throw new IllegalStateException("simulation state already finished");
        }
    }
}
