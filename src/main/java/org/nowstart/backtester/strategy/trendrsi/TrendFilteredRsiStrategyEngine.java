package org.nowstart.backtester.strategy.trendrsi;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.type.StrategyAction;
import org.nowstart.backtester.indicator.Crossovers;
import org.nowstart.backtester.indicator.IndicatorSet;
import org.nowstart.backtester.indicator.Indicators;
import org.nowstart.backtester.strategy.core.BarSeries;
import org.nowstart.backtester.strategy.core.ParamOverrides;
import org.nowstart.backtester.strategy.core.PositionSnapshot;
import org.nowstart.backtester.strategy.core.StrategyDiagnostic;
import org.nowstart.backtester.strategy.core.StrategyEvaluation;
import org.nowstart.backtester.strategy.core.StrategyInput;
import org.nowstart.backtester.strategy.core.StrategySignalDecision;
import org.nowstart.backtester.strategy.core.TradingStrategyEngine;
import org.springframework.stereotype.Component;

/**
 * RSI mean reversion taken only in the direction of a long EMA trend, with an ATR-distance stop on entry.
 *
 * <p>Long entries need {@code close > ema} and an oversold RSI; short entries need {@code close < ema} and an
 * overbought RSI. Positions close when RSI crosses back through the exit level.
 */
@Slf4j
@Component
public class TrendFilteredRsiStrategyEngine implements TradingStrategyEngine<TrendFilteredRsiParams> {

    public static final String NAME = "trend-rsi";
    public static final String RSI = "rsi";
    public static final String TREND_EMA = "ema.trend";
    public static final String ATR = "atr";

    private static final Set<String> PARAM_NAMES = Set.of(
            "rsiPeriod",
            "emaPeriod",
            "atrPeriod",
            "oversold",
            "overbought",
            "exitLevel",
            "stopAtrMultiplier"
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Class<TrendFilteredRsiParams> parameterType() {
        return TrendFilteredRsiParams.class;
    }

    @Override
    public TrendFilteredRsiParams defaultParams() {
        return TrendFilteredRsiParams.DEFAULTS;
    }

    @Override
    public TrendFilteredRsiParams bindParams(Map<String, Double> overrides) {
        ParamOverrides values = ParamOverrides.of(overrides, PARAM_NAMES);
        TrendFilteredRsiParams defaults = defaultParams();
        return new TrendFilteredRsiParams(
                values.intValue("rsiPeriod", defaults.rsiPeriod()),
                values.intValue("emaPeriod", defaults.emaPeriod()),
                values.intValue("atrPeriod", defaults.atrPeriod()),
                values.doubleValue("oversold", defaults.oversold()),
                values.doubleValue("overbought", defaults.overbought()),
                values.doubleValue("exitLevel", defaults.exitLevel()),
                values.doubleValue("stopAtrMultiplier", defaults.stopAtrMultiplier())
        );
    }

    @Override
    public int requiredWarmupCandles(TrendFilteredRsiParams params) {
        return Math.max(params.rsiPeriod(), Math.max(params.emaPeriod(), params.atrPeriod()));
    }

    @Override
    public IndicatorSet initialize(BarSeries series, TrendFilteredRsiParams params) {
        double[] close = series.closes();
        return IndicatorSet.builder(series.size())
                .register(RSI, Indicators.rsi(close, params.rsiPeriod()), params.rsiPeriod())
                .register(TREND_EMA, Indicators.ema(close, params.emaPeriod()), 1)
                .register(ATR, Indicators.atr(series.highs(), series.lows(), close, params.atrPeriod()), params.atrPeriod())
                .build();
    }

    @Override
    public StrategyEvaluation evaluate(StrategyInput<TrendFilteredRsiParams> input) {
        if (input == null) {
            throw new IllegalArgumentException("input is required");
        }

        int i = input.signalIndex();
        IndicatorSet indicators = input.indicators();
        double rsi = indicators.valueAt(RSI, i);
        double ema = indicators.valueAt(TREND_EMA, i);
        double atr = indicators.valueAt(ATR, i);
        if (!Double.isFinite(rsi) || !Double.isFinite(ema) || !Double.isFinite(atr) || atr <= 0.0) {
            return StrategyEvaluation.of(StrategySignalDecision.none(StrategySignalDecision.REASON_INDICATOR_UNDEFINED));
        }

        TrendFilteredRsiParams params = input.params();
        double close = input.bar().close();
        double previousRsi = indicators.valueAt(RSI, i - 1);

        List<StrategyDiagnostic> diagnostics = new ArrayList<>();
        diagnostics.add(StrategyDiagnostic.number("rsi.value", "RSI", "", "RSI at signal bar", rsi));
        diagnostics.add(StrategyDiagnostic.number("trend.ema", "Trend EMA", "price", "Trend filter EMA", ema));
        diagnostics.add(StrategyDiagnostic.number("atr.value", "ATR", "price", "Average true range", atr));
        diagnostics.add(StrategyDiagnostic.bool("trend.up", "Uptrend", "close > trend EMA", close > ema));

        PositionSnapshot position = input.position();
        StrategySignalDecision decision;
        if (!position.hasPosition()) {
            decision = decideEntry(params, close, ema, rsi, atr, diagnostics);
        } else {
            decision = decideExit(position, params, previousRsi, rsi);
        }
        return new StrategyEvaluation(decision, diagnostics);
    }

    private StrategySignalDecision decideEntry(
            TrendFilteredRsiParams params,
            double close,
            double ema,
            double rsi,
            double atr,
            List<StrategyDiagnostic> diagnostics
    ) {
        double stopDistance = params.stopAtrMultiplier() * atr;
        if (close > ema && rsi < params.oversold()) {
            return withStop(StrategyAction.ENTER_LONG, close, close - stopDistance,
                    "ENTER_LONG_TREND_RSI_OVERSOLD", diagnostics);
        }
        if (close < ema && rsi > params.overbought()) {
            return withStop(StrategyAction.ENTER_SHORT, close, close + stopDistance,
                    "ENTER_SHORT_TREND_RSI_OVERBOUGHT", diagnostics);
        }
        return StrategySignalDecision.none(StrategySignalDecision.REASON_NONE);
    }

    private StrategySignalDecision withStop(
            StrategyAction action,
            double price,
            double stopLoss,
            String reason,
            List<StrategyDiagnostic> diagnostics
    ) {
        diagnostics.add(StrategyDiagnostic.number("stop.price", "Stop", "price", "Computed protective stop", stopLoss));
        if (!isProtective(action, price, stopLoss)) {
            log.debug("[TrendRsi] rejected non-protective stop action={}, price={}, stop={}", action, price, stopLoss);
            diagnostics.add(StrategyDiagnostic.bool(
                    "stop.rejected",
                    "Stop Rejected",
                    "Computed stop was on the wrong side of the price",
                    true
            ));
            return StrategySignalDecision.none(StrategySignalDecision.REASON_REJECTED_STOP);
        }
        return new StrategySignalDecision(action, stopLoss, reason);
    }

    private StrategySignalDecision decideExit(
            PositionSnapshot position,
            TrendFilteredRsiParams params,
            double previousRsi,
            double rsi
    ) {
        double exit = params.exitLevel();
        if (position.isLong() && Crossovers.crossedAbove(previousRsi, exit, rsi, exit)) {
            return StrategySignalDecision.of(StrategyAction.CLOSE, "CLOSE_LONG_TREND_RSI_EXIT");
        }
        if (position.isShort() && Crossovers.crossedBelow(previousRsi, exit, rsi, exit)) {
            return StrategySignalDecision.of(StrategyAction.CLOSE, "CLOSE_SHORT_TREND_RSI_EXIT");
        }
        return StrategySignalDecision.none(StrategySignalDecision.REASON_NONE);
    }

    static boolean isProtective(StrategyAction action, double price, double stopLoss) {
        if (!Double.isFinite(stopLoss) || stopLoss <= 0.0) {
            return false;
        }
        return switch (action) {
            case ENTER_LONG -> stopLoss < price;
            case ENTER_SHORT -> stopLoss > price;
            default -> false;
        };
    }
}
