package org.nowstart.backtester.strategy.macd;

import java.util.List;
import java.util.Map;
import java.util.Set;
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
 * MACD line / signal line crossover. Enters on a cross while flat, exits on the opposite cross.
 */
@Component
public class MacdCrossoverStrategyEngine implements TradingStrategyEngine<MacdCrossoverParams> {

    public static final String NAME = "macd";
    public static final String MACD_LINE = "macd.line";
    public static final String SIGNAL_LINE = "macd.signal";

    private static final Set<String> PARAM_NAMES = Set.of("fastPeriod", "slowPeriod", "signalPeriod");
    private static final int REQUIRED_HISTORY = 2;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Class<MacdCrossoverParams> parameterType() {
        return MacdCrossoverParams.class;
    }

    @Override
    public MacdCrossoverParams defaultParams() {
        return MacdCrossoverParams.DEFAULTS;
    }

    @Override
    public MacdCrossoverParams bindParams(Map<String, Double> overrides) {
        ParamOverrides values = ParamOverrides.of(overrides, PARAM_NAMES);
        MacdCrossoverParams defaults = defaultParams();
        return new MacdCrossoverParams(
                values.intValue("fastPeriod", defaults.fastPeriod()),
                values.intValue("slowPeriod", defaults.slowPeriod()),
                values.intValue("signalPeriod", defaults.signalPeriod())
        );
    }

    @Override
    public int requiredWarmupCandles(MacdCrossoverParams params) {
        return REQUIRED_HISTORY;
    }

    @Override
    public IndicatorSet initialize(BarSeries series, MacdCrossoverParams params) {
        double[] macd = Indicators.macd(series.closes(), params.fastPeriod(), params.slowPeriod());
        double[] signal = Indicators.macdSignal(macd, params.signalPeriod());
        return IndicatorSet.builder(series.size())
                .register(MACD_LINE, macd, 1)
                .register(SIGNAL_LINE, signal, 1)
                .build();
    }

    @Override
    public StrategyEvaluation evaluate(StrategyInput<MacdCrossoverParams> input) {
        if (input == null) {
            throw new IllegalArgumentException("input is required");
        }

        int i = input.signalIndex();
        if (i + 1 < REQUIRED_HISTORY) {
            return StrategyEvaluation.of(StrategySignalDecision.none("INSUFFICIENT_HISTORY"));
        }

        IndicatorSet indicators = input.indicators();
        double previousMacd = indicators.valueAt(MACD_LINE, i - 1);
        double previousSignal = indicators.valueAt(SIGNAL_LINE, i - 1);
        double currentMacd = indicators.valueAt(MACD_LINE, i);
        double currentSignal = indicators.valueAt(SIGNAL_LINE, i);

        if (!Double.isFinite(previousMacd) || !Double.isFinite(previousSignal)
                || !Double.isFinite(currentMacd) || !Double.isFinite(currentSignal)) {
            return StrategyEvaluation.of(StrategySignalDecision.none(StrategySignalDecision.REASON_INDICATOR_UNDEFINED));
        }

        boolean crossUp = Crossovers.crossedAbove(previousMacd, previousSignal, currentMacd, currentSignal);
        boolean crossDown = Crossovers.crossedBelow(previousMacd, previousSignal, currentMacd, currentSignal);

        StrategySignalDecision decision = decide(input.position(), crossUp, crossDown);
        List<StrategyDiagnostic> diagnostics = List.of(
                StrategyDiagnostic.number("macd.line", "MACD", "price", "MACD line at signal bar", currentMacd),
                StrategyDiagnostic.number("macd.signal", "Signal", "price", "Signal line at signal bar", currentSignal),
                StrategyDiagnostic.number(
                        "macd.histogram",
                        "Histogram",
                        "price",
                        "MACD minus signal",
                        currentMacd - currentSignal
                ),
                StrategyDiagnostic.bool("macd.cross_up", "Cross Up", "MACD crossed above signal", crossUp),
                StrategyDiagnostic.bool("macd.cross_down", "Cross Down", "MACD crossed below signal", crossDown)
        );
        return new StrategyEvaluation(decision, diagnostics);
    }

    private StrategySignalDecision decide(PositionSnapshot position, boolean crossUp, boolean crossDown) {
        if (!position.hasPosition()) {
            if (crossUp) {
                return StrategySignalDecision.of(StrategyAction.ENTER_LONG, "ENTER_LONG_MACD_CROSS_UP");
            }
            if (crossDown) {
                return StrategySignalDecision.of(StrategyAction.ENTER_SHORT, "ENTER_SHORT_MACD_CROSS_DOWN");
            }
            return StrategySignalDecision.none(StrategySignalDecision.REASON_NONE);
        }
        if (position.isLong() && crossDown) {
            return StrategySignalDecision.of(StrategyAction.CLOSE, "CLOSE_LONG_MACD_CROSS_DOWN");
        }
        if (position.isShort() && crossUp) {
            return StrategySignalDecision.of(StrategyAction.CLOSE, "CLOSE_SHORT_MACD_CROSS_UP");
        }
        return StrategySignalDecision.none(StrategySignalDecision.REASON_NONE);
    }
}
