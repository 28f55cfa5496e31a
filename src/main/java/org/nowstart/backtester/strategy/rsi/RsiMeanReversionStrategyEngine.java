package org.nowstart.backtester.strategy.rsi;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.nowstart.backtester.data.type.StrategyAction;
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
 * Buys oversold and sells overbought RSI readings, flattening once RSI returns past the exit level.
 */
@Component
public class RsiMeanReversionStrategyEngine implements TradingStrategyEngine<RsiMeanReversionParams> {

    public static final String NAME = "rsi";
    public static final String RSI = "rsi";

    private static final Set<String> PARAM_NAMES = Set.of("rsiPeriod", "oversold", "overbought", "exitLevel");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Class<RsiMeanReversionParams> parameterType() {
        return RsiMeanReversionParams.class;
    }

    @Override
    public RsiMeanReversionParams defaultParams() {
        return RsiMeanReversionParams.DEFAULTS;
    }

    @Override
    public RsiMeanReversionParams bindParams(Map<String, Double> overrides) {
        ParamOverrides values = ParamOverrides.of(overrides, PARAM_NAMES);
        RsiMeanReversionParams defaults = defaultParams();
        return new RsiMeanReversionParams(
                values.intValue("rsiPeriod", defaults.rsiPeriod()),
                values.doubleValue("oversold", defaults.oversold()),
                values.doubleValue("overbought", defaults.overbought()),
                values.doubleValue("exitLevel", defaults.exitLevel())
        );
    }

    @Override
    public int requiredWarmupCandles(RsiMeanReversionParams params) {
        return params.rsiPeriod();
    }

    @Override
    public IndicatorSet initialize(BarSeries series, RsiMeanReversionParams params) {
        return IndicatorSet.builder(series.size())
                .register(RSI, Indicators.rsi(series.closes(), params.rsiPeriod()), params.rsiPeriod())
                .build();
    }

    @Override
    public StrategyEvaluation evaluate(StrategyInput<RsiMeanReversionParams> input) {
        if (input == null) {
            throw new IllegalArgumentException("input is required");
        }

        double rsi = input.indicators().valueAt(RSI, input.signalIndex());
        if (!Double.isFinite(rsi)) {
            return StrategyEvaluation.of(StrategySignalDecision.none(StrategySignalDecision.REASON_INDICATOR_UNDEFINED));
        }

        RsiMeanReversionParams params = input.params();
        StrategySignalDecision decision = decide(input.position(), params, rsi);
        return new StrategyEvaluation(decision, List.of(
                StrategyDiagnostic.number("rsi.value", "RSI", "", "RSI at signal bar", rsi),
                StrategyDiagnostic.number("rsi.oversold", "Oversold", "", "Long entry threshold", params.oversold()),
                StrategyDiagnostic.number("rsi.overbought", "Overbought", "", "Short entry threshold", params.overbought()),
                StrategyDiagnostic.number("rsi.exit", "Exit Level", "", "Exit threshold", params.exitLevel())
        ));
    }

    private StrategySignalDecision decide(PositionSnapshot position, RsiMeanReversionParams params, double rsi) {
        if (!position.hasPosition()) {
            if (rsi < params.oversold()) {
                return StrategySignalDecision.of(StrategyAction.ENTER_LONG, "ENTER_LONG_RSI_OVERSOLD");
            }
            if (rsi > params.overbought()) {
                return StrategySignalDecision.of(StrategyAction.ENTER_SHORT, "ENTER_SHORT_RSI_OVERBOUGHT");
            }
            return StrategySignalDecision.none(StrategySignalDecision.REASON_NONE);
        }
        if (position.isLong() && rsi > params.exitLevel()) {
            return StrategySignalDecision.of(StrategyAction.CLOSE, "CLOSE_LONG_RSI_EXIT");
        }
        if (position.isShort() && rsi < params.exitLevel()) {
            return StrategySignalDecision.of(StrategyAction.CLOSE, "CLOSE_SHORT_RSI_EXIT");
        }
        return StrategySignalDecision.none(StrategySignalDecision.REASON_NONE);
    }
}
