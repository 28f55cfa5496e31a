package org.nowstart.backtester.strategy.core;

import org.nowstart.backtester.data.type.StrategyAction;

/**
 * Action emitted for one bar.
 *
 * @param action       requested order, {@link StrategyAction#NONE} to do nothing
 * @param stopLoss     protective stop for entries, {@code NaN} when none
 * @param signalReason machine-readable reason such as {@code ENTER_LONG_MACD_CROSS_UP}
 */
public record StrategySignalDecision(
        StrategyAction action,
        double stopLoss,
        String signalReason
) {

    public static final String REASON_NONE = "NONE";
    public static final String REASON_INDICATOR_UNDEFINED = "INDICATOR_UNDEFINED";
    public static final String REASON_REJECTED_STOP = "REJECTED_NON_PROTECTIVE_STOP";

    public StrategySignalDecision {
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
        signalReason = (signalReason == null || signalReason.isBlank()) ? REASON_NONE : signalReason;
    }

    public static StrategySignalDecision none(String reason) {
        return new StrategySignalDecision(StrategyAction.NONE, Double.NaN, reason);
    }

    public static StrategySignalDecision of(StrategyAction action, String reason) {
        return new StrategySignalDecision(action, Double.NaN, reason);
    }

    public boolean hasStopLoss() {
        return Double.isFinite(stopLoss);
    }

    public boolean isRejection() {
        return action == StrategyAction.NONE && REASON_REJECTED_STOP.equals(signalReason);
    }
}
