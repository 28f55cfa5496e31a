package org.nowstart.backtester.strategy.core;

import java.util.List;
import java.util.Optional;

/**
 * Immutable output of one strategy evaluation.
 *
 * @param decision    action for the evaluated bar
 * @param diagnostics indicator values and flags behind the decision
 */
public record StrategyEvaluation(
        StrategySignalDecision decision,
        List<StrategyDiagnostic> diagnostics
) {

    public StrategyEvaluation {
        if (decision == null) {
            throw new IllegalArgumentException("decision is required");
        }
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static StrategyEvaluation of(StrategySignalDecision decision) {
        return new StrategyEvaluation(decision, List.of());
    }

    public Optional<StrategyDiagnostic> diagnostic(String key) {
        return diagnostics.stream().filter(d -> d.key().equals(key)).findFirst();
    }
}
