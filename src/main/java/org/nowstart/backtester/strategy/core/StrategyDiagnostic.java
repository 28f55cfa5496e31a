package org.nowstart.backtester.strategy.core;

/**
 * One explanatory value produced during {@link TradingStrategyEngine#evaluate(StrategyInput)}.
 *
 * <p>Diagnostics describe the indicator values a decision was based on. They never drive execution;
 * the simulation loop only reads the {@link StrategySignalDecision}.
 *
 * <pre>{@code
 * List<StrategyDiagnostic> diagnostics = List.of(
 *         StrategyDiagnostic.number("rsi.value", "RSI", "", "RSI at signal bar", rsi),
 *         StrategyDiagnostic.bool("stop.rejected", "Stop Rejected", "Computed stop was not protective", true)
 * );
 * }</pre>
 *
 * @param key         stable machine-readable identifier, for example {@code macd.line}
 * @param label       human-readable name
 * @param type        expected value type
 * @param unit        value unit, numeric diagnostics only
 * @param description optional short explanation
 * @param value       diagnostic value
 */
public record StrategyDiagnostic(
        String key,
        String label,
        StrategyDiagnosticType type,
        String unit,
        String description,
        Object value
) {

    public StrategyDiagnostic {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("diagnostic key is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("diagnostic type is required");
        }
        if (value == null) {
            throw new IllegalArgumentException("diagnostic value is required");
        }
        label = (label == null || label.isBlank()) ? key : label;
        unit = unit == null ? "" : unit;
        description = description == null ? "" : description;
        if (!type.supports(value)) {
            throw new IllegalArgumentException("diagnostic " + key + " must be " + type.typeName());
        }
    }

    public static StrategyDiagnostic number(String key, String label, String unit, String description, double value) {
        return new StrategyDiagnostic(key, label, StrategyDiagnosticType.NUMBER, unit, description, value);
    }

    public static StrategyDiagnostic bool(String key, String label, String description, boolean value) {
        return new StrategyDiagnostic(key, label, StrategyDiagnosticType.BOOLEAN, "", description, value);
    }
}
