package org.nowstart.backtester.strategy.core;

/**
 * Value type contract for {@link StrategyDiagnostic}.
 */
public enum StrategyDiagnosticType {
    NUMBER(Number.class),
    BOOLEAN(Boolean.class);

    private final Class<?> valueType;

    StrategyDiagnosticType(Class<?> valueType) {
        this.valueType = valueType;
    }

    public boolean supports(Object value) {
        return valueType.isInstance(value);
    }

    public String typeName() {
        return valueType.getSimpleName();
    }
}
