package org.nowstart.backtester.data.type;

public enum StrategyAction {
    NONE,
    ENTER_LONG,
    ENTER_SHORT,
    CLOSE;

    public boolean isEntry() {
        return this == ENTER_LONG || this == ENTER_SHORT;
    }
}
