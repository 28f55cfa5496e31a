package org.nowstart.backtester.data.exception;

import lombok.Getter;

@Getter
public class RunInterruptedException extends BacktestException {

    public static final String CODE = "run_interrupted";

    private final int barIndex;

    public RunInterruptedException(String strategy, int barIndex) {
        super(CODE, "Backtest of " + strategy + " interrupted at bar " + barIndex);
        this.barIndex = barIndex;
    }
}
