package org.nowstart.backtester.data.exception;

import lombok.Getter;

@Getter
public class DataInsufficientException extends BacktestException {

    public static final String CODE = "data_insufficient";

    private final int requiredBars;
    private final int availableBars;

    public DataInsufficientException(int requiredBars, int availableBars) {
        super(CODE, "At least " + requiredBars + " bars are required, got " + availableBars);
        this.requiredBars = requiredBars;
        this.availableBars = availableBars;
    }
}
