package org.nowstart.backtester.data.exception;

public class DataLoadException extends BacktestException {

    public static final String CODE = "data_load_failed";

    public DataLoadException(String message) {
        super(CODE, message);
    }

    public DataLoadException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
