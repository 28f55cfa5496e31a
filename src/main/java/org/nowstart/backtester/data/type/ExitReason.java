package org.nowstart.backtester.data.type;

public enum ExitReason {
    SIGNAL,
    STOP_LOSS,
    END_OF_DATA
}
