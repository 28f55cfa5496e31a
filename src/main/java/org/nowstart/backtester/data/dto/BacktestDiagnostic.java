package org.nowstart.backtester.data.dto;

import java.time.Instant;

/**
 * Non-fatal event recorded during a run, for example a rejected stop-loss.
 */
public record BacktestDiagnostic(
        int barIndex,
        Instant timestamp,
        String code,
        String message
) {

    public static final String STOP_REJECTED = "stop_rejected";
    public static final String STOP_NOT_PROTECTIVE_AT_FILL = "stop_not_protective_at_fill";
    public static final String ENTRY_SIZE_NOT_POSITIVE = "entry_size_not_positive";
    public static final String ORDER_DISCARDED_END_OF_DATA = "order_discarded_end_of_data";
}
