package org.nowstart.backtester.data.dto;

import java.time.Instant;
import org.nowstart.backtester.data.type.PositionSide;

/**
 * Mark-to-market snapshot at a bar close. {@code equity = cash + unrealized profit}.
 */
public record EquityPoint(
        Instant timestamp,
        double cash,
        double equity,
        PositionSide side
) {
}
