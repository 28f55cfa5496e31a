package org.nowstart.backtester.data.dto;

import java.time.Instant;
import org.nowstart.backtester.data.type.ExitReason;
import org.nowstart.backtester.data.type.PositionSide;

public record TradeRecord(
        PositionSide side,
        Instant entryTime,
        Instant exitTime,
        int entryIndex,
        int exitIndex,
        double entryPrice,
        double exitPrice,
        double size,
        double grossProfit,
        double commission,
        double netProfit,
        double returnPct,
        ExitReason exitReason
) {

    public TradeRecord {
        if (side == null || side == PositionSide.FLAT) {
            throw new IllegalArgumentException("trade side must be LONG or SHORT");
        }
        if (exitReason == null) {
            throw new IllegalArgumentException("exitReason is required");
        }
        if (exitIndex < entryIndex) {
            throw new IllegalArgumentException("exitIndex must be >= entryIndex");
        }
    }

    public boolean isWin() {
        return netProfit > 0.0;
    }

    public int barsHeld() {
        return exitIndex - entryIndex;
    }
}
