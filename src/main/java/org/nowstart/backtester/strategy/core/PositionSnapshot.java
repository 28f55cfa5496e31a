package org.nowstart.backtester.strategy.core;

import java.time.Instant;
import org.nowstart.backtester.data.type.PositionSide;

/**
 * Read-only view of the open position handed to a strategy.
 */
public record PositionSnapshot(
        PositionSide side,
        double entryPrice,
        double size,
        double stopLoss,
        Instant entryTime,
        int entryIndex
) {
    public static final PositionSnapshot FLAT = new PositionSnapshot(PositionSide.FLAT, 0.0, 0.0, Double.NaN, null, -1);

    public PositionSnapshot {
        if (side == null) {
            throw new IllegalArgumentException("position side is required");
        }
        if (side != PositionSide.FLAT && (!Double.isFinite(size) || size <= 0.0)) {
            throw new IllegalArgumentException("open position size must be > 0");
        }
    }

    public boolean hasPosition() {
        return side != PositionSide.FLAT;
    }

    public boolean isLong() {
        return side == PositionSide.LONG;
    }

    public boolean isShort() {
        return side == PositionSide.SHORT;
    }

    public boolean hasStopLoss() {
        return hasPosition() && Double.isFinite(stopLoss);
    }

    public double unrealizedProfit(double price) {
        return switch (side) {
            case LONG -> (price - entryPrice) * size;
            case SHORT -> (entryPrice - price) * size;
            case FLAT -> 0.0;
        };
    }
}
