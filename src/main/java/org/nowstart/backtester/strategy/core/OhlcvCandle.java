package org.nowstart.backtester.strategy.core;

import java.time.Instant;

public record OhlcvCandle(
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        double volume
) {

    public OhlcvCandle {
        if (timestamp == null) {
            throw new IllegalArgumentException("candle timestamp is required");
        }
        requirePositive("open", open);
        requirePositive("high", high);
        requirePositive("low", low);
        requirePositive("close", close);
        if (!Double.isFinite(volume) || volume < 0.0) {
            throw new IllegalArgumentException("volume must be finite and >= 0 at " + timestamp);
        }
        if (high < low) {
            throw new IllegalArgumentException("high must be >= low at " + timestamp);
        }
    }

    private static void requirePositive(String field, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new IllegalArgumentException(field + " must be finite and > 0, got " + value);
        }
    }
}
