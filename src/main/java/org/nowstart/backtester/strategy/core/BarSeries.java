package org.nowstart.backtester.strategy.core;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Immutable, ordered OHLCV series indexed by position.
 *
 * <p>Timestamps are strictly increasing. Instances hold no mutable state and may be shared between
 * concurrently running backtests.
 */
public final class BarSeries {

    private final List<OhlcvCandle> candles;

    private BarSeries(List<OhlcvCandle> candles) {
        this.candles = candles;
    }

    public static BarSeries of(List<OhlcvCandle> candles) {
        if (candles == null) {
            throw new IllegalArgumentException("candles are required");
        }
        List<OhlcvCandle> copy = List.copyOf(candles);
        for (int i = 1; i < copy.size(); i++) {
            OhlcvCandle previous = copy.get(i - 1);
            OhlcvCandle current = copy.get(i);
            if (!current.timestamp().isAfter(previous.timestamp())) {
                throw new IllegalArgumentException(
                        "timestamps must be strictly increasing: index=" + i
                                + ", previous=" + previous.timestamp()
                                + ", current=" + current.timestamp()
                );
            }
        }
        return new BarSeries(copy);
    }

    public int size() {
        return candles.size();
    }

    public boolean isEmpty() {
        return candles.isEmpty();
    }

    public OhlcvCandle get(int index) {
        return candles.get(index);
    }

    public OhlcvCandle last() {
        if (candles.isEmpty()) {
            throw new IllegalStateException("series is empty");
        }
        return candles.get(candles.size() - 1);
    }

    public List<OhlcvCandle> candles() {
        return candles;
    }

    public double[] highs() {
        return column(OhlcvCandle::high);
    }

    public double[] lows() {
        return column(OhlcvCandle::low);
    }

    public double[] closes() {
        return column(OhlcvCandle::close);
    }

    private double[] column(ToDoubleFunction<OhlcvCandle> field) {
        return candles.stream().mapToDouble(field).toArray();
    }

    @Override
    public String toString() {
        if (candles.isEmpty()) {
            return "BarSeries[empty]";
        }
        return "BarSeries[" + candles.size() + " bars, " + candles.get(0).timestamp()
                + " -> " + last().timestamp() + "]";
    }
}
