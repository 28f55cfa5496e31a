package org.nowstart.backtester.indicator;

import java.util.Arrays;

/**
 * Derived series aligned index-for-index with the bar series it was computed from.
 *
 * <p>Entries before the indicator's warm-up window are {@link Double#NaN}. Callers check
 * {@link #isDefined(int)} before consuming a value.
 *
 * @param name       registry key, for example {@code rsi} or {@code ema.trend}
 * @param values     indicator values, {@code NaN} where undefined
 * @param warmupBars number of bars required before the first defined value
 */
public record IndicatorSeries(
        String name,
        double[] values,
        int warmupBars
) {

    public IndicatorSeries {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("indicator name is required");
        }
        if (values == null) {
            throw new IllegalArgumentException("indicator values are required");
        }
        if (warmupBars < 0) {
            throw new IllegalArgumentException("warmupBars must be >= 0");
        }
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public double valueAt(int index) {
        if (index < 0 || index >= values.length) {
            return Double.NaN;
        }
        return values[index];
    }

    public boolean isDefined(int index) {
        return Double.isFinite(valueAt(index));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof IndicatorSeries that)) {
            return false;
        }
        return warmupBars == that.warmupBars && name.equals(that.name) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + Arrays.hashCode(values)) + warmupBars;
    }

    @Override
    public String toString() {
        return "IndicatorSeries[name=" + name + ", size=" + values.length + ", warmupBars=" + warmupBars + "]";
    }
}
