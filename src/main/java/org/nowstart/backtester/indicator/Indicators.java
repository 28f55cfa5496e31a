package org.nowstart.backtester.indicator;

import java.util.Arrays;

/**
 * Pure indicator functions over price arrays.
 *
 * <p>Every function returns a new array of the input length. Undefined entries are {@link Double#NaN}.
 */
public final class Indicators {

    private Indicators() {
    }

    /**
     * Exponential moving average seeded with the first defined value, {@code alpha = 2 / (length + 1)}.
     *
     * <p>Defined from the first defined input onwards; leading {@code NaN} inputs stay undefined.
     */
    public static double[] ema(double[] values, int length) {
        requirePeriod("length", length);
        int n = values.length;
        double[] ema = fillNaN(n);

        int start = firstDefinedIndex(values);
        if (start < 0) {
            return ema;
        }

        double alpha = 2.0 / (length + 1.0);
        ema[start] = values[start];
        for (int i = start + 1; i < n; i++) {
            ema[i] = (alpha * values[i]) + ((1.0 - alpha) * ema[i - 1]);
        }
        return ema;
    }

    /**
     * Relative strength index using simple rolling means of gains and losses.
     *
     * <p>The first bar contributes a zero change. Values are defined from index {@code period - 1}.
     * A window with losses of zero and positive gains yields 100; a window with neither gains nor losses
     * is undefined.
     */
    public static double[] rsi(double[] close, int period) {
        requirePeriod("period", period);
        int n = close.length;
        double[] rsi = fillNaN(n);
        if (n < period) {
            return rsi;
        }

        double[] gains = new double[n];
        double[] losses = new double[n];
        for (int i = 1; i < n; i++) {
            double delta = close[i] - close[i - 1];
            if (delta > 0.0) {
                gains[i] = delta;
            } else if (delta < 0.0) {
                losses[i] = -delta;
            }
        }

        for (int i = period - 1; i < n; i++) {
            double avgGain = windowSum(gains, i, period) / period;
            double avgLoss = windowSum(losses, i, period) / period;
            rsi[i] = relativeStrengthIndex(avgGain, avgLoss);
        }
        return rsi;
    }

    /**
     * True range per bar. The first bar has no previous close and uses {@code high - low}.
     */
    public static double[] trueRange(double[] high, double[] low, double[] close) {
        requireSameLength(high, low, close);
        int n = close.length;
        double[] tr = new double[n];
        if (n == 0) {
            return tr;
        }

        tr[0] = high[0] - low[0];
        for (int i = 1; i < n; i++) {
            double highLow = high[i] - low[i];
            double highPrevClose = Math.abs(high[i] - close[i - 1]);
            double lowPrevClose = Math.abs(low[i] - close[i - 1]);
            tr[i] = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
        }
        return tr;
    }

    /**
     * Average true range as a simple rolling mean of true range, defined from index {@code period - 1}.
     */
    public static double[] atr(double[] high, double[] low, double[] close, int period) {
        requirePeriod("period", period);
        double[] tr = trueRange(high, low, close);
        return rollingMean(tr, period);
    }

    /**
     * MACD line: {@code ema(fast) - ema(slow)}.
     */
    public static double[] macd(double[] close, int fastPeriod, int slowPeriod) {
        double[] fast = ema(close, fastPeriod);
        double[] slow = ema(close, slowPeriod);
        double[] macd = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            macd[i] = fast[i] - slow[i];
        }
        return macd;
    }

    public static double[] macdSignal(double[] macd, int signalPeriod) {
        return ema(macd, signalPeriod);
    }

    /**
     * Simple rolling mean over {@code window} values, defined from index {@code window - 1}.
     */
    public static double[] rollingMean(double[] values, int window) {
        requirePeriod("window", window);
        int n = values.length;
        double[] mean = fillNaN(n);

        for (int i = window - 1; i < n; i++) {
            mean[i] = windowSum(values, i, window) / window;
        }
        return mean;
    }

    private static double windowSum(double[] values, int endInclusive, int window) {
        double sum = 0.0;
        for (int j = endInclusive - window + 1; j <= endInclusive; j++) {
            sum += values[j];
        }
        return sum;
    }

    private static double relativeStrengthIndex(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            return avgGain > 0.0 ? 100.0 : Double.NaN;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    private static int firstDefinedIndex(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (Double.isFinite(values[i])) {
                return i;
            }
        }
        return -1;
    }

    private static void requirePeriod(String field, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be > 0, got " + value);
        }
    }

    private static void requireSameLength(double[] high, double[] low, double[] close) {
        if (high == null || low == null || close == null) {
            throw new IllegalArgumentException("high/low/close arrays are required");
        }
        if (high.length != close.length || low.length != close.length) {
            throw new IllegalArgumentException("high/low/close arrays must have identical lengths");
        }
    }

    private static double[] fillNaN(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return values;
    }
}
