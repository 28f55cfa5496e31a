package org.nowstart.backtester.indicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Indicators registered by a strategy during initialization, computed once per run.
 */
public final class IndicatorSet {

    public static final IndicatorSet EMPTY = new IndicatorSet(Map.of());

    private final Map<String, IndicatorSeries> byName;

    private IndicatorSet(Map<String, IndicatorSeries> byName) {
        this.byName = byName;
    }

    public static Builder builder(int seriesSize) {
        return new Builder(seriesSize);
    }

    public IndicatorSeries require(String name) {
        IndicatorSeries series = byName.get(name);
        if (series == null) {
            throw new IllegalStateException("Indicator not registered: " + name);
        }
        return series;
    }

    public double valueAt(String name, int index) {
        return require(name).valueAt(index);
    }

    public int maxWarmupBars() {
        int max = 0;
        for (IndicatorSeries series : byName.values()) {
            max = Math.max(max, series.warmupBars());
        }
        return max;
    }

    public static final class Builder {

        private final int seriesSize;
        private final Map<String, IndicatorSeries> byName = new LinkedHashMap<>();

        private Builder(int seriesSize) {
            this.seriesSize = seriesSize;
        }

        public Builder register(String name, double[] values, int warmupBars) {
            return register(new IndicatorSeries(name, values, warmupBars));
        }

        public Builder register(IndicatorSeries series) {
            if (series.size() != seriesSize) {
                throw new IllegalArgumentException(
                        "indicator " + series.name() + " has size " + series.size() + ", expected " + seriesSize
                );
            }
            IndicatorSeries previous = byName.putIfAbsent(series.name(), series);
            if (previous != null) {
                throw new IllegalStateException("Duplicate indicator registered: " + series.name());
            }
            return this;
        }

        public IndicatorSet build() {
            return new IndicatorSet(Map.copyOf(byName));
        }
    }
}
