package org.nowstart.backtester.strategy.core;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Name-to-value parameter mapping with relaxed keys.
 *
 * <p>{@code fast-period}, {@code fast_period} and {@code fastPeriod} address the same parameter.
 */
public final class ParamOverrides {

    private final Map<String, Double> values;

    private ParamOverrides(Map<String, Double> values) {
        this.values = values;
    }

    /**
     * @throws IllegalArgumentException when a key is not one of {@code allowedNames}
     */
    public static ParamOverrides of(Map<String, Double> raw, Set<String> allowedNames) {
        Map<String, String> allowed = new HashMap<>();
        for (String name : allowedNames) {
            allowed.put(normalize(name), name);
        }

        Map<String, Double> values = new HashMap<>();
        if (raw != null) {
            for (Map.Entry<String, Double> entry : raw.entrySet()) {
                String key = normalize(entry.getKey());
                if (!allowed.containsKey(key)) {
                    throw new IllegalArgumentException(
                            "Unknown parameter: " + entry.getKey() + ", allowed=" + new TreeSet<>(allowedNames)
                    );
                }
                if (entry.getValue() == null || !Double.isFinite(entry.getValue())) {
                    throw new IllegalArgumentException(entry.getKey() + " must be finite");
                }
                values.put(key, entry.getValue());
            }
        }
        return new ParamOverrides(values);
    }

    public int intValue(String name, int fallback) {
        Double value = values.get(normalize(name));
        if (value == null) {
            return fallback;
        }
        if (value != Math.rint(value)) {
            throw new IllegalArgumentException(name + " must be an integer, got " + value);
        }
        return (int) Math.round(value);
    }

    public double doubleValue(String name, double fallback) {
        Double value = values.get(normalize(name));
        return value == null ? fallback : value;
    }

    private static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("parameter name is required");
        }
        return name.replace("-", "").replace("_", "").replace(".", "").trim().toLowerCase(Locale.ROOT);
    }
}
