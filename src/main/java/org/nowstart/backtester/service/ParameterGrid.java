package org.nowstart.backtester.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cartesian product of parameter axes given as {@code start:end:step} ranges.
 *
 * <p>A bare number is a single-value axis. Combinations are addressed by index, last axis varying fastest.
 * Axes and the whole grid are capped at {@value #MAX_COMBINATIONS} values.
 */
public final class ParameterGrid {

    static final long MAX_COMBINATIONS = 1_000_000L;

    private static final double RANGE_EPSILON = 1e-9;

    private final List<String> names;
    private final List<List<Double>> axes;
    private final long[] strides;
    private final long size;

    private ParameterGrid(List<String> names, List<List<Double>> axes) {
        this.names = names;
        this.axes = axes;
        this.strides = new long[axes.size()];
        long stride = 1L;
        for (int i = axes.size() - 1; i >= 0; i--) {
            strides[i] = stride;
            int axisSize = axes.get(i).size();
            if (stride > MAX_COMBINATIONS / axisSize) {
                throw new IllegalArgumentException("parameter grid exceeds " + MAX_COMBINATIONS + " combinations");
            }
            stride *= axisSize;
        }
        this.size = stride;
    }

    public static ParameterGrid parse(Map<String, String> specs) {
        List<String> names = new ArrayList<>();
        List<List<Double>> axes = new ArrayList<>();
        if (specs != null) {
            for (Map.Entry<String, String> entry : specs.entrySet()) {
                names.add(entry.getKey());
                axes.add(parseAxis(entry.getKey(), entry.getValue()));
            }
        }
        return new ParameterGrid(List.copyOf(names), List.copyOf(axes));
    }

    static List<Double> parseAxis(String name, String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("range for " + name + " is required");
        }
        String[] parts = spec.split(":");
        try {
            if (parts.length == 1) {
                return List.of(Double.parseDouble(parts[0].trim()));
            }
            if (parts.length != 3) {
                throw new IllegalArgumentException("range for " + name + " must be start:end:step, got: " + spec);
            }
            double start = Double.parseDouble(parts[0].trim());
            double end = Double.parseDouble(parts[1].trim());
            double step = Double.parseDouble(parts[2].trim());
            if (!Double.isFinite(start) || !Double.isFinite(end) || !Double.isFinite(step)) {
                throw new IllegalArgumentException("range for " + name + " must be finite, got: " + spec);
            }
            if (step <= 0) {
                throw new IllegalArgumentException("range step for " + name + " must be > 0, got: " + spec);
            }
            if (end < start) {
                throw new IllegalArgumentException("range end for " + name + " must be >= start, got: " + spec);
            }

            double count = Math.floor((end - start) / step + RANGE_EPSILON) + 1;
            if (count > MAX_COMBINATIONS) {
                throw new IllegalArgumentException(
                        "range for " + name + " has more than " + MAX_COMBINATIONS + " values: " + spec
                );
            }

            List<Double> values = new ArrayList<>((int) count);
            for (int k = 0; k < (int) count; k++) {
                values.add(roundNoise(start + k * step));
            }
            return List.copyOf(values);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("range for " + name + " is not numeric: " + spec, e);
        }
    }

    public long size() {
        return size;
    }

    public List<String> names() {
        return names;
    }

    public Map<String, Double> combination(long index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("combination index " + index + " out of [0, " + size + ")");
        }
        Map<String, Double> values = new LinkedHashMap<>();
        for (int i = 0; i < axes.size(); i++) {
            List<Double> axis = axes.get(i);
            int coord = (int) ((index / strides[i]) % axis.size());
            values.put(names.get(i), axis.get(coord));
        }
        return Collections.unmodifiableMap(values);
    }

    private static double roundNoise(double value) {
        return Math.round(value * 1e9) / 1e9;
    }
}
