package com.salesanomaly.dto;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered named numeric features. The order of {@link #names()} is part of the contract: a model
 * only accepts vectors whose names match the ones it was trained on, position by position.
 */
public final class FeatureVector {

    private final List<String> names;
    private final double[] values;

    public FeatureVector(List<String> names, double[] values) {
        Objects.requireNonNull(names, "names");
        Objects.requireNonNull(values, "values");
        if (names.size() != values.length) {
            throw new IllegalArgumentException(
                "Feature name count " + names.size() + " does not match value count " + values.length);
        }
        this.names = List.copyOf(names);
        this.values = values.clone();
    }

    public static FeatureVector of(Map<String, Double> ordered) {
        double[] vals = new double[ordered.size()];
        int i = 0;
        for (Double v : ordered.values()) {
            vals[i++] = v != null ? v : 0.0;
        }
        return new FeatureVector(List.copyOf(ordered.keySet()), vals);
    }

    public List<String> names() {
        return names;
    }

    public int size() {
        return values.length;
    }

    public double value(int index) {
        return values[index];
    }

    public double get(String name) {
        int idx = indexOf(name);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown feature: " + name);
        }
        return values[idx];
    }

    public int indexOf(String name) {
        return names.indexOf(name);
    }

    public double[] toArray() {
        return values.clone();
    }

    public FeatureVector with(String name, double value) {
        int idx = indexOf(name);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown feature: " + name);
        }
        double[] copy = values.clone();
        copy[idx] = value;
        return new FeatureVector(names, copy);
    }

    public boolean hasSameSchema(List<String> otherNames) {
        return names.equals(otherNames);
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(names.get(i), values[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureVector other)) {
            return false;
        }
        return names.equals(other.names) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * names.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + asMap();
    }
}
