package com.eligibility.fact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flat, immutable view of the current value per fact key.
 * Keys whose current value is null are absent.
 */
public final class NormalizedFacts {

    private static final NormalizedFacts EMPTY = new NormalizedFacts(Map.of());

    private final Map<String, Object> values;

    private NormalizedFacts(Map<String, Object> values) {
        this.values = values;
    }

    public static NormalizedFacts empty() {
        return EMPTY;
    }

    /**
     * Wrap already-normalized values. Null values are dropped.
     */
    public static NormalizedFacts of(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return new NormalizedFacts(Collections.unmodifiableMap(copy));
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof NormalizedFacts other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "NormalizedFacts" + values;
    }
}
