package com.synthgov.core.sanitize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flattened, immutable view of one metric dictionary. Keys are dotted paths
 * ({@code privacy_risk.membership_inference_auc}); values are leaves of the
 * original input or {@link #UNAVAILABLE} where the sanitizer discarded them.
 */
public final class MetricSnapshot {

    /** Marker for a metric that was present but unusable. */
    public static final Object UNAVAILABLE = Unavailable.INSTANCE;

    private static final MetricSnapshot EMPTY = new MetricSnapshot(Map.of());

    private final Map<String, Object> values;

    MetricSnapshot(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static MetricSnapshot empty() {
        return EMPTY;
    }

    /** Whether the path was present in the input at all, usable or not. */
    public boolean contains(String path) {
        return values.containsKey(path);
    }

    public boolean isUnavailable(String path) {
        return values.get(path) == UNAVAILABLE;
    }

    /** The usable value at {@code path}; empty if missing or unavailable. */
    public Optional<Object> resolve(String path) {
        Object value = values.get(path);
        if (value == null || value == UNAVAILABLE) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof MetricSnapshot other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "MetricSnapshot" + values;
    }

    private enum Unavailable {
        INSTANCE;

        @Override
        public String toString() {
            return "unavailable";
        }
    }
}
