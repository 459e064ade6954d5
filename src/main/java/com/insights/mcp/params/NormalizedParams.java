package com.insights.mcp.params;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typed field values produced by {@link ParamNormalizer}, keyed by field name.
 */
public final class NormalizedParams {
    private final Map<String, Object> values;

    NormalizedParams(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @SuppressWarnings("unchecked")
    public <T> T require(String field) {
        final Object value = values.get(field);
        if (value == null) {
            throw new IllegalStateException("Field was not normalized: " + field);
        }
        return (T) value;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> find(String field) {
        return Optional.ofNullable((T) values.get(field));
    }

    @SuppressWarnings("unchecked")
    public <T> T getOrDefault(String field, T fallback) {
        final Object value = values.get(field);
        return value != null ? (T) value : fallback;
    }

    public boolean contains(String field) {
        return values.containsKey(field);
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
