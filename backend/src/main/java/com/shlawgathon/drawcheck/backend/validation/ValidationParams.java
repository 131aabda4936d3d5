package com.shlawgathon.drawcheck.backend.validation;

import com.shlawgathon.drawcheck.backend.extraction.Measurements;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-domain request parameters. Values arrive as parsed JSON, so numbers may
 * be numbers or strings such as {@code "3/8"}.
 */
public final class ValidationParams {

    private static final ValidationParams EMPTY = new ValidationParams(Map.of());

    private final Map<String, Object> values;

    private ValidationParams(Map<String, Object> values) {
        this.values = values;
    }

    public static ValidationParams of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new ValidationParams(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static ValidationParams empty() {
        return EMPTY;
    }

    public Optional<Double> getDouble(String key) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (value instanceof String text) {
            return Measurements.parse(text);
        }
        return Optional.empty();
    }

    public Optional<String> getString(String key) {
        Object value = values.get(key);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    public Optional<Boolean> getBoolean(String key) {
        Object value = values.get(key);
        if (value instanceof Boolean bool) {
            return Optional.of(bool);
        }
        if (value instanceof String text) {
            return Optional.of(Boolean.parseBoolean(text.trim()));
        }
        return Optional.empty();
    }

    /**
     * Nested numeric map, e.g. {@code chemistry: {carbon: 0.2}}. Non-numeric
     * entries are skipped.
     */
    public Map<String, Double> getNumberMap(String key) {
        Object value = values.get(key);
        if (!(value instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, Double> numbers = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (v instanceof Number number) {
                numbers.put(k.toString(), number.doubleValue());
            } else if (v instanceof String text) {
                Measurements.parse(text).ifPresent(d -> numbers.put(k.toString(), d));
            }
        });
        return numbers;
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
