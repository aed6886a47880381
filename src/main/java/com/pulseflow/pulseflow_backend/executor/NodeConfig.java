package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.exception.NodeConfigurationException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed, lenient reads over a node's JSON configuration. Values written by older editors are often numbers
 * stored as strings, so numeric getters accept both.
 */
final class NodeConfig {

    private final Map<String, Object> values;

    private NodeConfig(Map<String, Object> values) {
        this.values = values != null ? values : Collections.emptyMap();
    }

    static NodeConfig of(Map<String, Object> values) {
        return new NodeConfig(values);
    }

    Map<String, Object> asMap() {
        return values;
    }

    Object raw(String key) {
        return values.get(key);
    }

    Optional<String> string(String key) {
        Object value = values.get(key);
        if (value == null) return Optional.empty();
        String s = value.toString().trim();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    String requireString(String key, String what) {
        return string(key).orElseThrow(() -> new NodeConfigurationException(what + " is required"));
    }

    boolean flag(String key) {
        Object value = values.get(key);
        return value instanceof Boolean b ? b : "true".equalsIgnoreCase(String.valueOf(value));
    }

    BigDecimal decimal(String key, BigDecimal fallback) {
        Object value = values.get(key);
        if (value instanceof Number n) return new BigDecimal(n.toString());
        if (value instanceof String s && !s.isBlank()) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    /** Integer with the given fallback for absent, zero or unparseable values. */
    int integer(String key, int fallback) {
        Object value = values.get(key);
        int parsed = 0;
        if (value instanceof Number n) {
            parsed = n.intValue();
        } else if (value instanceof String s && !s.isBlank()) {
            try {
                parsed = new BigDecimal(s.trim()).intValue();
            } catch (NumberFormatException e) {
                parsed = 0;
            }
        }
        return parsed != 0 ? parsed : fallback;
    }

    List<String> stringList(String key) {
        Object value = values.get(key);
        if (value instanceof List<?> list) {
            return list.stream().filter(item -> item != null && !item.toString().isBlank())
                    .map(item -> item.toString().trim()).toList();
        }
        return List.of();
    }
}
