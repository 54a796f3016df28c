package com.ragbridge.entities;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for the free-form settings and metadata maps carried by the entities.
 * Copies keep insertion order and tolerate null values, which {@code Map.copyOf} does not.
 */
public final class Settings {

    private Settings() {
    }

    public static Map<String, Object> copyOf(Map<String, ?> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /** Returns {@code base} with every entry of {@code overrides} laid on top. */
    public static Map<String, Object> merge(Map<String, ?> base, Map<String, ?> overrides) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (base != null) out.putAll(base);
        if (overrides != null) out.putAll(overrides);
        return Collections.unmodifiableMap(out);
    }

    public static int intValue(Object value, int defaultValue) {
        if (value instanceof Number) return ((Number) value).intValue();
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static double doubleValue(Object value, double defaultValue) {
        if (value instanceof Number) return ((Number) value).doubleValue();
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static boolean booleanValue(Object value, boolean defaultValue) {
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof String && !((String) value).isBlank()) {
            String s = ((String) value).trim();
            return "true".equalsIgnoreCase(s) || "1".equals(s);
        }
        return defaultValue;
    }
}
