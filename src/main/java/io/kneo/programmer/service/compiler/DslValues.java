package io.kneo.programmer.service.compiler;

import io.kneo.programmer.service.exceptions.ValidationError;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed reads over the loosely-typed definition tree. Malformed numbers surface as
 * {@link ValidationError}, never as raw parse exceptions.
 */
final class DslValues {

    private DslValues() {
    }

    static Map<String, Object> map(Object value) {
        if (!(value instanceof Map<?, ?> raw)) {
            return Map.of();
        }
        Map<String, Object> node = new LinkedHashMap<>();
        raw.forEach((key, item) -> node.put(String.valueOf(key), item));
        return node;
    }

    static Map<String, Object> map(Map<String, Object> node, String key) {
        return map(node.get(key));
    }

    static List<Object> list(Object value) {
        if (value instanceof List<?> items) {
            return new ArrayList<>(items);
        }
        return List.of();
    }

    static String string(Map<String, Object> node, String key) {
        Object value = node.get(key);
        return value == null ? null : value.toString();
    }

    static String string(Map<String, Object> node, String key, String fallback) {
        String value = string(node, key);
        return value == null || value.isEmpty() ? fallback : value;
    }

    static Integer integer(Map<String, Object> node, String key) {
        Object value = node.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw malformed(key, "an integer", value);
        }
    }

    static Long longValue(Map<String, Object> node, String key) {
        Object value = node.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw malformed(key, "an integer", value);
        }
    }

    static double decimal(Map<String, Object> node, String key, double fallback) {
        Object value = node.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw malformed(key, "a number", value);
        }
    }

    static boolean bool(Map<String, Object> node, String key) {
        Object value = node.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    static List<String> strings(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).toList();
        }
        return List.of(value.toString());
    }

    private static ValidationError malformed(String key, String expected, Object value) {
        return new ValidationError(List.of(String.format("%s must be %s, got '%s'", key, expected, value)));
    }
}
