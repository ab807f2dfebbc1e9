package com.deepansh.explorer.tool;

import java.util.List;
import java.util.Map;

/**
 * Typed accessors for loosely-typed action parameters (they usually come from JSON or an LLM).
 */
public final class ToolParams {

    private ToolParams() {
    }

    public static String string(Map<String, Object> params, String key, String defaultValue) {
        Object value = params.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public static int integer(Map<String, Object> params, String key, int defaultValue) {
        Object value = params.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static List<String> stringList(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (value instanceof String s && !s.isBlank()) {
            return List.of(s.split("\\s*,\\s*"));
        }
        return List.of();
    }
}
