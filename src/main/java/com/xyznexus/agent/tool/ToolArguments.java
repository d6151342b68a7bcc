package com.xyznexus.agent.tool;

import com.xyznexus.agent.exception.CapabilityException;

import java.util.List;
import java.util.Map;

/**
 * Coercion helpers for loosely typed JSON arguments.
 * Numbers may arrive as Integer, Long, Double or numeric strings.
 */
public final class ToolArguments {

    private ToolArguments() {
    }

    public static String requireString(Map<String, Object> args, String key) {
        Object raw = args.get(key);
        if (raw == null || raw.toString().isBlank()) {
            throw new CapabilityException("'" + key + "' is required");
        }
        return raw.toString().trim();
    }

    public static String optionalString(Map<String, Object> args, String key, String fallback) {
        Object raw = args.get(key);
        return raw == null || raw.toString().isBlank() ? fallback : raw.toString().trim();
    }

    public static double requireNumber(Map<String, Object> args, String key) {
        Object raw = args.get(key);
        if (raw == null) {
            throw new CapabilityException("'" + key + "' is required");
        }
        return toDouble(key, raw);
    }

    public static double optionalNumber(Map<String, Object> args, String key, double fallback) {
        Object raw = args.get(key);
        return raw == null ? fallback : toDouble(key, raw);
    }

    public static int optionalInt(Map<String, Object> args, String key, int fallback) {
        Object raw = args.get(key);
        return raw == null ? fallback : (int) Math.round(toDouble(key, raw));
    }

    @SuppressWarnings("unchecked")
    public static List<String> optionalStringList(Map<String, Object> args, String key) {
        Object raw = args.get(key);
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof List<?> list) {
            return ((List<Object>) list).stream().map(String::valueOf).toList();
        }
        throw new CapabilityException("'" + key + "' must be an array of strings");
    }

    private static double toDouble(String key, Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new CapabilityException("'" + key + "' must be a number, got '" + raw + "'");
        }
    }
}
