package com.samsung.ees.infra.api.remotedb.executor;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.regex.Pattern;

/**
 * Normalizes decoded values to the scalar types rows carry: {@code null}, {@link Long},
 * {@link Double} or {@link String}.
 * <p>
 * Text that looks numeric is reparsed, since the remote side may have serialized a number as a
 * string. Text without {@code .}, {@code e} or {@code E} becomes a {@code Long}, other numeric
 * text a {@code Double}. Integers outside the {@code long} range stay text.
 */
public final class ScalarValues {
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private ScalarValues() {
        // Private constructor to prevent instantiation
    }

    public static Object fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.asText();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? 1L : 0L;
        }
        if (node.isTextual()) {
            return fromText(node.textValue());
        }
        // nested arrays and objects are carried as their JSON text
        return node.toString();
    }

    public static Object fromText(String text) {
        String trimmed = text.trim();
        if (INTEGER.matcher(trimmed).matches()) {
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                return text;
            }
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        return text;
    }

    /**
     * Normalizes an arbitrary Java value, for payloads handed over already decoded.
     */
    public static Object fromObject(Object value) {
        if (value == null || value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1L : 0L;
        }
        if (value instanceof JsonNode) {
            return fromJson((JsonNode) value);
        }
        if (value instanceof String) {
            return fromText((String) value);
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return value.toString();
    }
}
