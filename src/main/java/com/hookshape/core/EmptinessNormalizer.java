package com.hookshape.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The single definition of "present" used across the service.
 *
 * hasValue(x) is false for:
 *   null, NaN / Infinity, "" or whitespace-only strings,
 *   empty collections or arrays, maps without keys.
 * Everything else has a value, including 0 and false.
 *
 * normalize(x) additionally maps the upstream sentinels "", "null" and "n/a"
 * (any case, surrounding whitespace ignored) to null.
 */
public final class EmptinessNormalizer {

    private static final Set<String> SENTINELS = Set.of("", "null", "n/a");

    private EmptinessNormalizer() {}

    public static boolean hasValue(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String s) {
            return !s.isBlank();
        }
        if (value instanceof Double d) {
            return Double.isFinite(d);
        }
        if (value instanceof Float f) {
            return Float.isFinite(f);
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof JsonNode node) {
            return hasNodeValue(node);
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    public static Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return SENTINELS.contains(s.trim().toLowerCase(Locale.ROOT)) ? null : s;
        }
        if (value instanceof Double d && !Double.isFinite(d)) {
            return null;
        }
        if (value instanceof Float f && !Float.isFinite(f)) {
            return null;
        }
        return value;
    }

    /**
     * Deep copy of a JSON-like tree with every scalar passed through {@link #normalize}.
     * Keys survive with a null value so the shape of the delivery is unchanged.
     */
    public static Map<String, Object> normalizeTree(Map<String, ?> tree) {
        if (tree == null) {
            return null;
        }
        Map<String, Object> out = new LinkedHashMap<>();
        tree.forEach((key, value) -> out.put(key, normalizeAny(value)));
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object normalizeAny(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), normalizeAny(v)));
            return out;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> out = new ArrayList<>(collection.size());
            for (Object element : collection) {
                out.add(normalizeAny(element));
            }
            return out;
        }
        return normalize(value);
    }

    private static boolean hasNodeValue(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.textValue().isBlank();
        }
        if (node.isFloatingPointNumber()) {
            return Double.isFinite(node.doubleValue());
        }
        if (node.isContainerNode()) {
            return node.size() > 0;
        }
        return true;
    }
}
