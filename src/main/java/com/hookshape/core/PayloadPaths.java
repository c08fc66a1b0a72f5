package com.hookshape.core;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reads values out of a delivery body by dotted path ("sales_appointment.appointment.date_time").
 * Every value handed out has already gone through {@link EmptinessNormalizer#normalize}.
 */
public final class PayloadPaths {

    private PayloadPaths() {}

    public static Object resolve(Map<String, ?> payload, String path) {
        if (payload == null || path == null || path.isBlank()) {
            return null;
        }
        Object current = payload;
        for (String key : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(key);
            } else {
                return null;
            }
        }
        return EmptinessNormalizer.normalize(current);
    }

    public static String string(Map<String, ?> payload, String path) {
        Object value = resolve(payload, path);
        return value == null ? null : value.toString();
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> object(Map<String, ?> payload, String path) {
        Object value = resolve(payload, path);
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> list(Map<String, ?> payload, String path) {
        Object value = resolve(payload, path);
        return value instanceof List<?> ? (List<Object>) value : Collections.emptyList();
    }

    public static boolean isTrue(Map<String, ?> payload, String path) {
        return Boolean.TRUE.equals(resolve(payload, path));
    }
}
