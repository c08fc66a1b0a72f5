package com.hookshape.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Deterministic JSON serialization of JSON-like values.
 *
 * RULES:
 *   - object keys are sorted lexicographically at every nesting level
 *   - NaN / Infinity become null
 *   - values that are not JSON-like (arbitrary objects) become null
 *   - a container already on the current encoding path (a cycle) becomes null
 *   - integral doubles are written without a fraction (2.0 → 2)
 *
 * Two variants:
 *   canonicalize()                → arrays re-sorted by each element's own serialization,
 *                                   so list order never affects a fingerprint
 *   canonicalizePreservingOrder() → arrays keep their order
 *
 * Never throws. Uses its own plain ObjectMapper: application-level Jackson
 * customizations must not change hash input.
 */
@Component
@Slf4j
public class CanonicalEncoder {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final double MAX_EXACT_INTEGRAL = 9_007_199_254_740_991d;

    private final ObjectMapper mapper = new ObjectMapper();

    public String canonicalize(Object value) {
        return write(encode(value, true, newPath()));
    }

    public String canonicalizePreservingOrder(Object value) {
        return write(encode(value, false, newPath()));
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            log.error("Canonical serialization failed, hashing as null: {}", e.getMessage(), e);
            return "null";
        }
    }

    private JsonNode encode(Object value, boolean sortArrays, Set<Object> path) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof String s) {
            return NODES.textNode(s);
        }
        if (value instanceof Character c) {
            return NODES.textNode(c.toString());
        }
        if (value instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (value instanceof Number n) {
            return encodeNumber(n);
        }
        if (value instanceof JsonNode node) {
            return encodeNode(node, sortArrays, path);
        }
        if (value instanceof Map<?, ?> map) {
            if (!path.add(map)) {
                return NullNode.getInstance();
            }
            try {
                TreeMap<String, Object> sorted = new TreeMap<>();
                map.forEach((k, v) -> sorted.put(String.valueOf(k), v));
                ObjectNode out = NODES.objectNode();
                sorted.forEach((k, v) -> out.set(k, encode(v, sortArrays, path)));
                return out;
            } finally {
                path.remove(map);
            }
        }
        if (value instanceof Collection<?> collection) {
            if (!path.add(collection)) {
                return NullNode.getInstance();
            }
            try {
                List<JsonNode> elements = new ArrayList<>(collection.size());
                for (Object element : collection) {
                    elements.add(encode(element, sortArrays, path));
                }
                return toArray(elements, sortArrays);
            } finally {
                path.remove(collection);
            }
        }
        if (value instanceof Object[] array) {
            if (!path.add(array)) {
                return NullNode.getInstance();
            }
            try {
                List<JsonNode> elements = new ArrayList<>(array.length);
                for (Object element : array) {
                    elements.add(encode(element, sortArrays, path));
                }
                return toArray(elements, sortArrays);
            } finally {
                path.remove(array);
            }
        }
        return NullNode.getInstance();
    }

    private JsonNode encodeNode(JsonNode node, boolean sortArrays, Set<Object> path) {
        if (node.isObject()) {
            TreeMap<String, JsonNode> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sorted.put(field.getKey(), field.getValue());
            }
            ObjectNode out = NODES.objectNode();
            sorted.forEach((k, v) -> out.set(k, encodeNode(v, sortArrays, path)));
            return out;
        }
        if (node.isArray()) {
            List<JsonNode> elements = new ArrayList<>(node.size());
            node.forEach(element -> elements.add(encodeNode(element, sortArrays, path)));
            return toArray(elements, sortArrays);
        }
        if (node.isNumber()) {
            return encodeNumber(node.numberValue());
        }
        if (node.isValueNode()) {
            return node;
        }
        return NullNode.getInstance();
    }

    private JsonNode encodeNumber(Number n) {
        if (n instanceof BigInteger big) {
            return NODES.textNode(big.toString());
        }
        if (n instanceof BigDecimal decimal) {
            return NODES.numberNode(decimal);
        }
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (!Double.isFinite(d)) {
                return NullNode.getInstance();
            }
            if (d == Math.rint(d) && Math.abs(d) <= MAX_EXACT_INTEGRAL) {
                return NODES.numberNode((long) d);
            }
            return NODES.numberNode(d);
        }
        return NODES.numberNode(n.longValue());
    }

    private ArrayNode toArray(List<JsonNode> elements, boolean sortArrays) {
        if (sortArrays) {
            List<Map.Entry<String, JsonNode>> keyed = new ArrayList<>(elements.size());
            for (JsonNode element : elements) {
                keyed.add(Map.entry(write(element), element));
            }
            keyed.sort(Map.Entry.comparingByKey());
            elements = new ArrayList<>(keyed.size());
            for (Map.Entry<String, JsonNode> entry : keyed) {
                elements.add(entry.getValue());
            }
        }
        ArrayNode out = NODES.arrayNode(elements.size());
        out.addAll(elements);
        return out;
    }

    private static Set<Object> newPath() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
