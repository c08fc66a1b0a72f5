package com.hookshape.core;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.hookshape.core.EmptinessNormalizer.hasValue;

/**
 * Stamps every present leaf of an aggregate with the delivery's timestamp and fingerprint.
 *
 * Given:
 *   { "id": 7, "first_name": "Ana", "last_name": "",
 *     "current_address": { "city": "Austin", "zip_code": null },
 *     "desired_vehicle": [ {...}, {...} ] }
 * produces:
 *   lastReceivedAt = { "first_name": ts, "current_address": { "city": ts }, "desired_vehicle": ts }
 *   lastReceivedBy = { "first_name": fp, "current_address": { "city": fp }, "desired_vehicle": fp }
 *
 * Nested maps recurse and are nested, never flattened. Arrays count as one leaf.
 * The identifier and the two shadow fields themselves are skipped.
 *
 * A downstream store compares these timestamps per field to merge partial,
 * out-of-order updates (last writer wins); this class only produces the deltas.
 */
@Component
public class ProvenanceRecorder {

    static final Set<String> EXCLUDED_FIELDS = Set.of(
            Provenance.IDENTIFIER_FIELD, Provenance.RECEIVED_AT_FIELD, Provenance.RECEIVED_BY_FIELD);

    public Provenance stamp(Map<String, ?> fields, long timestamp, Fingerprint fingerprint) {
        Map<String, Object> receivedAt = new LinkedHashMap<>();
        Map<String, Object> receivedBy = new LinkedHashMap<>();
        if (fields != null) {
            walk(fields, timestamp, fingerprint.value(), receivedAt, receivedBy, true);
        }
        return new Provenance(receivedAt, receivedBy);
    }

    private void walk(Map<?, ?> fields, long timestamp, String fingerprint,
                      Map<String, Object> receivedAt, Map<String, Object> receivedBy, boolean topLevel) {
        for (Map.Entry<?, ?> entry : fields.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (topLevel && EXCLUDED_FIELDS.contains(key)) {
                continue;
            }
            if (!hasValue(value)) {
                continue;
            }
            if (value instanceof Map<?, ?> nested) {
                Map<String, Object> nestedAt = new LinkedHashMap<>();
                Map<String, Object> nestedBy = new LinkedHashMap<>();
                walk(nested, timestamp, fingerprint, nestedAt, nestedBy, false);
                if (!nestedAt.isEmpty()) {
                    receivedAt.put(key, nestedAt);
                    receivedBy.put(key, nestedBy);
                }
            } else {
                // scalars, and collections as a single unit
                receivedAt.put(key, timestamp);
                receivedBy.put(key, fingerprint);
            }
        }
    }
}
