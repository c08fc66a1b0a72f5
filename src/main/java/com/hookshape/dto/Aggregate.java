package com.hookshape.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hookshape.core.EmptinessNormalizer;
import com.hookshape.core.Provenance;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sparse projection of one business entity built from a single delivery.
 *
 * Only fields that have a value are written (see putIfHasValue). After reshaping,
 * the processor attaches the provenance shadow maps.
 *
 * Example JSON:
 * {
 *   "id": "C-100",
 *   "dealer_id": "D-7",
 *   "primary_tier": 1,
 *   "field_last_received_at": { "dealer_id": 1718000000000, "primary_tier": 1718000000000 },
 *   "field_last_received_by": { "dealer_id": "5f2c...", "primary_tier": "5f2c..." }
 * }
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Aggregate {

    @JsonIgnore
    private final String name;

    @JsonIgnore
    private final Map<String, Object> fields = new LinkedHashMap<>();

    /** Event time used for provenance instead of the arrival timestamp, when a category has one. */
    @JsonIgnore
    private Long provenanceTimestamp;

    @JsonProperty(Provenance.RECEIVED_AT_FIELD)
    private Map<String, Object> lastReceivedAt;

    @JsonProperty(Provenance.RECEIVED_BY_FIELD)
    private Map<String, Object> lastReceivedBy;

    public Aggregate(String name, Object id) {
        this.name = name;
        fields.put(Provenance.IDENTIFIER_FIELD, id);
    }

    @JsonIgnore
    public Object getId() {
        return fields.get(Provenance.IDENTIFIER_FIELD);
    }

    /** Writes the field unconditionally (required fields). */
    public Aggregate put(String key, Object value) {
        fields.put(key, value);
        return this;
    }

    public Aggregate putIfHasValue(String key, Object value) {
        if (EmptinessNormalizer.hasValue(value)) {
            fields.put(key, value);
        }
        return this;
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public boolean has(String key) {
        return fields.containsKey(key);
    }

    public Aggregate withProvenanceTimestamp(long timestamp) {
        this.provenanceTimestamp = timestamp;
        return this;
    }

    public void applyProvenance(Provenance provenance) {
        this.lastReceivedAt = provenance.getLastReceivedAt();
        this.lastReceivedBy = provenance.getLastReceivedBy();
    }

    @JsonAnyGetter
    public Map<String, Object> jsonFields() {
        return Collections.unmodifiableMap(fields);
    }
}
