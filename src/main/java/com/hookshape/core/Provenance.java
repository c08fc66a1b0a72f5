package com.hookshape.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * Shadow maps of an aggregate: for every present leaf, when it was last received
 * and by which delivery. Both maps mirror the aggregate's nesting.
 */
@Getter
@RequiredArgsConstructor
public class Provenance {

    public static final String IDENTIFIER_FIELD = "id";
    public static final String RECEIVED_AT_FIELD = "field_last_received_at";
    public static final String RECEIVED_BY_FIELD = "field_last_received_by";

    private final Map<String, Object> lastReceivedAt;
    private final Map<String, Object> lastReceivedBy;

    public boolean isEmpty() {
        return lastReceivedAt.isEmpty();
    }
}
