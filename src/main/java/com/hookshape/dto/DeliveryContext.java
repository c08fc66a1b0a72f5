package com.hookshape.dto;

import com.hookshape.core.Fingerprint;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * Everything a reshaping step may read about the delivery besides the classified
 * payload: correlation keys, arrival time, identity and the normalized body.
 */
@Getter
@Builder
public class DeliveryContext {

    private final Map<String, Object> body;
    private final Object tenantId;
    private final Object subjectId;
    private final long arrivalTimestamp;
    private final Fingerprint fingerprint;
    private final String deliveryId;

    /** Aggregate keyed by the subject (customer) and carrying the tenant. */
    public Aggregate subjectAggregate(String name) {
        return new Aggregate(name, subjectId).put("dealer_id", tenantId);
    }
}
