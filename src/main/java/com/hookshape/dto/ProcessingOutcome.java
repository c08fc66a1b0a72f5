package com.hookshape.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hookshape.model.OutcomeStatus;
import com.hookshape.model.RejectionReason;
import lombok.*;

import java.util.Map;

/**
 * What the service emits for one delivery.
 *
 * CLASSIFIED:
 *   tag, fingerprint (the category's identity), logical and delivery fingerprints,
 *   arrival timestamp, classified payload and the provenance-stamped aggregates.
 * REJECTED:
 *   rejection reason + error message, never any aggregate.
 * DEGRADED:
 *   tag "unknown", an "error-<millis>" fingerprint, the original payload and the error.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcessingOutcome {

    public static final String UNKNOWN_TAG = "unknown";

    private OutcomeStatus status;
    private String event;
    private String eventVersion;
    private String eventType;
    private String fingerprint;
    private String logicalFingerprint;
    private String deliveryFingerprint;
    private Long arrivalTimestamp;
    private String sentAt;
    private String deliveryId;
    private Object tenantId;
    private Object subjectId;
    private Map<String, Object> classifiedPayload;
    private Map<String, Aggregate> aggregates;
    private RejectionReason rejectionReason;
    private String error;
    private Map<String, Object> originalPayload;
}
