package com.hookshape.service;

import com.hookshape.classifier.DeliveryRejectedException;
import com.hookshape.config.HookshapeProperties;
import com.hookshape.core.EmptinessNormalizer;
import com.hookshape.core.Fingerprint;
import com.hookshape.core.FingerprintGenerator;
import com.hookshape.core.PayloadPaths;
import com.hookshape.core.ProvenanceRecorder;
import com.hookshape.core.Timestamps;
import com.hookshape.dto.Aggregate;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.dto.DeliveryContext;
import com.hookshape.dto.ProcessingOutcome;
import com.hookshape.dto.RawDelivery;
import com.hookshape.model.EventCategory;
import com.hookshape.model.OutcomeStatus;
import com.hookshape.model.RejectionReason;
import com.hookshape.reshape.CategoryHandler;
import com.hookshape.reshape.CategoryHandlerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The ingestion pipeline for one delivery.
 *
 * FLOW:
 *   1. Normalize the body (sentinel strings → null)
 *   2. Require the correlation keys (dealer_id, customer_id)
 *   3. Resolve the arrival timestamp (body "timestamp", else the clock)
 *   4. Classify through the category's handler → tag, or rejection
 *   5. Fingerprint: logical (no timestamp) and delivery (with timestamp);
 *      the category's policy picks which one is the identity
 *   6. Reshape into aggregates
 *   7. Stamp every aggregate's present fields with (timestamp, identity)
 *
 * Outcomes:
 *   CLASSIFIED → aggregates + fingerprints
 *   REJECTED   → DeliveryRejectedException anywhere in 1-4, no aggregates
 *   DEGRADED   → any other failure; tag "unknown", "error-<millis>" fingerprint
 *
 * process() is pure apart from the clock. handle() also publishes the outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryProcessor {

    private static final String ERROR_FINGERPRINT_PREFIX = "error-";

    private final CategoryHandlerRegistry handlers;
    private final FingerprintGenerator fingerprints;
    private final ProvenanceRecorder provenance;
    private final HookshapeProperties properties;
    private final OutcomePublisher publisher;
    private final Clock clock;

    public ProcessingOutcome handle(EventCategory category, RawDelivery delivery) {
        ProcessingOutcome outcome = process(category, delivery);
        publisher.publish(outcome);
        return outcome;
    }

    public ProcessingOutcome process(EventCategory category, RawDelivery delivery) {
        HookshapeProperties.Category settings = properties.category(category);
        try {
            return ingest(category, settings, delivery);
        } catch (DeliveryRejectedException e) {
            log.warn("Delivery rejected: category={}, deliveryId={}, reason={}, message={}",
                    category, delivery.getDeliveryId(), e.getReason(), e.getMessage());
            return ProcessingOutcome.builder()
                    .status(OutcomeStatus.REJECTED)
                    .event(settings.getEventName())
                    .eventVersion(settings.getSchemaVersion())
                    .deliveryId(delivery.getDeliveryId())
                    .rejectionReason(e.getReason())
                    .error(e.getMessage())
                    .sentAt(Timestamps.toIso(clock.millis()))
                    .build();
        } catch (Exception e) {
            long now = clock.millis();
            log.error("Delivery degraded: category={}, deliveryId={}, error={}",
                    category, delivery.getDeliveryId(), e.getMessage(), e);
            return ProcessingOutcome.builder()
                    .status(OutcomeStatus.DEGRADED)
                    .event(settings.getEventName())
                    .eventVersion(settings.getSchemaVersion())
                    .eventType(ProcessingOutcome.UNKNOWN_TAG)
                    .fingerprint(ERROR_FINGERPRINT_PREFIX + now)
                    .arrivalTimestamp(now)
                    .deliveryId(delivery.getDeliveryId())
                    .originalPayload(delivery.getBody())
                    .error(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage())
                    .sentAt(Timestamps.toIso(now))
                    .build();
        }
    }

    private ProcessingOutcome ingest(EventCategory category, HookshapeProperties.Category settings,
                                     RawDelivery delivery) {
        // Step 1: normalize
        Map<String, Object> body = EmptinessNormalizer.normalizeTree(delivery.getBody());
        if (body == null) {
            throw new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_SHAPE, "body must be an object");
        }

        // Step 2: correlation keys
        HookshapeProperties.Fields fields = properties.getFields();
        Object tenantId = PayloadPaths.resolve(body, fields.getTenant());
        Object subjectId = PayloadPaths.resolve(body, fields.getSubject());
        if (tenantId == null) {
            throw new DeliveryRejectedException(RejectionReason.MISSING_CORRELATION_KEY,
                    "missing required " + fields.getTenant());
        }
        if (subjectId == null) {
            throw new DeliveryRejectedException(RejectionReason.MISSING_CORRELATION_KEY,
                    "missing required " + fields.getSubject());
        }

        // Step 3: arrival timestamp
        long arrival = Timestamps.toEpochMillis(body.get(fields.getTimestamp())).orElseGet(clock::millis);

        // Step 4: classify
        CategoryHandler handler = handlers.find(category)
                .orElseThrow(() -> new IllegalStateException("No handler registered for " + category));
        ClassifiedEvent event = handler.classify(body);

        // Step 5: fingerprints
        Fingerprint logical = fingerprints.fingerprint(body, settings.getNamespace(), false);
        Fingerprint perDelivery = fingerprints.fingerprint(body, settings.getNamespace(), true);
        Fingerprint identity = settings.isIncludeVolatileTimestamp() ? perDelivery : logical;

        // Step 6: reshape
        DeliveryContext context = DeliveryContext.builder()
                .body(body)
                .tenantId(tenantId)
                .subjectId(subjectId)
                .arrivalTimestamp(arrival)
                .fingerprint(identity)
                .deliveryId(delivery.getDeliveryId())
                .build();
        List<Aggregate> aggregates = handler.reshape(event, context);

        // Step 7: provenance
        Map<String, Aggregate> byName = new LinkedHashMap<>();
        for (Aggregate aggregate : aggregates) {
            long stampedAt = aggregate.getProvenanceTimestamp() != null ? aggregate.getProvenanceTimestamp() : arrival;
            aggregate.applyProvenance(provenance.stamp(aggregate.getFields(), stampedAt, identity));
            byName.put(aggregate.getName(), aggregate);
        }

        log.info("Delivery classified: category={}, tag={}, fingerprint={}, deliveryId={}, aggregates={}",
                category, event.getTag().wireValue(), identity, delivery.getDeliveryId(), byName.keySet());

        return ProcessingOutcome.builder()
                .status(OutcomeStatus.CLASSIFIED)
                .event(settings.getEventName())
                .eventVersion(settings.getSchemaVersion())
                .eventType(event.getTag().wireValue())
                .fingerprint(identity.value())
                .logicalFingerprint(logical.value())
                .deliveryFingerprint(perDelivery.value())
                .arrivalTimestamp(arrival)
                .deliveryId(delivery.getDeliveryId())
                .tenantId(tenantId)
                .subjectId(subjectId)
                .classifiedPayload(event.getPayload())
                .aggregates(byName)
                .originalPayload(delivery.getBody())
                .sentAt(Timestamps.toIso(clock.millis()))
                .build();
    }
}
