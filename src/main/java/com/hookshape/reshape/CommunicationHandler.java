package com.hookshape.reshape;

import com.hookshape.classifier.CallDispositionClassifier;
import com.hookshape.classifier.CommunicationClassifier;
import com.hookshape.classifier.ConsentActionClassifier;
import com.hookshape.core.PayloadPaths;
import com.hookshape.dto.Aggregate;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.dto.DeliveryContext;
import com.hookshape.model.CallDisposition;
import com.hookshape.model.CommunicationTag;
import com.hookshape.model.ConsentAction;
import com.hookshape.model.EventCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Communication deliveries → customer, communication and customer_last_activity.
 *
 * FLOW:
 *   message kind (text / call / email / notes) → kind-specific enrichment
 *     text                → consent action
 *     call                → disposition from the rep's note
 *     call_recording_note → talk time, disposition, recording link from "Key: value" lines
 *     lead_note           → body after "Original Message:", event name after "Lead Event:"
 *   → tiering on the customer (inbound 2, outbound 3, lead note 1)
 *   → communication row keyed by the delivery fingerprint
 *   → last-activity timestamps by direction and kind
 */
@Component
@RequiredArgsConstructor
public class CommunicationHandler implements CategoryHandler {

    private static final String INBOUND = "inbound";
    private static final String OUTBOUND = "outbound";

    private final CommunicationClassifier classifier;
    private final CallDispositionClassifier dispositionClassifier;
    private final ConsentActionClassifier consentClassifier;

    @Override
    public EventCategory category() {
        return EventCategory.COMMUNICATION;
    }

    @Override
    public ClassifiedEvent classify(Map<String, Object> body) {
        return classifier.classify(body);
    }

    @Override
    public List<Aggregate> reshape(ClassifiedEvent event, DeliveryContext context) {
        CommunicationTag tag = (CommunicationTag) event.getTag();
        Map<String, Object> message = event.getPayload();
        long now = context.getArrivalTimestamp();

        String direction = direction(PayloadPaths.string(message, "direction"));
        String rawBody = PayloadPaths.string(message, "body");
        Object occurredAt = PayloadPaths.resolve(message, "date_time");
        Object employeeId = PayloadPaths.resolve(context.getBody(), CommunicationClassifier.COMMUNICATIONS + ".employee_id");

        Aggregate communication = new Aggregate("communication", context.getFingerprint().value())
                .put("occurred_at", occurredAt)
                .put("customer_id", context.getSubjectId())
                .put("dealer_id", context.getTenantId());
        if (tag != CommunicationTag.CALL_RECORDING_NOTE && tag != CommunicationTag.LEAD_NOTE) {
            communication.putIfHasValue("employee_id", employeeId);
        }
        if (tag != CommunicationTag.USER_NOTE && tag != CommunicationTag.LEAD_NOTE) {
            communication.putIfHasValue("direction", direction);
        }

        ConsentAction consent = null;
        String leadEventName = null;
        switch (tag) {
            case TEXT -> {
                consent = consentClassifier.classify(rawBody, INBOUND.equals(direction)).orElse(null);
                communication.putIfHasValue("body", rawBody)
                        .putIfHasValue("consent_action", consent == null ? null : consent.wireValue());
            }
            case CALL -> communication.putIfHasValue("body", rawBody)
                    .put("disposition", dispositionClassifier.classify(rawBody).wireValue());
            case EMAIL -> communication.putIfHasValue("subject", PayloadPaths.resolve(message, "subject"))
                    .putIfHasValue("body", rawBody);
            case CALL_RECORDING_NOTE -> {
                CallRecordingNote note = CallRecordingNote.parse(rawBody);
                communication.putIfHasValue("talk_time", note.getTalkTime())
                        .putIfHasValue("disposition", CallDisposition.fromWireValue(note.getClassification())
                                .map(CallDisposition::wireValue).orElse(null))
                        .putIfHasValue("recording_link", note.getRecordingLink());
            }
            case LEAD_NOTE -> {
                leadEventName = LeadNotes.eventName(rawBody);
                communication.putIfHasValue("body", LeadNotes.body(rawBody));
            }
            case USER_NOTE -> communication.putIfHasValue("body", rawBody);
        }

        Aggregate customer = context.subjectAggregate("customer");
        if (tag == CommunicationTag.TEXT || tag == CommunicationTag.CALL) {
            String kind = tag == CommunicationTag.TEXT ? "sms" : "call";
            boolean optOut = consent == ConsentAction.OPT_OUT;
            if (INBOUND.equals(direction) && !optOut) {
                customer.putIfHasValue("last_ib_" + kind, occurredAt)
                        .put("primary_tier", 2)
                        .putIfHasValue("last_primary_tier_event", occurredAt);
            } else if (OUTBOUND.equals(direction)) {
                customer.putIfHasValue("last_ob_" + kind, occurredAt)
                        .put("primary_tier", 3)
                        .putIfHasValue("last_primary_tier_event", occurredAt);
            }
        } else if (tag == CommunicationTag.LEAD_NOTE) {
            customer.put("primary_tier", 1)
                    .putIfHasValue("last_primary_tier_event", occurredAt)
                    .putIfHasValue("last_lead", occurredAt);
        }

        Aggregate lastActivity = context.subjectAggregate("customer_last_activity");
        switch (tag) {
            case TEXT, CALL, EMAIL -> {
                String kind = tag == CommunicationTag.TEXT ? "sms" : tag.wireValue();
                if (INBOUND.equals(direction)) {
                    lastActivity.put("last_ib_" + kind, now);
                } else if (OUTBOUND.equals(direction)) {
                    lastActivity.put("last_ob_" + kind, now);
                }
            }
            case LEAD_NOTE -> {
                lastActivity.put("last_lead_note", now);
                if (leadEventName != null) {
                    lastActivity.put("last_lead_" + leadEventName, now);
                }
            }
            case USER_NOTE, CALL_RECORDING_NOTE -> lastActivity.put("last_" + tag.wireValue(), now);
        }

        return List.of(customer, communication, lastActivity);
    }

    /** Outgoing/Incoming → outbound/inbound; anything else is dropped. */
    static String direction(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "outgoing", OUTBOUND -> OUTBOUND;
            case "incoming", INBOUND -> INBOUND;
            default -> null;
        };
    }
}
