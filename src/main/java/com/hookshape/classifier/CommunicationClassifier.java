package com.hookshape.classifier;

import com.hookshape.core.PayloadPaths;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.model.CommunicationTag;
import com.hookshape.model.RejectionReason;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Maps the first message of a "communications" delivery to a message kind.
 *
 *   Text              → text
 *   Phone             → call
 *   Email             → email
 *   Lead              → lead_note
 *   Note, no direction→ user_note
 *   Note + Outgoing   → call_recording_note
 *
 * Type and direction are compared case-insensitively. The classified payload is the
 * message itself.
 */
@Component
public class CommunicationClassifier {

    public static final String COMMUNICATIONS = "communications";

    @Getter
    private final ClassificationCascade<Map<String, Object>, CommunicationTag> cascade = new ClassificationCascade<>(List.of(
            ClassificationRule.of("text message", m -> typeIs(m, "text"), CommunicationTag.TEXT),
            ClassificationRule.of("phone call", m -> typeIs(m, "phone"), CommunicationTag.CALL),
            ClassificationRule.of("email", m -> typeIs(m, "email"), CommunicationTag.EMAIL),
            ClassificationRule.of("lead note", m -> typeIs(m, "lead"), CommunicationTag.LEAD_NOTE),
            ClassificationRule.of("note without direction",
                    m -> typeIs(m, "note") && PayloadPaths.string(m, "direction") == null,
                    CommunicationTag.USER_NOTE),
            ClassificationRule.of("outgoing note",
                    m -> typeIs(m, "note") && "outgoing".equalsIgnoreCase(PayloadPaths.string(m, "direction")),
                    CommunicationTag.CALL_RECORDING_NOTE)
    ));

    public ClassifiedEvent classify(Map<String, Object> body) {
        Map<String, Object> communications = PayloadPaths.object(body, COMMUNICATIONS);
        if (communications == null) {
            throw new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_SHAPE,
                    "missing required communications object");
        }
        List<Object> messages = PayloadPaths.list(communications, "messages");
        if (messages.isEmpty()) {
            throw new DeliveryRejectedException(RejectionReason.MISSING_REQUIRED_FIELD,
                    "messages array is empty");
        }
        if (!(messages.get(0) instanceof Map<?, ?>)) {
            throw new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_SHAPE,
                    "first message is not an object");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> message = (Map<String, Object>) messages.get(0);
        if (PayloadPaths.resolve(message, "date_time") == null) {
            throw new DeliveryRejectedException(RejectionReason.MISSING_REQUIRED_FIELD,
                    "message missing required date_time");
        }

        CommunicationTag tag = cascade.classify(message)
                .orElseThrow(() -> new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_ENUM_VALUE,
                        "unsupported message type \"" + PayloadPaths.string(message, "type")
                                + "\" with direction \"" + PayloadPaths.string(message, "direction") + "\""));
        return ClassifiedEvent.of(tag, message);
    }

    private static boolean typeIs(Map<String, Object> message, String type) {
        return type.equalsIgnoreCase(PayloadPaths.string(message, "type"));
    }
}
