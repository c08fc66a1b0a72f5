package com.hookshape.classifier;

import com.hookshape.core.PayloadPaths;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.model.RejectionReason;
import com.hookshape.model.StatusTag;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Classifies a "customer_status" delivery.
 *
 *   any status name marks a bad lead → disqualified
 *   customer status "Delivered"      → delivered
 *   anything else                    → updated
 */
@Component
public class StatusClassifier {

    public static final String CUSTOMER_STATUS = "customer_status";

    private static final List<String> DISQUALIFYING = List.of("bad lead", "unsubscribe", "bad - invalid info");

    @Getter
    private final ClassificationCascade<Map<String, Object>, StatusTag> cascade = new ClassificationCascade<>(List.of(
            ClassificationRule.of("disqualifying status", StatusClassifier::isDisqualified, StatusTag.DISQUALIFIED),
            ClassificationRule.of("delivered",
                    s -> "delivered".equalsIgnoreCase(PayloadPaths.string(s, "customer_status")),
                    StatusTag.DELIVERED),
            ClassificationRule.of("any other change", s -> true, StatusTag.UPDATED)
    ));

    public ClassifiedEvent classify(Map<String, Object> body) {
        Map<String, Object> status = PayloadPaths.object(body, CUSTOMER_STATUS);
        if (status == null) {
            throw new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_SHAPE,
                    "missing required customer_status object");
        }
        return ClassifiedEvent.of(cascade.classify(status).orElse(StatusTag.UPDATED), status);
    }

    static boolean isDisqualified(Map<String, Object> status) {
        return Stream.of("customer_status", "lead_status", "service_status")
                .map(field -> PayloadPaths.resolve(status, field))
                .filter(String.class::isInstance)
                .map(name -> ((String) name).toLowerCase(Locale.ROOT))
                .anyMatch(name -> DISQUALIFYING.stream().anyMatch(name::contains));
    }
}
