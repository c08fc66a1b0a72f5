package com.hookshape.classifier;

import com.hookshape.core.PayloadPaths;
import com.hookshape.core.Timestamps;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.model.NotificationTag;
import com.hookshape.model.RejectionReason;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Picks the first supported lead notification out of the "notifications" array.
 *
 * One rule per notification code (1000-1015). Notifications are scanned in array
 * order and the first whose code has a rule wins. Its
 * updates.lead_notification.date_time is the event time and must parse.
 */
@Component
public class NotificationClassifier {

    public static final String NOTIFICATIONS = "notifications";
    public static final String DATE_TIME = "updates.lead_notification.date_time";

    @Getter
    private final ClassificationCascade<Map<String, Object>, NotificationTag> cascade = new ClassificationCascade<>(
            Arrays.stream(NotificationTag.values())
                    .map(tag -> ClassificationRule.<Map<String, Object>, NotificationTag>of(
                            "code " + tag.code(), n -> code(n).filter(c -> c == tag.code()).isPresent(), tag))
                    .collect(Collectors.toList()));

    public ClassifiedEvent classify(Map<String, Object> body) {
        List<Object> notifications = PayloadPaths.list(body, NOTIFICATIONS);
        if (notifications.isEmpty()) {
            throw new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_SHAPE,
                    "missing or empty notifications array");
        }

        List<String> seenCodes = new ArrayList<>();
        for (Object candidate : notifications) {
            if (!(candidate instanceof Map<?, ?>)) {
                continue;
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> notification = (Map<String, Object>) candidate;
            code(notification).ifPresent(c -> seenCodes.add(String.valueOf(c)));
            Optional<NotificationTag> tag = cascade.classify(notification);
            if (tag.isPresent()) {
                requireDateTime(notification);
                return ClassifiedEvent.of(tag.get(), notification);
            }
        }
        throw new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_ENUM_VALUE,
                "no supported notification found (found codes: "
                        + (seenCodes.isEmpty() ? "none" : String.join(", ", seenCodes)) + ")");
    }

    private static void requireDateTime(Map<String, Object> notification) {
        Object dateTime = PayloadPaths.resolve(notification, DATE_TIME);
        if (dateTime == null) {
            throw new DeliveryRejectedException(RejectionReason.MISSING_REQUIRED_FIELD,
                    "missing required lead_notification.date_time");
        }
        if (Timestamps.parse(dateTime).isEmpty()) {
            throw new DeliveryRejectedException(RejectionReason.INVALID_FIELD_VALUE,
                    "unable to parse date_time: " + dateTime);
        }
    }

    static Optional<Integer> code(Map<String, Object> notification) {
        Object code = PayloadPaths.resolve(notification, "code");
        if (code instanceof Number n) {
            // integral values within int range only
            try {
                return Optional.of(new BigDecimal(n.toString()).intValueExact());
            } catch (ArithmeticException | NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (code instanceof String s) {
            try {
                return Optional.of(Integer.parseInt(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
