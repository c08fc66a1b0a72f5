package com.hookshape.reshape;

import com.hookshape.classifier.NotificationClassifier;
import com.hookshape.core.PayloadPaths;
import com.hookshape.core.Timestamps;
import com.hookshape.dto.Aggregate;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.dto.DeliveryContext;
import com.hookshape.model.EventCategory;
import com.hookshape.model.NotificationTag;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lead notification deliveries → customer, notification and (for activity-bearing
 * kinds) customer_last_activity.
 *
 * All three are stamped with the notification's own date_time instead of the
 * arrival timestamp: the notification says when the lead activity happened.
 *
 *   license, routeone                          → tier 1, last_notification_1
 *   credit_app, transunion, proposal, forms    → tier 2, last_notification_2
 *   others                                     → no tier
 */
@Component
@RequiredArgsConstructor
public class NotificationHandler implements CategoryHandler {

    private static final Map<NotificationTag, Integer> PRIMARY_TIERS = new EnumMap<>(NotificationTag.class);
    private static final Map<NotificationTag, String> ACTIVITY_FIELDS = new EnumMap<>(NotificationTag.class);

    static {
        PRIMARY_TIERS.put(NotificationTag.LICENSE, 1);
        PRIMARY_TIERS.put(NotificationTag.ROUTEONE, 1);
        PRIMARY_TIERS.put(NotificationTag.CREDIT_APP, 2);
        PRIMARY_TIERS.put(NotificationTag.TRANSUNION, 2);
        PRIMARY_TIERS.put(NotificationTag.PROPOSAL, 2);
        PRIMARY_TIERS.put(NotificationTag.FORMS, 2);

        ACTIVITY_FIELDS.put(NotificationTag.LICENSE, "last_license_scanned");
        ACTIVITY_FIELDS.put(NotificationTag.CREDIT_APP, "last_credit_app_printed");
        ACTIVITY_FIELDS.put(NotificationTag.TRANSUNION, "last_transunion_pulled");
        ACTIVITY_FIELDS.put(NotificationTag.ROUTEONE, "last_routeone_sent");
        ACTIVITY_FIELDS.put(NotificationTag.PROPOSAL, "last_proposal_printed");
        ACTIVITY_FIELDS.put(NotificationTag.FORMS, "last_forms_printed");
    }

    private final NotificationClassifier classifier;

    @Override
    public EventCategory category() {
        return EventCategory.NOTIFICATION;
    }

    @Override
    public ClassifiedEvent classify(Map<String, Object> body) {
        return classifier.classify(body);
    }

    @Override
    public List<Aggregate> reshape(ClassifiedEvent event, DeliveryContext context) {
        NotificationTag tag = (NotificationTag) event.getTag();
        Map<String, Object> notification = event.getPayload();

        Object dateTime = PayloadPaths.resolve(notification, NotificationClassifier.DATE_TIME);
        long occurredAt = Timestamps.toEpochMillis(dateTime)
                .orElseThrow(() -> new IllegalStateException("date_time passed classification but does not parse"));

        Aggregate customer = context.subjectAggregate("customer").withProvenanceTimestamp(occurredAt);
        Integer tier = PRIMARY_TIERS.get(tag);
        if (tier != null) {
            customer.put("primary_tier", tier)
                    .put("last_primary_tier_event", dateTime)
                    .put("last_notification_" + tier, dateTime);
        }

        Aggregate row = new Aggregate("notification", context.getFingerprint().value())
                .withProvenanceTimestamp(occurredAt)
                .put("occurred_at", occurredAt)
                .put("code_id", tag.code())
                .put("customer_id", context.getSubjectId())
                .put("dealer_id", context.getTenantId())
                .putIfHasValue("employee_id", PayloadPaths.resolve(notification, "updates.lead_notification.employee_id"));

        List<Aggregate> aggregates = new ArrayList<>(List.of(customer, row));
        String activityField = ACTIVITY_FIELDS.get(tag);
        if (activityField != null) {
            aggregates.add(context.subjectAggregate("customer_last_activity")
                    .withProvenanceTimestamp(occurredAt)
                    .put(activityField, occurredAt));
        }
        return aggregates;
    }
}
