package com.hookshape.reshape;

import com.hookshape.classifier.StatusClassifier;
import com.hookshape.core.PayloadPaths;
import com.hookshape.dto.Aggregate;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.dto.DeliveryContext;
import com.hookshape.model.EventCategory;
import com.hookshape.model.StatusTag;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.hookshape.core.EmptinessNormalizer.hasValue;

/**
 * Status deliveries → customer, one status_&lt;type&gt; row per present (id, name) pair,
 * and customer_last_activity.
 *
 * Tiering: delivered → 1, disqualified → no tier at all, anything else → 4.
 */
@Component
@RequiredArgsConstructor
public class StatusHandler implements CategoryHandler {

    private static final String[][] STATUS_TYPES = {
            {"customer", "Customer"},
            {"service", "Service"},
            {"lead", "Lead"}
    };

    private final StatusClassifier classifier;

    @Override
    public EventCategory category() {
        return EventCategory.STATUS;
    }

    @Override
    public ClassifiedEvent classify(Map<String, Object> body) {
        return classifier.classify(body);
    }

    @Override
    public List<Aggregate> reshape(ClassifiedEvent event, DeliveryContext context) {
        StatusTag tag = (StatusTag) event.getTag();
        Map<String, Object> status = event.getPayload();
        long now = context.getArrivalTimestamp();

        Aggregate customer = context.subjectAggregate("customer");
        for (String[] type : STATUS_TYPES) {
            customer.putIfHasValue(type[0] + "_status", PayloadPaths.resolve(status, type[0] + "_status"))
                    .putIfHasValue(type[0] + "_status_id", PayloadPaths.resolve(status, type[0] + "_status_id"));
        }
        if (tag != StatusTag.DISQUALIFIED) {
            customer.put("primary_tier", tag == StatusTag.DELIVERED ? 1 : 4)
                    .put("last_primary_tier_event", now);
        }

        List<Aggregate> aggregates = new ArrayList<>();
        aggregates.add(customer);

        for (String[] type : STATUS_TYPES) {
            Object id = PayloadPaths.resolve(status, type[0] + "_status_id");
            Object name = PayloadPaths.resolve(status, type[0] + "_status");
            if (hasValue(id) && hasValue(name)) {
                Aggregate row = new Aggregate("status_" + type[0], id)
                        .put("type", type[1])
                        .put("name", name);
                // lead rows carry no dealer_id
                if (!"lead".equals(type[0])) {
                    row.put("dealer_id", context.getTenantId());
                }
                aggregates.add(row);
            }
        }

        Aggregate lastActivity = context.subjectAggregate("customer_last_activity");
        if (hasValue(PayloadPaths.resolve(status, "customer_status"))) {
            lastActivity.put("last_customer_status_update", now);
        }
        if (hasValue(PayloadPaths.resolve(status, "lead_status"))) {
            lastActivity.put("last_lead_status_update", now);
        }
        if ("delivered".equalsIgnoreCase(PayloadPaths.string(status, "customer_status"))) {
            lastActivity.put("last_delivered", now);
        }
        aggregates.add(lastActivity);
        return aggregates;
    }
}
