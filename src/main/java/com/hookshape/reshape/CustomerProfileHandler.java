package com.hookshape.reshape;

import com.hookshape.classifier.CustomerClassifier;
import com.hookshape.core.PayloadPaths;
import com.hookshape.dto.Aggregate;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.dto.DeliveryContext;
import com.hookshape.model.EventCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.hookshape.core.EmptinessNormalizer.hasValue;

/**
 * Customer profile deliveries → customer (and lead_source when the source is named).
 *
 * Addresses and the sales team are written as nested objects so that each nested
 * field carries its own provenance entry:
 *
 *   "current_address":    { "street": ..., "city": ..., "zip_code": ... }
 *   "previous_addresses": { "previous_1": { ... }, "previous_2": { ... } }
 *   "sales_team":         { "sales_rep_1": ..., "sales_bdr": ... }
 *
 * Vehicle lists are kept whole and attributed as one unit.
 */
@Component
@RequiredArgsConstructor
public class CustomerProfileHandler implements CategoryHandler {

    private static final String[][] PREVIOUS_ADDRESSES = {
            {"Previous1", "previous_1"},
            {"Previous2", "previous_2"},
            {"Previous3", "previous_3"}
    };

    private static final String[][] SALES_TEAM = {
            {"SalesRep1", "sales_rep_1"},
            {"SalesRep2", "sales_rep_2"},
            {"SalesBDR", "sales_bdr"},
            {"ServiceBDR", "service_bdr"}
    };

    private final CustomerClassifier classifier;

    @Override
    public EventCategory category() {
        return EventCategory.CUSTOMER;
    }

    @Override
    public ClassifiedEvent classify(Map<String, Object> body) {
        return classifier.classify(body);
    }

    @Override
    public List<Aggregate> reshape(ClassifiedEvent event, DeliveryContext context) {
        Map<String, Object> profile = event.getPayload();
        long now = context.getArrivalTimestamp();

        Map<String, Object> person = PayloadPaths.object(profile, "person");
        List<Object> communications = PayloadPaths.list(person, "communications");
        List<Object> addresses = PayloadPaths.list(person, "address");
        List<Object> dealerParties = PayloadPaths.list(profile, "dealer_parties");

        Aggregate customer = context.subjectAggregate("customer")
                .put("primary_tier", 4)
                .put("last_primary_tier_event", now)
                .put("last_customer_update", now)
                .putIfHasValue("first_name", PayloadPaths.resolve(person, "first_name"))
                .putIfHasValue("middle_name", PayloadPaths.resolve(person, "middle_name"))
                .putIfHasValue("last_name", PayloadPaths.resolve(person, "last_name"))
                .putIfHasValue("primary_email", PayloadPaths.resolve(
                        findFirst(communications, "communication_type", "PrimaryEmail"), "email_address"))
                .putIfHasValue("secondary_email", PayloadPaths.resolve(
                        findFirst(communications, "communication_type", "SecondaryEmail"), "email_address"))
                .putIfHasValue("lead_source", PayloadPaths.resolve(profile, "lead_source"))
                .putIfHasValue("lead_source_id", PayloadPaths.resolve(profile, "lead_source_id"))
                .putIfHasValue("lead_type", PayloadPaths.resolve(profile, "lead_type"))
                .putIfHasValue("ad_source", PayloadPaths.resolve(profile, "ad_source"))
                .putIfHasValue("current_address", address(findFirst(addresses, "address_type", "Current")));

        Map<String, Object> previous = new LinkedHashMap<>();
        for (String[] slot : PREVIOUS_ADDRESSES) {
            Map<String, Object> address = address(findFirst(addresses, "address_type", slot[0]));
            if (hasValue(address)) {
                previous.put(slot[1], address);
            }
        }
        customer.putIfHasValue("previous_addresses", previous);

        Map<String, Object> salesTeam = new LinkedHashMap<>();
        for (String[] party : SALES_TEAM) {
            Object employeeId = PayloadPaths.resolve(findFirst(dealerParties, "party_type", party[0]), "employee_id");
            if (hasValue(employeeId)) {
                salesTeam.put(party[1], employeeId);
            }
        }
        customer.putIfHasValue("sales_team", salesTeam)
                .putIfHasValue("desired_vehicle", PayloadPaths.list(profile, "desired_vehicle"))
                .putIfHasValue("trade_vehicle", PayloadPaths.list(profile, "trade_vehicle"))
                .putIfHasValue("cash_down", PayloadPaths.resolve(profile, "cash_down"))
                .putIfHasValue("block_text", PayloadPaths.resolve(profile, "block_text"))
                .putIfHasValue("block_email", PayloadPaths.resolve(profile, "block_email"))
                .putIfHasValue("block_letters", PayloadPaths.resolve(profile, "block_letters"));

        List<Aggregate> aggregates = new ArrayList<>();
        aggregates.add(customer);

        Object leadSourceId = PayloadPaths.resolve(profile, "lead_source_id");
        Object leadSource = PayloadPaths.resolve(profile, "lead_source");
        if (hasValue(leadSourceId) && hasValue(leadSource)) {
            aggregates.add(new Aggregate("lead_source", leadSourceId)
                    .put("dealer_id", context.getTenantId())
                    .put("name", leadSource)
                    .putIfHasValue("type", PayloadPaths.resolve(profile, "lead_type")));
        }
        return aggregates;
    }

    private static Map<String, Object> address(Map<String, Object> source) {
        Map<String, Object> address = new LinkedHashMap<>();
        if (source == null) {
            return address;
        }
        putIfHasValue(address, "street", PayloadPaths.resolve(source, "line_one"));
        putIfHasValue(address, "street2", PayloadPaths.resolve(source, "line_two"));
        putIfHasValue(address, "city", PayloadPaths.resolve(source, "city"));
        putIfHasValue(address, "state", PayloadPaths.resolve(source, "state"));
        putIfHasValue(address, "zip_code", PayloadPaths.resolve(source, "zip_code"));
        putIfHasValue(address, "duration", PayloadPaths.resolve(source, "duration"));
        putIfHasValue(address, "monthly_payment", PayloadPaths.resolve(source, "monthly_payment"));
        return address;
    }

    private static void putIfHasValue(Map<String, Object> target, String key, Object value) {
        if (hasValue(value)) {
            target.put(key, value);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> findFirst(List<Object> items, String key, String value) {
        for (Object item : items) {
            if (item instanceof Map<?, ?> map && value.equals(map.get(key))) {
                return (Map<String, Object>) map;
            }
        }
        return null;
    }
}
