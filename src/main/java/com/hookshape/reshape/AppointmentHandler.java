package com.hookshape.reshape;

import com.hookshape.classifier.AppointmentClassifier;
import com.hookshape.core.PayloadPaths;
import com.hookshape.dto.Aggregate;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.dto.DeliveryContext;
import com.hookshape.model.AppointmentTag;
import com.hookshape.model.EventCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Appointment deliveries → customer, appointment, appointment_update and
 * customer_last_activity aggregates.
 *
 * appointment_update is keyed by the delivery fingerprint, so it gets one row per
 * physical transition. The other three merge onto existing entities.
 */
@Component
@RequiredArgsConstructor
public class AppointmentHandler implements CategoryHandler {

    private static final Set<AppointmentTag> PRIMARY_TIER_EVENTS = EnumSet.of(
            AppointmentTag.SET, AppointmentTag.CURRENT, AppointmentTag.CONFIRMED, AppointmentTag.SHOWN,
            AppointmentTag.SOLD, AppointmentTag.RESCHEDULED, AppointmentTag.UNSOLD);

    private final AppointmentClassifier classifier;

    @Override
    public EventCategory category() {
        return EventCategory.APPOINTMENT;
    }

    @Override
    public ClassifiedEvent classify(Map<String, Object> body) {
        return classifier.classify(body);
    }

    @Override
    public List<Aggregate> reshape(ClassifiedEvent event, DeliveryContext context) {
        AppointmentTag tag = (AppointmentTag) event.getTag();
        Map<String, Object> salesAppointment = event.getPayload();
        long now = context.getArrivalTimestamp();

        Object appointmentId = PayloadPaths.resolve(salesAppointment, "appointment.appointment_id");
        Object dateTime = PayloadPaths.resolve(salesAppointment, "appointment.date_time");
        String status = status(tag, salesAppointment);
        Object scheduledBy = PayloadPaths.resolve(salesAppointment, "dealer_parties.employee_id");
        Object confirmedBy = PayloadPaths.resolve(salesAppointment, "appointment.confirmed_status.dealer_parties.employee_id");
        Object newAppointmentId = PayloadPaths.resolve(salesAppointment,
                "appointment.appointment_status.details.new_appointment_id");
        Object comments = PayloadPaths.resolve(salesAppointment, "appointment.comments");

        Aggregate customer = context.subjectAggregate("customer");
        if (PRIMARY_TIER_EVENTS.contains(tag)) {
            customer.put("primary_tier", 1).put("last_primary_tier_event", now);
        }
        if (tag == AppointmentTag.SET) {
            customer.putIfHasValue("last_appt_scheduled_for", dateTime);
        }
        if (PRIMARY_TIER_EVENTS.contains(tag)) {
            customer.put("last_appt_updated_at", now);
        }

        Aggregate appointment = new Aggregate("appointment", appointmentId)
                .put("dealer_id", context.getTenantId())
                .put("customer_id", context.getSubjectId());
        switch (tag) {
            case SET -> appointment
                    .put("scheduled_at", now)
                    .putIfHasValue("scheduled_for", dateTime)
                    .putIfHasValue("scheduled_by", scheduledBy)
                    .putIfHasValue("status", status)
                    .put("status_updated_at", now)
                    .putIfHasValue("set_via", PayloadPaths.resolve(salesAppointment, "appointment.set_via"))
                    .putIfHasValue("comments", comments);
            case CONFIRMED -> appointment
                    .putIfHasValue("status", status)
                    .put("status_updated_at", now)
                    .put("confirmed_at", now)
                    .putIfHasValue("confirmed_by", confirmedBy);
            case RESCHEDULED -> appointment
                    .putIfHasValue("status", status)
                    .put("status_updated_at", now)
                    .putIfHasValue("new_appointment_id", newAppointmentId);
            default -> appointment
                    .putIfHasValue("status", status)
                    .put("status_updated_at", now);
        }

        Aggregate update = new Aggregate("appointment_update", context.getFingerprint().value())
                .put("websocket_timestamp", now)
                .put("dealer_id", context.getTenantId())
                .put("customer_id", context.getSubjectId())
                .put("appointment_id", appointmentId)
                .put("status", status)
                .putIfHasValue("date_time", tag == AppointmentTag.CONFIRMED ? now : dateTime);
        switch (tag) {
            case SET -> update.putIfHasValue("employee_id", scheduledBy).putIfHasValue("comments", comments);
            case CONFIRMED -> update.putIfHasValue("employee_id", confirmedBy);
            case RESCHEDULED -> update.putIfHasValue("new_appointment_id", newAppointmentId);
            default -> { }
        }

        Aggregate lastActivity = context.subjectAggregate("customer_last_activity");
        switch (tag) {
            case SET -> lastActivity.putIfHasValue("last_appt_scheduled_for", dateTime).put("last_appt_set", now);
            case CURRENT -> lastActivity.put("last_appt_set", now);
            default -> lastActivity.put("last_appt_" + tag.wireValue(), now);
        }

        return List.of(customer, appointment, update, lastActivity);
    }

    /** Confirmed and rescheduled carry their own status; the rest keep the upstream one. */
    static String status(AppointmentTag tag, Map<String, Object> salesAppointment) {
        return switch (tag) {
            case CONFIRMED -> "Confirmed";
            case RESCHEDULED -> "Rescheduled";
            default -> PayloadPaths.string(salesAppointment, "appointment.appointment_status.status");
        };
    }
}
