package com.hookshape.classifier;

import com.hookshape.core.PayloadPaths;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.model.AppointmentTag;
import com.hookshape.model.RejectionReason;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.hookshape.core.EmptinessNormalizer.hasValue;

/**
 * Decides which appointment transition a delivery describes.
 *
 * Input is the "sales_appointment" object. Priority:
 *   1. confirmed_status.confirmed == true                        → confirmed
 *   2. status "Current" + date_time + (dealer_parties
 *      or date_time on a quarter hour)                           → set
 *   3. status "Reschedule" + details.new_appointment_id          → rescheduled
 *   4. plain status mapping (Current, Missed, Shown, ...)        → that status
 * No match → rejected as an unrecognized status.
 */
@Component
public class AppointmentClassifier {

    public static final String SALES_APPOINTMENT = "sales_appointment";

    private static final Map<String, AppointmentTag> STATUS_TAGS = new LinkedHashMap<>();

    static {
        STATUS_TAGS.put("Current", AppointmentTag.CURRENT);
        STATUS_TAGS.put("Missed", AppointmentTag.MISSED);
        STATUS_TAGS.put("Shown", AppointmentTag.SHOWN);
        STATUS_TAGS.put("Sold", AppointmentTag.SOLD);
        STATUS_TAGS.put("Unsold", AppointmentTag.UNSOLD);
        STATUS_TAGS.put("Cancelled", AppointmentTag.CANCELLED);
        STATUS_TAGS.put("Deleted", AppointmentTag.DELETED);
    }

    private final ClassificationCascade<Map<String, Object>, AppointmentTag> cascade = buildCascade();

    public ClassifiedEvent classify(Map<String, Object> body) {
        Map<String, Object> salesAppointment = PayloadPaths.object(body, SALES_APPOINTMENT);
        if (salesAppointment == null) {
            throw new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_SHAPE,
                    "missing required sales_appointment object");
        }
        if (PayloadPaths.object(salesAppointment, "appointment") == null) {
            throw new DeliveryRejectedException(RejectionReason.MISSING_REQUIRED_FIELD,
                    "missing appointment object");
        }
        if (PayloadPaths.object(salesAppointment, "appointment.appointment_status") == null) {
            throw new DeliveryRejectedException(RejectionReason.MISSING_REQUIRED_FIELD,
                    "missing appointment.appointment_status");
        }
        if (PayloadPaths.resolve(salesAppointment, "appointment.appointment_id") == null) {
            throw new DeliveryRejectedException(RejectionReason.MISSING_REQUIRED_FIELD,
                    "missing appointment_id");
        }

        AppointmentTag tag = cascade.classify(salesAppointment)
                .orElseThrow(() -> new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_ENUM_VALUE,
                        "unsupported appointment status \"" + status(salesAppointment) + "\""));
        return ClassifiedEvent.of(tag, salesAppointment);
    }

    public ClassificationCascade<Map<String, Object>, AppointmentTag> getCascade() {
        return cascade;
    }

    private static ClassificationCascade<Map<String, Object>, AppointmentTag> buildCascade() {
        List<ClassificationRule<Map<String, Object>, AppointmentTag>> rules = new ArrayList<>();

        rules.add(ClassificationRule.of("confirmed flag",
                sa -> PayloadPaths.isTrue(sa, "appointment.confirmed_status.confirmed"),
                AppointmentTag.CONFIRMED));

        rules.add(ClassificationRule.of("current with scheduled time",
                sa -> {
                    Object dateTime = PayloadPaths.resolve(sa, "appointment.date_time");
                    return "Current".equals(status(sa))
                            && hasValue(dateTime)
                            && (hasValue(PayloadPaths.resolve(sa, "dealer_parties"))
                                || QuarterHour.isOnBoundary(dateTime));
                },
                AppointmentTag.SET));

        rules.add(ClassificationRule.of("reschedule with new appointment",
                sa -> "Reschedule".equals(status(sa))
                        && hasValue(PayloadPaths.resolve(sa, "appointment.appointment_status.details.new_appointment_id")),
                AppointmentTag.RESCHEDULED));

        STATUS_TAGS.forEach((status, tag) -> rules.add(ClassificationRule.of("status " + status,
                sa -> status.equals(status(sa)), tag)));

        return new ClassificationCascade<>(rules);
    }

    private static String status(Map<String, Object> salesAppointment) {
        return PayloadPaths.string(salesAppointment, "appointment.appointment_status.status");
    }
}
