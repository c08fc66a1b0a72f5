package com.hookshape.classifier;

import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.model.AppointmentTag;
import com.hookshape.model.RejectionReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppointmentClassifierTest {

    private final AppointmentClassifier classifier = new AppointmentClassifier();

    private static Map<String, Object> appointment(String status, Object dateTime) {
        Map<String, Object> appointmentStatus = new HashMap<>();
        appointmentStatus.put("status", status);
        Map<String, Object> appointment = new HashMap<>();
        appointment.put("appointment_id", "A-1");
        appointment.put("appointment_status", appointmentStatus);
        appointment.put("date_time", dateTime);
        Map<String, Object> salesAppointment = new HashMap<>();
        salesAppointment.put("appointment", appointment);
        Map<String, Object> body = new HashMap<>();
        body.put("customer_id", "C-100");
        body.put("dealer_id", "D-7");
        body.put("sales_appointment", salesAppointment);
        return body;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> inner(Map<String, Object> body, String key) {
        Map<String, Object> salesAppointment = (Map<String, Object>) body.get("sales_appointment");
        if (key.equals("sales_appointment")) {
            return salesAppointment;
        }
        Map<String, Object> appointment = (Map<String, Object>) salesAppointment.get("appointment");
        if (key.equals("appointment")) {
            return appointment;
        }
        return (Map<String, Object>) appointment.get(key);
    }

    private AppointmentTag tagOf(Map<String, Object> body) {
        return (AppointmentTag) classifier.classify(body).getTag();
    }

    @Nested
    @DisplayName("Priority")
    class Priority {

        @Test
        @DisplayName("Confirmed beats set when both predicates hold")
        void confirmedBeatsSet() {
            Map<String, Object> body = appointment("Current", "2024-06-10T22:30:00Z");
            inner(body, "sales_appointment").put("dealer_parties", Map.of("employee_id", 5));
            inner(body, "appointment").put("confirmed_status", Map.of("confirmed", true));

            assertEquals(AppointmentTag.CONFIRMED, tagOf(body));
        }

        @Test
        @DisplayName("confirmed must be the boolean true")
        void confirmedMustBeBoolean() {
            Map<String, Object> body = appointment("Missed", null);
            inner(body, "appointment").put("confirmed_status", Map.of("confirmed", "true"));

            assertEquals(AppointmentTag.MISSED, tagOf(body));
        }

        @Test
        @DisplayName("Current + date_time + dealer_parties is set, whatever the minute")
        void setWithDealerParties() {
            Map<String, Object> body = appointment("Current", "2024-06-10T22:31:00Z");
            inner(body, "sales_appointment").put("dealer_parties", Map.of("employee_id", 5));

            assertEquals(AppointmentTag.SET, tagOf(body));
        }

        @Test
        @DisplayName("Current without date_time is plain current")
        void currentWithoutDateTime() {
            Map<String, Object> body = appointment("Current", "");
            inner(body, "sales_appointment").put("dealer_parties", Map.of("employee_id", 5));

            assertEquals(AppointmentTag.CURRENT, tagOf(body));
        }

        @Test
        @DisplayName("Reschedule with a new appointment id is rescheduled")
        void rescheduled() {
            Map<String, Object> body = appointment("Reschedule", null);
            inner(body, "appointment_status").put("details", Map.of("new_appointment_id", "A-2"));

            assertEquals(AppointmentTag.RESCHEDULED, tagOf(body));
        }

        @Test
        @DisplayName("Plain statuses map one to one")
        void statusMapping() {
            assertEquals(AppointmentTag.MISSED, tagOf(appointment("Missed", null)));
            assertEquals(AppointmentTag.SHOWN, tagOf(appointment("Shown", null)));
            assertEquals(AppointmentTag.SOLD, tagOf(appointment("Sold", null)));
            assertEquals(AppointmentTag.UNSOLD, tagOf(appointment("Unsold", null)));
            assertEquals(AppointmentTag.CANCELLED, tagOf(appointment("Cancelled", null)));
            assertEquals(AppointmentTag.DELETED, tagOf(appointment("Deleted", null)));
        }

        @Test
        @DisplayName("The cascade exposes its priority order")
        void ruleOrder() {
            List<ClassificationRule<Map<String, Object>, AppointmentTag>> rules = classifier.getCascade().getRules();
            assertEquals(AppointmentTag.CONFIRMED, rules.get(0).getTag());
            assertEquals(AppointmentTag.SET, rules.get(1).getTag());
            assertEquals(AppointmentTag.RESCHEDULED, rules.get(2).getTag());
        }
    }

    @Nested
    @DisplayName("Quarter-hour heuristic")
    class QuarterHourBoundary {

        @Test
        @DisplayName("22:30 UTC without dealer_parties is set")
        void onBoundary() {
            assertEquals(AppointmentTag.SET, tagOf(appointment("Current", "2024-06-10T22:30:00Z")));
        }

        @Test
        @DisplayName("22:31 UTC without dealer_parties falls through to current")
        void offBoundary() {
            assertEquals(AppointmentTag.CURRENT, tagOf(appointment("Current", "2024-06-10T22:31:00Z")));
        }

        @Test
        @DisplayName("The minute is read in UTC, not the local offset")
        void utcMinute() {
            // 22:40 at +05:45 is 16:55 UTC
            assertEquals(AppointmentTag.CURRENT, tagOf(appointment("Current", "2024-06-10T22:40:00+05:45")));
            // 22:45 at +05:45 is 17:00 UTC
            assertEquals(AppointmentTag.SET, tagOf(appointment("Current", "2024-06-10T22:45:00+05:45")));
        }

        @Test
        @DisplayName("Epoch millis and local date-times are accepted")
        void otherFormats() {
            assertEquals(AppointmentTag.SET, tagOf(appointment("Current", 1_718_058_600_000L)));
            assertEquals(AppointmentTag.CURRENT, tagOf(appointment("Current", 1_718_058_660_000L)));
            assertEquals(AppointmentTag.SET, tagOf(appointment("Current", "2024-06-10T22:15:00")));
        }

        @Test
        @DisplayName("An unparseable date_time is never on a boundary")
        void unparseable() {
            assertEquals(AppointmentTag.CURRENT, tagOf(appointment("Current", "next tuesday")));
        }
    }

    @Nested
    @DisplayName("Rejection")
    class Rejection {

        @Test
        @DisplayName("An unknown status is rejected, never defaulted")
        void unknownStatus() {
            DeliveryRejectedException e = assertThrows(DeliveryRejectedException.class,
                    () -> classifier.classify(appointment("Pending", null)));

            assertEquals(RejectionReason.UNRECOGNIZED_ENUM_VALUE, e.getReason());
            assertTrue(e.getMessage().contains("Pending"));
        }

        @Test
        @DisplayName("Reschedule without a new appointment id is rejected")
        void rescheduleWithoutTarget() {
            DeliveryRejectedException e = assertThrows(DeliveryRejectedException.class,
                    () -> classifier.classify(appointment("Reschedule", null)));

            assertEquals(RejectionReason.UNRECOGNIZED_ENUM_VALUE, e.getReason());
        }

        @Test
        @DisplayName("A body without sales_appointment has the wrong shape")
        void wrongShape() {
            DeliveryRejectedException e = assertThrows(DeliveryRejectedException.class,
                    () -> classifier.classify(Map.of("customer_id", "C-100")));

            assertEquals(RejectionReason.UNRECOGNIZED_SHAPE, e.getReason());
        }

        @Test
        @DisplayName("A missing appointment_id is a missing required field")
        void missingAppointmentId() {
            Map<String, Object> body = appointment("Missed", null);
            inner(body, "appointment").put("appointment_id", "null");

            DeliveryRejectedException e = assertThrows(DeliveryRejectedException.class,
                    () -> classifier.classify(body));

            assertEquals(RejectionReason.MISSING_REQUIRED_FIELD, e.getReason());
        }
    }

    @Test
    @DisplayName("The classified payload is the sales_appointment object")
    void payload() {
        Map<String, Object> body = appointment("Sold", null);

        ClassifiedEvent event = classifier.classify(body);

        assertSame(inner(body, "sales_appointment"), event.getPayload());
    }
}
