package com.hookshape.reshape;

import com.hookshape.classifier.AppointmentClassifier;
import com.hookshape.core.Fingerprint;
import com.hookshape.dto.Aggregate;
import com.hookshape.dto.DeliveryContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppointmentHandlerTest {

    private static final long ARRIVAL = 1_718_058_600_000L;
    private static final Fingerprint FINGERPRINT = Fingerprint.fromHex("0123456789abcdef0123456789abcdef");

    private final AppointmentHandler handler = new AppointmentHandler(new AppointmentClassifier());

    private List<Aggregate> reshape(Map<String, Object> salesAppointment) {
        Map<String, Object> body = Map.of("customer_id", "C-100", "dealer_id", "D-7",
                "sales_appointment", salesAppointment);
        DeliveryContext context = DeliveryContext.builder()
                .body(body)
                .tenantId("D-7")
                .subjectId("C-100")
                .arrivalTimestamp(ARRIVAL)
                .fingerprint(FINGERPRINT)
                .build();
        return handler.reshape(handler.classify(body), context);
    }

    @Test
    @DisplayName("A set appointment fills all four aggregates")
    void setAppointment() {
        List<Aggregate> aggregates = reshape(Map.of(
                "dealer_parties", Map.of("employee_id", 5),
                "appointment", Map.of(
                        "appointment_id", "A-1",
                        "date_time", "2024-06-12T15:00:00Z",
                        "comments", "trade-in appraisal",
                        "appointment_status", Map.of("status", "Current"))));

        assertEquals(List.of("customer", "appointment", "appointment_update", "customer_last_activity"),
                aggregates.stream().map(Aggregate::getName).toList());

        Aggregate customer = aggregates.get(0);
        assertEquals(1, customer.get("primary_tier"));
        assertEquals("2024-06-12T15:00:00Z", customer.get("last_appt_scheduled_for"));

        Aggregate appointment = aggregates.get(1);
        assertEquals("A-1", appointment.getId());
        assertEquals(5, appointment.get("scheduled_by"));
        assertEquals(ARRIVAL, appointment.get("scheduled_at"));

        Aggregate update = aggregates.get(2);
        assertEquals(FINGERPRINT.value(), update.getId());
        assertEquals("Current", update.get("status"));
        assertEquals("trade-in appraisal", update.get("comments"));

        assertEquals(ARRIVAL, aggregates.get(3).get("last_appt_set"));
    }

    @Test
    @DisplayName("A confirmation overrides the status and records who confirmed")
    void confirmed() {
        List<Aggregate> aggregates = reshape(Map.of(
                "appointment", Map.of(
                        "appointment_id", "A-1",
                        "confirmed_status", Map.of("confirmed", true, "dealer_parties", Map.of("employee_id", 8)),
                        "appointment_status", Map.of("status", "Current"))));

        Aggregate appointment = aggregates.get(1);
        assertEquals("Confirmed", appointment.get("status"));
        assertEquals(8, appointment.get("confirmed_by"));
        assertEquals(ARRIVAL, aggregates.get(2).get("date_time"));
        assertEquals(ARRIVAL, aggregates.get(3).get("last_appt_confirmed"));
    }

    @Test
    @DisplayName("Missed appointments do not raise the tier")
    void missedHasNoTier() {
        List<Aggregate> aggregates = reshape(Map.of(
                "appointment", Map.of("appointment_id", "A-1", "appointment_status", Map.of("status", "Missed"))));

        assertFalse(aggregates.get(0).has("primary_tier"));
        assertEquals("Missed", aggregates.get(1).get("status"));
        assertEquals(ARRIVAL, aggregates.get(3).get("last_appt_missed"));
    }
}
