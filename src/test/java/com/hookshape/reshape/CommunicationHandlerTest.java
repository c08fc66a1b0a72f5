package com.hookshape.reshape;

import com.hookshape.classifier.CallDispositionClassifier;
import com.hookshape.classifier.CommunicationClassifier;
import com.hookshape.classifier.ConsentActionClassifier;
import com.hookshape.core.Fingerprint;
import com.hookshape.dto.Aggregate;
import com.hookshape.dto.DeliveryContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommunicationHandlerTest {

    private static final long ARRIVAL = 1_718_058_600_000L;
    private static final String OCCURRED = "2024-06-10T22:29:00Z";

    private final CommunicationHandler handler = new CommunicationHandler(
            new CommunicationClassifier(), new CallDispositionClassifier(), new ConsentActionClassifier());

    private List<Aggregate> reshape(String type, String direction, String text) {
        Map<String, Object> message = new HashMap<>();
        message.put("type", type);
        message.put("direction", direction);
        message.put("body", text);
        message.put("date_time", OCCURRED);
        Map<String, Object> body = Map.of("customer_id", "C-100", "dealer_id", "D-7",
                "communications", Map.of("employee_id", 42, "messages", List.of(message)));
        DeliveryContext context = DeliveryContext.builder()
                .body(body)
                .tenantId("D-7")
                .subjectId("C-100")
                .arrivalTimestamp(ARRIVAL)
                .fingerprint(Fingerprint.fromHex("0123456789abcdef0123456789abcdef"))
                .build();
        return handler.reshape(handler.classify(body), context);
    }

    @Nested
    @DisplayName("Texts")
    class Texts {

        @Test
        @DisplayName("An inbound text is tier 2 and records the consent action")
        void inboundText() {
            List<Aggregate> aggregates = reshape("Text", "Incoming", "Yes");

            Aggregate customer = aggregates.get(0);
            assertEquals(2, customer.get("primary_tier"));
            assertEquals(OCCURRED, customer.get("last_ib_sms"));

            Aggregate communication = aggregates.get(1);
            assertEquals("inbound", communication.get("direction"));
            assertEquals("opt_in_reply_possible", communication.get("consent_action"));
            assertEquals(42, communication.get("employee_id"));

            assertEquals(ARRIVAL, aggregates.get(2).get("last_ib_sms"));
        }

        @Test
        @DisplayName("An inbound STOP does not raise the tier")
        void optOutSuppressesTier() {
            Aggregate customer = reshape("Text", "Incoming", "STOP").get(0);

            assertFalse(customer.has("primary_tier"));
        }

        @Test
        @DisplayName("An outbound text is tier 3")
        void outboundText() {
            Aggregate customer = reshape("Text", "Outgoing", "See you at 5").get(0);

            assertEquals(3, customer.get("primary_tier"));
            assertEquals(OCCURRED, customer.get("last_ob_sms"));
        }
    }

    @Test
    @DisplayName("A call carries the disposition read from its note")
    void callDisposition() {
        Aggregate communication = reshape("Phone", "Outgoing", "couldn't leave a vm").get(1);

        assertEquals("no_answer", communication.get("disposition"));
    }

    @Test
    @DisplayName("A call recording note is parsed from its key-value lines")
    void callRecordingNote() {
        List<Aggregate> aggregates = reshape("Note", "Outgoing",
                "DurationSeconds: 95\nCallDnaClassification: Voicemail\nCallAudioURL: https://rec.example/1");

        Aggregate communication = aggregates.get(1);
        assertEquals(95, communication.get("talk_time"));
        assertEquals("voicemail", communication.get("disposition"));
        assertEquals("https://rec.example/1", communication.get("recording_link"));
        assertFalse(communication.has("employee_id"));
        assertEquals(ARRIVAL, aggregates.get(2).get("last_call_recording_note"));
    }

    @Test
    @DisplayName("A lead note keeps the original message and records the lead event")
    void leadNote() {
        List<Aggregate> aggregates = reshape("Lead", null,
                "Lead Event: web_form\nSource: site\nOriginal Message: Is the truck available?");

        assertEquals(1, aggregates.get(0).get("primary_tier"));
        assertEquals("Is the truck available?", aggregates.get(1).get("body"));
        assertEquals(ARRIVAL, aggregates.get(2).get("last_lead_web_form"));
    }

    @Test
    @DisplayName("Direction is normalized to inbound and outbound")
    void direction() {
        assertEquals("outbound", CommunicationHandler.direction(" Outgoing "));
        assertEquals("inbound", CommunicationHandler.direction("incoming"));
        assertNull(CommunicationHandler.direction("sideways"));
        assertNull(CommunicationHandler.direction(null));
    }
}
