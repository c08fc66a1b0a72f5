package com.hookshape.core;

import com.hookshape.config.HookshapeProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintGeneratorTest {

    private static final String NAMESPACE = "promax_dex";

    private final FingerprintGenerator generator =
            new FingerprintGenerator(new CanonicalEncoder(), new HookshapeProperties());

    private static Map<String, Object> delivery(long timestamp) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("customer_id", "C-100");
        body.put("dealer_id", "D-7");
        body.put("timestamp", timestamp);
        body.put("customer_status", Map.of("customer_status", "Delivered", "customer_status_id", 12));
        return body;
    }

    @Test
    @DisplayName("MD5 of the input, grouped 8-4-4-4-12")
    void hashFormat() {
        assertEquals("d41d8cd9-8f00-b204-e980-0998ecf8427e", generator.hash("").value());
        assertTrue(generator.fingerprint(delivery(1L), NAMESPACE, false).value()
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }

    @Test
    @DisplayName("The hash input is namespace:canonical-form")
    void hashInput() {
        Map<String, Object> body = Map.of("b", 2, "a", 1);

        assertEquals(generator.hash(NAMESPACE + ":{\"a\":1,\"b\":2}"),
                generator.fingerprint(body, NAMESPACE, true));
    }

    @Nested
    @DisplayName("Logical fingerprint (timestamp excluded)")
    class Logical {

        @Test
        @DisplayName("Redeliveries that differ only in timestamp collapse onto one fingerprint")
        void stableAcrossRedelivery() {
            assertEquals(
                    generator.fingerprint(delivery(1_718_000_000_000L), NAMESPACE, false),
                    generator.fingerprint(delivery(1_718_000_999_999L), NAMESPACE, false));
        }

        @Test
        @DisplayName("Key order and array order do not matter")
        void orderInsensitive() {
            Map<String, Object> first = new LinkedHashMap<>();
            first.put("x", List.of(1, 2, 3));
            first.put("y", "v");
            Map<String, Object> second = new LinkedHashMap<>();
            second.put("y", "v");
            second.put("x", List.of(3, 2, 1));

            assertEquals(generator.fingerprint(first, NAMESPACE, false),
                    generator.fingerprint(second, NAMESPACE, false));
        }

        @Test
        @DisplayName("Only the top-level timestamp is stripped")
        void nestedTimestampCounts() {
            Map<String, Object> first = Map.of("nested", Map.of("timestamp", 1));
            Map<String, Object> second = Map.of("nested", Map.of("timestamp", 2));

            assertNotEquals(generator.fingerprint(first, NAMESPACE, false),
                    generator.fingerprint(second, NAMESPACE, false));
        }

        @Test
        @DisplayName("The caller's map is not modified")
        void inputUntouched() {
            Map<String, Object> body = delivery(42L);

            generator.fingerprint(body, NAMESPACE, false);

            assertEquals(42L, body.get("timestamp"));
        }
    }

    @Nested
    @DisplayName("Delivery fingerprint (timestamp included)")
    class PerDelivery {

        @Test
        @DisplayName("A different timestamp gives a different fingerprint")
        void sensitiveToTimestamp() {
            assertNotEquals(
                    generator.fingerprint(delivery(1_718_000_000_000L), NAMESPACE, true),
                    generator.fingerprint(delivery(1_718_000_000_001L), NAMESPACE, true));
        }

        @Test
        @DisplayName("The same delivery always gives the same fingerprint")
        void deterministic() {
            assertEquals(
                    generator.fingerprint(delivery(5L), NAMESPACE, true),
                    generator.fingerprint(delivery(5L), NAMESPACE, true));
        }
    }

    @Test
    @DisplayName("The namespace separates otherwise identical bodies")
    void namespaceMatters() {
        assertNotEquals(generator.fingerprint(delivery(1L), "promax_dex", false),
                generator.fingerprint(delivery(1L), "other", false));
    }
}
