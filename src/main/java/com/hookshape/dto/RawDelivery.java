package com.hookshape.dto;

import lombok.*;

import java.util.Map;

/**
 * One inbound webhook delivery, as received.
 *
 * Example JSON (Kafka envelope):
 * {
 *   "category": "appointments",
 *   "deliveryId": "9b0e7d...",
 *   "body": {
 *     "customer_id": "C-100",
 *     "dealer_id": "D-7",
 *     "timestamp": 1718000000000,
 *     "sales_appointment": { ... }
 *   }
 * }
 *
 * - category:   which event family the body belongs to (see EventCategory)
 * - deliveryId: transport-level idempotency key, carried through untouched
 * - body:       the opaque upstream payload
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RawDelivery {

    private String category;
    private String deliveryId;
    private Map<String, Object> body;
}
