package com.hookshape.controller;

import com.hookshape.dto.ProcessingOutcome;
import com.hookshape.dto.RawDelivery;
import com.hookshape.model.EventCategory;
import com.hookshape.model.OutcomeStatus;
import com.hookshape.service.DeliveryProcessor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

/**
 * HTTP ingress for webhook deliveries (alternative to the Kafka envelope topic).
 *
 * POST /api/webhooks/appointments
 * Idempotency-Key: 9b0e7d...
 * {
 *   "customer_id": "C-100",
 *   "dealer_id": "D-7",
 *   "timestamp": 1718000000000,
 *   "sales_appointment": { ... }
 * }
 *
 *   202 → classified or degraded (the outcome body says which)
 *   422 → rejected
 *   404 → unknown category
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private final DeliveryProcessor processor;

    @PostMapping("/{category}")
    public ResponseEntity<ProcessingOutcome> receive(
            @PathVariable String category,
            @RequestHeader(value = IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @RequestBody Map<String, Object> body) {
        Optional<EventCategory> resolved = EventCategory.fromPath(category);
        if (resolved.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        RawDelivery delivery = RawDelivery.builder()
                .category(resolved.get().path())
                .deliveryId(idempotencyKey)
                .body(body)
                .build();
        ProcessingOutcome outcome = processor.handle(resolved.get(), delivery);
        HttpStatus status = outcome.getStatus() == OutcomeStatus.REJECTED
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(outcome);
    }
}
