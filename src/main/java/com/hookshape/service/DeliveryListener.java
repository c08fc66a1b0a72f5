package com.hookshape.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookshape.dto.RawDelivery;
import com.hookshape.model.EventCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Kafka consumer for delivery envelopes on "hookshape.deliveries".
 *
 * FLOW:
 *   upstream relay publishes {category, deliveryId, body} → hookshape.deliveries
 *                                       ↓
 *                               DeliveryListener reads it
 *                                       ↓
 *                 JSON → RawDelivery, category string → EventCategory
 *                                       ↓
 *                        DeliveryProcessor.handle() → outcome topics
 *
 * Envelopes that cannot be parsed or name an unknown category go to the DLQ raw.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeliveryListener {

    private final DeliveryProcessor processor;
    private final OutcomePublisher publisher;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = "${hookshape.topics.deliveries:hookshape.deliveries}", groupId = "hookshape-ingest")
    public void onDelivery(String message) {
        try {
            RawDelivery delivery = objectMapper.readValue(message, RawDelivery.class);
            Optional<EventCategory> category = EventCategory.fromPath(delivery.getCategory());
            if (category.isEmpty()) {
                log.warn("Unknown delivery category: {}", delivery.getCategory());
                publisher.publishRaw(message, "Unknown category: " + delivery.getCategory());
                return;
            }
            processor.handle(category.get(), delivery);
        } catch (Exception e) {
            log.error("Failed to process delivery message: {}", e.getMessage(), e);
            publisher.publishRaw(message, e.getMessage());
        }
    }
}
