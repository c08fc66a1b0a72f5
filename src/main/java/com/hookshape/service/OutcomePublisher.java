package com.hookshape.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookshape.config.HookshapeProperties;
import com.hookshape.dto.ProcessingOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends processing outcomes downstream.
 *
 *   CLASSIFIED → hookshape.classified, keyed by fingerprint
 *   REJECTED   → hookshape.rejected, keyed by delivery id
 *   DEGRADED   → hookshape.dlq, keyed by the error fingerprint
 *
 * Publication failures are logged and never change the outcome already computed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutcomePublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final HookshapeProperties properties;
    private final Clock clock;

    public void publish(ProcessingOutcome outcome) {
        HookshapeProperties.Topics topics = properties.getTopics();
        String topic;
        String key;
        switch (outcome.getStatus()) {
            case CLASSIFIED -> {
                topic = topics.getClassified();
                key = outcome.getFingerprint();
            }
            case REJECTED -> {
                topic = topics.getRejected();
                key = outcome.getDeliveryId();
            }
            default -> {
                topic = topics.getDlq();
                key = outcome.getFingerprint();
            }
        }
        try {
            String message = objectMapper.writeValueAsString(outcome);
            kafkaTemplate.send(topic, key, message);
            log.debug("Outcome published: topic={}, key={}, status={}", topic, key, outcome.getStatus());
        } catch (Exception e) {
            log.error("Failed to publish outcome: topic={}, key={}, error={}", topic, key, e.getMessage(), e);
        }
    }

    /** For messages that never became a delivery (unparseable envelope, unknown category). */
    public void publishRaw(String rawMessage, String errorMessage) {
        try {
            Map<String, Object> dlqMessage = new LinkedHashMap<>();
            dlqMessage.put("raw_message", rawMessage);
            dlqMessage.put("error", errorMessage);
            dlqMessage.put("timestamp", clock.millis());

            kafkaTemplate.send(properties.getTopics().getDlq(), objectMapper.writeValueAsString(dlqMessage));
            log.info("Unprocessable message sent to DLQ: error={}", errorMessage);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to send raw message to DLQ: {}", e.getMessage(), e);
        }
    }
}
