package com.hookshape.config;

import com.hookshape.model.EventCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Centralizes topic names, payload field names and per-category settings.
 *
 * Bound from application.yml under "hookshape" prefix:
 *   hookshape:
 *     topics:
 *       deliveries: hookshape.deliveries
 *       classified: hookshape.classified
 *       rejected: hookshape.rejected
 *       dlq: hookshape.dlq
 *     fields:
 *       tenant: dealer_id
 *       subject: customer_id
 *       timestamp: timestamp
 *     categories:
 *       appointment:
 *         namespace: promax_dex
 *         include-volatile-timestamp: true
 *
 * include-volatile-timestamp decides which fingerprint identifies a delivery:
 *   false → logical fingerprint, a redelivery collapses onto the same identity
 *   true  → delivery fingerprint, every physical occurrence is distinct
 */
@Component
@ConfigurationProperties(prefix = "hookshape")
@Validated
@Getter
@Setter
public class HookshapeProperties {

    @Valid
    private Topics topics = new Topics();
    @Valid
    private Fields fields = new Fields();
    @Valid
    private Categories categories = new Categories();

    public Category category(EventCategory category) {
        return switch (category) {
            case APPOINTMENT -> categories.getAppointment();
            case COMMUNICATION -> categories.getCommunication();
            case STATUS -> categories.getStatus();
            case NOTIFICATION -> categories.getNotification();
            case SHOWROOM_VISIT -> categories.getShowroomVisit();
            case CUSTOMER -> categories.getCustomer();
        };
    }

    @Getter
    @Setter
    public static class Topics {
        @NotBlank
        private String deliveries = "hookshape.deliveries";
        @NotBlank
        private String classified = "hookshape.classified";
        @NotBlank
        private String rejected = "hookshape.rejected";
        @NotBlank
        private String dlq = "hookshape.dlq";
    }

    @Getter
    @Setter
    public static class Fields {
        @NotBlank
        private String tenant = "dealer_id";
        @NotBlank
        private String subject = "customer_id";
        @NotBlank
        private String timestamp = "timestamp";
    }

    @Getter
    @Setter
    public static class Categories {
        @Valid
        private Category appointment = new Category("promax_websocket.appointments", "1.4", true);
        @Valid
        private Category communication = new Category("promax_websocket.communications", "2.7", false);
        @Valid
        private Category status = new Category("promax_websocket.status", "2.7", false);
        @Valid
        private Category notification = new Category("promax_websocket.notification", "2.7", false);
        @Valid
        private Category showroomVisit = new Category("promax_websocket.showroom_visit", "1.2", false);
        @Valid
        private Category customer = new Category("promax_websocket.customer", "2.7", false);
    }

    @Getter
    @Setter
    public static class Category {
        @NotBlank
        private String namespace = "promax_dex";
        @NotBlank
        private String eventName;
        private String schemaVersion;
        private boolean includeVolatileTimestamp;

        public Category() {
        }

        public Category(String eventName, String schemaVersion, boolean includeVolatileTimestamp) {
            this.eventName = eventName;
            this.schemaVersion = schemaVersion;
            this.includeVolatileTimestamp = includeVolatileTimestamp;
        }
    }
}
