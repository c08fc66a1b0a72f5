package com.hookshape.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The upstream event families. Each one has its own classifier, reshaping rules
 * and fingerprint policy.
 */
public enum EventCategory {
    APPOINTMENT("appointments"),
    COMMUNICATION("communications"),
    STATUS("status"),
    NOTIFICATION("notifications"),
    SHOWROOM_VISIT("showroom-visits"),
    CUSTOMER("customer");

    private final String path;

    EventCategory(String path) {
        this.path = path;
    }

    /** URL segment and Kafka envelope value for this category. */
    public String path() {
        return path;
    }

    public static Optional<EventCategory> fromPath(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.trim();
        return Arrays.stream(values())
                .filter(c -> c.path.equalsIgnoreCase(candidate) || c.name().equalsIgnoreCase(candidate))
                .findFirst();
    }
}
