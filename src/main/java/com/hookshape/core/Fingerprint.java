package com.hookshape.core;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

/**
 * Content hash of a delivery, printed as 8-4-4-4-12 hex groups.
 * UUID-shaped for presentation only; it carries no version or variant bits.
 */
@EqualsAndHashCode
public final class Fingerprint {

    private final String value;

    private Fingerprint(String value) {
        this.value = value;
    }

    /** Groups 32 hex digits as 8-4-4-4-12. */
    public static Fingerprint fromHex(String hex) {
        if (hex == null || hex.length() != 32) {
            throw new IllegalArgumentException("Expected 32 hex digits, got: " + hex);
        }
        return new Fingerprint(String.join("-",
                hex.substring(0, 8),
                hex.substring(8, 12),
                hex.substring(12, 16),
                hex.substring(16, 20),
                hex.substring(20, 32)));
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
