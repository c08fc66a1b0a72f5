package com.hookshape.core;

import com.hookshape.config.HookshapeProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic identity for a delivery.
 *
 * HOW IT WORKS:
 *   1. Optionally drop the top-level arrival timestamp
 *   2. Canonicalize the rest (keys sorted, arrays order-insensitive)
 *   3. MD5 over "namespace:canonical"
 *   4. Print the 128 bits as 8-4-4-4-12 hex groups
 *
 * includeVolatileTimestamp = false → logical fingerprint, equal for every redelivery
 * includeVolatileTimestamp = true  → delivery fingerprint, unique per physical delivery
 *
 * MD5 is used for dedup identity only, not for integrity or authentication.
 */
@Component
public class FingerprintGenerator {

    private static final String SEPARATOR = ":";

    private final CanonicalEncoder encoder;
    private final String timestampField;

    public FingerprintGenerator(CanonicalEncoder encoder, HookshapeProperties properties) {
        this.encoder = encoder;
        this.timestampField = properties.getFields().getTimestamp();
        newDigest();
    }

    public Fingerprint fingerprint(Map<String, ?> raw, String namespace, boolean includeVolatileTimestamp) {
        Map<String, Object> hashed = new LinkedHashMap<>();
        if (raw != null) {
            hashed.putAll(raw);
        }
        if (!includeVolatileTimestamp) {
            hashed.remove(timestampField);
        }
        String canonical = encoder.canonicalize(raw == null ? null : hashed);
        return hash(namespace + SEPARATOR + canonical);
    }

    /** Fingerprint of an already-built string, e.g. a composite external id. */
    public Fingerprint hash(String input) {
        byte[] digest = newDigest().digest(input.getBytes(StandardCharsets.UTF_8));
        return Fingerprint.fromHex(HexFormat.of().formatHex(digest));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available on this JVM", e);
        }
    }
}
