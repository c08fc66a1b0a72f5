package com.hookshape.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Outcome of a phone call, resolved from the rep's free-text note. */
public enum CallDisposition implements EventTag {
    VOICEMAIL("voicemail"),
    NO_ANSWER("no_answer"),
    HUNG_UP("hung_up"),
    NOT_INTERESTED("not_interested"),
    DISCONNECTED("disconnected"),
    WRONG_NUMBER("wrong_number"),
    BUSY("busy"),
    NO_NOTE("no_note"),
    UNKNOWN("unknown");

    private final String wireValue;

    CallDisposition(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** Case-insensitive lookup of an upstream classification label. */
    public static Optional<CallDisposition> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(d -> d.wireValue.equals(candidate)).findFirst();
    }
}
