package com.hookshape.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Message kinds carried by a communications delivery. */
public enum CommunicationTag implements EventTag {
    TEXT("text"),
    CALL("call"),
    EMAIL("email"),
    USER_NOTE("user_note"),
    CALL_RECORDING_NOTE("call_recording_note"),
    LEAD_NOTE("lead_note");

    private final String wireValue;

    CommunicationTag(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
