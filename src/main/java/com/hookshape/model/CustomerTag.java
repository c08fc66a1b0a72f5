package com.hookshape.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CustomerTag implements EventTag {
    PROFILE_UPDATE("profile_update");

    private final String wireValue;

    CustomerTag(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
