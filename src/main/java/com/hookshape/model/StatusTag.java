package com.hookshape.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * disqualified → a status marks the lead as bad or unsubscribed (no primary tier)
 * delivered    → customer status is Delivered (primary tier 1)
 * updated      → any other status change (primary tier 4)
 */
public enum StatusTag implements EventTag {
    DISQUALIFIED("disqualified"),
    DELIVERED("delivered"),
    UPDATED("updated");

    private final String wireValue;

    StatusTag(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
