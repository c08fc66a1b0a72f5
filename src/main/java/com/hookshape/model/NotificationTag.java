package com.hookshape.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lead notification kinds, keyed by the upstream numeric code (1000-1015).
 */
public enum NotificationTag implements EventTag {
    GENERIC(1000, "generic"),
    OTHER(1001, "other"),
    MERGE(1002, "merge"),
    TRANSFER(1003, "transfer"),
    DELETE(1004, "delete"),
    LICENSE(1005, "license"),
    CREDIT_APP(1006, "credit_app"),
    TRANSUNION(1007, "transunion"),
    ROUTEONE(1008, "routeone"),
    PROPOSAL(1009, "proposal"),
    FORMS(1010, "forms"),
    CAC(1011, "cac"),
    DEALERTRACK(1012, "dealertrack"),
    CUDL(1013, "cudl"),
    EQUIFAX(1014, "equifax"),
    EXPERIAN(1015, "experian");

    private final int code;
    private final String wireValue;

    NotificationTag(int code, String wireValue) {
        this.code = code;
        this.wireValue = wireValue;
    }

    public int code() {
        return code;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
