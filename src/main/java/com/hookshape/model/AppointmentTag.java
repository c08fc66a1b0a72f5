package com.hookshape.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Appointment lifecycle transitions. */
public enum AppointmentTag implements EventTag {
    SET("set"),
    CONFIRMED("confirmed"),
    CURRENT("current"),
    MISSED("missed"),
    SHOWN("shown"),
    SOLD("sold"),
    UNSOLD("unsold"),
    CANCELLED("cancelled"),
    RESCHEDULED("rescheduled"),
    DELETED("deleted");

    private final String wireValue;

    AppointmentTag(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
