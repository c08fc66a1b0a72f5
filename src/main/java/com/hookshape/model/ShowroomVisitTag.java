package com.hookshape.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ShowroomVisitTag implements EventTag {
    NEW_VISIT("new_visit"),
    EXIT_NOTE("exit_note"),
    DELETE("delete");

    private final String wireValue;

    ShowroomVisitTag(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
