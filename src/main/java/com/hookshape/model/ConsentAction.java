package com.hookshape.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** SMS consent signal detected in a message body. */
public enum ConsentAction implements EventTag {
    OPT_IN_REQUEST("opt_in_request"),
    OPT_OUT("opt_out"),
    OPT_IN_REPLY_POSSIBLE("opt_in_reply_possible"),
    OPT_IN_POSSIBLE("opt_in_possible"),
    OPT_OUT_POSSIBLE("opt_out_possible"),
    HELP("help");

    private final String wireValue;

    ConsentAction(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
