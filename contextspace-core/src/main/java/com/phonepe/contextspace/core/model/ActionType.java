package com.phonepe.contextspace.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActionType {
    PROVIDE_INFO,
    CHECK_STATUS,
    UPDATE_ACCOUNT,
    PROCESS_REFUND,
    ESCALATE,
    FOLLOW_UP,
    APOLOGIZE,
    OFFER_COMPENSATION,
    UPDATE_ORDER,
    CANCEL_ORDER,
    ;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
