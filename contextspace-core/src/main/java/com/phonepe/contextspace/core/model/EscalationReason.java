package com.phonepe.contextspace.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EscalationReason {
    AGENT_CANNOT_SOLVE,
    CRITICAL_PROBLEM,
    REPEATED_ISSUE,
    USER_REQUEST,
    ;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
