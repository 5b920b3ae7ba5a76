package com.phonepe.contextspace.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Who authored a message
 */
public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM,
    ;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
