package com.phonepe.contextspace.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

@Getter
@AllArgsConstructor
public enum EscalationPriority {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    URGENT(4),
    ;

    private final int rank;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
