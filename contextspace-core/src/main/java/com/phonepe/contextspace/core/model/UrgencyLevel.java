package com.phonepe.contextspace.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

/**
 * Coarse urgency bucket. Rank increases with urgency.
 */
@Getter
@AllArgsConstructor
public enum UrgencyLevel {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4),
    ;

    private final int rank;

    public boolean atLeast(UrgencyLevel other) {
        return rank >= other.rank;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
