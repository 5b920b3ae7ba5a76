package com.phonepe.contextspace.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of an escalation ticket. Tickets only ever move forward.
 */
@Getter
@AllArgsConstructor
public enum EscalationStatus {
    PENDING(1),
    ASSIGNED(2),
    IN_PROGRESS(3),
    RESOLVED(4),
    ;

    public static final Set<EscalationStatus> OPEN = EnumSet.of(PENDING, ASSIGNED, IN_PROGRESS);

    private final int rank;

    public boolean canMoveTo(EscalationStatus next) {
        return next.rank > rank;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
