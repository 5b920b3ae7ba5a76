package com.phonepe.contextspace.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The backing stores, used to tag failures
 */
@Getter
@AllArgsConstructor
public enum StoreType {
    SESSION_CACHE("session cache"),
    SHORT_TERM_VECTORS("short term vector index"),
    LONG_TERM_MEMORY("long term memory"),
    IDENTITY_MAP("identity map"),
    ESCALATIONS("escalation tickets"),
    ;

    private final String displayName;
}
