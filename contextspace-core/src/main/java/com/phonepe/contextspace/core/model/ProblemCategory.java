package com.phonepe.contextspace.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Broad classification of a user problem
 */
public enum ProblemCategory {
    DELIVERY,
    PAYMENT,
    REFUND,
    TECHNICAL,
    ACCOUNT,
    PRODUCT_QUALITY,
    BILLING,
    OTHER,
    ;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
