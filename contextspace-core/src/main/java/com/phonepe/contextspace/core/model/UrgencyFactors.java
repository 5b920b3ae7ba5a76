package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Individual urgency signals, each in [0,1]
 */
@Value
@Builder
@Jacksonized
public class UrgencyFactors {
    double frustration;
    double repetition;
    double timeSensitivity;
    double escalationKeywords;
}
