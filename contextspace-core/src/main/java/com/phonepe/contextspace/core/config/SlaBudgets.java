package com.phonepe.contextspace.core.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Latency targets per store operation. Used for alerting only.
 */
@Value
@Builder
public class SlaBudgets {
    public static final SlaBudgets DEFAULT = SlaBudgets.builder().build();

    @Builder.Default
    Duration sessionCache = Duration.ofMillis(5);

    @Builder.Default
    Duration shortTermVectorWrite = Duration.ofMillis(5);

    @Builder.Default
    Duration shortTermVectorSearch = Duration.ofMillis(15);

    @Builder.Default
    Duration longTermMemory = Duration.ofMillis(60);

    @Builder.Default
    Duration identityResolution = Duration.ofMillis(10);

    @Builder.Default
    Duration retrieval = Duration.ofMillis(120);
}
