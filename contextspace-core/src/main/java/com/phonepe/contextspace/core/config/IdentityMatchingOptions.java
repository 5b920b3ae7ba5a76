package com.phonepe.contextspace.core.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Weights and threshold used to decide whether a session belongs to a known pseudo user
 */
@Value
@Builder
@Jacksonized
public class IdentityMatchingOptions {
    public static final IdentityMatchingOptions DEFAULT = IdentityMatchingOptions.builder().build();

    @Builder.Default
    double vectorWeight = 0.35;

    @Builder.Default
    double metadataWeight = 0.25;

    @Builder.Default
    double behaviorWeight = 0.20;

    @Builder.Default
    double identifierWeight = 0.20;

    /**
     * Score must be strictly greater than this to reuse an existing pseudo user id
     */
    @Builder.Default
    double matchThreshold = 0.82;

    /**
     * Average message length difference (in characters) that counts as completely dissimilar
     */
    @Builder.Default
    double behaviorLengthScale = 100.0;
}
