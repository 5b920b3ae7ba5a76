package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Optional connection level metadata sent along with a message. All fields are optional.
 */
@Value
@Builder
@Jacksonized
public class SessionMetadata {
    public static final SessionMetadata EMPTY = SessionMetadata.builder().build();

    String ip;
    String geo;
    String lang;
    String userAgent;
}
