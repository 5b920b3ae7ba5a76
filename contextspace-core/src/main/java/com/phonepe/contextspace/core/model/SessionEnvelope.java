package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Normalized representation of one inbound turn. The channel user id is always the hashed form.
 */
@Value
@Builder
@Jacksonized
public class SessionEnvelope {
    @NonNull
    Channel channel;

    @NonNull
    String hashedChannelUserId;

    @NonNull
    Message message;

    SessionMetadata metadata;

    public String sessionId() {
        return sessionId(channel, hashedChannelUserId);
    }

    public static String sessionId(Channel channel, String hashedChannelUserId) {
        return "%s:%s".formatted(channel.getWireName(), hashedChannelUserId);
    }
}
