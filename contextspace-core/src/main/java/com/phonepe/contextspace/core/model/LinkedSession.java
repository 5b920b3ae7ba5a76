package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * A channel identity linked to a pseudo user
 */
@Value
@With
@Builder
@Jacksonized
public class LinkedSession {
    Channel channel;
    String hashedChannelUserId;
    double confidence;

    public boolean sameSession(final LinkedSession other) {
        return channel == other.channel && hashedChannelUserId.equals(other.hashedChannelUserId);
    }
}
