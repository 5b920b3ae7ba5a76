package com.phonepe.contextspace.storage.identity;

import com.phonepe.contextspace.core.model.Channel;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.FieldNameConstants;
import lombok.extern.jackson.Jacksonized;

/**
 * Records which pseudo user owns a channel identity. Written once and never changed.
 */
@Value
@FieldNameConstants
@Builder
@Jacksonized
public class ESSessionClaimDocument {
    Channel channel;

    String hashedChannelUserId;

    String pseudoUserId;

    long claimedAt;
}
