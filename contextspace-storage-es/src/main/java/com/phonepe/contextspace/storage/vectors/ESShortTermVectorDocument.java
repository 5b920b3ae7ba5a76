package com.phonepe.contextspace.storage.vectors;

import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.SessionMetadata;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.FieldNameConstants;
import lombok.extern.jackson.Jacksonized;

/**
 * Stored form of a short term vector point. The document id is the session id.
 */
@Value
@FieldNameConstants
@Builder
@Jacksonized
public class ESShortTermVectorDocument {
    String sessionId;

    String pseudoUserId;

    Channel channel;

    float[] intentVector;

    float[] frustrationVector;

    float[] productVector;

    SessionMetadata metadata;

    long timestamp;
}
