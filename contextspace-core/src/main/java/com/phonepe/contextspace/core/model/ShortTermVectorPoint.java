package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A recent interaction as stored in the short term vector index. A later upsert for the same session
 * replaces the point.
 */
@Value
@Builder
@Jacksonized
public class ShortTermVectorPoint {
    String sessionId;
    String pseudoUserId;
    Channel channel;
    float[] intentVector;
    float[] frustrationVector;
    float[] productVector;
    SessionMetadata metadata;
    long timestamp;
}
