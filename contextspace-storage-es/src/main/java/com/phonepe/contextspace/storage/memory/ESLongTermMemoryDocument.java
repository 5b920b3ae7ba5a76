package com.phonepe.contextspace.storage.memory;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.FieldNameConstants;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Stored form of a long term memory point
 */
@Value
@FieldNameConstants
@Builder
@Jacksonized
public class ESLongTermMemoryDocument {
    String id;

    String pseudoUserId;

    String summary;

    float[] intentVector;

    float[] toneVector;

    float[] productVector;

    List<String> entities;

    long lastSeen;
}
