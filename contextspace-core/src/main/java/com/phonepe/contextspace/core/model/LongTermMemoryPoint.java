package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Persistent summary of a past interaction. Points are only ever inserted.
 */
@Value
@Builder
@Jacksonized
public class LongTermMemoryPoint {
    String pseudoUserId;
    String summary;
    float[] intentVector;
    float[] toneVector;
    float[] productVector;
    List<String> entities;
    @With
    long lastSeen;

    public String id() {
        return "%s-%d".formatted(pseudoUserId, lastSeen);
    }
}
