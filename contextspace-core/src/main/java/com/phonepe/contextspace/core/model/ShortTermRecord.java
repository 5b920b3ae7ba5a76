package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Recent conversation state of one session. Lives in the session cache and expires on its own.
 */
@Value
@Builder
@Jacksonized
public class ShortTermRecord {
    @Singular
    List<Message> messages;

    float[] intentVector;

    double frustrationLevel;

    /**
     * Appends a message, dropping the oldest ones when more than {@code maxMessages} would be held.
     */
    public ShortTermRecord append(Message message, float[] latestIntent, double latestFrustration, int maxMessages) {
        final var updated = new ArrayList<>(messages);
        updated.add(message);
        final var from = Math.max(0, updated.size() - Math.max(1, maxMessages));
        return new ShortTermRecord(List.copyOf(updated.subList(from, updated.size())),
                                   latestIntent,
                                   latestFrustration);
    }

    public static ShortTermRecord empty() {
        return new ShortTermRecord(List.of(), new float[0], 0.0);
    }
}
