package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * All channel identities believed to belong to one pseudo user
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class IdentityMapEntry {
    String pseudoUserId;
    List<LinkedSession> linkedSessions;
    long updatedAt;

    /**
     * Returns a copy with the session linked. An existing link only ever has its confidence raised.
     */
    public IdentityMapEntry withLink(final LinkedSession session, long now) {
        final var links = new ArrayList<LinkedSession>(linkedSessions == null ? List.of() : linkedSessions);
        var found = false;
        for (int i = 0; i < links.size(); i++) {
            final var existing = links.get(i);
            if (existing.sameSession(session)) {
                found = true;
                if (session.getConfidence() > existing.getConfidence()) {
                    links.set(i, existing.withConfidence(session.getConfidence()));
                }
            }
        }
        if (!found) {
            links.add(session);
        }
        return toBuilder()
                .linkedSessions(List.copyOf(links))
                .updatedAt(now)
                .build();
    }

    public boolean hasLink(Channel channel, String hashedChannelUserId) {
        return linkedSessions != null && linkedSessions.stream()
                .anyMatch(session -> session.getChannel() == channel
                        && session.getHashedChannelUserId().equals(hashedChannelUserId));
    }

    public static IdentityMapEntry create(String pseudoUserId, LinkedSession session, long now) {
        return new IdentityMapEntry(pseudoUserId, List.of(session), now);
    }
}
