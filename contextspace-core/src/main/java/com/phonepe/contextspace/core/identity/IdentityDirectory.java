package com.phonepe.contextspace.core.identity;

import com.phonepe.contextspace.core.hashing.IdentifierHasher;
import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.IdentityMapEntry;
import com.phonepe.contextspace.core.model.LinkedSession;
import com.phonepe.contextspace.core.store.IdentityMapStore;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Read side of the identity map. All lookups degrade to empty results if the store is unavailable.
 */
@Slf4j
public class IdentityDirectory {
    public static final int DEFAULT_LIMIT = 100;

    private final IdentityMapStore identityMap;
    private final IdentifierHasher hasher;

    public IdentityDirectory(IdentityMapStore identityMap, IdentifierHasher hasher) {
        this.identityMap = identityMap;
        this.hasher = hasher;
    }

    public Optional<IdentityMapEntry> entry(String pseudoUserId) {
        return read("entry lookup", () -> identityMap.findByPseudoUserId(pseudoUserId), Optional.empty());
    }

    public List<LinkedSession> linkedSessions(String pseudoUserId) {
        return entry(pseudoUserId)
                .map(IdentityMapEntry::getLinkedSessions)
                .orElse(List.of());
    }

    /**
     * Distinct channels the pseudo user has been seen on, in link order
     */
    public Set<Channel> linkedChannels(String pseudoUserId) {
        final var channels = new LinkedHashSet<Channel>();
        linkedSessions(pseudoUserId).forEach(session -> channels.add(session.getChannel()));
        return channels;
    }

    public boolean isChannelLinked(String pseudoUserId, Channel channel) {
        return linkedChannels(pseudoUserId).contains(channel);
    }

    public Optional<String> pseudoUserId(Channel channel, String rawChannelUserId) {
        return read("reverse lookup",
                    () -> identityMap.findByLinkedSession(channel, hasher.hash(rawChannelUserId))
                            .map(IdentityMapEntry::getPseudoUserId),
                    Optional.empty());
    }

    public List<String> pseudoUserIds() {
        return pseudoUserIds(DEFAULT_LIMIT);
    }

    public List<String> pseudoUserIds(int limit) {
        return read("pseudo user listing", () -> identityMap.pseudoUserIds(limit), List.of());
    }

    private <T> T read(String operation, Supplier<T> call, T fallback) {
        try {
            return call.get();
        }
        catch (Exception e) {
            log.warn("Identity map {} failed: {}", operation, e.getMessage());
            return fallback;
        }
    }
}
