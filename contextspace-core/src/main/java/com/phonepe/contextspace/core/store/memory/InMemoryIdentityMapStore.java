package com.phonepe.contextspace.core.store.memory;

import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.IdentityMapEntry;
import com.phonepe.contextspace.core.model.LinkedSession;
import com.phonepe.contextspace.core.store.IdentityMapStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Identity map held in memory. Session ownership is claimed with {@code putIfAbsent} and entries are
 * updated with a single atomic {@code compute}, so concurrent links never lose updates.
 */
@Slf4j
public class InMemoryIdentityMapStore implements IdentityMapStore {
    private record SessionKey(Channel channel, String hashedChannelUserId) {
    }

    private final Map<String, IdentityMapEntry> entries = new ConcurrentHashMap<>();
    private final Map<SessionKey, String> owners = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIdentityMapStore() {
        this(Clock.systemUTC());
    }

    public InMemoryIdentityMapStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<IdentityMapEntry> findByPseudoUserId(String pseudoUserId) {
        return Optional.ofNullable(entries.get(pseudoUserId));
    }

    @Override
    public Optional<IdentityMapEntry> findByLinkedSession(Channel channel, String hashedChannelUserId) {
        return Optional.ofNullable(owners.get(new SessionKey(channel, hashedChannelUserId)))
                .map(entries::get);
    }

    @Override
    public IdentityMapEntry link(String pseudoUserId, LinkedSession session) {
        final var key = new SessionKey(session.getChannel(), session.getHashedChannelUserId());
        final var owner = owners.putIfAbsent(key, pseudoUserId);
        final var now = clock.millis();
        if (owner != null && !owner.equals(pseudoUserId)) {
            log.debug("Session {}:{} already belongs to {}, not linking to {}",
                      session.getChannel(), session.getHashedChannelUserId(), owner, pseudoUserId);
            //The owner's own link call may still be in flight
            return entries.getOrDefault(owner, IdentityMapEntry.create(owner, session, now));
        }
        return entries.compute(pseudoUserId, (id, existing) -> existing == null
                                                              ? IdentityMapEntry.create(id, session, now)
                                                              : existing.withLink(session, now));
    }

    @Override
    public List<String> pseudoUserIds(int limit) {
        return entries.keySet()
                .stream()
                .sorted()
                .limit(limit)
                .toList();
    }

    @Override
    public long count() {
        return entries.size();
    }
}
