package com.phonepe.contextspace.core.store.memory;

import com.phonepe.contextspace.core.model.ShortTermRecord;
import com.phonepe.contextspace.core.store.SessionCache;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session cache backed by a map. Expiry is checked against the clock on read, and expired sessions are
 * purged on every write.
 */
public class InMemorySessionCache implements SessionCache {
    private record Entry(ShortTermRecord shortTermRecord, long expiresAt) {
    }

    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionCache() {
        this(Clock.systemUTC());
    }

    public InMemorySessionCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<ShortTermRecord> read(String sessionId) {
        final var entry = sessions.get(sessionId);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt() <= clock.millis()) {
            sessions.remove(sessionId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.shortTermRecord());
    }

    @Override
    public void write(String sessionId, ShortTermRecord shortTermRecord, Duration ttl) {
        final var now = clock.millis();
        sessions.values().removeIf(entry -> entry.expiresAt() <= now);
        sessions.put(sessionId, new Entry(shortTermRecord, now + ttl.toMillis()));
    }

    int size() {
        return sessions.size();
    }
}
