package com.phonepe.contextspace.core.store;

import com.phonepe.contextspace.core.model.ShortTermRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * Key value cache holding the recent conversation of a session. Entries expire on their own.
 */
public interface SessionCache {
    Optional<ShortTermRecord> read(String sessionId);

    /**
     * Stores the record and restarts its time to live
     */
    void write(String sessionId, ShortTermRecord shortTermRecord, Duration ttl);
}
