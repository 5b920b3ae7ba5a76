package com.phonepe.contextspace.core.store.memory;

import com.phonepe.contextspace.core.errors.DuplicateMemoryPointException;
import com.phonepe.contextspace.core.errors.ErrorType;
import com.phonepe.contextspace.core.errors.StoreType;
import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.LongTermMemoryPoint;
import com.phonepe.contextspace.core.model.ShortTermRecord;
import com.phonepe.contextspace.core.model.ShortTermVectorPoint;
import com.phonepe.contextspace.core.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryStoresTest {

    @Test
    void testSessionCacheExpiresEntries() {
        final var clock = new TestUtils.TickingClock(1_000L);
        final var cache = new InMemorySessionCache(clock);
        final var record = ShortTermRecord.empty()
                .append(TestUtils.userMessage("hello", 1_000L), new float[]{1, 0}, 0.0, 50);
        cache.write("web:abc", record, Duration.ofMinutes(1));

        assertEquals(record, cache.read("web:abc").orElseThrow());
        clock.advance(Duration.ofMinutes(2).toMillis());
        assertTrue(cache.read("web:abc").isEmpty());
        assertTrue(cache.read("web:unknown").isEmpty());
    }

    @Test
    void testSessionCachePurgesExpiredEntriesOnWrite() {
        final var clock = new TestUtils.TickingClock(1_000L);
        final var cache = new InMemorySessionCache(clock);
        final var record = ShortTermRecord.empty()
                .append(TestUtils.userMessage("hello", 1_000L), new float[]{1, 0}, 0.0, 50);
        cache.write("web:a", record, Duration.ofMinutes(1));
        cache.write("web:b", record, Duration.ofMinutes(1));
        assertEquals(2, cache.size());

        clock.advance(Duration.ofMinutes(2).toMillis());
        cache.write("web:c", record, Duration.ofMinutes(1));
        assertEquals(1, cache.size());
        assertTrue(cache.read("web:a").isEmpty());
        assertEquals(record, cache.read("web:c").orElseThrow());
    }

    @Test
    void testShortTermRecordKeepsNewestMessages() {
        var record = ShortTermRecord.empty();
        for (int i = 0; i < 5; i++) {
            record = record.append(TestUtils.userMessage("message " + i, i), new float[]{i}, i / 10.0, 3);
        }
        assertEquals(List.of("message 2", "message 3", "message 4"),
                     record.getMessages().stream().map(m -> m.getText()).toList());
        assertEquals(0.4, record.getFrustrationLevel());
    }

    @Test
    void testVectorIndexReplacesPointsPerSession() {
        final var index = new InMemoryShortTermVectorIndex();
        index.upsert(point("web:a", "U1", new float[]{1, 0}, 1L));
        index.upsert(point("web:b", "U2", new float[]{0, 1}, 2L));
        index.upsert(point("web:a", "U1", new float[]{0.9f, 0.1f}, 3L));

        final var nearest = index.nearest(new float[]{1, 0}, 10);
        assertEquals(2, nearest.size());
        assertEquals("web:a", nearest.get(0).getSessionId());
        assertEquals(3L, nearest.get(0).getTimestamp());
        assertEquals(1, index.nearest(new float[]{1, 0}, 1).size());
    }

    @Test
    void testLongTermStoreRejectsDuplicates() {
        final var store = new InMemoryLongTermMemoryStore();
        final var point = LongTermMemoryPoint.builder()
                .pseudoUserId("U1")
                .summary("order AB123 delayed")
                .intentVector(new float[]{1, 0})
                .toneVector(new float[]{0, 0})
                .productVector(new float[]{1, 0})
                .entities(List.of("AB123"))
                .lastSeen(10L)
                .build();
        store.insert(point);
        final var error = assertThrows(DuplicateMemoryPointException.class, () -> store.insert(point));
        assertEquals(point.id(), error.getPointId());
        assertEquals(ErrorType.STORE_WRITE_FAILURE, error.getErrorType());
        assertEquals(StoreType.LONG_TERM_MEMORY, error.getStoreType());
        assertEquals(List.of(point), store.nearest(new float[]{1, 0}, 10));
    }

    private static ShortTermVectorPoint point(String sessionId, String pseudoUserId, float[] intent, long timestamp) {
        return ShortTermVectorPoint.builder()
                .sessionId(sessionId)
                .pseudoUserId(pseudoUserId)
                .channel(Channel.WEB)
                .intentVector(intent)
                .frustrationVector(new float[intent.length])
                .productVector(intent)
                .timestamp(timestamp)
                .build();
    }
}
