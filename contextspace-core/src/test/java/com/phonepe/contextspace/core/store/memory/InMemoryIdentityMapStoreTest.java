package com.phonepe.contextspace.core.store.memory;

import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.LinkedSession;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryIdentityMapStoreTest {

    private static LinkedSession session(Channel channel, String hash, double confidence) {
        return LinkedSession.builder()
                .channel(channel)
                .hashedChannelUserId(hash)
                .confidence(confidence)
                .build();
    }

    @Test
    void testLinksAccumulateAcrossChannels() {
        final var store = new InMemoryIdentityMapStore();
        store.link("U1", session(Channel.WEB, "h1", 1.0));
        store.link("U1", session(Channel.EMAIL, "h2", 0.9));
        final var entry = store.link("U1", session(Channel.WEB, "h1", 0.5));

        assertEquals(2, entry.getLinkedSessions().size());
        assertTrue(entry.hasLink(Channel.EMAIL, "h2"));
        assertEquals("U1", store.findByLinkedSession(Channel.EMAIL, "h2").orElseThrow().getPseudoUserId());
        assertTrue(store.findByLinkedSession(Channel.PHONE, "h2").isEmpty());
        assertEquals(1, store.count());
    }

    @Test
    @SneakyThrows
    void testConcurrentClaimsHaveSingleOwner() {
        final var store = new InMemoryIdentityMapStore();
        final var executor = Executors.newFixedThreadPool(8);
        try {
            final var start = new CountDownLatch(1);
            final var futures = new ArrayList<Future<String>>();
            IntStream.range(0, 16).forEach(i -> futures.add(executor.submit((Callable<String>) () -> {
                start.await();
                return store.link("U" + i, session(Channel.WHATSAPP, "same-phone", 1.0)).getPseudoUserId();
            })));
            start.countDown();
            final var owners = new HashSet<String>();
            for (final var future : futures) {
                owners.add(future.get());
            }
            assertEquals(1, owners.size());
            final var owner = owners.iterator().next();
            assertEquals(owner,
                         store.findByLinkedSession(Channel.WHATSAPP, "same-phone").orElseThrow().getPseudoUserId());
            assertEquals(1, store.count());
        }
        finally {
            executor.shutdownNow();
        }
    }
}
