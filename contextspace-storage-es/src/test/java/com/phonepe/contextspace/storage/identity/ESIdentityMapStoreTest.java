package com.phonepe.contextspace.storage.identity;

import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.LinkedSession;
import com.phonepe.contextspace.storage.ESIntegrationTestBase;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ESIdentityMapStoreTest extends ESIntegrationTestBase {

    @Test
    void linksAcrossChannelsAndKeepsHighestConfidence() {
        final var store = store();
        store.link("PU-A", session(Channel.WEB, "hash-web-a", 0.7));
        store.link("PU-A", session(Channel.EMAIL, "hash-mail-a", 0.9));
        final var entry = store.link("PU-A", session(Channel.WEB, "hash-web-a", 0.5));

        assertEquals(2, entry.getLinkedSessions().size());
        assertEquals(0.7, entry.getLinkedSessions().get(0).getConfidence(), 1e-9);
        assertEquals("PU-A", store.findByLinkedSession(Channel.EMAIL, "hash-mail-a")
                .orElseThrow()
                .getPseudoUserId());
        assertTrue(store.findByLinkedSession(Channel.X, "hash-mail-a").isEmpty());
        assertTrue(store.findByPseudoUserId("PU-A").orElseThrow().hasLink(Channel.WEB, "hash-web-a"));
    }

    @Test
    void firstOwnerKeepsTheSession() {
        final var store = store();
        store.link("PU-OWNER", session(Channel.WHATSAPP, "hash-shared", 0.8));

        final var result = store.link("PU-OTHER", session(Channel.WHATSAPP, "hash-shared", 1.0));

        assertEquals("PU-OWNER", result.getPseudoUserId());
        assertTrue(store.findByPseudoUserId("PU-OTHER").isEmpty());
        assertTrue(store.pseudoUserIds(100).contains("PU-OWNER"));
    }

    @Test
    @SneakyThrows
    void concurrentLinksAreAllKept() {
        final var store = store();
        final var executor = Executors.newFixedThreadPool(4);
        try {
            final var futures = new ArrayList<Future<?>>();
            for (int i = 0; i < 8; i++) {
                final var hash = "hash-concurrent-" + i;
                futures.add(executor.submit((Callable<Object>) () -> store.link("PU-C",
                                                                                 session(Channel.PHONE, hash, 0.9))));
            }
            for (final var future : futures) {
                future.get();
            }
        }
        finally {
            executor.shutdownNow();
        }
        assertEquals(8, store.findByPseudoUserId("PU-C").orElseThrow().getLinkedSessions().size());
    }

    private ESIdentityMapStore store() {
        return ESIdentityMapStore.builder()
                .client(client)
                .indexPrefix(indexPrefix())
                .indexSettings(indexSettings())
                .maxAttempts(50)
                .build();
    }

    private static LinkedSession session(Channel channel, String hash, double confidence) {
        return LinkedSession.builder()
                .channel(channel)
                .hashedChannelUserId(hash)
                .confidence(confidence)
                .build();
    }
}
