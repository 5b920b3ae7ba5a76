/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.contextspace.core.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonepe.contextspace.core.embedding.EmbeddingProvider;
import com.phonepe.contextspace.core.errors.ErrorType;
import com.phonepe.contextspace.core.hashing.Sha256IdentifierHasher;
import com.phonepe.contextspace.core.identity.IdentityResolver;
import com.phonepe.contextspace.core.intelligence.IntelligenceLayer;
import com.phonepe.contextspace.core.intelligence.escalation.EscalationManager;
import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.MultiVectorEmbedding;
import com.phonepe.contextspace.core.pipeline.MemoryPipeline;
import com.phonepe.contextspace.core.pipeline.SessionEnvelopeBuilder;
import com.phonepe.contextspace.core.store.MemoryStores;
import com.phonepe.contextspace.core.store.ShortTermVectorIndex;
import com.phonepe.contextspace.core.store.memory.InMemoryStores;
import com.phonepe.contextspace.core.utils.JsonUtils;
import com.phonepe.contextspace.core.utils.TestUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChannelGatewayTest {
    private final TestUtils.TickingClock clock = new TestUtils.TickingClock(1_700_000_000_000L);
    private ExecutorService executorService;

    @BeforeEach
    void setup() {
        executorService = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @SneakyThrows
    private static JsonNode json(String raw) {
        return JsonUtils.createMapper().readTree(raw);
    }

    private ChannelGateway gateway(MemoryStores stores) {
        final var embeddings = mock(EmbeddingProvider.class);
        when(embeddings.embed(anyString())).thenReturn(new float[]{0, 1, 0});
        when(embeddings.embedMessage(anyString(), any())).thenReturn(MultiVectorEmbedding.builder()
                                                                            .intentVector(new float[]{0, 1, 0})
                                                                            .frustrationVector(new float[]{0, 0, 0})
                                                                            .productVector(new float[]{0, 1, 0})
                                                                            .build());
        final var hasher = new Sha256IdentifierHasher();
        final var pipeline = MemoryPipeline.builder()
                .stores(stores)
                .embeddings(embeddings)
                .identityResolver(IdentityResolver.builder()
                                          .identityMap(stores.getIdentityMap())
                                          .hasher(hasher)
                                          .build())
                .intelligence(IntelligenceLayer.builder()
                                      .escalationManager(new EscalationManager(stores.getEscalations(), clock))
                                      .build())
                .executorService(executorService)
                .clock(clock)
                .build();
        return new ChannelGateway(pipeline, new SessionEnvelopeBuilder(hasher, clock));
    }

    @Test
    void testWebRoundTrip() {
        final var gateway = gateway(InMemoryStores.create(clock));
        final var reply = gateway.handle(Channel.WEB, json("""
                {"session_cookie": "cookie-1", "message": "Where is my order AB123? The tracking is wrong"}
                """));
        assertTrue(reply.get("success").asBoolean(), reply.toString());
        assertTrue(reply.get("session_id").asText().startsWith("web:"));
        assertEquals("low", reply.get("urgency").asText());
        assertFalse(reply.get("escalated").asBoolean());
        assertEquals("check_status", reply.get("recommended_actions").get(0).get("type").asText());

        final var memory = gateway.retrieve(Channel.WEB, "cookie-1", "order AB123");
        assertEquals(1, memory.getShortTerm().getMessages().size());
        assertTrue(memory.getMemoryBlock().contains("Where is my order AB123?"));
    }

    @Test
    void testInvalidPayloadIsReported() {
        final var reply = gateway(InMemoryStores.create(clock)).handle(Channel.WHATSAPP, json("""
                {"message": "hello"}
                """));
        assertEquals("VALIDATION_FAILURE", reply.get("code").asText());
        assertEquals("from", reply.get("field").asText());
        assertFalse(reply.get("escalated").asBoolean());
    }

    @Test
    void testStoreFailureIsReportedWithoutDetails() {
        final var stores = InMemoryStores.create(clock);
        final var vectors = mock(ShortTermVectorIndex.class);
        doThrow(new IllegalStateException("secret cluster name")).when(vectors).upsert(any());
        final var failing = MemoryStores.builder()
                .sessionCache(stores.getSessionCache())
                .shortTermVectors(vectors)
                .longTermMemory(stores.getLongTermMemory())
                .identityMap(stores.getIdentityMap())
                .escalations(stores.getEscalations())
                .build();
        final var reply = gateway(failing).handle(Channel.PHONE, json("""
                {"phone_number": "+14155550100", "transcript": "hello"}
                """));
        assertEquals("+14155550100", reply.get("phone_number").asText());
        assertEquals(ErrorType.STORE_WRITE_FAILURE.name(), reply.get("code").asText());
        assertFalse(reply.toString().contains("secret"));
    }
}
