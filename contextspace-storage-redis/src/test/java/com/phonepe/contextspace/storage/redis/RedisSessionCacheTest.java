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

package com.phonepe.contextspace.storage.redis;

import com.phonepe.contextspace.core.errors.ContextSpaceException;
import com.phonepe.contextspace.core.errors.ErrorType;
import com.phonepe.contextspace.core.errors.StoreType;
import com.phonepe.contextspace.core.model.Message;
import com.phonepe.contextspace.core.model.MessageRole;
import com.phonepe.contextspace.core.model.ShortTermRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisSessionCacheTest {

    @Mock
    private UnifiedJedis jedis;

    @Test
    void writesWithSlidingTtlAndReadsBack() {
        final var cache = RedisSessionCache.builder().jedis(jedis).build();
        final var record = ShortTermRecord.empty()
                .append(Message.builder()
                                .timestamp(42L)
                                .role(MessageRole.USER)
                                .text("Where is my order AB123?")
                                .summary("Where is my order AB123?")
                                .build(),
                        new float[]{1, 0, 0},
                        0.3,
                        50);

        cache.write("web:abc", record, Duration.ofHours(48));

        final var payload = ArgumentCaptor.forClass(String.class);
        verify(jedis).setex(eq("contextspace:session:web:abc"), eq(48L * 3600), payload.capture());

        when(jedis.get("contextspace:session:web:abc")).thenReturn(payload.getValue());
        final var read = cache.read("web:abc").orElseThrow();
        assertEquals(1, read.getMessages().size());
        assertEquals("Where is my order AB123?", read.getMessages().get(0).getText());
        assertEquals(MessageRole.USER, read.getMessages().get(0).getRole());
        assertArrayEquals(new float[]{1, 0, 0}, read.getIntentVector());
        assertEquals(0.3, read.getFrustrationLevel(), 1e-9);
    }

    @Test
    void subSecondTtlIsRoundedUp() {
        final var cache = RedisSessionCache.builder().jedis(jedis).keyPrefix("test").build();

        cache.write("x:1", ShortTermRecord.empty(), Duration.ofMillis(200));

        verify(jedis).setex(eq("test:x:1"), eq(1L), anyString());
    }

    @Test
    void missingKeyIsEmpty() {
        final var cache = RedisSessionCache.builder().jedis(jedis).build();
        when(jedis.get(anyString())).thenReturn(null);

        assertTrue(cache.read("email:nobody").isEmpty());
    }

    @Test
    void failuresAreTaggedWithTheSessionCache() {
        final var cache = RedisSessionCache.builder().jedis(jedis).build();
        when(jedis.get(anyString())).thenThrow(new JedisConnectionException("connection refused"));
        when(jedis.setex(anyString(), anyLong(), anyString()))
                .thenThrow(new JedisConnectionException("connection refused"));

        final var readError = assertThrows(ContextSpaceException.class, () -> cache.read("web:abc"));
        assertEquals(ErrorType.STORE_READ_FAILURE, readError.getErrorType());
        assertEquals(StoreType.SESSION_CACHE, readError.getStoreType());

        final var writeError = assertThrows(ContextSpaceException.class,
                                            () -> cache.write("web:abc",
                                                              ShortTermRecord.empty(),
                                                              Duration.ofMinutes(1)));
        assertEquals(ErrorType.STORE_WRITE_FAILURE, writeError.getErrorType());
        assertEquals(StoreType.SESSION_CACHE, writeError.getStoreType());
    }

    @Test
    void corruptPayloadIsAReadFailure() {
        final var cache = RedisSessionCache.builder().jedis(jedis).build();
        when(jedis.get(anyString())).thenReturn("{not json");

        final var error = assertThrows(ContextSpaceException.class, () -> cache.read("web:abc"));
        assertEquals(ErrorType.STORE_READ_FAILURE, error.getErrorType());
    }
}
