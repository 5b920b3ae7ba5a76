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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.contextspace.core.config.ContextSpaceEnv;
import com.phonepe.contextspace.core.errors.ContextSpaceException;
import com.phonepe.contextspace.core.errors.StoreType;
import com.phonepe.contextspace.core.model.ShortTermRecord;
import com.phonepe.contextspace.core.store.SessionCache;
import com.phonepe.contextspace.core.utils.JsonUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Session cache kept in redis as JSON strings. Every write goes through {@code SETEX}, so the expiry
 * slides forward with each message.
 */
@Slf4j
public class RedisSessionCache implements SessionCache, AutoCloseable {
    private static final String DEFAULT_KEY_PREFIX = "contextspace:session";

    private final UnifiedJedis jedis;
    private final String keyPrefix;
    private final ObjectMapper mapper;

    @Builder
    public RedisSessionCache(@NonNull UnifiedJedis jedis, String keyPrefix, ObjectMapper mapper) {
        this.jedis = jedis;
        this.keyPrefix = Strings.isNullOrEmpty(keyPrefix) ? DEFAULT_KEY_PREFIX : keyPrefix;
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    public static RedisSessionCache fromEnvironment(ContextSpaceEnv env) {
        log.info("Connecting to redis at {}:{}", env.getRedisHost(), env.getRedisPort());
        return RedisSessionCache.builder()
                .jedis(new JedisPooled(env.getRedisHost(), env.getRedisPort()))
                .build();
    }

    @Override
    public Optional<ShortTermRecord> read(String sessionId) {
        final String raw;
        try {
            raw = jedis.get(key(sessionId));
        }
        catch (JedisException e) {
            throw ContextSpaceException.readFailure(StoreType.SESSION_CACHE, e);
        }
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(raw, ShortTermRecord.class));
        }
        catch (JsonProcessingException e) {
            throw ContextSpaceException.readFailure(StoreType.SESSION_CACHE, e);
        }
    }

    @Override
    public void write(String sessionId, ShortTermRecord shortTermRecord, Duration ttl) {
        final String serialized;
        try {
            serialized = mapper.writeValueAsString(shortTermRecord);
        }
        catch (JsonProcessingException e) {
            throw ContextSpaceException.serializationFailure(e);
        }
        //SETEX works in whole seconds
        final var seconds = Math.max(1L, ttl.toSeconds());
        try {
            final var result = jedis.setex(key(sessionId), seconds, serialized);
            log.debug("Session {} written with ttl {}s: {}", sessionId, seconds, result);
        }
        catch (JedisException e) {
            throw ContextSpaceException.writeFailure(StoreType.SESSION_CACHE, e);
        }
    }

    @Override
    public void close() {
        jedis.close();
    }

    String key(String sessionId) {
        return keyPrefix + ":" + sessionId;
    }
}
