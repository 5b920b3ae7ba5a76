package com.phonepe.contextspace.core.config;

import com.phonepe.contextspace.core.errors.ErrorType;
import com.phonepe.contextspace.core.errors.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextSpaceEnvTest {

    @Test
    void testDefaults() {
        final var env = ContextSpaceEnv.fromEnvironment(Map.of(ContextSpaceEnv.ES_URL, "http://localhost:9200"));
        assertEquals("http://localhost:9200", env.getEsUrl());
        assertNull(env.getEsApiKey());
        assertEquals("contextspace", env.getEsIndexPrefix());
        assertEquals("localhost", env.getRedisHost());
        assertEquals(6379, env.getRedisPort());
    }

    @Test
    void testOverrides() {
        final var env = ContextSpaceEnv.fromEnvironment(Map.of(ContextSpaceEnv.ES_URL, "https://es:9243",
                                                               ContextSpaceEnv.ES_API_KEY, "secret",
                                                               ContextSpaceEnv.ES_INDEX_PREFIX, "staging",
                                                               ContextSpaceEnv.REDIS_HOST, "redis",
                                                               ContextSpaceEnv.REDIS_PORT, "6380"));
        assertEquals("secret", env.getEsApiKey());
        assertEquals("staging", env.getEsIndexPrefix());
        assertEquals("redis", env.getRedisHost());
        assertEquals(6380, env.getRedisPort());
    }

    @Test
    void testMissingEsUrl() {
        final var error = assertThrows(NullPointerException.class, () -> ContextSpaceEnv.fromEnvironment(Map.of()));
        assertEquals("Please set environment variable: " + ContextSpaceEnv.ES_URL, error.getMessage());
    }

    @Test
    void testBadRedisPort() {
        for (final var port : new String[]{"redis", "0", "70000"}) {
            final var variables = Map.of(ContextSpaceEnv.ES_URL, "http://localhost:9200",
                                         ContextSpaceEnv.REDIS_PORT, port);
            final var error = assertThrows(ValidationException.class,
                                           () -> ContextSpaceEnv.fromEnvironment(variables));
            assertEquals(ContextSpaceEnv.REDIS_PORT, error.getField());
            assertEquals(ErrorType.VALIDATION_FAILURE, error.getErrorType());
            assertTrue(error.getMessage().contains(port), error.getMessage());
        }
    }
}
