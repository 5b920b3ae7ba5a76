package com.phonepe.contextspace.core.config;

import com.google.common.primitives.Ints;
import com.phonepe.contextspace.core.errors.ValidationException;
import com.phonepe.contextspace.core.utils.EnvLoader;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Deployment settings read from the environment
 */
@Value
@Builder
public class ContextSpaceEnv {
    public static final String ES_URL = "CONTEXTSPACE_ES_URL";
    public static final String ES_API_KEY = "CONTEXTSPACE_ES_API_KEY";
    public static final String ES_INDEX_PREFIX = "CONTEXTSPACE_ES_INDEX_PREFIX";
    public static final String REDIS_HOST = "CONTEXTSPACE_REDIS_HOST";
    public static final String REDIS_PORT = "CONTEXTSPACE_REDIS_PORT";

    String esUrl;
    String esApiKey;
    String esIndexPrefix;
    String redisHost;
    int redisPort;

    public static ContextSpaceEnv fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads settings from the given variables. Only {@value #ES_URL} is mandatory.
     */
    public static ContextSpaceEnv fromEnvironment(Map<String, String> variables) {
        return ContextSpaceEnv.builder()
                .esUrl(EnvLoader.readEnv(variables::get, ES_URL))
                .esApiKey(EnvLoader.readEnv(variables::get, ES_API_KEY, null))
                .esIndexPrefix(EnvLoader.readEnv(variables::get, ES_INDEX_PREFIX, "contextspace"))
                .redisHost(EnvLoader.readEnv(variables::get, REDIS_HOST, "localhost"))
                .redisPort(port(EnvLoader.readEnv(variables::get, REDIS_PORT, "6379")))
                .build();
    }

    private static int port(String value) {
        final var port = Ints.tryParse(value.trim());
        if (port == null || port < 1 || port > 65535) {
            throw new ValidationException(REDIS_PORT, "must be a port number, got '%s'".formatted(value));
        }
        return port;
    }
}
