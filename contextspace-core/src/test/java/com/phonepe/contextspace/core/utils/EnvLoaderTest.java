package com.phonepe.contextspace.core.utils;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EnvLoaderTest {

    @Test
    void testReadEnvFromSystem() {
        // PATH is usually present in all environments
        assertNotNull(EnvLoader.readEnv("PATH", null), "PATH should be readable from system environment");
    }

    @Test
    void testReadEnvWithDefault() {
        final var variable = "NON_EXISTENT_VAR_" + System.currentTimeMillis();
        assertEquals("default_value", EnvLoader.readEnv(variable, "default_value"));
        assertNull(EnvLoader.readEnv(variable, null));
    }

    @Test
    void testEmptyValueFallsBackToDefault() {
        final var variables = Map.of("EMPTY_VAR", "", "SET_VAR", "value");
        assertEquals("default", EnvLoader.readEnv(variables::get, "EMPTY_VAR", "default"));
        assertEquals("value", EnvLoader.readEnv(variables::get, "SET_VAR", "default"));
    }

    @Test
    void testMissingMandatoryVariable() {
        final var variable = "NON_EXISTENT_VAR_" + System.currentTimeMillis();
        final var error = assertThrows(NullPointerException.class, () -> EnvLoader.readEnv(variable));
        assertEquals("Please set environment variable: " + variable, error.getMessage());
        assertEquals("value", EnvLoader.readEnv(Map.of("MANDATORY", "value")::get, "MANDATORY"));
    }
}
