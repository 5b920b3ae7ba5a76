package com.phonepe.contextspace.core.utils;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Loads variables from environment
 */
@UtilityClass
public class EnvLoader {
    /**
     * Reads a mandatory environment variable
     * @param variable the name of the variable
     * @return the value of the variable
     */
    public static String readEnv(final String variable) {
        return readEnv(System::getenv, variable);
    }

    /**
     * Reads an environment variable, falling back to the default if it is unset or empty
     */
    public static String readEnv(final String variable, final String defaultValue) {
        return readEnv(System::getenv, variable, defaultValue);
    }

    /**
     * Reads a mandatory variable from the given source
     */
    public static String readEnv(final UnaryOperator<String> source, final String variable) {
        return Objects.requireNonNull(source.apply(variable),
                                      "Please set environment variable: %s".formatted(variable));
    }

    public static String readEnv(final UnaryOperator<String> source,
                                 final String variable,
                                 final String defaultValue) {
        final var value = source.apply(variable);
        return Strings.isNullOrEmpty(value) ? defaultValue : value;
    }
}
