package com.phonepe.contextspace.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

/**
 * Channels through which a user can reach the agent
 */
@Getter
@AllArgsConstructor
public enum Channel {
    WEB("web"),
    WHATSAPP("whatsapp"),
    X("x"),
    EMAIL("email"),
    PHONE("phone"),
    ;

    @JsonValue
    private final String wireName;

    @JsonCreator
    public static Channel fromWireName(final String name) {
        return Arrays.stream(values())
                .filter(channel -> channel.wireName.equalsIgnoreCase(name) || channel.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown channel: " + name));
    }
}
