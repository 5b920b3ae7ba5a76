package com.phonepe.contextspace.core.model;

import com.fasterxml.jackson.annotation.JsonClassDescription;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * A single conversational turn
 */
@Value
@With
@Builder
@Jacksonized
@JsonClassDescription("A single message exchanged on a channel")
public class Message {
    @JsonPropertyDescription("Epoch milliseconds at which the message was received")
    long timestamp;

    @JsonPropertyDescription("Author of the message")
    MessageRole role;

    @JsonPropertyDescription("Raw text of the message")
    String text;

    @JsonPropertyDescription("Short summary of the message, e.g. 'user asking about order AB123 delay'")
    String summary;
}
