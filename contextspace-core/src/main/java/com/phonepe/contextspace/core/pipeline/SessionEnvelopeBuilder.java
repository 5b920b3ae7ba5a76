package com.phonepe.contextspace.core.pipeline;

import com.google.common.base.Strings;
import com.phonepe.contextspace.core.errors.ValidationException;
import com.phonepe.contextspace.core.hashing.IdentifierHasher;
import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.Message;
import com.phonepe.contextspace.core.model.MessageRole;
import com.phonepe.contextspace.core.model.SessionEnvelope;
import com.phonepe.contextspace.core.model.SessionMetadata;

import java.time.Clock;
import java.util.Objects;

/**
 * Validates an inbound turn, hashes the channel user id and stamps the receive time
 */
public class SessionEnvelopeBuilder {
    static final int DEFAULT_SUMMARY_LENGTH = 100;

    private final IdentifierHasher hasher;
    private final Clock clock;

    public SessionEnvelopeBuilder(IdentifierHasher hasher, Clock clock) {
        this.hasher = hasher;
        this.clock = clock;
    }

    public SessionEnvelope build(
            Channel channel,
            String rawChannelUserId,
            MessageRole role,
            String text,
            String summary,
            SessionMetadata metadata) {
        if (channel == null) {
            throw new ValidationException("channel", "must be one of web, whatsapp, x, email, phone");
        }
        if (Strings.isNullOrEmpty(rawChannelUserId) || rawChannelUserId.isBlank()) {
            throw ValidationException.blank("channel_user_id");
        }
        if (Strings.isNullOrEmpty(text) || text.isBlank()) {
            throw ValidationException.blank("message.text");
        }
        return SessionEnvelope.builder()
                .channel(channel)
                .hashedChannelUserId(hasher.hash(rawChannelUserId))
                .message(Message.builder()
                                 .timestamp(clock.millis())
                                 .role(Objects.requireNonNullElse(role, MessageRole.USER))
                                 .text(text)
                                 .summary(Strings.isNullOrEmpty(summary) ? defaultSummary(text) : summary)
                                 .build())
                .metadata(Objects.requireNonNullElse(metadata, SessionMetadata.EMPTY))
                .build();
    }

    /**
     * Session id for a raw channel user id
     */
    public String sessionId(Channel channel, String rawChannelUserId) {
        if (Strings.isNullOrEmpty(rawChannelUserId) || rawChannelUserId.isBlank()) {
            throw ValidationException.blank("channel_user_id");
        }
        return SessionEnvelope.sessionId(channel, hasher.hash(rawChannelUserId));
    }

    public static String defaultSummary(String text) {
        return text.substring(0, Math.min(DEFAULT_SUMMARY_LENGTH, text.length()));
    }
}
