package com.phonepe.contextspace.core.pipeline;

import com.google.common.base.Strings;
import com.phonepe.contextspace.core.model.LongTermMemoryPoint;
import com.phonepe.contextspace.core.model.ShortTermRecord;
import com.phonepe.contextspace.core.model.ShortTermVectorPoint;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders retrieved memory as a markdown block for prompt injection
 */
@UtilityClass
public class MemoryBlockBuilder {
    public static final String EMPTY = "No previous context found.";

    static final int RECENT_MESSAGES = 5;
    static final int SIMILAR_SESSIONS = 5;

    public static String build(
            ShortTermRecord shortTerm,
            List<ShortTermVectorPoint> similarSessions,
            List<LongTermMemoryPoint> longTerm) {
        final var lines = new ArrayList<String>();
        if (shortTerm != null && !shortTerm.getMessages().isEmpty()) {
            lines.add("## Recent Conversation Context");
            final var messages = shortTerm.getMessages();
            messages.subList(Math.max(0, messages.size() - RECENT_MESSAGES), messages.size())
                    .forEach(message -> lines.add("- [%s] %s".formatted(
                            message.getRole().wireName(),
                            Strings.isNullOrEmpty(message.getSummary())
                            ? SessionEnvelopeBuilder.defaultSummary(message.getText())
                            : message.getSummary())));
        }
        if (!similarSessions.isEmpty()) {
            lines.add("\n## Similar Recent Interactions (%d found)".formatted(similarSessions.size()));
            for (int i = 0; i < Math.min(SIMILAR_SESSIONS, similarSessions.size()); i++) {
                final var point = similarSessions.get(i);
                lines.add("- %s session: %s".formatted(
                        point.getChannel() == null ? "unknown" : point.getChannel().getWireName(),
                        Strings.isNullOrEmpty(point.getSessionId()) ? "#" + (i + 1) : point.getSessionId()));
            }
        }
        if (!longTerm.isEmpty()) {
            lines.add("\n## Historical Context (%d memories)".formatted(longTerm.size()));
            longTerm.forEach(memory -> {
                lines.add("- " + memory.getSummary());
                if (memory.getEntities() != null && !memory.getEntities().isEmpty()) {
                    lines.add("  Entities: " + String.join(", ", memory.getEntities()));
                }
            });
        }
        return lines.isEmpty() ? EMPTY : String.join("\n", lines);
    }
}
