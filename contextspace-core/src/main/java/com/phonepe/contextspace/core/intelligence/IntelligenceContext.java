package com.phonepe.contextspace.core.intelligence;

import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.LongTermMemoryPoint;
import com.phonepe.contextspace.core.model.Message;
import com.phonepe.contextspace.core.model.MultiVectorEmbedding;
import com.phonepe.contextspace.core.model.ShortTermRecord;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Inputs to the intelligence layer for one turn: the new message and the history read before it
 */
@Value
@Builder
public class IntelligenceContext {
    @NonNull
    Channel channel;

    String pseudoUserId;

    @NonNull
    Message message;

    @NonNull
    MultiVectorEmbedding embedding;

    /**
     * Session state as it was before this turn, null for a new session
     */
    ShortTermRecord shortTerm;

    @Builder.Default
    List<LongTermMemoryPoint> longTerm = List.of();

    public Optional<ShortTermRecord> shortTerm() {
        return Optional.ofNullable(shortTerm);
    }

    public String text() {
        return message.getText();
    }
}
