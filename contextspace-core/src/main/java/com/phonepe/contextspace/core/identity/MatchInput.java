package com.phonepe.contextspace.core.identity;

import com.phonepe.contextspace.core.model.Message;
import com.phonepe.contextspace.core.model.MultiVectorEmbedding;
import com.phonepe.contextspace.core.model.SessionMetadata;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything known about the incoming turn and its possible history. Candidates are expected in
 * relevance order; the first one supplies the pseudo user id on a match.
 */
@Value
@Builder
public class MatchInput {
    MultiVectorEmbedding embedding;

    SessionMetadata metadata;

    @Singular
    List<Message> currentMessages;

    @Singular
    List<HistoricalCandidate> historicalCandidates;

    SessionMetadata historicalMetadata;

    @Singular
    List<String> historicalMessages;
}
