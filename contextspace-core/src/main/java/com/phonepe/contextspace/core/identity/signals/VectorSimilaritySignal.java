package com.phonepe.contextspace.core.identity.signals;

import com.phonepe.contextspace.core.identity.MatchInput;
import com.phonepe.contextspace.core.identity.MatchSignal;
import com.phonepe.contextspace.core.utils.VectorMath;

/**
 * Mean cosine similarity between the incoming intent vector and every candidate's intent vector, clamped to [0, 1]
 */
public class VectorSimilaritySignal implements MatchSignal {
    @Override
    public String name() {
        return "vector";
    }

    @Override
    public double score(MatchInput input) {
        final var candidates = input.getHistoricalCandidates();
        if (candidates.isEmpty() || input.getEmbedding() == null) {
            return 0.0;
        }
        final var incoming = input.getEmbedding().getIntentVector();
        return VectorMath.clamp(candidates.stream()
                                        .mapToDouble(candidate -> VectorMath.cosineSimilarity(
                                                incoming, candidate.getIntentVector()))
                                        .average()
                                        .orElse(0.0));
    }
}
