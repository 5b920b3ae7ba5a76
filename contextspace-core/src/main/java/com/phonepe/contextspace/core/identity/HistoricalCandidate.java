package com.phonepe.contextspace.core.identity;

import com.phonepe.contextspace.core.model.LongTermMemoryPoint;
import com.phonepe.contextspace.core.model.ShortTermVectorPoint;
import lombok.Value;

/**
 * A previously stored interaction that the incoming session may belong to
 */
@Value
public class HistoricalCandidate {
    String pseudoUserId;
    float[] intentVector;

    public static HistoricalCandidate of(ShortTermVectorPoint point) {
        return new HistoricalCandidate(point.getPseudoUserId(), point.getIntentVector());
    }

    public static HistoricalCandidate of(LongTermMemoryPoint point) {
        return new HistoricalCandidate(point.getPseudoUserId(), point.getIntentVector());
    }
}
