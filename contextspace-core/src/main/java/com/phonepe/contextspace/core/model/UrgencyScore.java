package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Combined urgency of a message
 */
@Value
@Builder
@Jacksonized
public class UrgencyScore {
    double score;
    UrgencyLevel level;
    UrgencyFactors factors;

    /**
     * Sort key for queues: level dominates, score breaks ties.
     */
    public double priorityRank() {
        return level.getRank() * 1000 + score * 100;
    }
}
