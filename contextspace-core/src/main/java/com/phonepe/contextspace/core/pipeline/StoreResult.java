package com.phonepe.contextspace.core.pipeline;

import com.phonepe.contextspace.core.model.EscalationTicket;
import com.phonepe.contextspace.core.model.ExtractedProblem;
import com.phonepe.contextspace.core.model.RecommendedAction;
import com.phonepe.contextspace.core.model.UrgencyScore;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of storing one turn
 */
@Value
@Builder
public class StoreResult {
    String sessionId;
    String pseudoUserId;
    long storedAt;
    UrgencyScore urgency;
    ExtractedProblem problem;
    boolean escalated;
    EscalationTicket escalationTicket;

    @Builder.Default
    List<RecommendedAction> recommendedActions = List.of();

    public Optional<ExtractedProblem> problem() {
        return Optional.ofNullable(problem);
    }

    public Optional<EscalationTicket> escalationTicket() {
        return Optional.ofNullable(escalationTicket);
    }
}
