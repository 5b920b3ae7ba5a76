package com.phonepe.contextspace.core.intelligence;

import com.phonepe.contextspace.core.model.EscalationTicket;
import com.phonepe.contextspace.core.model.ExtractedProblem;
import com.phonepe.contextspace.core.model.RecommendedAction;
import com.phonepe.contextspace.core.model.UrgencyScore;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * What the intelligence layer concluded about one turn
 */
@Value
@Builder
public class IntelligenceReport {
    UrgencyScore urgency;
    ExtractedProblem problem;
    EscalationTicket escalationTicket;

    @Builder.Default
    List<RecommendedAction> recommendedActions = List.of();

    public Optional<ExtractedProblem> problem() {
        return Optional.ofNullable(problem);
    }

    public Optional<EscalationTicket> escalationTicket() {
        return Optional.ofNullable(escalationTicket);
    }

    public boolean isEscalated() {
        return escalationTicket != null;
    }
}
