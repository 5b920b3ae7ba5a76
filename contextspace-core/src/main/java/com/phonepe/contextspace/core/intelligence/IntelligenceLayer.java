package com.phonepe.contextspace.core.intelligence;

import com.phonepe.contextspace.core.intelligence.action.ActionRecommender;
import com.phonepe.contextspace.core.intelligence.action.CategoryActionRecommender;
import com.phonepe.contextspace.core.intelligence.escalation.EscalationManager;
import com.phonepe.contextspace.core.intelligence.problem.KeywordProblemExtractor;
import com.phonepe.contextspace.core.intelligence.problem.ProblemExtractor;
import com.phonepe.contextspace.core.intelligence.urgency.KeywordUrgencyEstimator;
import com.phonepe.contextspace.core.intelligence.urgency.UrgencyEstimator;
import com.phonepe.contextspace.core.model.Message;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs urgency estimation, problem extraction, escalation and action recommendation in sequence.
 * Each stage consumes the output of the previous one.
 */
@Slf4j
public class IntelligenceLayer {
    private final UrgencyEstimator urgencyEstimator;
    private final ProblemExtractor problemExtractor;
    private final EscalationManager escalationManager;
    private final ActionRecommender actionRecommender;

    @Builder
    public IntelligenceLayer(
            UrgencyEstimator urgencyEstimator,
            ProblemExtractor problemExtractor,
            @NonNull EscalationManager escalationManager,
            ActionRecommender actionRecommender) {
        this.urgencyEstimator = Objects.requireNonNullElseGet(urgencyEstimator, KeywordUrgencyEstimator::new);
        this.problemExtractor = Objects.requireNonNullElseGet(problemExtractor, KeywordProblemExtractor::new);
        this.escalationManager = escalationManager;
        this.actionRecommender = Objects.requireNonNullElseGet(actionRecommender, CategoryActionRecommender::new);
    }

    /**
     * Analyses the turn. A ticket, if needed, is stored before this returns.
     *
     * @throws com.phonepe.contextspace.core.errors.ContextSpaceException if an escalation ticket could not be stored
     */
    public IntelligenceReport analyze(IntelligenceContext context) {
        final var urgency = urgencyEstimator.estimate(context);
        final var report = IntelligenceReport.builder().urgency(urgency);
        final var problem = problemExtractor.extract(context, urgency).orElse(null);
        if (problem == null) {
            return report.build();
        }
        report.problem(problem);
        escalationManager.escalate(problem, context.getPseudoUserId(), context.getChannel(), conversation(context))
                .ifPresent(ticket -> {
                    log.info("Problem {} escalated with urgency {}", problem.getId(), urgency.getLevel());
                    report.escalationTicket(ticket);
                });
        return report
                .recommendedActions(actionRecommender.recommend(problem, urgency))
                .build();
    }

    private static String conversation(IntelligenceContext context) {
        return context.shortTerm()
                .filter(shortTerm -> !shortTerm.getMessages().isEmpty())
                .map(shortTerm -> shortTerm.getMessages()
                        .stream()
                        .map(Message::getText)
                        .collect(Collectors.joining(" ")))
                .orElse(context.text());
    }
}
