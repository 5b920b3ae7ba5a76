package com.phonepe.contextspace.core.intelligence.urgency;

import com.phonepe.contextspace.core.intelligence.IntelligenceContext;
import com.phonepe.contextspace.core.model.MessageRole;
import com.phonepe.contextspace.core.model.UrgencyFactors;
import com.phonepe.contextspace.core.model.UrgencyLevel;
import com.phonepe.contextspace.core.model.UrgencyScore;
import com.phonepe.contextspace.core.utils.KeywordSet;
import com.phonepe.contextspace.core.utils.TextSimilarity;
import com.phonepe.contextspace.core.utils.VectorMath;
import lombok.extern.slf4j.Slf4j;

/**
 * Combines frustration, repetition, time sensitivity and escalation language into an urgency score.
 */
@Slf4j
public class KeywordUrgencyEstimator implements UrgencyEstimator {
    public static final double FRUSTRATION_WEIGHT = 0.35;
    public static final double REPETITION_WEIGHT = 0.30;
    public static final double TIME_SENSITIVITY_WEIGHT = 0.20;
    public static final double ESCALATION_WEIGHT = 0.15;

    static final double REPETITION_SIMILARITY = 0.30;

    static final KeywordSet TIME_SENSITIVE = KeywordSet.of(
            "urgent", "asap", "immediately", "now", "today", "deadline",
            "expired", "overdue", "late", "emergency", "critical", "important");

    static final KeywordSet ESCALATION = KeywordSet.of(
            "manager", "supervisor", "escalate", "complaint", "unacceptable", "terrible",
            "worst", "cancel", "refund", "legal", "sue", "lawyer");

    @Override
    public UrgencyScore estimate(IntelligenceContext context) {
        final var factors = UrgencyFactors.builder()
                .frustration(frustration(context))
                .repetition(repetition(context))
                .timeSensitivity(Math.min(1.0, TIME_SENSITIVE.count(context.text()) * 0.2))
                .escalationKeywords(Math.min(1.0, ESCALATION.count(context.text()) * 0.25))
                .build();
        final var score = VectorMath.clamp(factors.getFrustration() * FRUSTRATION_WEIGHT
                                                   + factors.getRepetition() * REPETITION_WEIGHT
                                                   + factors.getTimeSensitivity() * TIME_SENSITIVITY_WEIGHT
                                                   + factors.getEscalationKeywords() * ESCALATION_WEIGHT);
        final var level = level(score);
        log.debug("Urgency {} ({}) from factors {}", score, level, factors);
        return UrgencyScore.builder()
                .score(score)
                .level(level)
                .factors(factors)
                .build();
    }

    public static UrgencyLevel level(double score) {
        if (score >= 0.85) {
            return UrgencyLevel.CRITICAL;
        }
        if (score >= 0.6) {
            return UrgencyLevel.HIGH;
        }
        if (score >= 0.3) {
            return UrgencyLevel.MEDIUM;
        }
        return UrgencyLevel.LOW;
    }

    private static double frustration(IntelligenceContext context) {
        return Math.min(1.0, VectorMath.normalizedMagnitude(context.getEmbedding().getFrustrationVector()) * 2);
    }

    private static double repetition(IntelligenceContext context) {
        final var text = context.text();
        var repetition = 0.0;
        final var shortTerm = context.getShortTerm();
        if (shortTerm != null && shortTerm.getMessages().size() > 1) {
            final var similar = shortTerm.getMessages()
                    .stream()
                    .filter(message -> message.getRole() == MessageRole.USER)
                    .filter(message -> TextSimilarity.keywordOverlap(message.getText(), text) > REPETITION_SIMILARITY)
                    .count();
            repetition += Math.min(0.5, similar * 0.15);
        }
        final var similarHistorical = context.getLongTerm()
                .stream()
                .filter(memory -> TextSimilarity.keywordOverlap(memory.getSummary(), text) > REPETITION_SIMILARITY)
                .count();
        repetition += Math.min(0.5, similarHistorical * 0.1);
        return Math.min(1.0, repetition);
    }
}
