package com.phonepe.contextspace.core.intelligence.problem;

import com.phonepe.contextspace.core.intelligence.IntelligenceContext;
import com.phonepe.contextspace.core.model.ExtractedProblem;
import com.phonepe.contextspace.core.model.UrgencyScore;

import java.util.Optional;

/**
 * Detects and classifies a problem in a message. Returns empty if the message does not describe one.
 */
public interface ProblemExtractor {
    Optional<ExtractedProblem> extract(IntelligenceContext context, UrgencyScore urgency);
}
