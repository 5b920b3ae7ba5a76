package com.phonepe.contextspace.core.intelligence.urgency;

import com.phonepe.contextspace.core.intelligence.IntelligenceContext;
import com.phonepe.contextspace.core.model.UrgencyScore;

/**
 * Estimates how urgently a message needs attention
 */
public interface UrgencyEstimator {
    UrgencyScore estimate(IntelligenceContext context);
}
