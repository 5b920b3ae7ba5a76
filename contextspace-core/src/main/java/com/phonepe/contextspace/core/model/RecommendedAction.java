package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * An action the agent could take for a problem. Actions that are not auto executable need a manual
 * approval before they are run.
 */
@Value
@Builder
@Jacksonized
public class RecommendedAction {
    String id;
    ActionType type;
    String description;
    double confidence;
    double priority;
    boolean canAutoExecute;
    Map<String, String> executionParams;

    public double rankingScore() {
        return priority * 0.6 + confidence * 0.4;
    }
}
