package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;

/**
 * A problem detected in a user message along with how critical it is
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ExtractedProblem {
    String id;
    String summary;
    String description;
    ProblemCategory category;
    double criticality;
    boolean canAgentSolve;
    List<String> entities;
    UrgencyScore urgency;
    long firstSeen;
    long lastSeen;
    int occurrenceCount;
    Set<Channel> channels;
}
