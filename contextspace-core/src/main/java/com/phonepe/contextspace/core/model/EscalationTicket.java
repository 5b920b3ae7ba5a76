package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A problem handed over to a human agent
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EscalationTicket {
    String id;
    String problemId;
    String pseudoUserId;
    Channel channel;
    EscalationReason reason;
    EscalationPriority priority;
    EscalationStatus status;
    long createdAt;
    String assignedTo;
    Long resolvedAt;
    String problemSummary;
    String conversationContext;
}
