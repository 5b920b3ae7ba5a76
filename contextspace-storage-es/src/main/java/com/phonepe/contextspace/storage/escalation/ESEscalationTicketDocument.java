package com.phonepe.contextspace.storage.escalation;

import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.EscalationPriority;
import com.phonepe.contextspace.core.model.EscalationReason;
import com.phonepe.contextspace.core.model.EscalationStatus;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.FieldNameConstants;
import lombok.extern.jackson.Jacksonized;

/**
 * Stored form of an escalation ticket. The priority rank is denormalized for sorting.
 */
@Value
@FieldNameConstants
@Builder
@Jacksonized
public class ESEscalationTicketDocument {
    String id;

    String problemId;

    String pseudoUserId;

    Channel channel;

    EscalationReason reason;

    EscalationPriority priority;

    int priorityRank;

    EscalationStatus status;

    long createdAt;

    String assignedTo;

    Long resolvedAt;

    String problemSummary;

    String conversationContext;
}
