package com.phonepe.contextspace.core.intelligence.escalation;

import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.EscalationPriority;
import com.phonepe.contextspace.core.model.EscalationReason;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Point in time view of the escalation queue. Breakdowns only count tickets that are not resolved.
 */
@Value
@Builder
@Jacksonized
public class EscalationStats {
    long total;
    long pending;
    long critical;
    long resolved;

    /**
     * Tickets resolved in the last 24 hours as a percentage of tickets created in that window
     */
    double resolutionRate24h;

    Map<EscalationPriority, Long> openByPriority;
    Map<EscalationReason, Long> openByReason;
    Map<Channel, Long> openByChannel;
    long uniqueUsers;
}
