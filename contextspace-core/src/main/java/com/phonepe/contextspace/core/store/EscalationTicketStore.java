package com.phonepe.contextspace.core.store;

import com.phonepe.contextspace.core.model.EscalationPriority;
import com.phonepe.contextspace.core.model.EscalationStatus;
import com.phonepe.contextspace.core.model.EscalationTicket;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable storage for escalation tickets
 */
public interface EscalationTicketStore {
    /**
     * Queue order: highest priority first, oldest first within a priority
     */
    Comparator<EscalationTicket> QUEUE_ORDER = Comparator
            .comparing((EscalationTicket ticket) -> ticket.getPriority().getRank())
            .reversed()
            .thenComparingLong(EscalationTicket::getCreatedAt)
            .thenComparing(EscalationTicket::getId);

    void save(EscalationTicket ticket);

    Optional<EscalationTicket> ticket(String ticketId);

    void update(EscalationTicket ticket);

    /**
     * Tickets matching any of the given statuses and priorities, in {@link #QUEUE_ORDER}
     */
    List<EscalationTicket> tickets(Set<EscalationStatus> statuses, Set<EscalationPriority> priorities, int limit);
}
