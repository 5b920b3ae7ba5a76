package com.phonepe.contextspace.core.store.memory;

import com.phonepe.contextspace.core.errors.ContextSpaceException;
import com.phonepe.contextspace.core.errors.StoreType;
import com.phonepe.contextspace.core.model.EscalationPriority;
import com.phonepe.contextspace.core.model.EscalationStatus;
import com.phonepe.contextspace.core.model.EscalationTicket;
import com.phonepe.contextspace.core.store.EscalationTicketStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEscalationTicketStore implements EscalationTicketStore {
    private final Map<String, EscalationTicket> tickets = new ConcurrentHashMap<>();

    @Override
    public void save(EscalationTicket ticket) {
        if (tickets.putIfAbsent(ticket.getId(), ticket) != null) {
            throw ContextSpaceException.writeFailure(StoreType.ESCALATIONS,
                                                     "Ticket %s already exists".formatted(ticket.getId()));
        }
    }

    @Override
    public Optional<EscalationTicket> ticket(String ticketId) {
        return Optional.ofNullable(tickets.get(ticketId));
    }

    @Override
    public void update(EscalationTicket ticket) {
        if (tickets.replace(ticket.getId(), ticket) == null) {
            throw ContextSpaceException.notFound("Ticket " + ticket.getId());
        }
    }

    @Override
    public List<EscalationTicket> tickets(
            Set<EscalationStatus> statuses,
            Set<EscalationPriority> priorities,
            int limit) {
        return tickets.values()
                .stream()
                .filter(ticket -> statuses.contains(ticket.getStatus()))
                .filter(ticket -> priorities.contains(ticket.getPriority()))
                .sorted(QUEUE_ORDER)
                .limit(limit)
                .toList();
    }
}
