package com.phonepe.contextspace.core.intelligence.escalation;

import com.google.common.annotations.VisibleForTesting;
import com.phonepe.contextspace.core.errors.ContextSpaceException;
import com.phonepe.contextspace.core.errors.InvalidStateTransitionException;
import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.EscalationPriority;
import com.phonepe.contextspace.core.model.EscalationReason;
import com.phonepe.contextspace.core.model.EscalationStatus;
import com.phonepe.contextspace.core.model.EscalationTicket;
import com.phonepe.contextspace.core.model.ExtractedProblem;
import com.phonepe.contextspace.core.model.UrgencyLevel;
import com.phonepe.contextspace.core.store.EscalationTicketStore;
import com.phonepe.contextspace.core.utils.KeywordSet;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides when a problem needs a human, creates the ticket and moves it through its lifecycle.
 * <p>
 * Ticket creation and updates propagate store failures. Listing degrades to an empty list.
 */
@Slf4j
public class EscalationManager {
    public static final int DEFAULT_PENDING_LIMIT = 50;
    public static final int DEFAULT_CRITICAL_LIMIT = 20;

    static final double CRITICAL_THRESHOLD = 0.7;
    static final int REPEAT_THRESHOLD = 3;
    static final KeywordSet USER_REQUEST = KeywordSet.of("manager", "supervisor");

    private static final Set<EscalationPriority> CRITICAL_PRIORITIES
            = EnumSet.of(EscalationPriority.URGENT, EscalationPriority.HIGH);
    private static final char[] ID_CHARS = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    private final EscalationTicketStore store;
    private final Clock clock;

    public EscalationManager(EscalationTicketStore store) {
        this(store, Clock.systemUTC());
    }

    public EscalationManager(EscalationTicketStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public boolean shouldEscalate(ExtractedProblem problem) {
        return reason(problem).isPresent();
    }

    /**
     * The first applicable reason, checked in order: agent cannot solve, critical, repeated, user request
     */
    public Optional<EscalationReason> reason(ExtractedProblem problem) {
        if (!problem.isCanAgentSolve()) {
            return Optional.of(EscalationReason.AGENT_CANNOT_SOLVE);
        }
        if (problem.getCriticality() >= CRITICAL_THRESHOLD) {
            return Optional.of(EscalationReason.CRITICAL_PROBLEM);
        }
        if (problem.getOccurrenceCount() >= REPEAT_THRESHOLD) {
            return Optional.of(EscalationReason.REPEATED_ISSUE);
        }
        if (USER_REQUEST.anyIn(problem.getDescription())) {
            return Optional.of(EscalationReason.USER_REQUEST);
        }
        return Optional.empty();
    }

    public EscalationPriority priority(ExtractedProblem problem) {
        final var level = problem.getUrgency().getLevel();
        final var criticality = problem.getCriticality();
        if (level == UrgencyLevel.CRITICAL || criticality >= 0.9) {
            return EscalationPriority.URGENT;
        }
        if (level == UrgencyLevel.HIGH || criticality >= 0.7) {
            return EscalationPriority.HIGH;
        }
        if (level == UrgencyLevel.MEDIUM || criticality >= 0.5) {
            return EscalationPriority.MEDIUM;
        }
        return EscalationPriority.LOW;
    }

    /**
     * Creates and durably stores a ticket if the problem warrants one
     *
     * @return The stored ticket, empty if no escalation is needed
     * @throws ContextSpaceException if the ticket could not be stored
     */
    public Optional<EscalationTicket> escalate(
            ExtractedProblem problem,
            String pseudoUserId,
            Channel channel,
            String conversationContext) {
        return reason(problem)
                .map(reason -> createTicket(problem, reason, pseudoUserId, channel, conversationContext));
    }

    public EscalationTicket createTicket(
            ExtractedProblem problem,
            EscalationReason reason,
            String pseudoUserId,
            Channel channel,
            String conversationContext) {
        final var now = clock.millis();
        final var ticket = EscalationTicket.builder()
                .id(ticketId(now))
                .problemId(problem.getId())
                .pseudoUserId(pseudoUserId)
                .channel(channel)
                .reason(reason)
                .priority(priority(problem))
                .status(EscalationStatus.PENDING)
                .createdAt(now)
                .problemSummary(problem.getSummary())
                .conversationContext(conversationContext)
                .build();
        try {
            store.save(ticket);
        }
        catch (Exception e) {
            log.error("Failed to store escalation ticket {}: {}", ticket.getId(), e.getMessage());
            throw ContextSpaceException.escalationStoreFailure(e);
        }
        log.info("Created escalation ticket {} for problem {} with priority {} and reason {}",
                 ticket.getId(), problem.getId(), ticket.getPriority(), reason);
        return ticket;
    }

    public List<EscalationTicket> pendingEscalations() {
        return pendingEscalations(DEFAULT_PENDING_LIMIT);
    }

    public List<EscalationTicket> pendingEscalations(int limit) {
        return list("pending", EnumSet.of(EscalationStatus.PENDING), EnumSet.allOf(EscalationPriority.class), limit);
    }

    public List<EscalationTicket> criticalEscalations() {
        return criticalEscalations(DEFAULT_CRITICAL_LIMIT);
    }

    /**
     * Open tickets with urgent or high priority
     */
    public List<EscalationTicket> criticalEscalations(int limit) {
        return list("critical", EscalationStatus.OPEN, CRITICAL_PRIORITIES, limit);
    }

    /**
     * Moves a ticket forward in its lifecycle. Skipping states is allowed, going back is not.
     *
     * @param assignedTo Optional assignee, kept unchanged if null
     * @return The updated ticket
     */
    public EscalationTicket updateStatus(String ticketId, EscalationStatus status, String assignedTo) {
        final var existing = store.ticket(ticketId)
                .orElseThrow(() -> ContextSpaceException.notFound("Escalation ticket " + ticketId));
        if (!existing.getStatus().canMoveTo(status)) {
            throw new InvalidStateTransitionException(ticketId, existing.getStatus(), status);
        }
        final var builder = existing.toBuilder().status(status);
        if (assignedTo != null) {
            builder.assignedTo(assignedTo);
        }
        if (status == EscalationStatus.RESOLVED) {
            builder.resolvedAt(clock.millis());
        }
        final var updated = builder.build();
        store.update(updated);
        log.info("Escalation ticket {} moved from {} to {}", ticketId, existing.getStatus(), status);
        return updated;
    }

    private List<EscalationTicket> list(
            String what,
            Set<EscalationStatus> statuses,
            Set<EscalationPriority> priorities,
            int limit) {
        try {
            return store.tickets(statuses, priorities, limit);
        }
        catch (Exception e) {
            log.warn("Failed to list {} escalations: {}", what, e.getMessage());
            return List.of();
        }
    }

    @VisibleForTesting
    static String ticketId(long now) {
        final var random = ThreadLocalRandom.current();
        final var suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(ID_CHARS[random.nextInt(ID_CHARS.length)]);
        }
        return "ESC-%d-%s".formatted(now, suffix);
    }
}
