package com.phonepe.contextspace.core.intelligence.escalation;

import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.EscalationPriority;
import com.phonepe.contextspace.core.model.EscalationReason;
import com.phonepe.contextspace.core.model.EscalationStatus;
import com.phonepe.contextspace.core.model.EscalationTicket;
import com.phonepe.contextspace.core.store.EscalationTicketStore;
import com.phonepe.contextspace.core.store.IdentityMapStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Aggregates escalation tickets for the admin view
 */
@Slf4j
public class EscalationAnalytics {
    public static final int DEFAULT_SCAN_LIMIT = 10_000;
    private static final long DAY = Duration.ofHours(24).toMillis();

    private final EscalationTicketStore tickets;
    private final IdentityMapStore identityMap;
    private final Clock clock;
    private final int scanLimit;

    public EscalationAnalytics(EscalationTicketStore tickets, IdentityMapStore identityMap, Clock clock) {
        this(tickets, identityMap, clock, DEFAULT_SCAN_LIMIT);
    }

    public EscalationAnalytics(
            EscalationTicketStore tickets,
            IdentityMapStore identityMap,
            Clock clock,
            int scanLimit) {
        this.tickets = tickets;
        this.identityMap = identityMap;
        this.clock = clock;
        this.scanLimit = scanLimit;
    }

    public EscalationStats stats() {
        final var all = tickets.tickets(EnumSet.allOf(EscalationStatus.class),
                                        EnumSet.allOf(EscalationPriority.class),
                                        scanLimit);
        final var open = all.stream()
                .filter(ticket -> ticket.getStatus() != EscalationStatus.RESOLVED)
                .toList();
        final var since = clock.millis() - DAY;
        final var createdLastDay = all.stream().filter(ticket -> ticket.getCreatedAt() >= since).count();
        final var resolvedLastDay = all.stream()
                .filter(ticket -> ticket.getStatus() == EscalationStatus.RESOLVED)
                .filter(ticket -> ticket.getResolvedAt() != null && ticket.getResolvedAt() >= since)
                .count();
        final var rate = createdLastDay > 0 ? (resolvedLastDay * 100.0) / createdLastDay : 0.0;
        final var stats = EscalationStats.builder()
                .total(all.size())
                .pending(all.stream().filter(ticket -> ticket.getStatus() == EscalationStatus.PENDING).count())
                .critical(open.stream()
                                  .filter(ticket -> ticket.getPriority().getRank() >= EscalationPriority.HIGH.getRank())
                                  .count())
                .resolved(all.size() - open.size())
                .resolutionRate24h(Math.round(rate * 100) / 100.0)
                .openByPriority(countBy(open, EscalationTicket::getPriority, EscalationPriority.class))
                .openByReason(countBy(open, EscalationTicket::getReason, EscalationReason.class))
                .openByChannel(countBy(open, EscalationTicket::getChannel, Channel.class))
                .uniqueUsers(identityMap.count())
                .build();
        log.debug("Escalation stats: {}", stats);
        return stats;
    }

    private static <E extends Enum<E>> Map<E, Long> countBy(
            List<EscalationTicket> tickets,
            Function<EscalationTicket, E> key,
            Class<E> type) {
        final var counts = new EnumMap<E, Long>(type);
        for (final var value : type.getEnumConstants()) {
            counts.put(value, 0L);
        }
        tickets.forEach(ticket -> counts.merge(key.apply(ticket), 1L, Long::sum));
        return counts;
    }
}
