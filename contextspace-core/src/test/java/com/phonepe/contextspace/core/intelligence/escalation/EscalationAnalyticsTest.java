package com.phonepe.contextspace.core.intelligence.escalation;

import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.EscalationPriority;
import com.phonepe.contextspace.core.model.EscalationReason;
import com.phonepe.contextspace.core.model.EscalationStatus;
import com.phonepe.contextspace.core.model.ProblemCategory;
import com.phonepe.contextspace.core.store.IdentityMapStore;
import com.phonepe.contextspace.core.store.memory.InMemoryEscalationTicketStore;
import com.phonepe.contextspace.core.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.phonepe.contextspace.core.intelligence.IntelligenceTestSupport.problem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EscalationAnalyticsTest {

    @Test
    void testStats() {
        final var clock = new TestUtils.TickingClock(1_700_000_000_000L);
        final var store = new InMemoryEscalationTicketStore();
        final var identityMap = mock(IdentityMapStore.class);
        when(identityMap.count()).thenReturn(7L);
        final var manager = new EscalationManager(store, clock);
        final var analytics = new EscalationAnalytics(store, identityMap, clock);

        final var urgent = manager.escalate(problem(ProblemCategory.OTHER, "a", 0.95, false, 0.5),
                                            "U1", Channel.WEB, "").orElseThrow();
        manager.escalate(problem(ProblemCategory.OTHER, "b", 0.75, true, 0.1), "U2", Channel.EMAIL, "")
                .orElseThrow();
        final var low = manager.escalate(problem(ProblemCategory.OTHER, "c", 0.1, false, 0.1),
                                         "U3", Channel.EMAIL, "").orElseThrow();
        manager.updateStatus(urgent.getId(), EscalationStatus.RESOLVED, "agent-1");
        manager.updateStatus(low.getId(), EscalationStatus.ASSIGNED, "agent-2");

        final var stats = analytics.stats();
        assertEquals(3, stats.getTotal());
        assertEquals(1, stats.getPending());
        assertEquals(1, stats.getResolved());
        assertEquals(1, stats.getCritical());
        assertEquals(33.33, stats.getResolutionRate24h(), 1e-9);
        assertEquals(0L, stats.getOpenByPriority().get(EscalationPriority.URGENT));
        assertEquals(1L, stats.getOpenByPriority().get(EscalationPriority.HIGH));
        assertEquals(1L, stats.getOpenByPriority().get(EscalationPriority.LOW));
        assertEquals(1L, stats.getOpenByReason().get(EscalationReason.CRITICAL_PROBLEM));
        assertEquals(1L, stats.getOpenByReason().get(EscalationReason.AGENT_CANNOT_SOLVE));
        assertEquals(2L, stats.getOpenByChannel().get(Channel.EMAIL));
        assertEquals(0L, stats.getOpenByChannel().get(Channel.WEB));
        assertEquals(7L, stats.getUniqueUsers());

        clock.advance(Duration.ofDays(2).toMillis());
        assertEquals(0.0, analytics.stats().getResolutionRate24h());
    }
}
