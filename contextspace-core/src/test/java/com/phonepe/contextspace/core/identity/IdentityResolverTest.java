package com.phonepe.contextspace.core.identity;

import com.phonepe.contextspace.core.hashing.Sha256IdentifierHasher;
import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.LinkedSession;
import com.phonepe.contextspace.core.model.SessionMetadata;
import com.phonepe.contextspace.core.store.IdentityMapStore;
import com.phonepe.contextspace.core.store.memory.InMemoryIdentityMapStore;
import com.phonepe.contextspace.core.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IdentityResolverTest {
    private static final String KNOWN_USER = "0A1B2C3D-0000-1111-2222-333344445555";
    private static final SessionMetadata METADATA = SessionMetadata.builder()
            .ip("10.0.0.1")
            .geo("IN")
            .lang("en")
            .build();

    private static MatchSignal constant(double value) {
        return new MatchSignal() {
            @Override
            public String name() {
                return "constant";
            }

            @Override
            public double score(MatchInput input) {
                return value;
            }
        };
    }

    private static MatchInput.MatchInputBuilder inputWithCandidate(float[] incoming, float[] historical) {
        return MatchInput.builder()
                .embedding(TestUtils.calmEmbedding(incoming))
                .currentMessage(TestUtils.userMessage("Where is my order AB123?", 1L))
                .historicalCandidate(new HistoricalCandidate(KNOWN_USER, historical))
                .historicalCandidate(new HistoricalCandidate("SOMEONE-ELSE", historical));
    }

    @Test
    void testMintsWellFormedIdsWithoutHistory() {
        final var resolver = IdentityResolver.builder()
                .identityMap(new InMemoryIdentityMapStore())
                .build();
        final var ids = new HashSet<String>();
        IntStream.range(0, 1000).forEach(i -> {
            final var resolution = resolver.resolveWithScore(MatchInput.builder()
                                                                     .embedding(TestUtils.calmEmbedding(1, 0))
                                                                     .build());
            assertTrue(resolution.isMinted());
            assertEquals(1.0, resolution.linkConfidence());
            assertTrue(SecurePseudoUserIdGenerator.FORMAT.matcher(resolution.getPseudoUserId()).matches());
            ids.add(resolution.getPseudoUserId());
        });
        assertEquals(1000, ids.size());
    }

    @Test
    void testMatchesFirstCandidateWhenEverySignalAgrees() {
        final var resolver = IdentityResolver.builder()
                .identityMap(new InMemoryIdentityMapStore())
                .build();
        final var input = inputWithCandidate(new float[]{1, 0, 0, 0}, new float[]{1, 0, 0, 0})
                .metadata(METADATA)
                .historicalMetadata(METADATA)
                .historicalMessage("Where is my order AB123?")
                .build();
        final var resolution = resolver.resolveWithScore(input);
        assertFalse(resolution.isMinted());
        assertEquals(KNOWN_USER, resolution.getPseudoUserId());
        assertEquals(1.0, resolution.getMatchScore(), 1e-6);
        assertEquals(resolution.getMatchScore(), resolution.linkConfidence());
    }

    @Test
    void testMintsWhenVectorsAreOrthogonalAndNothingElseIsKnown() {
        final var resolver = IdentityResolver.builder()
                .identityMap(new InMemoryIdentityMapStore())
                .build();
        final var input = inputWithCandidate(new float[]{1, 0, 0, 0}, new float[]{0, 1, 0, 0}).build();
        assertEquals(0.0, resolver.matchScore(input), 1e-9);
        final var resolution = resolver.resolveWithScore(input);
        assertTrue(resolution.isMinted());
        assertTrue(SecurePseudoUserIdGenerator.FORMAT.matcher(resolution.getPseudoUserId()).matches());
    }

    @Test
    void testOpposedVectorsScoreZero() {
        final var resolver = IdentityResolver.builder()
                .identityMap(new InMemoryIdentityMapStore())
                .build();
        final var input = inputWithCandidate(new float[]{1, 0}, new float[]{-1, 0}).build();
        assertEquals(0.0, resolver.matchScore(input), 1e-9);
        assertTrue(resolver.resolveWithScore(input).isMinted());
    }

    @Test
    void testThresholdIsExclusive() {
        final var input = inputWithCandidate(new float[]{1, 0}, new float[]{1, 0}).build();
        final var atThreshold = IdentityResolver.builder()
                .identityMap(new InMemoryIdentityMapStore())
                .signals(List.of(new WeightedSignal(constant(0.82), 1.0)))
                .idGenerator(() -> "MINTED")
                .build();
        assertEquals("MINTED", atThreshold.resolve(input));

        final var aboveThreshold = IdentityResolver.builder()
                .identityMap(new InMemoryIdentityMapStore())
                .signals(List.of(new WeightedSignal(constant(0.9), 1.0)))
                .idGenerator(() -> "MINTED")
                .build();
        assertEquals(KNOWN_USER, aboveThreshold.resolve(input));
    }

    @Test
    void testSignalFailureMintsNewId() {
        final var failing = mock(MatchSignal.class);
        when(failing.name()).thenReturn("failing");
        when(failing.score(any())).thenThrow(new IllegalStateException("boom"));
        final var resolver = IdentityResolver.builder()
                .identityMap(new InMemoryIdentityMapStore())
                .signals(List.of(new WeightedSignal(failing, 1.0)))
                .idGenerator(() -> "MINTED")
                .build();
        final var resolution = resolver.resolveWithScore(
                inputWithCandidate(new float[]{1, 0}, new float[]{1, 0}).build());
        assertEquals("MINTED", resolution.getPseudoUserId());
        assertTrue(resolution.isMinted());
    }

    @Test
    void testLinkingOnlyRaisesConfidence() {
        final var store = new InMemoryIdentityMapStore();
        final var resolver = IdentityResolver.builder()
                .identityMap(store)
                .build();
        resolver.linkToMap(KNOWN_USER, Channel.WEB, "cookie-1", 0.7);
        resolver.linkToMap(KNOWN_USER, Channel.WEB, "cookie-1", 0.9);
        final var entry = resolver.linkToMap(KNOWN_USER, Channel.WEB, "cookie-1", 0.5).orElseThrow();

        assertEquals(1, entry.getLinkedSessions().size());
        final var link = entry.getLinkedSessions().get(0);
        assertEquals(0.9, link.getConfidence());
        assertEquals(new Sha256IdentifierHasher().hash("cookie-1"), link.getHashedChannelUserId());
        assertEquals(KNOWN_USER, resolver.findPseudoUserId(Channel.WEB, "cookie-1").orElseThrow());
        assertTrue(resolver.findPseudoUserId(Channel.EMAIL, "cookie-1").isEmpty());
    }

    @Test
    void testSessionStaysWithFirstOwner() {
        final var resolver = IdentityResolver.builder()
                .identityMap(new InMemoryIdentityMapStore())
                .build();
        resolver.linkToMap(KNOWN_USER, Channel.WHATSAPP, "+911234567890", 1.0);
        final var entry = resolver.linkToMap("OTHER", Channel.WHATSAPP, "+911234567890", 1.0).orElseThrow();
        assertEquals(KNOWN_USER, entry.getPseudoUserId());
    }

    @Test
    void testLinkFailureIsSwallowed() {
        final var store = mock(IdentityMapStore.class);
        when(store.link(anyString(), any(LinkedSession.class))).thenThrow(new IllegalStateException("down"));
        final var resolver = IdentityResolver.builder()
                .identityMap(store)
                .build();
        assertTrue(resolver.linkToMap(KNOWN_USER, Channel.X, "handle", 1.0).isEmpty());
    }
}
