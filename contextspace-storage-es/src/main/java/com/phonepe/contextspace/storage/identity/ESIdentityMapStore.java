package com.phonepe.contextspace.storage.identity;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.phonepe.contextspace.core.errors.ContextSpaceException;
import com.phonepe.contextspace.core.errors.StoreType;
import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.IdentityMapEntry;
import com.phonepe.contextspace.core.model.LinkedSession;
import com.phonepe.contextspace.core.store.IdentityMapStore;
import com.phonepe.contextspace.storage.ESClient;
import com.phonepe.contextspace.storage.ESIndices;
import com.phonepe.contextspace.storage.IndexSettings;
import lombok.Builder;
import lombok.NonNull;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Identity map backed by two elasticsearch indices.
 * <p>
 * Ownership of a channel identity is claimed by creating a document keyed on the identity, which
 * elasticsearch allows only once. Entries are then updated with optimistic concurrency control on the
 * sequence number, retrying on conflict, so concurrent links never lose updates.
 */
@Slf4j
public class ESIdentityMapStore implements IdentityMapStore {
    private static final String ENTRIES_INDEX = "identity-map";
    private static final String CLAIMS_INDEX = "identity-claims";
    private static final int DEFAULT_MAX_ATTEMPTS = 5;

    private final ESClient client;
    private final String entriesIndex;
    private final String claimsIndex;
    private final Clock clock;
    private final int maxAttempts;

    @Builder
    public ESIdentityMapStore(
            @NonNull ESClient client,
            String indexPrefix,
            IndexSettings indexSettings,
            Clock clock,
            int maxAttempts) {
        this.client = client;
        this.entriesIndex = ESIndices.indexName(indexPrefix, ENTRIES_INDEX);
        this.claimsIndex = ESIndices.indexName(indexPrefix, CLAIMS_INDEX);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.maxAttempts = maxAttempts > 0 ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
        final var settings = Objects.requireNonNullElse(indexSettings, IndexSettings.DEFAULT);
        ESIndices.ensureIndex(client, entriesIndex, settings, mapping -> mapping
                .properties(ESIdentityMapDocument.Fields.pseudoUserId, p -> p.keyword(t -> t))
                .properties(ESIdentityMapDocument.Fields.linkedSessions, p -> p.object(o -> o.enabled(false)))
                .properties(ESIdentityMapDocument.Fields.updatedAt, p -> p.long_(t -> t)));
        ESIndices.ensureIndex(client, claimsIndex, settings, mapping -> mapping
                .properties(ESSessionClaimDocument.Fields.channel, p -> p.keyword(t -> t))
                .properties(ESSessionClaimDocument.Fields.hashedChannelUserId, p -> p.keyword(t -> t))
                .properties(ESSessionClaimDocument.Fields.pseudoUserId, p -> p.keyword(t -> t))
                .properties(ESSessionClaimDocument.Fields.claimedAt, p -> p.long_(t -> t)));
    }

    @Override
    @SneakyThrows
    public Optional<IdentityMapEntry> findByPseudoUserId(String pseudoUserId) {
        final var doc = client.getElasticsearchClient()
                .get(g -> g.index(entriesIndex).id(pseudoUserId), ESIdentityMapDocument.class);
        if (doc.found() && doc.source() != null) {
            return Optional.of(toWire(doc.source()));
        }
        return Optional.empty();
    }

    @Override
    public Optional<IdentityMapEntry> findByLinkedSession(Channel channel, String hashedChannelUserId) {
        return owner(channel, hashedChannelUserId)
                .flatMap(this::findByPseudoUserId);
    }

    @Override
    public IdentityMapEntry link(String pseudoUserId, LinkedSession session) {
        final var owner = claim(pseudoUserId, session);
        final var now = clock.millis();
        if (!owner.equals(pseudoUserId)) {
            log.debug("Session {}:{} already belongs to {}, not linking to {}",
                      session.getChannel(), session.getHashedChannelUserId(), owner, pseudoUserId);
            //The owner's own link call may still be in flight
            return findByPseudoUserId(owner)
                    .orElseGet(() -> IdentityMapEntry.create(owner, session, now));
        }
        return addLink(pseudoUserId, session);
    }

    @Override
    @SneakyThrows
    public List<String> pseudoUserIds(int limit) {
        return client.getElasticsearchClient()
                .search(s -> s.index(entriesIndex)
                                .query(q -> q.matchAll(m -> m))
                                .sort(so -> so.field(f -> f.field(ESIdentityMapDocument.Fields.pseudoUserId)
                                        .order(SortOrder.Asc)))
                                .size(limit),
                        ESIdentityMapDocument.class)
                .hits()
                .hits()
                .stream()
                .map(Hit::source)
                .filter(Objects::nonNull)
                .map(ESIdentityMapDocument::getPseudoUserId)
                .toList();
    }

    @Override
    @SneakyThrows
    public long count() {
        return client.getElasticsearchClient()
                .count(c -> c.index(entriesIndex))
                .count();
    }

    /**
     * Claims the session for the pseudo user unless someone else got there first
     *
     * @return The owner of the session after the claim
     */
    @SneakyThrows
    private String claim(String pseudoUserId, LinkedSession session) {
        final var claimId = claimId(session.getChannel(), session.getHashedChannelUserId());
        final var claimDocument = ESSessionClaimDocument.builder()
                .channel(session.getChannel())
                .hashedChannelUserId(session.getHashedChannelUserId())
                .pseudoUserId(pseudoUserId)
                .claimedAt(clock.millis())
                .build();
        try {
            client.getElasticsearchClient()
                    .create(c -> c.index(claimsIndex)
                            .id(claimId)
                            .document(claimDocument)
                            .refresh(Refresh.True));
            log.debug("Session {} claimed by {}", claimId, pseudoUserId);
            return pseudoUserId;
        }
        catch (ElasticsearchException e) {
            if (!ESIndices.hasStatus(e, ESIndices.CONFLICT)) {
                throw e;
            }
            return owner(session.getChannel(), session.getHashedChannelUserId())
                    .orElseThrow(() -> ContextSpaceException.writeFailure(
                            StoreType.IDENTITY_MAP, "Claim %s exists but could not be read".formatted(claimId)));
        }
    }

    @SneakyThrows
    private Optional<String> owner(Channel channel, String hashedChannelUserId) {
        final var doc = client.getElasticsearchClient()
                .get(g -> g.index(claimsIndex).id(claimId(channel, hashedChannelUserId)),
                     ESSessionClaimDocument.class);
        if (doc.found() && doc.source() != null) {
            return Optional.ofNullable(doc.source().getPseudoUserId());
        }
        return Optional.empty();
    }

    @SneakyThrows
    private IdentityMapEntry addLink(String pseudoUserId, LinkedSession session) {
        final var elasticsearchClient = client.getElasticsearchClient();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            final var now = clock.millis();
            final var current = elasticsearchClient
                    .get(g -> g.index(entriesIndex).id(pseudoUserId), ESIdentityMapDocument.class);
            try {
                if (!current.found() || current.source() == null) {
                    final var created = IdentityMapEntry.create(pseudoUserId, session, now);
                    elasticsearchClient.create(c -> c.index(entriesIndex)
                            .id(pseudoUserId)
                            .document(toStored(created))
                            .refresh(Refresh.True));
                    return created;
                }
                final var updated = toWire(current.source()).withLink(session, now);
                elasticsearchClient.index(i -> i.index(entriesIndex)
                        .id(pseudoUserId)
                        .document(toStored(updated))
                        .ifSeqNo(current.seqNo())
                        .ifPrimaryTerm(current.primaryTerm())
                        .refresh(Refresh.True));
                return updated;
            }
            catch (ElasticsearchException e) {
                if (!ESIndices.hasStatus(e, ESIndices.CONFLICT)) {
                    throw e;
                }
                log.debug("Concurrent update on identity map entry {}. Attempt {} of {}",
                          pseudoUserId, attempt, maxAttempts);
            }
        }
        throw ContextSpaceException.writeFailure(
                StoreType.IDENTITY_MAP,
                "Could not update entry %s after %d attempts".formatted(pseudoUserId, maxAttempts));
    }

    private static String claimId(Channel channel, String hashedChannelUserId) {
        return "%s:%s".formatted(channel.name(), hashedChannelUserId);
    }

    private static IdentityMapEntry toWire(ESIdentityMapDocument document) {
        return IdentityMapEntry.builder()
                .pseudoUserId(document.getPseudoUserId())
                .linkedSessions(Objects.requireNonNullElse(document.getLinkedSessions(), List.of()))
                .updatedAt(document.getUpdatedAt())
                .build();
    }

    private static ESIdentityMapDocument toStored(IdentityMapEntry entry) {
        return ESIdentityMapDocument.builder()
                .pseudoUserId(entry.getPseudoUserId())
                .linkedSessions(entry.getLinkedSessions())
                .updatedAt(entry.getUpdatedAt())
                .build();
    }
}
