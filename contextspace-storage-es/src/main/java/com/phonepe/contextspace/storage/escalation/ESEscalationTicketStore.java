package com.phonepe.contextspace.storage.escalation;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.query_dsl.TermsQueryField;
import com.phonepe.contextspace.core.errors.ContextSpaceException;
import com.phonepe.contextspace.core.errors.StoreType;
import com.phonepe.contextspace.core.model.EscalationPriority;
import com.phonepe.contextspace.core.model.EscalationStatus;
import com.phonepe.contextspace.core.model.EscalationTicket;
import com.phonepe.contextspace.core.store.EscalationTicketStore;
import com.phonepe.contextspace.storage.ESClient;
import com.phonepe.contextspace.storage.ESIndices;
import com.phonepe.contextspace.storage.IndexSettings;
import lombok.Builder;
import lombok.NonNull;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Escalation tickets stored in elasticsearch
 */
@Slf4j
public class ESEscalationTicketStore implements EscalationTicketStore {
    private static final String TICKETS_INDEX = "escalation-tickets";

    private final ESClient client;
    private final String indexName;

    @Builder
    public ESEscalationTicketStore(@NonNull ESClient client, String indexPrefix, IndexSettings indexSettings) {
        this.client = client;
        this.indexName = ESIndices.indexName(indexPrefix, TICKETS_INDEX);
        ESIndices.ensureIndex(client,
                              indexName,
                              Objects.requireNonNullElse(indexSettings, IndexSettings.DEFAULT),
                              mapping -> mapping
                                      .properties(ESEscalationTicketDocument.Fields.id, p -> p.keyword(t -> t))
                                      .properties(ESEscalationTicketDocument.Fields.problemId, p -> p.keyword(t -> t))
                                      .properties(ESEscalationTicketDocument.Fields.pseudoUserId,
                                                  p -> p.keyword(t -> t))
                                      .properties(ESEscalationTicketDocument.Fields.channel, p -> p.keyword(t -> t))
                                      .properties(ESEscalationTicketDocument.Fields.reason, p -> p.keyword(t -> t))
                                      .properties(ESEscalationTicketDocument.Fields.priority, p -> p.keyword(t -> t))
                                      .properties(ESEscalationTicketDocument.Fields.priorityRank,
                                                  p -> p.integer(t -> t))
                                      .properties(ESEscalationTicketDocument.Fields.status, p -> p.keyword(t -> t))
                                      .properties(ESEscalationTicketDocument.Fields.createdAt, p -> p.long_(t -> t))
                                      .properties(ESEscalationTicketDocument.Fields.assignedTo, p -> p.keyword(t -> t))
                                      .properties(ESEscalationTicketDocument.Fields.resolvedAt, p -> p.long_(t -> t))
                                      .properties(ESEscalationTicketDocument.Fields.problemSummary,
                                                  p -> p.text(t -> t))
                                      .properties(ESEscalationTicketDocument.Fields.conversationContext,
                                                  p -> p.text(t -> t)));
    }

    @Override
    @SneakyThrows
    public void save(EscalationTicket ticket) {
        final var stored = toStored(ticket);
        try {
            client.getElasticsearchClient()
                    .create(c -> c.index(indexName)
                            .id(stored.getId())
                            .document(stored)
                            .refresh(Refresh.True));
            log.debug("Saved ticket {}", stored.getId());
        }
        catch (ElasticsearchException e) {
            if (ESIndices.hasStatus(e, ESIndices.CONFLICT)) {
                throw ContextSpaceException.writeFailure(StoreType.ESCALATIONS,
                                                         "Ticket %s already exists".formatted(stored.getId()));
            }
            throw e;
        }
    }

    @Override
    @SneakyThrows
    public Optional<EscalationTicket> ticket(String ticketId) {
        final var doc = client.getElasticsearchClient()
                .get(g -> g.index(indexName).id(ticketId), ESEscalationTicketDocument.class);
        if (doc.found() && doc.source() != null) {
            return Optional.of(toWire(doc.source()));
        }
        return Optional.empty();
    }

    @Override
    @SneakyThrows
    public void update(EscalationTicket ticket) {
        final var stored = toStored(ticket);
        try {
            final var result = client.getElasticsearchClient()
                    .update(u -> u.index(indexName)
                                    .id(stored.getId())
                                    .doc(stored)
                                    .refresh(Refresh.True),
                            ESEscalationTicketDocument.class)
                    .result();
            log.debug("Result of updating ticket {}: {}", stored.getId(), result);
        }
        catch (ElasticsearchException e) {
            if (ESIndices.hasStatus(e, ESIndices.NOT_FOUND)) {
                throw ContextSpaceException.notFound("Ticket " + stored.getId());
            }
            throw e;
        }
    }

    @Override
    @SneakyThrows
    public List<EscalationTicket> tickets(
            Set<EscalationStatus> statuses,
            Set<EscalationPriority> priorities,
            int limit) {
        if (statuses.isEmpty() || priorities.isEmpty() || limit <= 0) {
            return List.of();
        }
        final var statusValues = statuses.stream()
                .map(status -> FieldValue.of(status.wireName()))
                .toList();
        final var priorityValues = priorities.stream()
                .map(priority -> FieldValue.of(priority.wireName()))
                .toList();
        return client.getElasticsearchClient()
                .search(s -> s.index(indexName)
                                .query(q -> q.bool(b -> b
                                        .filter(f -> f.terms(t -> t.field(ESEscalationTicketDocument.Fields.status)
                                                .terms(new TermsQueryField.Builder()
                                                               .value(statusValues)
                                                               .build())))
                                        .filter(f -> f.terms(t -> t.field(ESEscalationTicketDocument.Fields.priority)
                                                .terms(new TermsQueryField.Builder()
                                                               .value(priorityValues)
                                                               .build())))))
                                .sort(so -> so.field(f -> f.field(ESEscalationTicketDocument.Fields.priorityRank)
                                        .order(SortOrder.Desc)))
                                .sort(so -> so.field(f -> f.field(ESEscalationTicketDocument.Fields.createdAt)
                                        .order(SortOrder.Asc)))
                                .sort(so -> so.field(f -> f.field(ESEscalationTicketDocument.Fields.id)
                                        .order(SortOrder.Asc)))
                                .size(limit),
                        ESEscalationTicketDocument.class)
                .hits()
                .hits()
                .stream()
                .filter(hit -> null != hit.source())
                .map(hit -> toWire(hit.source()))
                .toList();
    }

    private static EscalationTicket toWire(ESEscalationTicketDocument document) {
        return EscalationTicket.builder()
                .id(document.getId())
                .problemId(document.getProblemId())
                .pseudoUserId(document.getPseudoUserId())
                .channel(document.getChannel())
                .reason(document.getReason())
                .priority(document.getPriority())
                .status(document.getStatus())
                .createdAt(document.getCreatedAt())
                .assignedTo(document.getAssignedTo())
                .resolvedAt(document.getResolvedAt())
                .problemSummary(document.getProblemSummary())
                .conversationContext(document.getConversationContext())
                .build();
    }

    private static ESEscalationTicketDocument toStored(EscalationTicket ticket) {
        return ESEscalationTicketDocument.builder()
                .id(ticket.getId())
                .problemId(ticket.getProblemId())
                .pseudoUserId(ticket.getPseudoUserId())
                .channel(ticket.getChannel())
                .reason(ticket.getReason())
                .priority(ticket.getPriority())
                .priorityRank(ticket.getPriority().getRank())
                .status(ticket.getStatus())
                .createdAt(ticket.getCreatedAt())
                .assignedTo(ticket.getAssignedTo())
                .resolvedAt(ticket.getResolvedAt())
                .problemSummary(ticket.getProblemSummary())
                .conversationContext(ticket.getConversationContext())
                .build();
    }
}
