package com.phonepe.contextspace.storage.memory;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.Refresh;
import com.phonepe.contextspace.core.errors.DuplicateMemoryPointException;
import com.phonepe.contextspace.core.model.LongTermMemoryPoint;
import com.phonepe.contextspace.core.store.LongTermMemoryStore;
import com.phonepe.contextspace.storage.ESClient;
import com.phonepe.contextspace.storage.ESIndices;
import com.phonepe.contextspace.storage.IndexSettings;
import lombok.Builder;
import lombok.NonNull;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * An implementation of the long term memory archive that uses elasticsearch as the backend.
 * Points are written with the create op type, so an existing point is never overwritten.
 */
@Slf4j
public class ESLongTermMemoryStore implements LongTermMemoryStore {
    private static final String MEMORIES_INDEX = "long-term-memories";

    private final ESClient client;
    private final String indexName;

    @Builder
    public ESLongTermMemoryStore(@NonNull ESClient client, String indexPrefix, IndexSettings indexSettings) {
        this.client = client;
        this.indexName = ESIndices.indexName(indexPrefix, MEMORIES_INDEX);
        final var settings = Objects.requireNonNullElse(indexSettings, IndexSettings.DEFAULT);
        final var dims = settings.getDimensions();
        ESIndices.ensureIndex(client, indexName, settings, mapping -> mapping
                .properties(ESLongTermMemoryDocument.Fields.id, p -> p.keyword(t -> t))
                .properties(ESLongTermMemoryDocument.Fields.pseudoUserId, p -> p.keyword(t -> t))
                .properties(ESLongTermMemoryDocument.Fields.summary, p -> p.text(t -> t))
                .properties(ESLongTermMemoryDocument.Fields.intentVector, p -> ESIndices.searchableVector(p, dims))
                .properties(ESLongTermMemoryDocument.Fields.toneVector, p -> ESIndices.storedVector(p, dims))
                .properties(ESLongTermMemoryDocument.Fields.productVector, p -> ESIndices.storedVector(p, dims))
                .properties(ESLongTermMemoryDocument.Fields.entities, p -> p.keyword(t -> t))
                .properties(ESLongTermMemoryDocument.Fields.lastSeen, p -> p.long_(t -> t)));
    }

    @Override
    @SneakyThrows
    public void insert(LongTermMemoryPoint point) {
        final var stored = toStored(point);
        try {
            final var result = client.getElasticsearchClient()
                    .create(c -> c.index(indexName)
                            .id(stored.getId())
                            .document(stored)
                            .refresh(Refresh.True))
                    .result();
            log.debug("Result of inserting memory {}: {}", stored.getId(), result);
        }
        catch (ElasticsearchException e) {
            if (ESIndices.hasStatus(e, ESIndices.CONFLICT)) {
                throw new DuplicateMemoryPointException(stored.getId());
            }
            throw e;
        }
    }

    @Override
    @SneakyThrows
    public List<LongTermMemoryPoint> nearest(float[] intentVector, int topK) {
        final var queryVector = ESIndices.toList(intentVector);
        return client.getElasticsearchClient()
                .search(s -> s.index(indexName)
                                .query(q -> q.knn(k -> k.field(ESLongTermMemoryDocument.Fields.intentVector)
                                        .queryVector(queryVector)
                                        .k(topK)))
                                .size(topK),
                        ESLongTermMemoryDocument.class)
                .hits()
                .hits()
                .stream()
                .filter(hit -> null != hit.source())
                .map(hit -> toWire(hit.source()))
                .toList();
    }

    private LongTermMemoryPoint toWire(final ESLongTermMemoryDocument document) {
        return LongTermMemoryPoint.builder()
                .pseudoUserId(document.getPseudoUserId())
                .summary(document.getSummary())
                .intentVector(document.getIntentVector())
                .toneVector(document.getToneVector())
                .productVector(document.getProductVector())
                .entities(document.getEntities())
                .lastSeen(document.getLastSeen())
                .build();
    }

    private ESLongTermMemoryDocument toStored(final LongTermMemoryPoint point) {
        return ESLongTermMemoryDocument.builder()
                .id(point.id())
                .pseudoUserId(point.getPseudoUserId())
                .summary(point.getSummary())
                .intentVector(point.getIntentVector())
                .toneVector(point.getToneVector())
                .productVector(point.getProductVector())
                .entities(point.getEntities())
                .lastSeen(point.getLastSeen())
                .build();
    }
}
