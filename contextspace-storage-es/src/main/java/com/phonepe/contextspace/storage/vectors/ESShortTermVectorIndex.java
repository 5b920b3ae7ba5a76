package com.phonepe.contextspace.storage.vectors;

import co.elastic.clients.elasticsearch._types.Refresh;
import com.phonepe.contextspace.core.model.ShortTermVectorPoint;
import com.phonepe.contextspace.core.store.ShortTermVectorIndex;
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
 * Short term vector index backed by elasticsearch. Nearest neighbour search runs on the intent vector,
 * the other two views are stored alongside.
 */
@Slf4j
public class ESShortTermVectorIndex implements ShortTermVectorIndex {
    private static final String VECTORS_INDEX = "short-term-vectors";

    private final ESClient client;
    private final String indexName;

    @Builder
    public ESShortTermVectorIndex(@NonNull ESClient client, String indexPrefix, IndexSettings indexSettings) {
        this.client = client;
        this.indexName = ESIndices.indexName(indexPrefix, VECTORS_INDEX);
        final var settings = Objects.requireNonNullElse(indexSettings, IndexSettings.DEFAULT);
        final var dims = settings.getDimensions();
        ESIndices.ensureIndex(client, indexName, settings, mapping -> mapping
                .properties(ESShortTermVectorDocument.Fields.sessionId, p -> p.keyword(t -> t))
                .properties(ESShortTermVectorDocument.Fields.pseudoUserId, p -> p.keyword(t -> t))
                .properties(ESShortTermVectorDocument.Fields.channel, p -> p.keyword(t -> t))
                .properties(ESShortTermVectorDocument.Fields.intentVector,
                            p -> ESIndices.searchableVector(p, dims))
                .properties(ESShortTermVectorDocument.Fields.frustrationVector,
                            p -> ESIndices.storedVector(p, dims))
                .properties(ESShortTermVectorDocument.Fields.productVector,
                            p -> ESIndices.storedVector(p, dims))
                .properties(ESShortTermVectorDocument.Fields.metadata, p -> p.object(o -> o.enabled(false)))
                .properties(ESShortTermVectorDocument.Fields.timestamp, p -> p.long_(t -> t)));
    }

    @Override
    @SneakyThrows
    public void upsert(ShortTermVectorPoint point) {
        final var stored = toStored(point);
        final var result = client.getElasticsearchClient()
                .index(i -> i.index(indexName)
                        .id(stored.getSessionId())
                        .document(stored)
                        .refresh(Refresh.True))
                .result();
        log.debug("Result of indexing vectors for session {}: {}", stored.getSessionId(), result);
    }

    @Override
    @SneakyThrows
    public List<ShortTermVectorPoint> nearest(float[] intentVector, int topK) {
        final var queryVector = ESIndices.toList(intentVector);
        return client.getElasticsearchClient()
                .search(s -> s.index(indexName)
                                .query(q -> q.knn(k -> k.field(ESShortTermVectorDocument.Fields.intentVector)
                                        .queryVector(queryVector)
                                        .k(topK)))
                                .size(topK),
                        ESShortTermVectorDocument.class)
                .hits()
                .hits()
                .stream()
                .filter(hit -> null != hit.source())
                .map(hit -> toWire(hit.source()))
                .toList();
    }

    private ShortTermVectorPoint toWire(ESShortTermVectorDocument document) {
        return ShortTermVectorPoint.builder()
                .sessionId(document.getSessionId())
                .pseudoUserId(document.getPseudoUserId())
                .channel(document.getChannel())
                .intentVector(document.getIntentVector())
                .frustrationVector(document.getFrustrationVector())
                .productVector(document.getProductVector())
                .metadata(document.getMetadata())
                .timestamp(document.getTimestamp())
                .build();
    }

    private ESShortTermVectorDocument toStored(ShortTermVectorPoint point) {
        return ESShortTermVectorDocument.builder()
                .sessionId(point.getSessionId())
                .pseudoUserId(point.getPseudoUserId())
                .channel(point.getChannel())
                .intentVector(point.getIntentVector())
                .frustrationVector(point.getFrustrationVector())
                .productVector(point.getProductVector())
                .metadata(point.getMetadata())
                .timestamp(point.getTimestamp())
                .build();
    }
}
