package com.phonepe.contextspace.storage;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TypeMapping;
import co.elastic.clients.util.ObjectBuilder;
import com.google.common.base.Strings;
import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Index bootstrapping and small helpers shared by the stores
 */
@Slf4j
@UtilityClass
public class ESIndices {
    public static final int CONFLICT = 409;
    public static final int NOT_FOUND = 404;

    public static String indexName(String indexPrefix, String index) {
        return Strings.isNullOrEmpty(indexPrefix) ? index : "%s.%s".formatted(indexPrefix, index);
    }

    /**
     * Creates the index with the given mapping if it does not exist yet
     */
    @SneakyThrows
    public static void ensureIndex(
            ESClient client,
            String indexName,
            IndexSettings indexSettings,
            Function<TypeMapping.Builder, ObjectBuilder<TypeMapping>> mapping) {
        final var elasticsearchClient = client.getElasticsearchClient();
        if (elasticsearchClient.indices().exists(ex -> ex.index(indexName)).value()) {
            log.info("Index {} already exists", indexName);
            return;
        }
        log.info("Creating index {}", indexName);
        try {
            final var creationStatus = elasticsearchClient.indices()
                    .create(ex -> ex.index(indexName)
                            .mappings(mapping)
                            .settings(s -> s.numberOfShards(Integer.toString(indexSettings.getShards()))
                                    .numberOfReplicas(Integer.toString(indexSettings.getReplicas()))))
                    .acknowledged();
            log.info("Index creation status for index {}: {}", indexName, creationStatus);
        }
        catch (ElasticsearchException e) {
            //Another instance created it in the meantime
            if (!"resource_already_exists_exception".equals(e.error().type())) {
                throw e;
            }
            log.info("Index {} was created concurrently", indexName);
        }
    }

    /**
     * Cosine indexed vector field used for nearest neighbour search
     */
    public static ObjectBuilder<Property> searchableVector(Property.Builder property, int dimensions) {
        return property.denseVector(t -> t.dims(dimensions)
                .elementType("float")
                .similarity("cosine")
                .index(true)
                .indexOptions(i -> i.type("hnsw")));
    }

    /**
     * Vector kept only for retrieval. Not indexed, so zero vectors are accepted.
     */
    public static ObjectBuilder<Property> storedVector(Property.Builder property, int dimensions) {
        return property.denseVector(t -> t.dims(dimensions)
                .elementType("float")
                .index(false));
    }

    public static List<Float> toList(float[] vector) {
        final var list = new ArrayList<Float>(vector.length);
        for (float v : vector) {
            list.add(v);
        }
        return list;
    }

    public static boolean hasStatus(ElasticsearchException e, int status) {
        return e.status() == status;
    }
}
