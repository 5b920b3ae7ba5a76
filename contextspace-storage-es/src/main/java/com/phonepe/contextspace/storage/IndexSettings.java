package com.phonepe.contextspace.storage;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for the indices created by the stores
 */
@Value
@Builder
public class IndexSettings {
    public static final int DEFAULT_SHARDS = 1;
    public static final int DEFAULT_REPLICAS = 0;
    public static final int DEFAULT_DIMENSIONS = 384;
    public static final IndexSettings DEFAULT = new IndexSettings(DEFAULT_SHARDS, DEFAULT_REPLICAS, DEFAULT_DIMENSIONS);

    @Builder.Default
    int shards = DEFAULT_SHARDS;

    @Builder.Default
    int replicas = DEFAULT_REPLICAS;

    /**
     * Dimensionality of the stored embeddings. Must match the embedding model in use.
     */
    @Builder.Default
    int dimensions = DEFAULT_DIMENSIONS;
}
