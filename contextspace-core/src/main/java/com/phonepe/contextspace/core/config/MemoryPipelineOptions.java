package com.phonepe.contextspace.core.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tuning knobs for the memory pipeline
 */
@Value
@Builder
public class MemoryPipelineOptions {
    public static final MemoryPipelineOptions DEFAULT = MemoryPipelineOptions.builder().build();

    /**
     * Number of nearest neighbours fetched from each vector store
     */
    @Builder.Default
    int topK = 10;

    @Builder.Default
    Duration sessionTtl = Duration.ofHours(48);

    @Builder.Default
    int maxSessionMessages = 50;

    /**
     * If set, a read taking longer than this degrades to empty. Null means reads are awaited.
     */
    Duration readTimeout;

    @Builder.Default
    SlaBudgets slaBudgets = SlaBudgets.DEFAULT;
}
