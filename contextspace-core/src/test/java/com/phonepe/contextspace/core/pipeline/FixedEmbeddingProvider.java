package com.phonepe.contextspace.core.pipeline;

import com.phonepe.contextspace.core.embedding.EmbeddingProvider;
import com.phonepe.contextspace.core.model.MultiVectorEmbedding;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Returns the same vectors for every text
 */
class FixedEmbeddingProvider implements EmbeddingProvider {
    private final float[] intent;
    private final float[] frustration;
    private final AtomicInteger calls = new AtomicInteger();

    FixedEmbeddingProvider(float[] intent, float[] frustration) {
        this.intent = intent;
        this.frustration = frustration;
    }

    @Override
    public float[] embed(String text) {
        calls.incrementAndGet();
        return intent.clone();
    }

    @Override
    public MultiVectorEmbedding embedMessage(String text, String context) {
        calls.incrementAndGet();
        return MultiVectorEmbedding.builder()
                .intentVector(intent.clone())
                .frustrationVector(frustration.clone())
                .productVector(intent.clone())
                .build();
    }

    int calls() {
        return calls.get();
    }
}
