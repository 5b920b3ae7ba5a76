package com.phonepe.contextspace.core.embedding;

import com.phonepe.contextspace.core.model.MultiVectorEmbedding;

/**
 * Turns text into vectors. Every call within a deployment returns vectors of the same dimensionality.
 * Implementations signal failure by throwing; an embedding failure aborts the request that needed it.
 */
public interface EmbeddingProvider {
    /**
     * Embeds a single piece of text, used for retrieval queries
     */
    float[] embed(String text);

    /**
     * Generates intent, frustration and product views of a message
     *
     * @param text    Message text
     * @param context Optional summary of the message, may be null
     */
    MultiVectorEmbedding embedMessage(String text, String context);
}
