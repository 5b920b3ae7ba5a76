package com.phonepe.contextspace.embedding;

/**
 * A sentence embedding model. All embeddings produced by one instance have the same dimensionality.
 */
public interface EmbeddingModel extends AutoCloseable {
    /**
     * Get the embedding for the given input
     *
     * @param input The text to embed
     * @return The embedding for the input
     */
    float[] getEmbedding(String input);

    @Override
    void close();
}
