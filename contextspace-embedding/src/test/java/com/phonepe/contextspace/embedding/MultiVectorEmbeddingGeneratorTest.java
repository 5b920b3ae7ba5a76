package com.phonepe.contextspace.embedding;

import com.phonepe.contextspace.core.errors.ContextSpaceException;
import com.phonepe.contextspace.core.errors.ErrorType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MultiVectorEmbeddingGeneratorTest {

    @Test
    void generatesThreeViewsFromFramedPrompts() {
        final var model = mock(EmbeddingModel.class);
        when(model.getEmbedding("Where is my order AB123?")).thenReturn(new float[]{1, 0, 0});
        when(model.getEmbedding("User is frustrated about: Where is my order AB123?. Context: late order"))
                .thenReturn(new float[]{0, 1, 0});
        when(model.getEmbedding("Order AB123")).thenReturn(new float[]{0, 0, 1});

        final var generator = new MultiVectorEmbeddingGenerator(model);
        final var embedding = generator.embedMessage("Where is my order AB123?", "late order");

        assertArrayEquals(new float[]{1, 0, 0}, embedding.getIntentVector());
        assertArrayEquals(new float[]{0, 1, 0}, embedding.getFrustrationVector());
        assertArrayEquals(new float[]{0, 0, 1}, embedding.getProductVector());
        assertEquals(3, embedding.dimensions());
    }

    @Test
    void usesPlainFramingWithoutContext() {
        final var model = mock(EmbeddingModel.class);
        when(model.getEmbedding(anyString())).thenReturn(new float[]{1, 1});

        new MultiVectorEmbeddingGenerator(model).embedMessage("hello there", null);

        verify(model).getEmbedding("User message: hello there");
    }

    @Test
    void productPromptPrefersOrderReferenceThenTerms() {
        assertEquals("Order ab123",
                     MultiVectorEmbeddingGenerator.productPrompt("refund for order ab123 and order XY9"));
        assertEquals("delivery refund",
                     MultiVectorEmbeddingGenerator.productPrompt("the delivery failed, I want a refund"));
        final var longText = "a".repeat(150);
        assertEquals(100, MultiVectorEmbeddingGenerator.productPrompt(longText).length());
        assertEquals("hi", MultiVectorEmbeddingGenerator.productPrompt("hi"));
    }

    @Test
    void mismatchedDimensionsAreEmbeddingFailures() {
        final var model = mock(EmbeddingModel.class);
        when(model.getEmbedding("text")).thenReturn(new float[]{1, 0, 0});
        when(model.getEmbedding("User message: text")).thenReturn(new float[]{1, 0});

        final var generator = new MultiVectorEmbeddingGenerator(model);
        final var error = assertThrows(ContextSpaceException.class, () -> generator.embedMessage("text", ""));
        assertEquals(ErrorType.EMBEDDING_FAILURE, error.getErrorType());
    }

    @Test
    void modelFailuresAreWrapped() {
        final var model = mock(EmbeddingModel.class);
        when(model.getEmbedding(anyString())).thenThrow(new IllegalStateException("model offline"));

        final var generator = new MultiVectorEmbeddingGenerator(model);
        final var error = assertThrows(ContextSpaceException.class, () -> generator.embed("query"));
        assertEquals(ErrorType.EMBEDDING_FAILURE, error.getErrorType());
        assertEquals(IllegalStateException.class, error.getCause().getClass());
        assertThrows(ContextSpaceException.class, () -> generator.embedMessage("query", "ctx"));
    }
}
