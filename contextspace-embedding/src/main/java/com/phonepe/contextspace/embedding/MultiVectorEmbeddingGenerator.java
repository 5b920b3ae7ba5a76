package com.phonepe.contextspace.embedding;

import com.google.common.base.Strings;
import com.phonepe.contextspace.core.embedding.EmbeddingProvider;
import com.phonepe.contextspace.core.errors.ContextSpaceException;
import com.phonepe.contextspace.core.errors.ErrorType;
import com.phonepe.contextspace.core.model.MultiVectorEmbedding;
import com.phonepe.contextspace.core.utils.KeywordSet;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Builds the intent, frustration and product views of a message from a single embedding model.
 * <p>
 * Each view embeds a differently framed prompt. Any failure, including vectors of mismatched
 * dimensionality, is reported as an embedding failure.
 */
@Slf4j
public class MultiVectorEmbeddingGenerator implements EmbeddingProvider {
    static final Pattern ORDER_REFERENCE = Pattern.compile("order\\s+([A-Z0-9]+)", Pattern.CASE_INSENSITIVE);
    static final KeywordSet PRODUCT_TERMS = KeywordSet.of(
            "delivery", "refund", "return", "shipment", "package", "product");
    private static final int FALLBACK_LENGTH = 100;

    private final EmbeddingModel model;

    public MultiVectorEmbeddingGenerator(EmbeddingModel model) {
        this.model = model;
    }

    @Override
    public float[] embed(String text) {
        try {
            return model.getEmbedding(text);
        }
        catch (ContextSpaceException e) {
            throw e;
        }
        catch (Exception e) {
            throw ContextSpaceException.embeddingFailure(e);
        }
    }

    @Override
    public MultiVectorEmbedding embedMessage(String text, String context) {
        try {
            final var intent = model.getEmbedding(text);
            final var frustration = model.getEmbedding(frustrationPrompt(text, context));
            final var product = model.getEmbedding(productPrompt(text));
            if (intent.length != frustration.length || intent.length != product.length) {
                throw new IllegalStateException("Vector dimensions differ: %d/%d/%d"
                                                        .formatted(intent.length, frustration.length, product.length));
            }
            log.debug("Generated {} dimensional multi vector embedding", intent.length);
            return MultiVectorEmbedding.builder()
                    .intentVector(intent)
                    .frustrationVector(frustration)
                    .productVector(product)
                    .build();
        }
        catch (ContextSpaceException e) {
            if (e.getErrorType() == ErrorType.EMBEDDING_FAILURE) {
                throw e;
            }
            throw ContextSpaceException.embeddingFailure(e);
        }
        catch (Exception e) {
            throw ContextSpaceException.embeddingFailure(e);
        }
    }

    static String frustrationPrompt(String text, String context) {
        if (Strings.isNullOrEmpty(context)) {
            return "User message: " + text;
        }
        return "User is frustrated about: %s. Context: %s".formatted(text, context);
    }

    /**
     * The first order reference in the text, else the product terms it mentions, else its beginning
     */
    static String productPrompt(String text) {
        final var order = ORDER_REFERENCE.matcher(text);
        if (order.find()) {
            return "Order " + order.group(1);
        }
        final var terms = PRODUCT_TERMS.presentIn(text);
        if (!terms.isEmpty()) {
            return String.join(" ", terms);
        }
        return text.substring(0, Math.min(FALLBACK_LENGTH, text.length()));
    }
}
