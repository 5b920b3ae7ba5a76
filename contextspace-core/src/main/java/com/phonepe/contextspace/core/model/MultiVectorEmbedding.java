package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Three independently embedded views of a message. All three vectors have the same dimensionality.
 */
@Value
@Builder
public class MultiVectorEmbedding {
    @NonNull
    float[] intentVector;

    @NonNull
    float[] frustrationVector;

    @NonNull
    float[] productVector;

    public int dimensions() {
        return intentVector.length;
    }
}
