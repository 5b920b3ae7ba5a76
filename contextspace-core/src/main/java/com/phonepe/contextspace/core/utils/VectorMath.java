package com.phonepe.contextspace.core.utils;

import lombok.experimental.UtilityClass;

/**
 * Vector helpers shared by the identity resolver, the intelligence layer and the in-memory stores
 */
@UtilityClass
public class VectorMath {

    /**
     * Cosine similarity of two vectors. Zero norm on either side yields 0.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    public static double magnitude(float[] vector) {
        if (vector == null) {
            return 0.0;
        }
        double sum = 0.0;
        for (float value : vector) {
            sum += value * value;
        }
        return Math.sqrt(sum);
    }

    /**
     * Magnitude divided by dimensionality. Empty vectors yield 0.
     */
    public static double normalizedMagnitude(float[] vector) {
        if (vector == null || vector.length == 0) {
            return 0.0;
        }
        return magnitude(vector) / vector.length;
    }

    public static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
