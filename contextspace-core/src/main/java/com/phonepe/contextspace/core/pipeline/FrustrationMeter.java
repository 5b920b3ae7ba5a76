package com.phonepe.contextspace.core.pipeline;

import com.phonepe.contextspace.core.utils.KeywordSet;
import com.phonepe.contextspace.core.utils.VectorMath;
import lombok.experimental.UtilityClass;

/**
 * Frustration level kept on the session: normalized frustration vector magnitude plus a boost for
 * explicit frustration language
 */
@UtilityClass
public class FrustrationMeter {
    static final KeywordSet FRUSTRATION_WORDS = KeywordSet.of(
            "frustrated", "angry", "upset", "disappointed", "terrible", "awful", "horrible");

    public static double level(String text, float[] frustrationVector) {
        final var boost = FRUSTRATION_WORDS.anyIn(text) ? 0.3 : 0.0;
        return Math.min(1.0, VectorMath.normalizedMagnitude(frustrationVector) + boost);
    }
}
