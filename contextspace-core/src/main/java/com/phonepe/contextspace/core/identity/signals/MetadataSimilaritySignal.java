package com.phonepe.contextspace.core.identity.signals;

import com.google.common.base.Strings;
import com.phonepe.contextspace.core.identity.MatchInput;
import com.phonepe.contextspace.core.identity.MatchSignal;
import com.phonepe.contextspace.core.model.SessionMetadata;

import java.util.List;
import java.util.function.Function;

/**
 * Fraction of ip, geo and lang values that agree, counted only over fields present on both sides
 */
public class MetadataSimilaritySignal implements MatchSignal {
    private static final List<Function<SessionMetadata, String>> FIELDS = List.of(
            SessionMetadata::getIp,
            SessionMetadata::getGeo,
            SessionMetadata::getLang);

    @Override
    public String name() {
        return "metadata";
    }

    @Override
    public double score(MatchInput input) {
        final var incoming = input.getMetadata();
        final var historical = input.getHistoricalMetadata();
        if (incoming == null || historical == null) {
            return 0.0;
        }
        var comparable = 0;
        var matches = 0;
        for (final var field : FIELDS) {
            final var left = field.apply(incoming);
            final var right = field.apply(historical);
            if (!Strings.isNullOrEmpty(left) && !Strings.isNullOrEmpty(right)) {
                comparable++;
                if (left.equals(right)) {
                    matches++;
                }
            }
        }
        return comparable == 0 ? 0.0 : (double) matches / comparable;
    }
}
