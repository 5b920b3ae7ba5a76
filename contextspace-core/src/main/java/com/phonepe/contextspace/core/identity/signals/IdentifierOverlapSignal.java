package com.phonepe.contextspace.core.identity.signals;

import com.phonepe.contextspace.core.identity.MatchInput;
import com.phonepe.contextspace.core.identity.MatchSignal;
import com.phonepe.contextspace.core.model.Message;
import com.phonepe.contextspace.core.utils.IdentifierExtractor;

import java.util.HashSet;
import java.util.stream.Collectors;

/**
 * Best Jaccard overlap between identifiers in the current messages and those in any one historical text
 */
public class IdentifierOverlapSignal implements MatchSignal {
    @Override
    public String name() {
        return "identifier";
    }

    @Override
    public double score(MatchInput input) {
        if (input.getHistoricalMessages().isEmpty()) {
            return 0.0;
        }
        final var currentText = input.getCurrentMessages()
                .stream()
                .map(Message::getText)
                .collect(Collectors.joining(" "));
        final var current = IdentifierExtractor.identifiers(currentText);
        if (current.isEmpty()) {
            return 0.0;
        }
        var best = 0.0;
        for (final var historicalText : input.getHistoricalMessages()) {
            final var historical = IdentifierExtractor.identifiers(historicalText);
            final var union = new HashSet<>(current);
            union.addAll(historical);
            final var intersection = new HashSet<>(current);
            intersection.retainAll(historical);
            best = Math.max(best, (double) intersection.size() / union.size());
        }
        return best;
    }
}
