package com.phonepe.contextspace.core.identity.signals;

import com.phonepe.contextspace.core.identity.MatchInput;
import com.phonepe.contextspace.core.identity.MatchSignal;
import com.phonepe.contextspace.core.model.Message;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Compares writing style: average message length, punctuation density and capitalisation density
 */
public class BehaviorSimilaritySignal implements MatchSignal {
    private static final Pattern PUNCTUATION = Pattern.compile("[.!?,;:]");
    private static final Pattern CAPITALS = Pattern.compile("[A-Z]");

    private final double lengthScale;

    record WritingStyle(double averageLength, double punctuationRatio, double capitalizationRatio) {
    }

    public BehaviorSimilaritySignal(double lengthScale) {
        this.lengthScale = lengthScale;
    }

    @Override
    public String name() {
        return "behavior";
    }

    @Override
    public double score(MatchInput input) {
        final var current = input.getCurrentMessages().stream().map(Message::getText).toList();
        final var historical = input.getHistoricalMessages();
        if (current.isEmpty() || historical.isEmpty()) {
            return 0.0;
        }
        final var currentStyle = style(current);
        final var historicalStyle = style(historical);
        final var lengthSimilarity = 1 - Math.min(
                1.0, Math.abs(currentStyle.averageLength() - historicalStyle.averageLength()) / lengthScale);
        final var punctuationSimilarity = 1 - Math.abs(
                currentStyle.punctuationRatio() - historicalStyle.punctuationRatio());
        final var capitalizationSimilarity = 1 - Math.abs(
                currentStyle.capitalizationRatio() - historicalStyle.capitalizationRatio());
        return (lengthSimilarity + punctuationSimilarity + capitalizationSimilarity) / 3;
    }

    static WritingStyle style(List<String> texts) {
        long totalChars = 0;
        long punctuation = 0;
        long capitals = 0;
        for (final var text : texts) {
            final var safe = text == null ? "" : text;
            totalChars += safe.length();
            punctuation += PUNCTUATION.matcher(safe).results().count();
            capitals += CAPITALS.matcher(safe).results().count();
        }
        if (totalChars == 0) {
            return new WritingStyle(0, 0, 0);
        }
        return new WritingStyle((double) totalChars / texts.size(),
                                (double) punctuation / totalChars,
                                (double) capitals / totalChars);
    }
}
