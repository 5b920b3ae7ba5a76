package com.phonepe.contextspace.core.utils;

import com.google.common.base.Splitter;
import lombok.experimental.UtilityClass;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword overlap between two texts: Jaccard index of their lower cased, whitespace separated words
 */
@UtilityClass
public class TextSimilarity {
    private static final Splitter WORDS = Splitter.on(Pattern.compile("\\s+")).omitEmptyStrings();

    public static double keywordOverlap(String first, String second) {
        final var words1 = words(first);
        final var words2 = words(second);
        final var union = new HashSet<>(words1);
        union.addAll(words2);
        if (union.isEmpty()) {
            return 0.0;
        }
        final var intersection = new HashSet<>(words1);
        intersection.retainAll(words2);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> words(String text) {
        final var result = new HashSet<String>();
        if (text != null) {
            WORDS.split(text.toLowerCase(Locale.ROOT)).forEach(result::add);
        }
        return result;
    }
}
