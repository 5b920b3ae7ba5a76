package com.phonepe.contextspace.core.utils;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A fixed list of keywords matched case-insensitively at the start of a word, so that "late" matches
 * "later" but "sue" does not match "issue".
 */
public class KeywordSet {
    @Getter
    private final List<String> keywords;
    private final List<Pattern> patterns;

    private KeywordSet(List<String> keywords) {
        this.keywords = List.copyOf(keywords);
        this.patterns = keywords.stream()
                .map(keyword -> Pattern.compile("\\b" + Pattern.quote(keyword), Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public static KeywordSet of(String... keywords) {
        return new KeywordSet(List.of(keywords));
    }

    /**
     * Number of distinct keywords present in the text
     */
    public int count(String text) {
        if (text == null) {
            return 0;
        }
        return (int) patterns.stream()
                .filter(pattern -> pattern.matcher(text).find())
                .count();
    }

    public boolean anyIn(String text) {
        return text != null && patterns.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    /**
     * Keywords present in the text, in declaration order
     */
    public List<String> presentIn(String text) {
        if (text == null) {
            return List.of();
        }
        final var present = new ArrayList<String>();
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i).matcher(text).find()) {
                present.add(keywords.get(i));
            }
        }
        return present;
    }
}
