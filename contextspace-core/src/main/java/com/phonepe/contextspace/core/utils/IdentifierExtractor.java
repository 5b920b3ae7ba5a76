package com.phonepe.contextspace.core.utils;

import lombok.experimental.UtilityClass;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pulls structured identifiers (order codes, long numbers, email addresses) out of free text
 */
@UtilityClass
public class IdentifierExtractor {
    public static final Pattern ORDER_CODE = Pattern.compile("\\b([A-Z]{2,}\\d+|[A-Z]+-\\d+)\\b");
    public static final Pattern LONG_NUMBER = Pattern.compile("\\b\\d{10,}\\b");
    public static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

    private static final List<Pattern> ALL = List.of(ORDER_CODE, LONG_NUMBER, EMAIL);

    /**
     * All identifiers in order of first appearance per pattern, without duplicates
     */
    public static Set<String> identifiers(String text) {
        final var result = new LinkedHashSet<String>();
        ALL.forEach(pattern -> result.addAll(matches(pattern, text)));
        return result;
    }

    public static Set<String> orderCodes(String text) {
        return matches(ORDER_CODE, text);
    }

    public static Set<String> matches(Pattern pattern, String text) {
        final var result = new LinkedHashSet<String>();
        if (text == null) {
            return result;
        }
        final var matcher = pattern.matcher(text);
        while (matcher.find()) {
            result.add(matcher.group());
        }
        return result;
    }
}
