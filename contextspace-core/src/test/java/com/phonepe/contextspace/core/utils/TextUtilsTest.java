package com.phonepe.contextspace.core.utils;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link TextSimilarity}, {@link KeywordSet} and {@link IdentifierExtractor}
 */
class TextUtilsTest {

    @Test
    void testKeywordOverlapIsJaccardOfWords() {
        assertEquals(1.0, TextSimilarity.keywordOverlap("Where is my order", "where IS my   order"), 1e-9);
        //{where, is, my, order} vs {where, is, my, parcel}: 3 shared of 5
        assertEquals(0.6, TextSimilarity.keywordOverlap("where is my order", "where is my parcel"), 1e-9);
        assertEquals(0.0, TextSimilarity.keywordOverlap("", "   "));
    }

    @Test
    void testKeywordsMatchAtWordStart() {
        final var keywords = KeywordSet.of("sue", "late", "now");
        assertEquals(0, keywords.count("I have an issue I know about"));
        assertEquals(2, keywords.count("I will SUE you, it is later than promised"));
        assertTrue(keywords.anyIn("do it now"));
        assertFalse(keywords.anyIn(null));
        assertEquals(List.of("late", "now"), keywords.presentIn("now it is late"));
    }

    @Test
    void testIdentifiersAreExtracted() {
        final var text = "Order AB123 and ORDER-456, call 9876543210 or mail jane.doe@example.com. AB123 again";
        assertEquals(Set.of("AB123", "ORDER-456", "9876543210", "jane.doe@example.com"),
                     IdentifierExtractor.identifiers(text));
        assertEquals(Set.of("AB123", "ORDER-456"), IdentifierExtractor.orderCodes(text));
        assertTrue(IdentifierExtractor.identifiers("nothing to see here").isEmpty());
    }
}
