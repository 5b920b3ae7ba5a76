package com.phonepe.contextspace.core.intelligence.problem;

import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.LongTermMemoryPoint;
import com.phonepe.contextspace.core.model.ProblemCategory;
import com.phonepe.contextspace.core.model.ShortTermRecord;
import com.phonepe.contextspace.core.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.phonepe.contextspace.core.intelligence.IntelligenceTestSupport.context;
import static com.phonepe.contextspace.core.intelligence.IntelligenceTestSupport.urgency;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeywordProblemExtractorTest {
    private final KeywordProblemExtractor extractor = new KeywordProblemExtractor();

    @Test
    void testNoProblemWithoutIndicators() {
        assertTrue(extractor.extract(context("Hello there, lovely weather").build(), urgency(0.1)).isEmpty());
    }

    @Test
    void testExtractsProblem() {
        final var problem = extractor.extract(context("My order AB123 is delayed. Thanks").build(), urgency(0.2))
                .orElseThrow();
        assertEquals("problem:web:42:my-order-ab123-is-de", problem.getId());
        assertEquals("My order AB123 is delayed", problem.getSummary());
        assertEquals(ProblemCategory.OTHER, problem.getCategory());
        assertEquals(List.of("AB123"), problem.getEntities());
        assertEquals(1, problem.getOccurrenceCount());
        assertEquals(Set.of(Channel.WEB), problem.getChannels());
        assertEquals(42L, problem.getFirstSeen());
        assertTrue(problem.isCanAgentSolve());
        assertEquals(0.2, problem.getCriticality(), 1e-9);
    }

    @Test
    void testCategoriesCheckedInOrder() {
        assertEquals(ProblemCategory.DELIVERY, KeywordProblemExtractor.classify("tracking shows no payment"));
        assertEquals(ProblemCategory.PAYMENT, KeywordProblemExtractor.classify("card charge failed"));
        assertEquals(ProblemCategory.REFUND, KeywordProblemExtractor.classify("I want my money back"));
        assertEquals(ProblemCategory.TECHNICAL, KeywordProblemExtractor.classify("the app is not working"));
        assertEquals(ProblemCategory.ACCOUNT, KeywordProblemExtractor.classify("cannot login"));
        assertEquals(ProblemCategory.PRODUCT_QUALITY, KeywordProblemExtractor.classify("item came damaged"));
        assertEquals(ProblemCategory.BILLING, KeywordProblemExtractor.classify("my bill is wrong"));
        assertEquals(ProblemCategory.OTHER, KeywordProblemExtractor.classify("something odd"));
    }

    @Test
    void testAgentSolvability() {
        assertTrue(KeywordProblemExtractor.canAgentSolve("where is my order", urgency(0.4)));
        assertTrue(KeywordProblemExtractor.canAgentSolve("something is wrong", urgency(0.1)));
        assertFalse(KeywordProblemExtractor.canAgentSolve("where is my order, I want a refund", urgency(0.1)));
        assertFalse(KeywordProblemExtractor.canAgentSolve("how to track my order", urgency(0.7)));
        assertTrue(KeywordProblemExtractor.canAgentSolve("there is an issue with tracking", urgency(0.1)));
    }

    @Test
    void testCriticalityAddsUp() {
        final var history = LongTermMemoryPoint.builder()
                .pseudoUserId("U1")
                .summary("order AB123 delayed")
                .lastSeen(1L)
                .build();
        final var problem = extractor.extract(
                        context("My order AB123 is delayed, this is unacceptable, I want my manager")
                                .longTerm(List.of(history))
                                .build(),
                        urgency(0.425))
                .orElseThrow();
        assertFalse(problem.isCanAgentSolve());
        assertEquals(1.0, problem.getCriticality(), 1e-9);
    }

    @Test
    void testOccurrencesCountSimilarMessages() {
        final var shortTerm = ShortTermRecord.builder()
                .message(TestUtils.userMessage("my parcel is missing", 1L))
                .message(TestUtils.userMessage("hello", 2L))
                .build();
        final var history = LongTermMemoryPoint.builder()
                .pseudoUserId("U1")
                .summary("parcel is missing again")
                .lastSeen(1L)
                .build();
        final var problem = extractor.extract(context("my parcel is missing")
                                                      .shortTerm(shortTerm)
                                                      .longTerm(List.of(history))
                                                      .build(),
                                              urgency(0.1))
                .orElseThrow();
        assertEquals(3, problem.getOccurrenceCount());
    }
}
