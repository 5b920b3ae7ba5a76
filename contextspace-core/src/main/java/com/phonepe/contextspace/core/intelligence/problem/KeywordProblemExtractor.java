package com.phonepe.contextspace.core.intelligence.problem;

import com.google.common.base.Splitter;
import com.phonepe.contextspace.core.intelligence.IntelligenceContext;
import com.phonepe.contextspace.core.model.ExtractedProblem;
import com.phonepe.contextspace.core.model.ProblemCategory;
import com.phonepe.contextspace.core.model.UrgencyLevel;
import com.phonepe.contextspace.core.model.UrgencyScore;
import com.phonepe.contextspace.core.utils.IdentifierExtractor;
import com.phonepe.contextspace.core.utils.KeywordSet;
import com.phonepe.contextspace.core.utils.TextSimilarity;
import com.phonepe.contextspace.core.utils.VectorMath;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword and pattern based problem extraction
 */
@Slf4j
public class KeywordProblemExtractor implements ProblemExtractor {
    static final double OCCURRENCE_SIMILARITY = 0.40;
    static final int MAX_SUMMARY_LENGTH = 150;

    static final KeywordSet PROBLEM_INDICATORS = KeywordSet.of(
            "problem", "issue", "error", "broken", "not working", "wrong", "delayed", "missing",
            "failed", "can't", "cannot", "help", "support", "complaint");

    static final KeywordSet SUMMARY_KEYWORDS = KeywordSet.of(
            "problem", "issue", "error", "broken", "wrong", "delayed", "missing");

    static final KeywordSet CRITICAL_KEYWORDS = KeywordSet.of(
            "refund", "cancel", "legal", "complaint", "unacceptable");

    static final Map<ProblemCategory, KeywordSet> CATEGORIES = categories();

    static final List<Pattern> AGENT_SOLVABLE = patterns(
            "order.*status", "tracking", "where.*order", "update.*account",
            "change.*password", "forgot.*password", "how.*to", "what.*is");

    static final List<Pattern> HUMAN_REQUIRED = patterns(
            "refund", "cancel.*order", "complaint", "legal", "\\bsue\\b", "manager",
            "supervisor", "escalate", "unacceptable", "demand");

    private static final Splitter SENTENCES = Splitter.on(Pattern.compile("[.!?]+")).omitEmptyStrings();
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public Optional<ExtractedProblem> extract(IntelligenceContext context, UrgencyScore urgency) {
        final var text = context.text();
        if (!PROBLEM_INDICATORS.anyIn(text)) {
            return Optional.empty();
        }
        final var message = context.getMessage();
        final var summary = summary(text);
        final var canAgentSolve = canAgentSolve(text, urgency);
        final var problem = ExtractedProblem.builder()
                .id(problemId(context))
                .summary(summary)
                .description(text)
                .category(classify(text))
                .criticality(criticality(context, urgency, canAgentSolve))
                .canAgentSolve(canAgentSolve)
                .entities(List.copyOf(IdentifierExtractor.identifiers(text)))
                .urgency(urgency)
                .firstSeen(message.getTimestamp())
                .lastSeen(message.getTimestamp())
                .occurrenceCount(occurrences(summary, context))
                .channels(Set.of(context.getChannel()))
                .build();
        log.debug("Extracted problem {} category {} criticality {} solvable {}",
                  problem.getId(), problem.getCategory(), problem.getCriticality(), canAgentSolve);
        return Optional.of(problem);
    }

    /**
     * First category with a matching keyword, {@link ProblemCategory#OTHER} if none match
     */
    public static ProblemCategory classify(String text) {
        return CATEGORIES.entrySet()
                .stream()
                .filter(entry -> entry.getValue().anyIn(text))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(ProblemCategory.OTHER);
    }

    /**
     * Human required patterns override agent solvable ones. High urgency always needs a human.
     */
    public static boolean canAgentSolve(String text, UrgencyScore urgency) {
        if (urgency.getLevel().atLeast(UrgencyLevel.HIGH)) {
            return false;
        }
        if (HUMAN_REQUIRED.stream().anyMatch(pattern -> pattern.matcher(text).find())) {
            return false;
        }
        if (AGENT_SOLVABLE.stream().anyMatch(pattern -> pattern.matcher(text).find())) {
            return true;
        }
        return urgency.getLevel() == UrgencyLevel.LOW || urgency.getLevel() == UrgencyLevel.MEDIUM;
    }

    static String summary(String text) {
        final var sentences = SENTENCES.splitToList(text)
                .stream()
                .filter(sentence -> !sentence.isBlank())
                .toList();
        if (sentences.isEmpty()) {
            return text.substring(0, Math.min(100, text.length()));
        }
        var best = sentences.get(0);
        var bestScore = 0;
        for (final var sentence : sentences) {
            final var score = SUMMARY_KEYWORDS.count(sentence);
            if (score > bestScore) {
                bestScore = score;
                best = sentence;
            }
        }
        final var trimmed = best.trim();
        return trimmed.substring(0, Math.min(MAX_SUMMARY_LENGTH, trimmed.length()));
    }

    private static double criticality(IntelligenceContext context, UrgencyScore urgency, boolean canAgentSolve) {
        var criticality = urgency.getScore();
        if (!canAgentSolve) {
            criticality += 0.3;
        }
        if (!context.getLongTerm().isEmpty()) {
            criticality += 0.2;
        }
        if (CRITICAL_KEYWORDS.anyIn(context.text())) {
            criticality += 0.2;
        }
        return VectorMath.clamp(criticality);
    }

    private static int occurrences(String summary, IntelligenceContext context) {
        var count = 1;
        count += context.shortTerm()
                .map(shortTerm -> shortTerm.getMessages()
                        .stream()
                        .filter(message -> TextSimilarity.keywordOverlap(message.getText(), summary)
                                >= OCCURRENCE_SIMILARITY)
                        .count())
                .orElse(0L);
        count += context.getLongTerm()
                .stream()
                .filter(memory -> TextSimilarity.keywordOverlap(memory.getSummary(), summary) >= OCCURRENCE_SIMILARITY)
                .count();
        return count;
    }

    private static String problemId(IntelligenceContext context) {
        final var text = context.text();
        final var slug = WHITESPACE.matcher(text.substring(0, Math.min(20, text.length())))
                .replaceAll("-")
                .toLowerCase(Locale.ROOT);
        return "problem:%s:%d:%s".formatted(context.getChannel().getWireName(),
                                            context.getMessage().getTimestamp(),
                                            slug);
    }

    private static Map<ProblemCategory, KeywordSet> categories() {
        final var categories = new LinkedHashMap<ProblemCategory, KeywordSet>();
        categories.put(ProblemCategory.DELIVERY,
                       KeywordSet.of("delivery", "shipment", "shipping", "tracking", "package", "arrived"));
        categories.put(ProblemCategory.PAYMENT,
                       KeywordSet.of("payment", "charge", "billing", "invoice", "transaction", "card"));
        categories.put(ProblemCategory.REFUND,
                       KeywordSet.of("refund", "return", "money back", "cancel"));
        categories.put(ProblemCategory.TECHNICAL,
                       KeywordSet.of("error", "bug", "broken", "not working", "crash", "technical"));
        categories.put(ProblemCategory.ACCOUNT,
                       KeywordSet.of("account", "login", "password", "access", "profile"));
        categories.put(ProblemCategory.PRODUCT_QUALITY,
                       KeywordSet.of("quality", "defective", "damaged", "broken product"));
        categories.put(ProblemCategory.BILLING,
                       KeywordSet.of("bill", "invoice", "charge", "payment"));
        return categories;
    }

    private static List<Pattern> patterns(String... regexes) {
        return Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
