package com.phonepe.contextspace.core.pipeline;

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.phonepe.contextspace.core.config.MemoryPipelineOptions;
import com.phonepe.contextspace.core.embedding.EmbeddingProvider;
import com.phonepe.contextspace.core.errors.ContextSpaceException;
import com.phonepe.contextspace.core.errors.DuplicateMemoryPointException;
import com.phonepe.contextspace.core.errors.ErrorType;
import com.phonepe.contextspace.core.errors.StoreType;
import com.phonepe.contextspace.core.errors.ValidationException;
import com.phonepe.contextspace.core.identity.HistoricalCandidate;
import com.phonepe.contextspace.core.identity.IdentityResolver;
import com.phonepe.contextspace.core.identity.MatchInput;
import com.phonepe.contextspace.core.intelligence.IntelligenceContext;
import com.phonepe.contextspace.core.intelligence.IntelligenceLayer;
import com.phonepe.contextspace.core.model.IdentityMapEntry;
import com.phonepe.contextspace.core.model.LongTermMemoryPoint;
import com.phonepe.contextspace.core.model.MultiVectorEmbedding;
import com.phonepe.contextspace.core.model.SessionEnvelope;
import com.phonepe.contextspace.core.model.ShortTermRecord;
import com.phonepe.contextspace.core.model.ShortTermVectorPoint;
import com.phonepe.contextspace.core.store.MemoryStores;
import com.phonepe.contextspace.core.utils.IdentifierExtractor;
import com.phonepe.contextspace.core.utils.KeywordSet;
import com.phonepe.contextspace.core.utils.SlaTimer;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Orchestrates the store and retrieve paths across the session cache, the short term vector index and
 * long term memory.
 * <p>
 * Store path: embed, read the three stores concurrently, resolve identity, run the intelligence layer, then
 * write back to the session cache, the vector index and long term memory in that order.
 * Embedding and write failures are fatal. Read failures degrade to empty history.
 */
@Slf4j
public class MemoryPipeline {
    private static final KeywordSet PRODUCT_TERMS = KeywordSet.of("delivery", "refund", "return", "shipment", "package");
    private static final int MAX_MEMORY_INSERT_ATTEMPTS = 5;
    private static final Comparator<ShortTermVectorPoint> MOST_RECENT_FIRST = Comparator
            .comparingLong(ShortTermVectorPoint::getTimestamp)
            .reversed();

    private final MemoryStores stores;
    private final EmbeddingProvider embeddings;
    private final IdentityResolver identityResolver;
    private final IntelligenceLayer intelligence;
    private final MemoryPipelineOptions options;
    private final ExecutorService executorService;
    private final Clock clock;

    private record History(ShortTermRecord shortTerm,
                           List<ShortTermVectorPoint> similarSessions,
                           List<LongTermMemoryPoint> longTerm) {
    }

    @Builder
    public MemoryPipeline(
            @NonNull MemoryStores stores,
            @NonNull EmbeddingProvider embeddings,
            @NonNull IdentityResolver identityResolver,
            @NonNull IntelligenceLayer intelligence,
            MemoryPipelineOptions options,
            @NonNull ExecutorService executorService,
            Clock clock) {
        this.stores = stores;
        this.embeddings = embeddings;
        this.identityResolver = identityResolver;
        this.intelligence = intelligence;
        this.options = Objects.requireNonNullElse(options, MemoryPipelineOptions.DEFAULT);
        this.executorService = executorService;
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    /**
     * Stores one inbound turn and runs the intelligence layer on it
     *
     * @throws ContextSpaceException on embedding failure, escalation ticket failure or any write failure
     */
    public StoreResult store(@NonNull SessionEnvelope envelope) {
        final var stopwatch = Stopwatch.createStarted();
        final var sessionId = envelope.sessionId();
        final var message = envelope.getMessage();
        final var embedding = embedMessage(envelope);

        final var history = readHistory(sessionId, embedding.getIntentVector());

        final var pseudoUserId = resolveIdentity(envelope, embedding, history);

        final var report = intelligence.analyze(IntelligenceContext.builder()
                                                        .channel(envelope.getChannel())
                                                        .pseudoUserId(pseudoUserId)
                                                        .message(message)
                                                        .embedding(embedding)
                                                        .shortTerm(history.shortTerm())
                                                        .longTerm(history.longTerm())
                                                        .build());

        writeBack(envelope, pseudoUserId, embedding, history.shortTerm());

        log.debug("Stored turn for session {} as pseudo user {} in {} ms",
                  sessionId, pseudoUserId, stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return StoreResult.builder()
                .sessionId(sessionId)
                .pseudoUserId(pseudoUserId)
                .storedAt(message.getTimestamp())
                .urgency(report.getUrgency())
                .problem(report.getProblem())
                .escalated(report.isEscalated())
                .escalationTicket(report.getEscalationTicket())
                .recommendedActions(report.getRecommendedActions())
                .build();
    }

    /**
     * Assembles memory relevant to the query without touching any store state
     *
     * @throws ContextSpaceException if the query could not be embedded
     */
    public RetrievalResult retrieve(String sessionId, String queryText) {
        if (Strings.isNullOrEmpty(sessionId) || sessionId.isBlank()) {
            throw ValidationException.blank("session_id");
        }
        if (Strings.isNullOrEmpty(queryText) || queryText.isBlank()) {
            throw ValidationException.blank("query");
        }
        final var stopwatch = Stopwatch.createStarted();
        final float[] queryVector;
        try {
            queryVector = embeddings.embed(queryText);
        }
        catch (Exception e) {
            throw embeddingFailure(e);
        }
        final var history = readHistory(sessionId, queryVector);
        final var result = RetrievalResult.builder()
                .memoryBlock(MemoryBlockBuilder.build(history.shortTerm(),
                                                      history.similarSessions(),
                                                      history.longTerm()))
                .shortTerm(history.shortTerm())
                .similarSessions(history.similarSessions())
                .longTerm(history.longTerm())
                .retrievedAt(clock.millis())
                .build();
        log.debug("Retrieved memory for session {}: short term {}, {} similar sessions, {} long term memories",
                  sessionId,
                  history.shortTerm() != null ? "found" : "not found",
                  history.similarSessions().size(),
                  history.longTerm().size());
        SlaTimer.report("Memory retrieval", options.getSlaBudgets().getRetrieval(), stopwatch);
        return result;
    }

    private MultiVectorEmbedding embedMessage(SessionEnvelope envelope) {
        final MultiVectorEmbedding embedding;
        try {
            embedding = embeddings.embedMessage(envelope.getMessage().getText(), envelope.getMessage().getSummary());
        }
        catch (Exception e) {
            throw embeddingFailure(e);
        }
        if (embedding == null) {
            throw ContextSpaceException.embeddingFailure(new IllegalStateException("No embedding returned"));
        }
        return embedding;
    }

    private static ContextSpaceException embeddingFailure(Exception e) {
        log.error("Embedding generation failed: {}", e.getMessage());
        if (e instanceof ContextSpaceException cse && cse.getErrorType() == ErrorType.EMBEDDING_FAILURE) {
            return cse;
        }
        return ContextSpaceException.embeddingFailure(e);
    }

    /**
     * Issues the session read and both vector searches concurrently and waits for all three
     */
    private History readHistory(String sessionId, float[] queryVector) {
        final var budgets = options.getSlaBudgets();
        final var topK = options.getTopK();
        final var shortTerm = readAsync(StoreType.SESSION_CACHE,
                                        budgets.getSessionCache(),
                                        () -> stores.getSessionCache().read(sessionId).orElse(null),
                                        null);
        final var similar = readAsync(StoreType.SHORT_TERM_VECTORS,
                                      budgets.getShortTermVectorSearch(),
                                      () -> stores.getShortTermVectors().nearest(queryVector, topK),
                                      List.<ShortTermVectorPoint>of());
        final var longTerm = readAsync(StoreType.LONG_TERM_MEMORY,
                                       budgets.getLongTermMemory(),
                                       () -> stores.getLongTermMemory().nearest(queryVector, topK),
                                       List.<LongTermMemoryPoint>of());
        CompletableFuture.allOf(shortTerm, similar, longTerm).join();
        final var similarSessions = new ArrayList<>(similar.join());
        similarSessions.sort(MOST_RECENT_FIRST);
        return new History(shortTerm.join(), List.copyOf(similarSessions), longTerm.join());
    }

    private <T> CompletableFuture<T> readAsync(StoreType store, Duration budget, Supplier<T> read, T fallback) {
        var future = CompletableFuture.supplyAsync(
                () -> SlaTimer.timed("Read from " + store.getDisplayName(), budget, read), executorService);
        if (options.getReadTimeout() != null) {
            future = future.orTimeout(options.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        return future.exceptionally(error -> {
            final var failure = ContextSpaceException.readFailure(store, error);
            log.warn("{}. Continuing without it", failure.getMessage());
            return fallback;
        });
    }

    private String resolveIdentity(SessionEnvelope envelope, MultiVectorEmbedding embedding, History history) {
        final var input = MatchInput.builder()
                .embedding(embedding)
                .metadata(envelope.getMetadata())
                .currentMessage(envelope.getMessage())
                .historicalMetadata(history.similarSessions().isEmpty()
                                    ? null
                                    : history.similarSessions().get(0).getMetadata());
        history.similarSessions().forEach(point -> input.historicalCandidate(HistoricalCandidate.of(point)));
        history.longTerm().forEach(point -> {
            input.historicalCandidate(HistoricalCandidate.of(point));
            input.historicalMessage(point.getSummary());
        });
        final var resolution = identityResolver.resolveWithScore(input.build());
        final var linked = identityResolver.linkHashedToMap(resolution.getPseudoUserId(),
                                                            envelope.getChannel(),
                                                            envelope.getHashedChannelUserId(),
                                                            resolution.linkConfidence())
                .map(IdentityMapEntry::getPseudoUserId)
                .orElse(resolution.getPseudoUserId());
        if (!linked.equals(resolution.getPseudoUserId())) {
            log.info("Session {} is already linked to pseudo user {}. Using it instead of {}",
                     envelope.sessionId(), linked, resolution.getPseudoUserId());
        }
        return linked;
    }

    private void writeBack(
            SessionEnvelope envelope,
            String pseudoUserId,
            MultiVectorEmbedding embedding,
            ShortTermRecord existing) {
        final var budgets = options.getSlaBudgets();
        final var sessionId = envelope.sessionId();
        final var message = envelope.getMessage();

        final var updated = Objects.requireNonNullElseGet(existing, ShortTermRecord::empty)
                .append(message,
                        embedding.getIntentVector(),
                        FrustrationMeter.level(message.getText(), embedding.getFrustrationVector()),
                        options.getMaxSessionMessages());
        write(StoreType.SESSION_CACHE, budgets.getSessionCache(),
              () -> stores.getSessionCache().write(sessionId, updated, options.getSessionTtl()));

        final var vectorPoint = ShortTermVectorPoint.builder()
                .sessionId(sessionId)
                .pseudoUserId(pseudoUserId)
                .channel(envelope.getChannel())
                .intentVector(embedding.getIntentVector())
                .frustrationVector(embedding.getFrustrationVector())
                .productVector(embedding.getProductVector())
                .metadata(envelope.getMetadata())
                .timestamp(message.getTimestamp())
                .build();
        write(StoreType.SHORT_TERM_VECTORS, budgets.getShortTermVectorWrite(),
              () -> stores.getShortTermVectors().upsert(vectorPoint));

        final var memoryPoint = LongTermMemoryPoint.builder()
                .pseudoUserId(pseudoUserId)
                .summary(message.getSummary())
                .intentVector(embedding.getIntentVector())
                .toneVector(embedding.getFrustrationVector())
                .productVector(embedding.getProductVector())
                .entities(entities(message.getText()))
                .lastSeen(message.getTimestamp())
                .build();
        write(StoreType.LONG_TERM_MEMORY, budgets.getLongTermMemory(), () -> insertMemory(memoryPoint));
    }

    /**
     * Points are keyed on user and millisecond. A second turn in the same millisecond moves to the next free one.
     */
    private void insertMemory(LongTermMemoryPoint memoryPoint) {
        var point = memoryPoint;
        for (int attempt = 1; ; attempt++) {
            try {
                stores.getLongTermMemory().insert(point);
                return;
            }
            catch (DuplicateMemoryPointException e) {
                if (attempt >= MAX_MEMORY_INSERT_ATTEMPTS) {
                    throw e;
                }
                log.warn("Memory point {} already exists, retrying at the next millisecond", e.getPointId());
                point = point.withLastSeen(point.getLastSeen() + 1);
            }
        }
    }

    private static void write(StoreType store, Duration budget, Runnable write) {
        try {
            SlaTimer.timed("Write to " + store.getDisplayName(), budget, write);
        }
        catch (ContextSpaceException e) {
            log.error("Write to {} failed: {}", store.getDisplayName(), e.getMessage());
            if (e.getErrorType() == ErrorType.STORE_WRITE_FAILURE && e.getStoreType() == store) {
                throw e;
            }
            throw ContextSpaceException.writeFailure(store, e);
        }
        catch (Exception e) {
            log.error("Write to {} failed: {}", store.getDisplayName(), e.getMessage());
            throw ContextSpaceException.writeFailure(store, e);
        }
    }

    /**
     * Order codes followed by product terms, without duplicates
     */
    static List<String> entities(String text) {
        final var entities = new LinkedHashSet<>(IdentifierExtractor.orderCodes(text));
        entities.addAll(PRODUCT_TERMS.presentIn(text));
        return List.copyOf(entities);
    }
}
