package com.phonepe.contextspace.core.identity;

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.phonepe.contextspace.core.config.IdentityMatchingOptions;
import com.phonepe.contextspace.core.config.SlaBudgets;
import com.phonepe.contextspace.core.errors.ErrorType;
import com.phonepe.contextspace.core.errors.ValidationException;
import com.phonepe.contextspace.core.hashing.IdentifierHasher;
import com.phonepe.contextspace.core.hashing.Sha256IdentifierHasher;
import com.phonepe.contextspace.core.identity.signals.BehaviorSimilaritySignal;
import com.phonepe.contextspace.core.identity.signals.IdentifierOverlapSignal;
import com.phonepe.contextspace.core.identity.signals.MetadataSimilaritySignal;
import com.phonepe.contextspace.core.identity.signals.VectorSimilaritySignal;
import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.IdentityMapEntry;
import com.phonepe.contextspace.core.model.IdentityResolution;
import com.phonepe.contextspace.core.model.LinkedSession;
import com.phonepe.contextspace.core.store.IdentityMapStore;
import com.phonepe.contextspace.core.utils.SlaTimer;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Decides which pseudo user an incoming session belongs to and maintains the identity map.
 * <p>
 * Resolution is best effort: any failure while scoring results in a freshly minted pseudo user id.
 */
@Slf4j
public class IdentityResolver {
    private final IdentityMapStore identityMap;
    private final IdentifierHasher hasher;
    private final PseudoUserIdGenerator idGenerator;
    private final IdentityMatchingOptions options;
    private final List<WeightedSignal> signals;
    private final Duration sla;

    @Builder
    public IdentityResolver(
            @NonNull IdentityMapStore identityMap,
            IdentifierHasher hasher,
            PseudoUserIdGenerator idGenerator,
            IdentityMatchingOptions options,
            List<WeightedSignal> signals,
            SlaBudgets slaBudgets) {
        this.identityMap = identityMap;
        this.hasher = Objects.requireNonNullElseGet(hasher, Sha256IdentifierHasher::new);
        this.idGenerator = Objects.requireNonNullElseGet(idGenerator, SecurePseudoUserIdGenerator::new);
        this.options = Objects.requireNonNullElse(options, IdentityMatchingOptions.DEFAULT);
        this.signals = signals == null || signals.isEmpty() ? defaultSignals(this.options) : List.copyOf(signals);
        this.sla = Objects.requireNonNullElse(slaBudgets, SlaBudgets.DEFAULT).getIdentityResolution();
    }

    public static List<WeightedSignal> defaultSignals(IdentityMatchingOptions options) {
        return List.of(
                new WeightedSignal(new VectorSimilaritySignal(), options.getVectorWeight()),
                new WeightedSignal(new MetadataSimilaritySignal(), options.getMetadataWeight()),
                new WeightedSignal(new BehaviorSimilaritySignal(options.getBehaviorLengthScale()),
                                   options.getBehaviorWeight()),
                new WeightedSignal(new IdentifierOverlapSignal(), options.getIdentifierWeight()));
    }

    /**
     * Resolves the pseudo user id for the incoming turn
     */
    public String resolve(MatchInput input) {
        return resolveWithScore(input).getPseudoUserId();
    }

    public IdentityResolution resolveWithScore(MatchInput input) {
        final var stopwatch = Stopwatch.createStarted();
        try {
            if (input.getHistoricalCandidates().isEmpty()) {
                final var minted = idGenerator.generate();
                log.debug("Minted pseudo user id {} as there is no history", minted);
                return new IdentityResolution(minted, 0.0, true);
            }
            final var score = matchScore(input);
            if (score > options.getMatchThreshold()) {
                final var matched = input.getHistoricalCandidates().get(0).getPseudoUserId();
                if (!Strings.isNullOrEmpty(matched)) {
                    log.debug("Linked to existing pseudo user id {} with score {}", matched, score);
                    return new IdentityResolution(matched, score, false);
                }
            }
            final var minted = idGenerator.generate();
            log.debug("Minted pseudo user id {}. Score {} is not above threshold {}",
                      minted, score, options.getMatchThreshold());
            return new IdentityResolution(minted, score, true);
        }
        catch (Exception e) {
            log.error("{}. Minting a new pseudo user id",
                      ErrorType.RESOLUTION_FAILURE.getMessage().formatted(e.getMessage()), e);
            return new IdentityResolution(idGenerator.generate(), 0.0, true);
        }
        finally {
            SlaTimer.report("Identity resolution", sla, stopwatch);
        }
    }

    /**
     * Weighted sum of all signals
     */
    public double matchScore(MatchInput input) {
        var score = 0.0;
        for (final var weighted : signals) {
            final var value = weighted.signal().score(input);
            log.debug("Identity signal {}: {}", weighted.signal().name(), value);
            score += weighted.weight() * value;
        }
        return score;
    }

    /**
     * Hashes the raw channel user id and links it to the pseudo user
     *
     * @return The entry the session ends up linked to, empty if linking failed
     */
    public Optional<IdentityMapEntry> linkToMap(
            String pseudoUserId,
            Channel channel,
            String rawChannelUserId,
            double confidence) {
        if (Strings.isNullOrEmpty(rawChannelUserId)) {
            throw ValidationException.blank("channel_user_id");
        }
        return linkHashedToMap(pseudoUserId, channel, hasher.hash(rawChannelUserId), confidence);
    }

    /**
     * Same as {@link #linkToMap(String, Channel, String, double)} for an id that is already hashed.
     * Failures are logged and swallowed.
     */
    public Optional<IdentityMapEntry> linkHashedToMap(
            String pseudoUserId,
            Channel channel,
            String hashedChannelUserId,
            double confidence) {
        final var stopwatch = Stopwatch.createStarted();
        try {
            final var entry = identityMap.link(pseudoUserId, LinkedSession.builder()
                    .channel(channel)
                    .hashedChannelUserId(hashedChannelUserId)
                    .confidence(confidence)
                    .build());
            log.debug("Linked {} session to {} with confidence {} in {} ms",
                      channel, entry.getPseudoUserId(), confidence, stopwatch.elapsed(TimeUnit.MILLISECONDS));
            return Optional.of(entry);
        }
        catch (Exception e) {
            log.error("Failed to link {} session to pseudo user {}: {}", channel, pseudoUserId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Reverse lookup of the pseudo user a channel identity is linked to
     */
    public Optional<String> findPseudoUserId(Channel channel, String rawChannelUserId) {
        if (Strings.isNullOrEmpty(rawChannelUserId)) {
            return Optional.empty();
        }
        try {
            return identityMap.findByLinkedSession(channel, hasher.hash(rawChannelUserId))
                    .map(IdentityMapEntry::getPseudoUserId);
        }
        catch (Exception e) {
            log.warn("Reverse lookup failed for {} session: {}", channel, e.getMessage());
            return Optional.empty();
        }
    }
}
