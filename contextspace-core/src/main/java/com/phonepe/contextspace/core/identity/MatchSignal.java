package com.phonepe.contextspace.core.identity;

/**
 * One similarity signal between an incoming session and its historical candidates.
 * Implementations return a value in [0,1].
 */
public interface MatchSignal {
    String name();

    double score(MatchInput input);
}
