package com.phonepe.contextspace.core.hashing;

/**
 * One way, deterministic hashing of raw channel identifiers
 */
@FunctionalInterface
public interface IdentifierHasher {
    String hash(String rawIdentifier);
}
