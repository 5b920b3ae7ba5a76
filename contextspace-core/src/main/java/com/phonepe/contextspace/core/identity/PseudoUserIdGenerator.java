package com.phonepe.contextspace.core.identity;

/**
 * Mints new pseudo user ids
 */
@FunctionalInterface
public interface PseudoUserIdGenerator {
    String generate();
}
