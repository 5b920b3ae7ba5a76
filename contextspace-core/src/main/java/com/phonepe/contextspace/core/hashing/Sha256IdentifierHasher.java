package com.phonepe.contextspace.core.hashing;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Lower case hex SHA-256 of the UTF-8 bytes of the identifier
 */
public class Sha256IdentifierHasher implements IdentifierHasher {
    @Override
    public String hash(String rawIdentifier) {
        return Hashing.sha256()
                .hashString(rawIdentifier, StandardCharsets.UTF_8)
                .toString();
    }
}
