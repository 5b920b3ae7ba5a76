package com.phonepe.contextspace.core.identity;

import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * Generates ids of five upper case hex groups (8-4-4-4-12) from a {@link SecureRandom}
 */
public class SecurePseudoUserIdGenerator implements PseudoUserIdGenerator {
    public static final Pattern FORMAT = Pattern.compile(
            "^[0-9A-F]{8}-[0-9A-F]{4}-[0-9A-F]{4}-[0-9A-F]{4}-[0-9A-F]{12}$");

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();
    private static final int[] GROUPS = {8, 4, 4, 4, 12};

    private final SecureRandom random;

    public SecurePseudoUserIdGenerator() {
        this(new SecureRandom());
    }

    public SecurePseudoUserIdGenerator(SecureRandom random) {
        this.random = random;
    }

    @Override
    public String generate() {
        final var id = new StringBuilder(36);
        for (int group = 0; group < GROUPS.length; group++) {
            if (group > 0) {
                id.append('-');
            }
            for (int i = 0; i < GROUPS[group]; i++) {
                id.append(HEX[random.nextInt(HEX.length)]);
            }
        }
        return id.toString();
    }
}
