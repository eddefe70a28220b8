package com.diagramforge.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic cell id generation based on SHA-256.
 *
 * <p>The same inputs always produce the same id, so repaired documents are reproducible.
 *
 * <pre>{@code
 * String id = IdGenerator.generate("cell", "3");  // 16 hex characters
 * }</pre>
 */
public final class IdGenerator {

    private static final int ID_LENGTH = 16;

    private IdGenerator() {
    }

    /**
     * Generates a 16-character id from one or more components joined with {@code :}.
     *
     * @param components id components
     * @return 16 hex characters
     * @throws IllegalArgumentException if no component is given
     */
    public static String generate(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        return generateFullHash(String.join(":", components)).substring(0, ID_LENGTH);
    }

    /**
     * Returns the full SHA-256 hex digest of the input.
     *
     * @param input input text
     * @return 64 hex characters
     */
    public static String generateFullHash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
