package warden.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Utility for hashing and generating sensitive identifiers.
 *
 * <p>Uses SHA-256 so that values stored in caches or databases are deterministic
 * but never expose the original input.
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private SecureHash() {}

    /**
     * Return the full SHA-256 hex digest of the input string.
     *
     * @param input the string to hash
     * @return 64-character lowercase hex digest
     */
    public static String sha256Hex(String input) {
        return HexFormat.of().formatHex(digest(input));
    }

    /**
     * Return a truncated SHA-256 hex digest of the input string.
     *
     * <p>Uses the first {@code hexChars} characters of the full hex digest.
     * 32 hex characters = 128 bits, enough for cache keys.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1-64)
     * @return truncated hex digest
     * @throws IllegalArgumentException if hexChars is less than 1 or greater than 64
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        return sha256Hex(input).substring(0, hexChars);
    }

    /**
     * Generate a random hex string from a cryptographically secure source.
     *
     * @param bytes number of random bytes; the result has twice as many characters
     * @return lowercase hex string
     */
    public static String randomHex(int bytes) {
        final var buffer = new byte[bytes];
        SECURE_RANDOM.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }

    private static byte[] digest(String input) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 not available", e);
        }
    }
}
