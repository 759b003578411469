package warden.core.util;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

/**
 * PBKDF2-HMAC-SHA256 hashing for user passwords and API key secrets.
 *
 * <p>10,000 iterations, 50-byte output, hex encoded.
 */
public final class PasswordHash {

    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final int KDF_ITERATIONS = 10_000;
    private static final int KDF_KEY_BYTES = 50;
    private static final int SALT_BYTES = 5;

    private PasswordHash() {}

    /**
     * Hash a password with the given salt.
     *
     * @throws IllegalStateException if hashing fails, including for an empty salt
     */
    public static String encode(String password, String salt) {
        try {
            final var spec = new PBEKeySpec(
                    password.toCharArray(), salt.getBytes(StandardCharsets.UTF_8), KDF_ITERATIONS, KDF_KEY_BYTES * 8);
            final var factory = SecretKeyFactory.getInstance(KDF_ALGORITHM);
            return HexFormat.of().formatHex(factory.generateSecret(spec).getEncoded());
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Password hashing failed", e);
        }
    }

    /**
     * Compare a password against a stored hash in constant time.
     */
    public static boolean matches(String password, String salt, String encoded) {
        if (encoded == null) {
            return false;
        }
        final var computed = encode(password, salt);
        return MessageDigest.isEqual(
                computed.getBytes(StandardCharsets.UTF_8), encoded.getBytes(StandardCharsets.UTF_8));
    }

    public static String newSalt() {
        return SecureHash.randomHex(SALT_BYTES);
    }
}
