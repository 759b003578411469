package warden.core.util;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Parses {@code Authorization: Basic ...} header values.
 */
public final class BasicAuthHeader {

    private static final String BASIC_PREFIX = "Basic ";

    private BasicAuthHeader() {}

    /**
     * Decoded basic credentials.
     *
     * @param username the username
     * @param password the password
     */
    public record Credentials(String username, String password) {

        @Override
        public String toString() {
            return "Credentials[username=" + username + ", password=***]";
        }
    }

    /**
     * Decode a basic auth header value.
     *
     * @param header the full header value (may be null)
     * @return the credentials, or empty if the header is not a well-formed Basic header
     */
    public static Optional<Credentials> decode(String header) {
        if (header == null || !header.startsWith(BASIC_PREFIX)) {
            return Optional.empty();
        }
        final var encoded = header.substring(BASIC_PREFIX.length()).trim();
        final String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        final var separator = decoded.indexOf(':');
        if (separator < 0) {
            return Optional.empty();
        }
        return Optional.of(new Credentials(decoded.substring(0, separator), decoded.substring(separator + 1)));
    }

    /**
     * Encode credentials as a basic auth header value.
     *
     * @return header value including the {@code Basic} scheme
     */
    public static String encode(String username, String password) {
        final var raw = username + ":" + password;
        return BASIC_PREFIX + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }
}
