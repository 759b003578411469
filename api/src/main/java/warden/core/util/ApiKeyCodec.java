package warden.core.util;

import java.io.IOException;
import java.util.Base64;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import warden.core.model.auth.DecodedApiKey;

/**
 * Encodes, decodes and verifies organization API keys.
 *
 * <p>A client key is the base64 encoding of {@code {"k":secret,"n":name,"id":orgId}}.
 * The store keeps a PBKDF2-HMAC-SHA256 hash of the secret salted with the key name.
 */
public final class ApiKeyCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int SECRET_BYTES = 16;

    private ApiKeyCodec() {}

    /**
     * Wire form of a client key.
     */
    record KeyPayload(
            @JsonProperty("k") String secret, @JsonProperty("n") String name, @JsonProperty("id") long orgId) {}

    /**
     * A freshly generated key.
     *
     * @param clientKey the encoded key to hand to the client once
     * @param hashedKey the hash to store
     */
    public record GeneratedKey(String clientKey, String hashedKey) {}

    /**
     * Generate a new key for the given name and organization.
     */
    public static GeneratedKey generate(String name, long orgId) {
        final var secret = SecureHash.randomHex(SECRET_BYTES);
        return new GeneratedKey(encode(new DecodedApiKey(name, orgId, secret)), hashSecret(secret, name));
    }

    /**
     * Encode key parts into the client form.
     */
    public static String encode(DecodedApiKey key) {
        try {
            final var json = MAPPER.writeValueAsBytes(new KeyPayload(key.secret(), key.name(), key.orgId()));
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode API key", e);
        }
    }

    /**
     * Decode a client key.
     *
     * @param clientKey the key from the request
     * @return the key parts
     * @throws InvalidApiKeyException if the key is not valid base64 JSON with a name and secret
     */
    public static DecodedApiKey decode(String clientKey) {
        final byte[] json;
        try {
            json = Base64.getDecoder().decode(clientKey.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidApiKeyException("API key is not valid base64", e);
        }
        final KeyPayload payload;
        try {
            payload = MAPPER.readValue(json, KeyPayload.class);
        } catch (IOException e) {
            throw new InvalidApiKeyException("API key payload is malformed", e);
        }
        if (payload == null || payload.name() == null || payload.name().isEmpty() || payload.secret() == null) {
            throw new InvalidApiKeyException("API key payload is incomplete", null);
        }
        return new DecodedApiKey(payload.name(), payload.orgId(), payload.secret());
    }

    /**
     * Hash a key secret for storage.
     *
     * @param secret the plaintext secret
     * @param name   the key name, used as salt
     * @return hex-encoded hash
     */
    public static String hashSecret(String secret, String name) {
        return PasswordHash.encode(secret, name);
    }

    /**
     * Verify a decoded key against a stored hash in constant time.
     *
     * @param key       the decoded client key
     * @param hashedKey the stored hash
     * @return true if the secret matches
     */
    public static boolean isValid(DecodedApiKey key, String hashedKey) {
        return PasswordHash.matches(key.secret(), key.name(), hashedKey);
    }

    /**
     * Thrown when a client key cannot be decoded.
     */
    public static class InvalidApiKeyException extends RuntimeException {

        public InvalidApiKeyException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
