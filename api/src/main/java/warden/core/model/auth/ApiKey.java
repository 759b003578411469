package warden.core.model.auth;

import java.time.Instant;

/**
 * An organization API key as stored by the identity store.
 *
 * <p>Only the PBKDF2 hash of the secret is kept. The plaintext key is returned
 * to the client once, when the key is issued.
 *
 * @param id        the key id
 * @param name      the key name, unique within the organization
 * @param orgId     the organization the key belongs to
 * @param hashedKey hex-encoded hash of the key secret
 * @param role      the role granted to callers using the key
 * @param expiresAt expiration timestamp (null if the key never expires)
 */
public record ApiKey(long id, String name, long orgId, String hashedKey, OrgRole role, Instant expiresAt) {

    /**
     * Check whether the key has expired at the given instant.
     *
     * <p>A key whose expiry equals {@code now} is already expired.
     *
     * @param now the current time
     * @return true if an expiry is set and is not after {@code now}
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
