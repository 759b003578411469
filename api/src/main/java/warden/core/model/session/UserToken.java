package warden.core.model.session;

import java.time.Instant;

/**
 * A long-lived, rotating session token.
 *
 * <p>Only {@code authToken} and {@code prevAuthToken} (both hashed) are persisted.
 * {@code unhashedToken} is set in memory right after creation, lookup or rotation
 * so it can be written to the session cookie, and is never stored.
 *
 * <p>After a rotation the previous hash moves to {@code prevAuthToken}, so a
 * request already in flight with the old value still resolves.
 *
 * @param id             token id
 * @param userId         the user the token belongs to
 * @param authToken      hash of the current token value
 * @param prevAuthToken  hash of the value before the last rotation
 * @param unhashedToken  the current raw value, only in memory (may be null)
 * @param authTokenSeen  whether a client has presented the current value
 * @param seenAt         when the current value was first presented (may be null)
 * @param rotatedAt      when the value was last rotated (creation counts as a rotation)
 * @param createdAt      when the session was created
 * @param updatedAt      when the record was last modified
 * @param clientIp       client address at the last rotation (may be null)
 * @param userAgent      client user agent at the last rotation (may be null)
 */
public record UserToken(
        long id,
        long userId,
        String authToken,
        String prevAuthToken,
        String unhashedToken,
        boolean authTokenSeen,
        Instant seenAt,
        Instant rotatedAt,
        Instant createdAt,
        Instant updatedAt,
        String clientIp,
        String userAgent) {

    /**
     * Creates a copy carrying the given raw value.
     */
    public UserToken withUnhashedToken(String unhashedToken) {
        return new UserToken(
                id,
                userId,
                authToken,
                prevAuthToken,
                unhashedToken,
                authTokenSeen,
                seenAt,
                rotatedAt,
                createdAt,
                updatedAt,
                clientIp,
                userAgent);
    }

    /**
     * Creates a copy with the current value marked as seen.
     */
    public UserToken markSeen(Instant now) {
        return new UserToken(
                id,
                userId,
                authToken,
                prevAuthToken,
                unhashedToken,
                true,
                now,
                rotatedAt,
                createdAt,
                now,
                clientIp,
                userAgent);
    }

    /**
     * Creates a copy with the current value marked as not yet seen, so it is sent again.
     */
    public UserToken markUnseen(Instant now) {
        return new UserToken(
                id,
                userId,
                authToken,
                prevAuthToken,
                unhashedToken,
                false,
                seenAt,
                rotatedAt,
                createdAt,
                now,
                clientIp,
                userAgent);
    }

    /**
     * Creates a rotated copy.
     *
     * <p>The previous hash is only replaced when the current value has been seen.
     * Otherwise the client never received the current value and the older hash
     * must keep working.
     *
     * @param newHashedToken   hash of the new value
     * @param newUnhashedToken the new raw value
     * @param now              the rotation time
     * @param clientIp         client address
     * @param userAgent        client user agent
     */
    public UserToken rotate(
            String newHashedToken, String newUnhashedToken, Instant now, String clientIp, String userAgent) {
        return new UserToken(
                id,
                userId,
                newHashedToken,
                authTokenSeen ? authToken : prevAuthToken,
                newUnhashedToken,
                false,
                null,
                now,
                createdAt,
                now,
                clientIp,
                userAgent);
    }

    @Override
    public String toString() {
        return "UserToken[id=" + id + ", userId=" + userId + ", authTokenSeen=" + authTokenSeen + ", rotatedAt="
                + rotatedAt + ", createdAt=" + createdAt + "]";
    }
}
