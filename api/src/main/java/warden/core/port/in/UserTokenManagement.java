package warden.core.port.in;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.UserToken;

/**
 * Port for session token lifecycle operations.
 */
public interface UserTokenManagement {

    /**
     * Issue a new session token for a user.
     *
     * @param userId    the user id
     * @param clientIp  client address (may be null)
     * @param userAgent client user agent (may be null)
     * @return Uni with the token, carrying its raw value
     */
    Uni<UserToken> createToken(long userId, String clientIp, String userAgent);

    /**
     * Resolve a raw token value presented by a client.
     *
     * @param unhashedToken the raw value from the cookie
     * @return Uni with the token, failing with UserTokenNotFoundException if unknown or expired
     */
    Uni<UserToken> lookupToken(String unhashedToken);

    /**
     * Rotate a token if it is due.
     *
     * <p>Safe under concurrent calls for the same token: at most one caller rotates
     * within the grace window.
     *
     * @param token     the token resolved for the current request
     * @param clientIp  client address
     * @param userAgent client user agent
     * @return Uni with the rotation result
     */
    Uni<RotationResult> tryRotateToken(UserToken token, String clientIp, String userAgent);

    /**
     * Revoke a token.
     *
     * @param token the token
     * @return Uni completing when revoked
     */
    Uni<Void> revokeToken(UserToken token);

    /**
     * Result of a rotation attempt.
     *
     * @param rotated true if this call rotated the token
     * @param token   the token after the attempt; carries the new raw value if rotated
     */
    record RotationResult(boolean rotated, UserToken token) {

        public static RotationResult notRotated(UserToken token) {
            return new RotationResult(false, token);
        }
    }
}
