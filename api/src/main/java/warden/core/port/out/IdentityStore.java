package warden.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.ApiKey;
import warden.core.model.auth.ExternalUserInfo;
import warden.core.model.auth.Org;
import warden.core.model.auth.SignedInUser;
import warden.core.model.auth.User;

/**
 * Port for looking up the identities the authentication pipeline resolves.
 *
 * <p>Lookups that find nothing fail with a subclass of
 * {@link warden.core.model.exception.IdentityNotFoundException}. Any other failure
 * means the store itself is unhealthy.
 */
public interface IdentityStore {

    /**
     * Find an API key by name within an organization.
     *
     * @param name  the key name
     * @param orgId the organization id
     * @return Uni with the key, failing with ApiKeyNotFoundException if absent
     */
    Uni<ApiKey> lookupApiKey(String name, long orgId);

    /**
     * Check a username (login or email) and password.
     *
     * @param username login or email
     * @param password plaintext password
     * @return Uni with the user; fails with UserNotFoundException or InvalidCredentialsException
     */
    Uni<User> login(String username, String password);

    /**
     * Resolve a user within an organization.
     *
     * <p>An {@code orgId} of 0 or less selects the user's current organization.
     *
     * @param userId the user id
     * @param orgId  the requested organization id
     * @return Uni with the signed-in user, failing with UserNotFoundException if absent
     */
    Uni<SignedInUser> getSignedInUser(long userId, long orgId);

    /**
     * Find an organization by name.
     *
     * @param name the organization name
     * @return Uni with the organization, failing with OrgNotFoundException if absent
     */
    Uni<Org> getOrgByName(String name);

    /**
     * Find a user whose login or email equals the given value.
     *
     * @param loginOrEmail the value to match
     * @return Uni with the user if found
     */
    Uni<Optional<User>> findUserByLoginOrEmail(String loginOrEmail);

    /**
     * Create or update a user asserted by an external source.
     *
     * @param info          the asserted user details
     * @param signUpAllowed whether a missing user may be created
     * @return Uni with the user; fails with UserNotFoundException if missing and sign-up is not allowed
     */
    Uni<User> upsertExternalUser(ExternalUserInfo info, boolean signUpAllowed);

    /**
     * Record that a user was just seen.
     *
     * @param userId the user id
     * @return Uni completing when the timestamp is stored
     */
    Uni<Void> updateLastSeenAt(long userId);
}
