package warden.core.model.auth;

import java.time.Instant;

/**
 * A user resolved within the scope of one organization.
 *
 * @param userId     the user id
 * @param orgId      the organization id the user is acting in
 * @param orgName    the organization name
 * @param orgRole    the user's role in the organization
 * @param login      the user's login
 * @param email      the user's email (may be null)
 * @param name       the user's display name (may be null)
 * @param lastSeenAt when the user was last seen (may be null if never)
 */
public record SignedInUser(
        long userId,
        long orgId,
        String orgName,
        OrgRole orgRole,
        String login,
        String email,
        String name,
        Instant lastSeenAt) {

    public SignedInUser {
        if (orgRole == null) {
            orgRole = OrgRole.VIEWER;
        }
    }
}
