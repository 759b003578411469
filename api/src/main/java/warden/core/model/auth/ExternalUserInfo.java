package warden.core.model.auth;

import java.util.Map;

/**
 * User details asserted by an external authentication source, such as an auth proxy.
 *
 * @param authModule the module that asserted the user, e.g. {@code authproxy}
 * @param authId     the identifier the module knows the user by
 * @param login      the login to match or create
 * @param email      the email to match or create (may be null)
 * @param name       the display name (may be null)
 * @param orgRoles   org roles to assign on sign-up, keyed by org id
 */
public record ExternalUserInfo(
        String authModule, String authId, String login, String email, String name, Map<Long, OrgRole> orgRoles) {

    public ExternalUserInfo {
        orgRoles = orgRoles != null ? Map.copyOf(orgRoles) : Map.of();
    }
}
