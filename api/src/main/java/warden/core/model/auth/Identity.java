package warden.core.model.auth;

/**
 * The kind of caller a request was resolved to.
 *
 * <p>This is a sealed interface with four possible identities:
 * - Anonymous: no credentials, anonymous access granted to a configured org
 * - ApiKeyPrincipal: authenticated with an organization API key
 * - UserPrincipal: a signed-in user (basic auth, auth proxy or session token)
 * - RenderPrincipal: the image renderer acting on behalf of a user
 */
public sealed interface Identity {

    /**
     * Anonymous caller.
     */
    record Anonymous() implements Identity {
        private static final Anonymous INSTANCE = new Anonymous();

        public static Anonymous instance() {
            return INSTANCE;
        }
    }

    /**
     * Caller authenticated with an API key.
     *
     * @param keyId   the API key id
     * @param keyName the API key name
     * @param orgId   the organization the key belongs to
     * @param orgRole the role granted by the key
     */
    record ApiKeyPrincipal(long keyId, String keyName, long orgId, OrgRole orgRole) implements Identity {}

    /**
     * Signed-in user.
     *
     * @param userId  the user id
     * @param orgId   the organization the request is scoped to
     * @param orgRole the user's role in that organization
     */
    record UserPrincipal(long userId, long orgId, OrgRole orgRole) implements Identity {}

    /**
     * Render service acting on behalf of a user.
     *
     * @param userId  the user the render was requested for
     * @param orgId   the organization of the render
     * @param orgRole the role the render runs with
     */
    record RenderPrincipal(long userId, long orgId, OrgRole orgRole) implements Identity {}
}
