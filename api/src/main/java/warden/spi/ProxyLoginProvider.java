package warden.spi;

import io.smallrye.mutiny.Uni;

import warden.core.model.proxy.AuthProxyRequest;

/**
 * Service Provider Interface for resolving an auth proxy claim to a user id.
 *
 * <p>The built-in provider looks the user up by the header value and signs it up
 * when allowed. A directory-backed provider (LDAP, SCIM) can be added by
 * implementing this interface as a CDI bean with a higher priority.
 *
 * <p>Providers are discovered via CDI. The available provider with the highest
 * priority handles every proxy login.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class LdapProxyLoginProvider implements ProxyLoginProvider {
 *     public String name() { return "ldap"; }
 *     public int priority() { return 100; }
 *     public boolean isAvailable() { return ldapConfig.enabled(); }
 *     public Uni<Long> login(AuthProxyRequest request) {
 *         return directory.syncUser(request.headerValue());
 *     }
 * }
 * }</pre>
 */
public interface ProxyLoginProvider {

    /**
     * Unique name identifying this provider, used in logs.
     */
    String name();

    /**
     * Priority for provider selection (higher = preferred).
     *
     * <p>The built-in header provider uses 0.
     */
    default int priority() {
        return 0;
    }

    /**
     * Whether this provider can currently be used.
     *
     * <p>Check configuration or connectivity here. Unavailable providers are skipped.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Resolve the proxy claim to a local user, creating or syncing it as needed.
     *
     * @param request what the proxy asserted
     * @return Uni with the user id; fails when the claim cannot be resolved
     */
    Uni<Long> login(AuthProxyRequest request);
}
