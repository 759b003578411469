package warden.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for trusting an authenticating reverse proxy.
 *
 * <p>Configuration prefix: {@code warden.auth.proxy}
 *
 * <h2>Example</h2>
 * <pre>
 * warden.auth.proxy.enabled=true
 * warden.auth.proxy.header-name=X-WEBAUTH-USER
 * warden.auth.proxy.header-property=username
 * warden.auth.proxy.headers.Email=X-WEBAUTH-EMAIL
 * warden.auth.proxy.whitelist=10.0.0.0/8, 192.168.1.5
 * </pre>
 */
@ConfigMapping(prefix = "warden.auth.proxy")
public interface AuthProxyConfig {

    /** @return true if the proxy header is trusted (default: false) */
    @WithDefault("false")
    boolean enabled();

    /** @return header carrying the authenticated user (default: X-WEBAUTH-USER) */
    @WithDefault("X-WEBAUTH-USER")
    String headerName();

    /**
     * How the header value is interpreted.
     *
     * @return {@code username} or {@code email} (default: username)
     */
    @WithDefault("username")
    String headerProperty();

    /**
     * Additional headers describing the user, keyed by attribute.
     *
     * <p>Recognized attributes: {@code Name}, {@code Email}, {@code Login}, {@code Role}
     * and {@code Groups}. {@code Groups} is not synced to the user; it only feeds the
     * cache key, so a change in group membership forces a fresh login.
     *
     * @return attribute to header name
     */
    Map<String, String> headers();

    /**
     * IPs or CIDR ranges the proxy connects from.
     *
     * <p>Entries may be separated by commas or spaces. When empty, every address
     * is accepted.
     *
     * @return allow-list entries
     */
    Optional<List<String>> whitelist();

    /**
     * How long a resolved proxy user id is cached.
     *
     * @return cache TTL (default: 60 minutes)
     */
    @WithDefault("PT60M")
    Duration syncTtl();

    /** @return true if unknown proxy users are created on first sight (default: true) */
    @WithDefault("true")
    boolean autoSignUp();
}
