package warden.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for session token authentication.
 *
 * <p>Configuration prefix: {@code warden.auth.session}
 */
@ConfigMapping(prefix = "warden.auth.session")
public interface SessionConfig {

    /**
     * Cookie configuration.
     */
    CookieConfig cookie();

    /**
     * Maximum lifetime of a session, from its creation.
     *
     * @return lifetime (default: 30 days)
     */
    @WithDefault("P30D")
    Duration loginMaxLifetime();

    /**
     * Maximum time a session may go without being rotated.
     *
     * @return inactive lifetime (default: 7 days)
     */
    @WithDefault("P7D")
    Duration loginMaxInactiveLifetime();

    /**
     * How often a seen token is rotated.
     *
     * @return rotation interval (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration rotationInterval();

    /**
     * Secret mixed into token hashes.
     *
     * @return secret key
     */
    @WithDefault("SW2YcwTIb9zpOOhoPsMm")
    String secretKey();

    /**
     * Cookie configuration options.
     */
    interface CookieConfig {

        /**
         * Session cookie name. Session authentication is disabled when unset.
         *
         * @return cookie name
         */
        Optional<String> name();

        /** @return cookie path (default: /) */
        @WithDefault("/")
        String path();

        /** @return cookie domain (optional) */
        Optional<String> domain();

        /** @return true if the cookie is HTTPS only (default: false) */
        @WithDefault("false")
        boolean secure();

        /** @return true if the cookie is hidden from scripts (default: true) */
        @WithDefault("true")
        boolean httpOnly();

        /** @return SameSite value: Strict, Lax, or None (default: Lax) */
        @WithDefault("Lax")
        String sameSite();
    }
}
