package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration prefix: {@code warden.auth.basic}
 */
@ConfigMapping(prefix = "warden.auth.basic")
public interface BasicAuthConfig {

    /** @return true if username/password basic auth is accepted (default: true) */
    @WithDefault("true")
    boolean enabled();
}
