package warden.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Initial organization and admin user created at startup.
 */
@ConfigMapping(prefix = "warden.bootstrap")
public interface BootstrapConfig {

    @WithDefault("true")
    boolean enabled();

    @WithDefault("Main Org.")
    String orgName();

    @WithDefault("admin")
    String adminUser();

    /**
     * Admin password. Startup fails when bootstrap is enabled and none is set.
     */
    Optional<String> adminPassword();

    Optional<String> adminEmail();
}
