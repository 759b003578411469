package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import warden.core.model.auth.OrgRole;

/**
 * Configuration for anonymous access.
 *
 * <p>Configuration prefix: {@code warden.auth.anonymous}
 *
 * <h2>Example</h2>
 * <pre>
 * warden.auth.anonymous.enabled=true
 * warden.auth.anonymous.org-name=Public
 * warden.auth.anonymous.org-role=Viewer
 * </pre>
 */
@ConfigMapping(prefix = "warden.auth.anonymous")
public interface AnonymousConfig {

    /** @return true if requests without credentials get anonymous access (default: false) */
    @WithDefault("false")
    boolean enabled();

    /** @return name of the organization anonymous callers are scoped to (default: Main Org.) */
    @WithDefault("Main Org.")
    String orgName();

    /** @return role granted to anonymous callers (default: Viewer) */
    @WithDefault("VIEWER")
    OrgRole orgRole();
}
