package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration shared by all authentication strategies.
 *
 * <p>Configuration prefix: {@code warden.auth}
 */
@ConfigMapping(prefix = "warden.auth")
public interface ContextConfig {

    /**
     * Header carrying the organization a request is scoped to.
     *
     * @return header name (default: X-Grafana-Org-Id)
     */
    @WithDefault("X-Grafana-Org-Id")
    String orgIdHeader();

    /**
     * How stale a user's last-seen timestamp may get before it is refreshed.
     *
     * @return refresh interval (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration lastSeenUpdateInterval();
}
