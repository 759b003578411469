package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration prefix: {@code warden.telemetry}
 */
@ConfigMapping(prefix = "warden.telemetry")
public interface TelemetryConfig {

    /** @return true if authentication metrics are recorded (default: true) */
    @WithDefault("true")
    boolean enabled();
}
