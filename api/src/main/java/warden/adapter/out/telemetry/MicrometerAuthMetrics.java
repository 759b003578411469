package warden.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.config.TelemetryConfig;
import warden.core.port.out.AuthMetrics;

/**
 * Records authentication metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, so callers never need to
 * check configuration.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.auth.attempts.total} - Dispatch outcomes by strategy and result</li>
 *   <li>{@code warden.auth.proxy.cache.total} - Auth proxy cache lookups by hit or miss</li>
 *   <li>{@code warden.cache.timeouts.total} - Remote cache operations that timed out</li>
 *   <li>{@code warden.cache.failures.total} - Remote cache operations that failed</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAuthMetrics implements AuthMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerAuthMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAttempt(String strategy, String result) {
        if (!enabled) {
            return;
        }
        Counter.builder("warden.auth.attempts.total")
                .description("Authentication dispatch outcomes")
                .tag("strategy", nullSafe(strategy))
                .tag("result", nullSafe(result))
                .register(registry)
                .increment();
    }

    @Override
    public void recordProxyCacheLookup(boolean hit) {
        if (!enabled) {
            return;
        }
        Counter.builder("warden.auth.proxy.cache.total")
                .description("Auth proxy user id cache lookups")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheTimeout(String cache, String operation) {
        if (!enabled) {
            return;
        }
        Counter.builder("warden.cache.timeouts.total")
                .description("Remote cache operations that timed out")
                .tag("cache", nullSafe(cache))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheFailure(String cache, String operation) {
        if (!enabled) {
            return;
        }
        Counter.builder("warden.cache.failures.total")
                .description("Remote cache operations that failed")
                .tag("cache", nullSafe(cache))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
