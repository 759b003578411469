package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the remote cache.
 *
 * <p>Configuration prefix: {@code warden.cache}
 */
@ConfigMapping(prefix = "warden.cache")
public interface RemoteCacheConfig {

    /**
     * Cache provider.
     *
     * @return {@code redis} or {@code memory} (default: memory)
     */
    @WithDefault("memory")
    String provider();

    /**
     * Timeout applied to every cache operation.
     *
     * @return timeout (default: 1 second)
     */
    @WithDefault("PT1S")
    Duration timeout();

    RedisConfig redis();

    MemoryConfig memory();

    interface RedisConfig {

        /** @return prefix for every key written to Redis (default: warden:) */
        @WithDefault("warden:")
        String keyPrefix();
    }

    interface MemoryConfig {

        /** @return maximum entries kept in memory (default: 10000) */
        @WithDefault("10000")
        long maxSize();
    }
}
