package warden.adapter.out.cache;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.core.config.RemoteCacheConfig;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.RemoteCache;

/**
 * Produces the remote cache selected by {@code warden.cache.provider}.
 *
 * <ul>
 *   <li>{@code memory}: Caffeine, local to this instance (default)</li>
 *   <li>{@code redis}: shared Redis, using the Quarkus Redis client</li>
 * </ul>
 */
@ApplicationScoped
public class RemoteCacheProducer {

    private static final Logger LOG = Logger.getLogger(RemoteCacheProducer.class);

    private final RemoteCacheConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final AuthMetrics metrics;

    @Inject
    public RemoteCacheProducer(
            RemoteCacheConfig config, Instance<ReactiveRedisDataSource> redisDataSource, AuthMetrics metrics) {
        this.config = config;
        this.redisDataSource = redisDataSource;
        this.metrics = metrics;
    }

    @Produces
    @ApplicationScoped
    public RemoteCache remoteCache() {
        final var provider = config.provider().trim().toLowerCase(Locale.ROOT);
        switch (provider) {
            case "memory" -> {
                LOG.infof("Using in-memory remote cache (max size %d)", config.memory().maxSize());
                return new InMemoryRemoteCache(config.memory().maxSize());
            }
            case "redis" -> {
                if (!redisDataSource.isResolvable()) {
                    throw new CacheProviderException("Redis cache selected but no Redis data source is configured");
                }
                LOG.infof("Using Redis remote cache (key prefix %s, timeout %s)",
                        config.redis().keyPrefix(), config.timeout());
                return new RedisRemoteCache(
                        redisDataSource.get(), config.redis().keyPrefix(), config.timeout(), metrics);
            }
            default -> throw new CacheProviderException(
                    "Unknown cache provider: " + config.provider() + ". Available: [memory, redis]");
        }
    }
}
