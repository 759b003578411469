package warden.adapter.out.cache;

import java.time.Duration;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;

import warden.core.model.exception.CacheItemNotFoundException;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.RemoteCache;

/**
 * Redis implementation of RemoteCache, shared by every instance.
 *
 * <p>Keys are stored with the configured prefix ({@code warden:} by default).
 * Entries are written with {@code SETEX} so Redis expires them.
 */
public class RedisRemoteCache implements RemoteCache {

    private final ReactiveValueCommands<String, byte[]> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final CacheTimeoutHelper timeoutHelper;

    public RedisRemoteCache(ReactiveRedisDataSource ds, String keyPrefix, Duration timeout, AuthMetrics metrics) {
        this.valueCommands = ds.value(String.class, byte[].class);
        this.keyCommands = ds.key(String.class);
        this.keyPrefix = keyPrefix;
        this.timeoutHelper = new CacheTimeoutHelper(timeout, metrics, "redis");
    }

    @Override
    public Uni<Optional<byte[]>> get(String key) {
        return timeoutHelper.withTimeout(valueCommands.get(prefixed(key)).map(Optional::ofNullable), "get");
    }

    @Override
    public Uni<Void> set(String key, byte[] value, Duration ttl) {
        final var seconds = Math.max(1L, ttl.toSeconds());
        return timeoutHelper.withTimeout(valueCommands.setex(prefixed(key), seconds, value), "set");
    }

    @Override
    public Uni<Void> delete(String key) {
        final var operation = keyCommands.del(prefixed(key)).map(deleted -> {
            if (deleted == 0) {
                throw new CacheItemNotFoundException(key);
            }
            return (Void) null;
        });
        return timeoutHelper.withTimeout(operation, "delete");
    }

    private String prefixed(String key) {
        return keyPrefix + key;
    }
}
