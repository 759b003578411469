package warden.adapter.out.cache;

import java.time.Duration;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import io.smallrye.mutiny.Uni;

import warden.core.model.exception.CacheItemNotFoundException;
import warden.core.port.out.RemoteCache;

/**
 * Caffeine-backed remote cache for single-instance deployments.
 *
 * <p>Each entry expires after the TTL it was written with.
 */
public class InMemoryRemoteCache implements RemoteCache {

    private final Cache<String, Entry> cache;

    private record Entry(byte[] value, long ttlNanos) {}

    public InMemoryRemoteCache(long maxSize) {
        this.cache = Caffeine.newBuilder()
                .expireAfter(new PerEntryExpiry())
                .maximumSize(maxSize)
                .build();
    }

    private static class PerEntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    @Override
    public Uni<Optional<byte[]>> get(String key) {
        final var entry = cache.getIfPresent(key);
        return Uni.createFrom().item(Optional.ofNullable(entry).map(e -> e.value().clone()));
    }

    @Override
    public Uni<Void> set(String key, byte[] value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return Uni.createFrom().failure(new IllegalArgumentException("TTL must be positive: " + ttl));
        }
        cache.put(key, new Entry(value.clone(), ttl.toNanos()));
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Void> delete(String key) {
        if (cache.asMap().remove(key) == null) {
            return Uni.createFrom().failure(new CacheItemNotFoundException(key));
        }
        return Uni.createFrom().voidItem();
    }
}
