package warden.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Shared key/value cache with per-entry TTL.
 *
 * <p>Entries are advisory: callers must tolerate misses and stale values.
 */
public interface RemoteCache {

    /**
     * @param key the cache key
     * @return Uni with the cached bytes, or empty on a miss
     */
    Uni<Optional<byte[]>> get(String key);

    /**
     * Store a value.
     *
     * @param key   the cache key
     * @param value the bytes to store
     * @param ttl   time-to-live; zero or negative means no expiry
     * @return Uni completing when stored
     */
    Uni<Void> set(String key, byte[] value, Duration ttl);

    /**
     * Remove a value.
     *
     * @param key the cache key
     * @return Uni completing when removed; fails with CacheItemNotFoundException if absent
     */
    Uni<Void> delete(String key);
}
