package warden.adapter.out.storage.memory;

import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import warden.core.model.auth.RenderUser;
import warden.core.port.out.RenderKeyStore;
import warden.core.util.SecureHash;

/**
 * Caffeine-backed render key store. Each key expires after the TTL it was issued with.
 */
@ApplicationScoped
public class InMemoryRenderKeyStore implements RenderKeyStore {

    private static final int KEY_BYTES = 16;
    private static final long MAX_KEYS = 10_000;

    private final Cache<String, Entry> keys;

    private record Entry(RenderUser user, long ttlNanos) {}

    public InMemoryRenderKeyStore() {
        this.keys = Caffeine.newBuilder()
                .expireAfter(new Expiry<String, Entry>() {
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
                })
                .maximumSize(MAX_KEYS)
                .build();
    }

    @Override
    public String issue(RenderUser user, Duration ttl) {
        final var key = SecureHash.randomHex(KEY_BYTES);
        keys.put(key, new Entry(user, ttl.toNanos()));
        return key;
    }

    @Override
    public Optional<RenderUser> getRenderUser(String key) {
        return Optional.ofNullable(keys.getIfPresent(key)).map(Entry::user);
    }

    @Override
    public void revoke(String key) {
        keys.invalidate(key);
    }
}
