package warden.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.UserToken;
import warden.core.port.out.UserTokenRepository;

/**
 * In-memory implementation of UserTokenRepository.
 *
 * <p>Intended for development and testing only. Sessions are lost on restart.
 * Conditional updates run inside {@link ConcurrentMap#compute}, so they are atomic
 * per token. Raw token values are never stored.
 */
@ApplicationScoped
public class InMemoryUserTokenRepository implements UserTokenRepository {

    private final AtomicLong ids = new AtomicLong();
    private final ConcurrentMap<Long, UserToken> tokens = new ConcurrentHashMap<>();

    @Override
    public Uni<UserToken> insert(UserToken token) {
        return Uni.createFrom().item(() -> {
            final var stored = new UserToken(
                    ids.incrementAndGet(),
                    token.userId(),
                    token.authToken(),
                    token.prevAuthToken(),
                    null,
                    token.authTokenSeen(),
                    token.seenAt(),
                    token.rotatedAt(),
                    token.createdAt(),
                    token.updatedAt(),
                    token.clientIp(),
                    token.userAgent());
            tokens.put(stored.id(), stored);
            return stored;
        });
    }

    @Override
    public Uni<Optional<UserToken>> findByHashedToken(String hashedToken) {
        return Uni.createFrom().item(() -> tokens.values().stream()
                .filter(token -> hashedToken.equals(token.authToken()) || hashedToken.equals(token.prevAuthToken()))
                .findFirst());
    }

    @Override
    public Uni<Optional<UserToken>> updateIf(
            long id, Predicate<UserToken> condition, UnaryOperator<UserToken> update) {
        return Uni.createFrom().item(() -> {
            final var applied = new UserToken[1];
            tokens.computeIfPresent(id, (key, current) -> {
                if (!condition.test(current)) {
                    return current;
                }
                final var updated = update.apply(current);
                applied[0] = updated;
                return updated.withUnhashedToken(null);
            });
            return Optional.ofNullable(applied[0]);
        });
    }

    @Override
    public Uni<Boolean> delete(long id) {
        return Uni.createFrom().item(() -> tokens.remove(id) != null);
    }

    public int size() {
        return tokens.size();
    }
}
