package warden.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.SessionConfig;
import warden.core.model.exception.UserTokenNotFoundException;
import warden.core.model.session.UserToken;
import warden.core.port.in.UserTokenManagement;
import warden.core.port.out.UserTokenRepository;
import warden.core.util.SecureHash;

/**
 * Issues, resolves and rotates session tokens.
 *
 * <p>Tokens are stored as {@code sha256(raw + secretKey)}. A token is rotated once
 * the client has presented it and the rotation interval has passed. A token the
 * client never presented is re-sent after a minute, in case the cookie got lost.
 *
 * <p>Rotation is a compare-and-set on the stored record, so concurrent requests
 * carrying the same token rotate it at most once.
 */
@ApplicationScoped
public class UserTokenService implements UserTokenManagement {

    private static final Logger LOG = Logger.getLogger(UserTokenService.class);

    private static final int TOKEN_BYTES = 16;
    static final Duration UNSEEN_GRACE = Duration.ofMinutes(1);
    static final Duration CONCURRENT_ROTATION_WINDOW = Duration.ofSeconds(30);

    private final UserTokenRepository repository;
    private final SessionConfig config;
    private final Clock clock;

    @Inject
    public UserTokenService(UserTokenRepository repository, SessionConfig config, Clock clock) {
        this.repository = repository;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<UserToken> createToken(long userId, String clientIp, String userAgent) {
        final var now = clock.instant();
        final var raw = SecureHash.randomHex(TOKEN_BYTES);
        final var hashed = hashToken(raw);
        final var token = new UserToken(
                0L, userId, hashed, hashed, raw, false, null, now, now, now, clientIp, userAgent);
        return repository.insert(token).map(saved -> {
            LOG.debugf("Created user token %d for user %d", saved.id(), userId);
            return saved.withUnhashedToken(raw);
        });
    }

    @Override
    public Uni<UserToken> lookupToken(String unhashedToken) {
        final var hashed = hashToken(unhashedToken);
        final var now = clock.instant();
        return repository
                .findByHashedToken(hashed)
                .map(found -> found.filter(token -> isActive(token, now))
                        .orElseThrow(UserTokenNotFoundException::new))
                .flatMap(token -> expirePreviousIfSuperseded(token, hashed, now))
                .flatMap(token -> markSeenIfCurrent(token, hashed, now))
                .map(token -> token.withUnhashedToken(unhashedToken));
    }

    @Override
    public Uni<RotationResult> tryRotateToken(UserToken token, String clientIp, String userAgent) {
        if (token == null) {
            return Uni.createFrom().item(RotationResult.notRotated(null));
        }
        final var now = clock.instant();
        if (!needsRotation(token, now)) {
            return Uni.createFrom().item(RotationResult.notRotated(token));
        }

        final var raw = SecureHash.randomHex(TOKEN_BYTES);
        final var hashed = hashToken(raw);
        final var concurrentCutoff = now.minus(CONCURRENT_ROTATION_WINDOW);
        return repository
                .updateIf(
                        token.id(),
                        current -> current.authTokenSeen() || current.rotatedAt().isBefore(concurrentCutoff),
                        current -> current.rotate(hashed, raw, now, clientIp, userAgent))
                .map(updated -> {
                    if (updated.isEmpty()) {
                        LOG.debugf("User token %d already rotated by a concurrent request", token.id());
                        return RotationResult.notRotated(token);
                    }
                    LOG.debugf("Rotated user token %d for user %d", token.id(), token.userId());
                    return new RotationResult(true, updated.get().withUnhashedToken(raw));
                });
    }

    @Override
    public Uni<Void> revokeToken(UserToken token) {
        return repository.delete(token.id()).map(deleted -> {
            if (!deleted) {
                throw new UserTokenNotFoundException();
            }
            LOG.debugf("Revoked user token %d for user %d", token.id(), token.userId());
            return null;
        });
    }

    String hashToken(String unhashedToken) {
        return SecureHash.sha256Hex(unhashedToken + config.secretKey());
    }

    private boolean isActive(UserToken token, Instant now) {
        return token.createdAt().isAfter(now.minus(config.loginMaxLifetime()))
                && token.rotatedAt().isAfter(now.minus(config.loginMaxInactiveLifetime()));
    }

    private boolean needsRotation(UserToken token, Instant now) {
        if (token.authTokenSeen()) {
            return token.rotatedAt().isBefore(now.minus(config.rotationInterval()));
        }
        return token.rotatedAt().isBefore(now.minus(UNSEEN_GRACE));
    }

    /**
     * A client still presenting the previous value never received the current one.
     * Mark the current value unseen so the next rotation re-sends a cookie.
     */
    private Uni<UserToken> expirePreviousIfSuperseded(UserToken token, String hashed, Instant now) {
        if (!hashed.equals(token.prevAuthToken()) || hashed.equals(token.authToken()) || !token.authTokenSeen()) {
            return Uni.createFrom().item(token);
        }
        final var cutoff = now.minus(UNSEEN_GRACE);
        return repository
                .updateIf(
                        token.id(),
                        current -> hashed.equals(current.prevAuthToken()) && current.rotatedAt().isBefore(cutoff),
                        current -> current.markUnseen(now))
                .map(updated -> {
                    if (updated.isPresent()) {
                        LOG.debugf("Previous value of user token %d presented, marked current value unseen", token.id());
                    }
                    return updated.orElse(token);
                });
    }

    private Uni<UserToken> markSeenIfCurrent(UserToken token, String hashed, Instant now) {
        if (token.authTokenSeen() || !hashed.equals(token.authToken())) {
            return Uni.createFrom().item(token);
        }
        return repository
                .updateIf(
                        token.id(),
                        current -> hashed.equals(current.authToken()) && !current.authTokenSeen(),
                        current -> current.markSeen(now))
                .map(updated -> updated.orElse(token));
    }
}
