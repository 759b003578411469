package warden.core.service.auth;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.SessionConfig;
import warden.core.model.auth.AuthExchange;
import warden.core.model.auth.FinalizeHook;
import warden.core.model.auth.StrategyResult;
import warden.core.model.session.UserToken;
import warden.core.port.in.UserTokenManagement;
import warden.core.port.out.IdentityStore;

/**
 * Authenticates browser sessions by their session cookie.
 *
 * <p>Never rejects: an unknown or expired token clears the cookie and lets the
 * remaining strategies (anonymous access) run. A resolved session registers a
 * hook that rotates the token just before the response is written.
 */
@ApplicationScoped
public class SessionTokenStrategy implements AuthStrategy {

    private static final Logger LOG = Logger.getLogger(SessionTokenStrategy.class);

    private final SessionConfig config;
    private final UserTokenManagement tokens;
    private final IdentityStore identityStore;

    @Inject
    public SessionTokenStrategy(SessionConfig config, UserTokenManagement tokens, IdentityStore identityStore) {
        this.config = config;
        this.tokens = tokens;
        this.identityStore = identityStore;
    }

    @Override
    public String name() {
        return "session";
    }

    @Override
    public Uni<StrategyResult> tryHandle(AuthExchange exchange, long requestedOrgId) {
        final var cookieName = config.cookie().name().filter(name -> !name.isBlank());
        if (cookieName.isEmpty()) {
            return Uni.createFrom().item(StrategyResult.notHandled());
        }
        final var rawToken = exchange.cookie(cookieName.get()).filter(value -> !value.isEmpty());
        if (rawToken.isEmpty()) {
            return Uni.createFrom().item(StrategyResult.notHandled());
        }

        return tokens.lookupToken(rawToken.get())
                .map(Optional::of)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugf("Failed to look up user based on cookie: %s", error.getMessage());
                    exchange.clearSessionCookie();
                    return Optional.empty();
                })
                .flatMap(token -> token.isPresent()
                        ? resolveUser(exchange, token.get(), requestedOrgId)
                        : Uni.createFrom().item(StrategyResult.notHandled()));
    }

    private Uni<StrategyResult> resolveUser(AuthExchange exchange, UserToken token, long orgId) {
        return identityStore
                .getSignedInUser(token.userId(), orgId)
                .map(user -> {
                    exchange.context().signIn(user, token);
                    exchange.beforeWrite(rotateEndOfRequest(exchange, token));
                    return StrategyResult.authenticated();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorf("Failed to get user with id %d: %s", token.userId(), error.getMessage());
                    return StrategyResult.notHandled();
                });
    }

    /**
     * Rotate the session token once the handler has finished, unless the response
     * is already on the wire or the client went away.
     */
    FinalizeHook rotateEndOfRequest(AuthExchange exchange, UserToken token) {
        return state -> {
            if (state.isWritten() || state.isCanceled()) {
                return Uni.createFrom().voidItem();
            }
            return tokens.tryRotateToken(token, exchange.remoteAddress(), exchange.userAgent())
                    .invoke(result -> {
                        if (result.rotated()) {
                            exchange.context().replaceUserToken(result.token());
                            exchange.writeSessionCookie(result.token().unhashedToken(), config.loginMaxLifetime());
                        }
                    })
                    .replaceWithVoid()
                    .onFailure()
                    .recoverWithItem(error -> {
                        LOG.errorf(error, "Failed to rotate token for user %d", token.userId());
                        return null;
                    });
        };
    }
}
