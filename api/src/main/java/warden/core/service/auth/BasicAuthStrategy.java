package warden.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.BasicAuthConfig;
import warden.core.model.auth.AuthExchange;
import warden.core.model.auth.AuthRejection;
import warden.core.model.auth.StrategyResult;
import warden.core.model.auth.User;
import warden.core.model.exception.IdentityNotFoundException;
import warden.core.model.exception.InvalidCredentialsException;
import warden.core.port.out.IdentityStore;
import warden.core.util.BasicAuthHeader;

/**
 * Authenticates users with username and password in a basic auth header.
 *
 * <p>Every login failure, store errors included, produces the same 401 response, so
 * the endpoint cannot be used to discover which logins exist.
 */
@ApplicationScoped
public class BasicAuthStrategy implements AuthStrategy {

    private static final Logger LOG = Logger.getLogger(BasicAuthStrategy.class);

    static final String INVALID_USERNAME_PASSWORD = "Invalid username or password";
    static final String INVALID_HEADER = "Invalid Basic Auth Header";

    private final BasicAuthConfig config;
    private final IdentityStore identityStore;

    @Inject
    public BasicAuthStrategy(BasicAuthConfig config, IdentityStore identityStore) {
        this.config = config;
        this.identityStore = identityStore;
    }

    @Override
    public String name() {
        return "basic";
    }

    @Override
    public Uni<StrategyResult> tryHandle(AuthExchange exchange, long requestedOrgId) {
        if (!config.enabled()) {
            return Uni.createFrom().item(StrategyResult.notHandled());
        }

        final var header = exchange.header(ApiKeyStrategy.AUTHORIZATION_HEADER);
        if (header.isEmpty()) {
            return Uni.createFrom().item(StrategyResult.notHandled());
        }

        final var credentials = BasicAuthHeader.decode(header.get());
        if (credentials.isEmpty()) {
            return Uni.createFrom().item(StrategyResult.rejected(AuthRejection.unauthorized(INVALID_HEADER)));
        }

        final var username = credentials.get().username();
        return identityStore
                .login(username, credentials.get().password())
                .flatMap(user -> resolveSignedInUser(exchange, user, requestedOrgId))
                .onFailure()
                .recoverWithItem(error -> loginFailed(username, error));
    }

    private Uni<StrategyResult> resolveSignedInUser(AuthExchange exchange, User user, long orgId) {
        return identityStore
                .getSignedInUser(user.id(), orgId)
                .map(signedInUser -> {
                    exchange.context().signIn(signedInUser, null);
                    return StrategyResult.authenticated();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorf("Failed at user signed in, id: %d, org: %d", user.id(), orgId);
                    return StrategyResult.rejected(AuthRejection.unauthorized(INVALID_USERNAME_PASSWORD, error));
                });
    }

    private StrategyResult loginFailed(String username, Throwable error) {
        if (error instanceof IdentityNotFoundException || error instanceof InvalidCredentialsException) {
            LOG.debugf("Failed to authorize the user %s: %s", username, error.getMessage());
            return StrategyResult.rejected(
                    AuthRejection.unauthorized(INVALID_USERNAME_PASSWORD, new InvalidCredentialsException()));
        }
        LOG.errorf(error, "Login check failed for user %s", username);
        return StrategyResult.rejected(AuthRejection.unauthorized(INVALID_USERNAME_PASSWORD, error));
    }
}
