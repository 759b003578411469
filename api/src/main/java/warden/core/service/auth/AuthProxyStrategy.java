package warden.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.AuthExchange;
import warden.core.model.auth.AuthRejection;
import warden.core.model.auth.SignedInUser;
import warden.core.model.auth.StrategyResult;
import warden.core.model.exception.AuthProxyException;
import warden.core.model.exception.CacheItemNotFoundException;
import warden.core.model.proxy.AuthProxyRequest;
import warden.core.service.proxy.AuthProxyService;

/**
 * Trusts the user asserted by an authenticating reverse proxy.
 *
 * <p>A cached user id that no longer resolves is dropped and the login is retried
 * once without the cache. Every failure after the allow-list check is reported
 * with 407, except failing to cache the resolved id, which is a 500.
 */
@ApplicationScoped
public class AuthProxyStrategy implements AuthStrategy {

    private static final Logger LOG = Logger.getLogger(AuthProxyStrategy.class);

    static final String PROXY_AUTH_REQUIRED = "proxy authentication required";

    private final AuthProxyService proxyService;

    @Inject
    public AuthProxyStrategy(AuthProxyService proxyService) {
        this.proxyService = proxyService;
    }

    @Override
    public String name() {
        return "auth_proxy";
    }

    @Override
    public Uni<StrategyResult> tryHandle(AuthExchange exchange, long requestedOrgId) {
        if (!proxyService.isEnabled()) {
            return Uni.createFrom().item(StrategyResult.notHandled());
        }
        final var headerValue = proxyService.headerValue(exchange);
        if (headerValue.isEmpty()) {
            return Uni.createFrom().item(StrategyResult.notHandled());
        }

        final var remoteAddress = exchange.remoteAddress();
        if (!proxyService.isAllowed(remoteAddress)) {
            final var message = String.format(
                    "Request for user (%s) from %s is not from the authentication proxy",
                    headerValue.get(), remoteAddress);
            LOG.warn(message);
            return Uni.createFrom()
                    .item(StrategyResult.rejected(AuthRejection.proxyRejected(message, PROXY_AUTH_REQUIRED)));
        }

        final var request = proxyService.newRequest(exchange, headerValue.get(), requestedOrgId);
        return proxyService
                .login(request, false)
                .flatMap(userId -> proxyService
                        .getSignedInUser(userId, request.orgId())
                        .onFailure()
                        .recoverWithUni(error -> retryWithoutCache(request, userId, error)))
                .flatMap(user -> rememberAndSignIn(exchange, request, user))
                .onFailure(AuthProxyException.class)
                .recoverWithItem(error -> {
                    final var proxyError = (AuthProxyException) error;
                    LOG.errorf("Auth proxy login failed for %s: %s (%s)",
                            request.headerValue(), proxyError.getMessage(), proxyError.getDetail());
                    return StrategyResult.rejected(AuthRejection.proxyRejected(
                            proxyError.getMessage(), proxyError.getDetail(), proxyError));
                });
    }

    private Uni<SignedInUser> retryWithoutCache(AuthProxyRequest request, long cachedUserId, Throwable error) {
        LOG.debugf("Failed to get user %d from cached id, retrying without cache: %s", cachedUserId, error.getMessage());
        return proxyService
                .removeUserFromCache(request.cacheKey())
                .onFailure()
                .recoverWithItem(removeError -> {
                    if (!(removeError instanceof CacheItemNotFoundException)) {
                        LOG.errorf(removeError, "Failed to remove user from auth proxy cache: %s", request.cacheKey());
                    }
                    return null;
                })
                .flatMap(ignored -> proxyService.login(request, true))
                .flatMap(userId -> proxyService.getSignedInUser(userId, request.orgId()));
    }

    private Uni<StrategyResult> rememberAndSignIn(AuthExchange exchange, AuthProxyRequest request, SignedInUser user) {
        return proxyService
                .remember(request.cacheKey(), user.userId())
                .map(ignored -> {
                    exchange.context().signIn(user, null);
                    return StrategyResult.authenticated();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorf(error, "Failed to store user %d in auth proxy cache", user.userId());
                    return StrategyResult.rejected(AuthRejection.internal("Failed to store user in cache", error));
                });
    }
}
