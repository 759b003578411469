package warden.core.service.auth;

import java.time.Clock;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.ContextConfig;
import warden.core.model.auth.AuthExchange;
import warden.core.model.auth.StrategyResult;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.IdentityStore;

/**
 * Runs the authentication strategies for a request, strongest first.
 *
 * <p>Strategy order:
 * <ol>
 *   <li>Render key cookie</li>
 *   <li>API key (bearer or basic with {@code api_key} user)</li>
 *   <li>Basic auth (username and password)</li>
 *   <li>Auth proxy header</li>
 *   <li>Session cookie</li>
 *   <li>Anonymous access</li>
 * </ol>
 *
 * <p>The first strategy that handles the request ends the chain. Its result is
 * returned as is; rendering a rejection is up to the caller. The request context
 * is frozen once dispatch completes.
 */
@ApplicationScoped
public class AuthenticationDispatcher {

    private static final Logger LOG = Logger.getLogger(AuthenticationDispatcher.class);

    static final String NO_STRATEGY = "none";

    private final List<AuthStrategy> strategies;
    private final ContextConfig config;
    private final IdentityStore identityStore;
    private final AuthMetrics metrics;
    private final Clock clock;

    @Inject
    public AuthenticationDispatcher(
            RenderKeyStrategy renderKey,
            ApiKeyStrategy apiKey,
            BasicAuthStrategy basicAuth,
            AuthProxyStrategy authProxy,
            SessionTokenStrategy session,
            AnonymousStrategy anonymous,
            ContextConfig config,
            IdentityStore identityStore,
            AuthMetrics metrics,
            Clock clock) {
        this(List.of(renderKey, apiKey, basicAuth, authProxy, session, anonymous), config, identityStore, metrics, clock);
    }

    public AuthenticationDispatcher(
            List<AuthStrategy> strategies,
            ContextConfig config,
            IdentityStore identityStore,
            AuthMetrics metrics,
            Clock clock) {
        this.strategies = List.copyOf(strategies);
        this.config = config;
        this.identityStore = identityStore;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Resolve the identity of a request.
     *
     * @param exchange the request and its context
     * @return Uni with the outcome of the strategy that handled the request, or
     *     {@link StrategyResult.NotHandled} when none did
     */
    public Uni<StrategyResult> dispatch(AuthExchange exchange) {
        final var orgId = requestedOrgId(exchange);
        return tryFrom(0, exchange, orgId).map(outcome -> {
            exchange.context().freeze();
            metrics.recordAttempt(outcome.strategy(), resultLabel(outcome.result()));
            LOG.debugf("Request handled by %s: %s", outcome.strategy(), exchange.context());
            touchLastSeen(exchange);
            return outcome.result();
        });
    }

    private Uni<Outcome> tryFrom(int index, AuthExchange exchange, long orgId) {
        if (index >= strategies.size()) {
            return Uni.createFrom().item(new Outcome(NO_STRATEGY, StrategyResult.notHandled()));
        }
        final var strategy = strategies.get(index);
        return strategy.tryHandle(exchange, orgId).flatMap(result -> {
            if (result.handled()) {
                return Uni.createFrom().item(new Outcome(strategy.name(), result));
            }
            return tryFrom(index + 1, exchange, orgId);
        });
    }

    /**
     * Refresh last seen for a stale user without holding up the request.
     */
    private void touchLastSeen(AuthExchange exchange) {
        final var context = exchange.context();
        if (!context.shouldUpdateLastSeenAt(clock.instant(), config.lastSeenUpdateInterval())) {
            return;
        }
        final var userId = context.userId();
        identityStore
                .updateLastSeenAt(userId)
                .subscribe()
                .with(
                        ignored -> LOG.debugf("Updated last seen for user %d", userId),
                        error -> LOG.errorf(error, "Failed to update last seen at for user %d", userId));
    }

    long requestedOrgId(AuthExchange exchange) {
        final var header = exchange.header(config.orgIdHeader());
        if (header.isEmpty() || header.get().isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(header.get().trim());
        } catch (NumberFormatException e) {
            LOG.debugf("Ignoring invalid %s header: %s", config.orgIdHeader(), header.get());
            return 0L;
        }
    }

    private static String resultLabel(StrategyResult result) {
        if (result instanceof StrategyResult.Rejected rejected) {
            return "rejected_" + rejected.rejection().statusCode();
        }
        return result.handled() ? "authenticated" : "unauthenticated";
    }

    private record Outcome(String strategy, StrategyResult result) {}
}
