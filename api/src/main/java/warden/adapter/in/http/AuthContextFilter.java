package warden.adapter.in.http;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import io.smallrye.mutiny.Uni;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import warden.adapter.in.problem.AuthProblem;
import warden.core.model.auth.RequestContext;
import warden.core.model.auth.StrategyResult;
import warden.core.service.auth.AuthenticationDispatcher;

/**
 * Resolves the caller's identity before any resource method runs.
 *
 * <p>The frozen {@link RequestContext} is stored as request property
 * {@value #CONTEXT_PROPERTY} and in the routing context under the same key. A
 * rejected request is answered with an RFC 7807 problem and never reaches the
 * resource.
 *
 * <p>The response filter fires the hooks strategies registered (session token
 * rotation), once, before the response head is written.
 *
 * <p>Uses @ServerRequestFilter with Uni return type so no event loop thread blocks
 * on store or cache lookups.
 */
public class AuthContextFilter {

    private static final Logger LOG = Logger.getLogger(AuthContextFilter.class);

    public static final String CONTEXT_PROPERTY = "warden.auth.context";
    static final String EXCHANGE_PROPERTY = "warden.auth.exchange";

    private final AuthenticationDispatcher dispatcher;
    private final SessionCookieWriter cookieWriter;

    @Inject
    public AuthContextFilter(AuthenticationDispatcher dispatcher, SessionCookieWriter cookieWriter) {
        this.dispatcher = dispatcher;
        this.cookieWriter = cookieWriter;
    }

    /**
     * @return Uni with null to continue; fails with {@link HttpProblem} to reject
     */
    @ServerRequestFilter(priority = Priorities.AUTHENTICATION)
    public Uni<Response> authenticate(ContainerRequestContext requestContext, RoutingContext routingContext) {
        final var exchange = new VertxAuthExchange(routingContext, cookieWriter);
        requestContext.setProperty(EXCHANGE_PROPERTY, exchange);
        requestContext.setProperty(CONTEXT_PROPERTY, exchange.context());
        routingContext.put(CONTEXT_PROPERTY, exchange.context());

        return dispatcher
                .dispatch(exchange)
                .map(result -> {
                    if (result instanceof StrategyResult.Rejected rejected) {
                        throw AuthProblem.fromRejection(rejected.rejection());
                    }
                    return (Response) null;
                })
                .onFailure(error -> !(error instanceof HttpProblem))
                .transform(error -> {
                    LOG.errorf(error, "Authentication dispatch failed for %s", requestContext.getUriInfo().getPath());
                    return AuthProblem.internalError("Authentication failed");
                });
    }

    /**
     * Run finalize hooks before the response is written.
     */
    @ServerResponseFilter
    public Uni<Void> finalizeResponse(ContainerRequestContext requestContext) {
        if (!(requestContext.getProperty(EXCHANGE_PROPERTY) instanceof VertxAuthExchange exchange)) {
            return Uni.createFrom().voidItem();
        }
        if (exchange.hooks().isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        return exchange.hooks().fire(exchange.responseState());
    }

    /**
     * Read the resolved context of the current request.
     *
     * @return the context, or an empty unauthenticated one if the filter did not run
     */
    public static RequestContext requestContext(ContainerRequestContext requestContext) {
        return orEmpty(requestContext.getProperty(CONTEXT_PROPERTY));
    }

    public static RequestContext requestContext(RoutingContext routingContext) {
        return orEmpty(routingContext.get(CONTEXT_PROPERTY));
    }

    private static RequestContext orEmpty(Object value) {
        if (value instanceof RequestContext context) {
            return context;
        }
        final var empty = new RequestContext();
        empty.freeze();
        return empty;
    }
}
