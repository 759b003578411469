package warden.adapter.in.http;

import java.time.Duration;
import java.util.Optional;

import io.vertx.ext.web.RoutingContext;

import warden.core.model.auth.AuthExchange;
import warden.core.model.auth.FinalizeHook;
import warden.core.model.auth.FinalizeHooks;
import warden.core.model.auth.RequestContext;
import warden.core.model.auth.ResponseState;

/**
 * {@link AuthExchange} over a Vert.x routing context.
 *
 * <p>Cookies are added to the Vert.x response, which emits them with the headers.
 */
public class VertxAuthExchange implements AuthExchange {

    private final RoutingContext routingContext;
    private final SessionCookieWriter cookieWriter;
    private final RequestContext context = new RequestContext();
    private final FinalizeHooks hooks = new FinalizeHooks();

    public VertxAuthExchange(RoutingContext routingContext, SessionCookieWriter cookieWriter) {
        this.routingContext = routingContext;
        this.cookieWriter = cookieWriter;
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(routingContext.request().getHeader(name)).filter(value -> !value.isBlank());
    }

    @Override
    public Optional<String> cookie(String name) {
        final var cookie = routingContext.request().getCookie(name);
        return cookie != null
                ? Optional.ofNullable(cookie.getValue()).filter(value -> !value.isBlank())
                : Optional.empty();
    }

    @Override
    public String remoteAddress() {
        final var address = routingContext.request().remoteAddress();
        return address != null && address.host() != null ? address.host() : "";
    }

    @Override
    public String userAgent() {
        final var userAgent = routingContext.request().getHeader("User-Agent");
        return userAgent != null ? userAgent : "";
    }

    @Override
    public RequestContext context() {
        return context;
    }

    @Override
    public void writeSessionCookie(String value, Duration maxAge) {
        cookieWriter.sessionCookie(value, maxAge).ifPresent(routingContext.response()::addCookie);
    }

    @Override
    public void clearSessionCookie() {
        cookieWriter.expiredSessionCookie().ifPresent(routingContext.response()::addCookie);
    }

    @Override
    public void beforeWrite(FinalizeHook hook) {
        hooks.register(hook);
    }

    FinalizeHooks hooks() {
        return hooks;
    }

    ResponseState responseState() {
        return new ResponseState() {
            @Override
            public boolean isWritten() {
                return routingContext.response().headWritten();
            }

            @Override
            public boolean isCanceled() {
                return routingContext.response().closed();
            }
        };
    }
}
