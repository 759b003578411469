package warden.adapter.in.http;

import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import warden.adapter.in.problem.AuthProblem;
import warden.core.config.SessionConfig;
import warden.core.model.exception.IdentityNotFoundException;
import warden.core.model.exception.InvalidCredentialsException;
import warden.core.port.in.UserTokenManagement;
import warden.core.port.out.IdentityStore;

/**
 * Form login and logout for browser sessions.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class LoginResource {

    private static final Logger LOG = Logger.getLogger(LoginResource.class);

    private final IdentityStore identityStore;
    private final UserTokenManagement tokens;
    private final SessionCookieWriter cookieWriter;
    private final SessionConfig config;

    @Inject
    public LoginResource(
            IdentityStore identityStore,
            UserTokenManagement tokens,
            SessionCookieWriter cookieWriter,
            SessionConfig config) {
        this.identityStore = identityStore;
        this.tokens = tokens;
        this.cookieWriter = cookieWriter;
        this.config = config;
    }

    /**
     * Check the credentials and start a session.
     */
    @POST
    @Path("login")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> login(LoginRequest request, @Context RoutingContext routingContext) {
        if (cookieWriter.cookieName().isEmpty()) {
            throw AuthProblem.featureDisabled("Session login");
        }
        if (request == null || isBlank(request.user()) || request.password() == null) {
            throw AuthProblem.badRequest("user and password are required");
        }

        final var httpRequest = routingContext.request();
        final var clientIp = httpRequest.remoteAddress() != null ? httpRequest.remoteAddress().host() : null;
        final var userAgent = httpRequest.getHeader("User-Agent");

        return identityStore
                .login(request.user(), request.password())
                .flatMap(user -> tokens.createToken(user.id(), clientIp, userAgent))
                .map(token -> {
                    LOG.debugf("Session started for user %d", token.userId());
                    final var cookie = cookieWriter
                            .sessionCookie(token.unhashedToken(), config.loginMaxLifetime())
                            .map(cookieWriter::toJaxRs)
                            .orElseThrow();
                    return Response.ok(Map.of("message", "Logged in"))
                            .cookie(cookie)
                            .build();
                })
                .onFailure()
                .transform(error -> {
                    if (error instanceof IdentityNotFoundException || error instanceof InvalidCredentialsException) {
                        LOG.debugf("Login failed for %s: %s", request.user(), error.getMessage());
                        return AuthProblem.unauthorized("Invalid username or password");
                    }
                    LOG.errorf(error, "Login failed for %s", request.user());
                    return AuthProblem.internalError("Login failed");
                });
    }

    /**
     * End the caller's session, if it has one, and clear the cookie.
     */
    @POST
    @Path("logout")
    public Uni<Response> logout(@Context RoutingContext routingContext) {
        final var context = AuthContextFilter.requestContext(routingContext);
        final var expired = cookieWriter.expiredSessionCookie().map(cookieWriter::toJaxRs);
        final var token = context.userToken();

        final Uni<Void> revoke = token.isPresent()
                ? tokens.revokeToken(token.get()).onFailure().recoverWithItem(error -> {
                    LOG.warnf("Failed to revoke session token %d: %s", token.get().id(), error.getMessage());
                    return null;
                })
                : Uni.createFrom().voidItem();

        return revoke.map(ignored -> {
            final var builder = Response.ok(Map.of("message", "Logged out"));
            expired.ifPresent(cookie -> builder.cookie(cookie));
            return builder.build();
        });
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Login request body.
     */
    public record LoginRequest(String user, String password) {}
}
