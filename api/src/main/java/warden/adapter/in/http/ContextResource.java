package warden.adapter.in.http;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;

import io.vertx.ext.web.RoutingContext;

import warden.adapter.in.problem.AuthProblem;
import warden.core.model.auth.Identity;
import warden.core.model.auth.RequestContext;
import warden.core.service.auth.AccessGuard;
import warden.core.service.auth.AccessGuard.AccessDeniedException;

/**
 * Returns the identity resolved for the calling request.
 */
@Path("/api/context")
@Produces(MediaType.APPLICATION_JSON)
public class ContextResource {

    @GET
    public ContextView current(@Context RoutingContext routingContext) {
        final var context = AuthContextFilter.requestContext(routingContext);
        try {
            AccessGuard.requireSignedIn(context);
        } catch (AccessDeniedException e) {
            throw AuthProblem.fromAccessDenied(e);
        }
        return ContextView.of(context);
    }

    /**
     * JSON view of a resolved request context.
     */
    public record ContextView(
            String identity,
            boolean signedIn,
            boolean allowAnonymous,
            long userId,
            String login,
            long orgId,
            String orgName,
            String orgRole,
            Long apiKeyId,
            boolean renderCall) {

        static ContextView of(RequestContext context) {
            final var user = context.signedInUser();
            return new ContextView(
                    context.identity().map(ContextView::identityType).orElse("none"),
                    context.isSignedIn(),
                    context.allowAnonymous(),
                    context.userId(),
                    user.map(u -> u.login()).orElse(null),
                    context.orgId(),
                    context.orgName(),
                    context.orgRole() != null ? context.orgRole().value() : null,
                    context.apiKeyId().orElse(null),
                    context.isRenderCall());
        }

        private static String identityType(Identity identity) {
            if (identity instanceof Identity.ApiKeyPrincipal) {
                return "api_key";
            }
            if (identity instanceof Identity.RenderPrincipal) {
                return "render";
            }
            if (identity instanceof Identity.UserPrincipal) {
                return "user";
            }
            return "anonymous";
        }
    }
}
