package warden.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import warden.core.model.auth.AuthRejection;
import warden.core.service.auth.AccessGuard.AccessDeniedException;

/**
 * RFC 7807 Problem Details factory for authentication errors.
 *
 * <p>Creates {@link HttpProblem} instances from quarkus-resteasy-problem so every
 * rejected request gets the same error body.
 */
public final class AuthProblem {

    private AuthProblem() {}

    /**
     * Render a strategy rejection. The cause is never included.
     */
    public static HttpProblem fromRejection(AuthRejection rejection) {
        final var status = Status.fromStatusCode(rejection.statusCode());
        final var builder = HttpProblem.builder()
                .withTitle(status.getReasonPhrase())
                .withStatus(status)
                .withDetail(rejection.message());
        if (rejection.detail() != null) {
            builder.with("reason", rejection.detail());
        }
        return builder.build();
    }

    public static HttpProblem fromAccessDenied(AccessDeniedException denied) {
        final var status = Status.fromStatusCode(denied.getStatus());
        return HttpProblem.builder()
                .withTitle(status.getReasonPhrase())
                .withStatus(status)
                .withDetail(denied.getMessage())
                .build();
    }

    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem featureDisabled(String feature) {
        return HttpProblem.builder()
                .withTitle("Feature Disabled")
                .withStatus(Status.NOT_FOUND)
                .withDetail("%s is disabled".formatted(feature))
                .build();
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}
