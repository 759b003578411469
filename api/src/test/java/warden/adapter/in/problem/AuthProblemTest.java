package warden.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.auth.AuthRejection;
import warden.core.service.auth.AccessGuard.AccessDeniedException;

@DisplayName("AuthProblem")
class AuthProblemTest {

    @Test
    @DisplayName("should render a rejection without its cause")
    void shouldRenderRejection() {
        var problem = AuthProblem.fromRejection(
                AuthRejection.internal("Failed to look up API key", new IllegalStateException("secret detail")));

        assertEquals(500, problem.getStatusCode());
        assertEquals("Internal Server Error", problem.getTitle());
        assertEquals("Failed to look up API key", problem.getDetail());
        assertFalse(problem.getParameters().containsKey("reason"));
    }

    @Test
    @DisplayName("should use the proxy status for proxy rejections")
    void shouldRenderProxyRejection() {
        var problem = AuthProblem.fromRejection(AuthRejection.proxyRejected("Failed to get the user", "not found"));

        assertEquals(407, problem.getStatusCode());
        assertEquals("not found", problem.getParameters().get("reason"));
    }

    @Test
    @DisplayName("should carry the status of an access check")
    void shouldRenderAccessDenied() {
        var problem = AuthProblem.fromAccessDenied(new AccessDeniedException(403, "Permission denied"));

        assertEquals(403, problem.getStatusCode());
        assertEquals("Permission denied", problem.getDetail());
    }
}
