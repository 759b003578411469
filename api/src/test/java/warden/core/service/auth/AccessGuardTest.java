package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.auth.Org;
import warden.core.model.auth.OrgRole;
import warden.core.model.auth.RequestContext;
import warden.core.model.auth.SignedInUser;
import warden.core.service.auth.AccessGuard.AccessDeniedException;

@DisplayName("AccessGuard")
class AccessGuardTest {

    private static RequestContext user(OrgRole role) {
        var context = new RequestContext();
        context.signIn(new SignedInUser(1L, 1L, "Main Org.", role, "jane", null, null, null), null);
        return context;
    }

    @Test
    @DisplayName("should deny callers with no identity")
    void shouldDenyEmptyContext() {
        var error = assertThrows(AccessDeniedException.class, () -> AccessGuard.requireSignedIn(new RequestContext()));

        assertEquals(401, error.getStatus());
    }

    @Test
    @DisplayName("should let anonymous callers through the sign-in check")
    void shouldAllowAnonymous() {
        var context = new RequestContext();
        context.allowAnonymous(new Org(1L, "Main Org."), OrgRole.VIEWER);

        assertDoesNotThrow(() -> AccessGuard.requireSignedIn(context));
    }

    @Test
    @DisplayName("should allow roles at or above the minimum")
    void shouldAllowSufficientRole() {
        assertDoesNotThrow(() -> AccessGuard.requireRole(user(OrgRole.EDITOR), OrgRole.EDITOR));
        assertDoesNotThrow(() -> AccessGuard.requireRole(user(OrgRole.ADMIN), OrgRole.EDITOR));
    }

    @Test
    @DisplayName("should deny roles below the minimum with 403")
    void shouldDenyInsufficientRole() {
        var error = assertThrows(
                AccessDeniedException.class, () -> AccessGuard.requireRole(user(OrgRole.VIEWER), OrgRole.ADMIN));

        assertEquals(403, error.getStatus());
        assertEquals("Permission denied: requires role Admin", error.getMessage());
    }
}
