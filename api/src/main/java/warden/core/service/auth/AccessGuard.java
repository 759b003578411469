package warden.core.service.auth;

import warden.core.model.auth.OrgRole;
import warden.core.model.auth.RequestContext;

/**
 * Checks a resolved request context before a protected handler runs.
 *
 * <p>Anonymous access counts as signed in for read access, matching how the
 * anonymous organization role is meant to be used.
 */
public final class AccessGuard {

    private AccessGuard() {}

    public static boolean isSignedIn(RequestContext context) {
        return context.isSignedIn() || context.allowAnonymous();
    }

    /**
     * @throws AccessDeniedException with status 401 when the caller is not signed in
     */
    public static void requireSignedIn(RequestContext context) {
        if (!isSignedIn(context)) {
            throw new AccessDeniedException(401, "Unauthorized");
        }
    }

    /**
     * @throws AccessDeniedException with status 401 when not signed in, 403 when the role is insufficient
     */
    public static void requireRole(RequestContext context, OrgRole required) {
        requireSignedIn(context);
        final var role = context.orgRole();
        if (role == null || !role.includes(required)) {
            throw new AccessDeniedException(403, "Permission denied: requires role " + required.value());
        }
    }

    /**
     * Access check failure, carrying the HTTP status to respond with.
     */
    public static class AccessDeniedException extends RuntimeException {

        private final int status;

        public AccessDeniedException(int status, String message) {
            super(message);
            this.status = status;
        }

        public int getStatus() {
            return status;
        }
    }
}
