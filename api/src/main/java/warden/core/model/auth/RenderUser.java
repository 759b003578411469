package warden.core.model.auth;

/**
 * The user a render key was issued for.
 *
 * @param orgId   the organization of the render
 * @param userId  the user the render runs as
 * @param orgRole the role the render runs with
 */
public record RenderUser(long orgId, long userId, OrgRole orgRole) {}
