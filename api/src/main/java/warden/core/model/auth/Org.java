package warden.core.model.auth;

/**
 * An organization.
 *
 * @param id   the organization id
 * @param name the unique organization name
 */
public record Org(long id, String name) {}
