package warden.core.model.auth;

/**
 * A user account.
 *
 * @param id    the user id
 * @param login the unique login
 * @param email the unique email (may be null)
 * @param name  the display name (may be null)
 */
public record User(long id, String login, String email, String name) {}
