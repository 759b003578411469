package warden.core.model.exception;

/**
 * Thrown when a session token is unknown, expired or idle for too long.
 */
public class UserTokenNotFoundException extends IdentityNotFoundException {

    public UserTokenNotFoundException() {
        super("User token not found");
    }

    public UserTokenNotFoundException(String message) {
        super(message);
    }
}
