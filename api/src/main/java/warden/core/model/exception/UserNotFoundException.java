package warden.core.model.exception;

/**
 * Thrown when a user does not exist, or is not a member of the requested organization.
 */
public class UserNotFoundException extends IdentityNotFoundException {

    public UserNotFoundException() {
        super("User not found");
    }

    public UserNotFoundException(String message) {
        super(message);
    }
}
