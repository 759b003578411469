package warden.core.model.exception;

/**
 * Thrown when a username/password pair does not authenticate.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException() {
        super("Invalid username or password");
    }
}
