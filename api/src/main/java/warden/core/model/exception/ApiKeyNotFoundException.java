package warden.core.model.exception;

/**
 * Thrown when no API key with the given name exists in the organization.
 */
public class ApiKeyNotFoundException extends IdentityNotFoundException {

    public ApiKeyNotFoundException() {
        super("API key not found");
    }

    public ApiKeyNotFoundException(String message) {
        super(message);
    }
}
