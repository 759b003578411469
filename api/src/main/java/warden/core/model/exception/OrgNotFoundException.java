package warden.core.model.exception;

/**
 * Thrown when an organization lookup finds nothing.
 */
public class OrgNotFoundException extends IdentityNotFoundException {

    public OrgNotFoundException() {
        super("Organization not found");
    }

    public OrgNotFoundException(String message) {
        super(message);
    }
}
