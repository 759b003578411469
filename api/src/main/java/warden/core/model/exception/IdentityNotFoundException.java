package warden.core.model.exception;

/**
 * Base exception for identity store lookups that found nothing.
 *
 * <p>Strategies treat this as a credential problem. Any other exception from a
 * store is treated as an internal failure.
 */
public class IdentityNotFoundException extends RuntimeException {

    public IdentityNotFoundException(String message) {
        super(message);
    }
}
