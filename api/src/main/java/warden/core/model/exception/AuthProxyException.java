package warden.core.model.exception;

/**
 * Failure while resolving an auth proxy claim.
 *
 * <p>The message and detail are shown to the client, since they describe what the
 * upstream proxy asserted.
 */
public class AuthProxyException extends RuntimeException {

    private final String detail;

    public AuthProxyException(String message, String detail) {
        super(message);
        this.detail = detail;
    }

    public AuthProxyException(String message, String detail, Throwable cause) {
        super(message, cause);
        this.detail = detail;
    }

    /** Returns the client-visible detail. */
    public String getDetail() {
        return detail;
    }
}
