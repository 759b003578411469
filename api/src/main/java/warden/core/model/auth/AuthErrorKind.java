package warden.core.model.auth;

/**
 * Classes of authentication errors a strategy can terminate a request with.
 */
public enum AuthErrorKind {
    /** Bad or expired credential. */
    UNAUTHORIZED(401),

    /** Caller is not a trusted auth proxy, or the proxy's claim could not be resolved. */
    PROXY_REJECTED(407),

    /** Store or cache malfunction. */
    INTERNAL_LOOKUP_FAILURE(500);

    private final int statusCode;

    AuthErrorKind(int statusCode) {
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
