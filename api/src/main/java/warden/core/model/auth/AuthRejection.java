package warden.core.model.auth;

/**
 * Terminal authentication error written to the client.
 *
 * <p>{@code message} and {@code detail} are client-visible. {@code cause} is for
 * logging only and is never rendered.
 *
 * @param kind    the error class, which fixes the HTTP status
 * @param message client-visible message
 * @param detail  client-visible detail (may be null)
 * @param cause   underlying error (may be null)
 */
public record AuthRejection(AuthErrorKind kind, String message, String detail, Throwable cause) {

    public AuthRejection {
        if (kind == null) {
            throw new IllegalArgumentException("Error kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            message = "Authentication failed";
        }
    }

    public int statusCode() {
        return kind.statusCode();
    }

    public static AuthRejection unauthorized(String message) {
        return new AuthRejection(AuthErrorKind.UNAUTHORIZED, message, null, null);
    }

    public static AuthRejection unauthorized(String message, Throwable cause) {
        return new AuthRejection(AuthErrorKind.UNAUTHORIZED, message, null, cause);
    }

    public static AuthRejection proxyRejected(String message, String detail) {
        return new AuthRejection(AuthErrorKind.PROXY_REJECTED, message, detail, null);
    }

    public static AuthRejection proxyRejected(String message, String detail, Throwable cause) {
        return new AuthRejection(AuthErrorKind.PROXY_REJECTED, message, detail, cause);
    }

    public static AuthRejection internal(String message, Throwable cause) {
        return new AuthRejection(AuthErrorKind.INTERNAL_LOOKUP_FAILURE, message, null, cause);
    }

    public static AuthRejection internal(String message, String detail, Throwable cause) {
        return new AuthRejection(AuthErrorKind.INTERNAL_LOOKUP_FAILURE, message, detail, cause);
    }
}
