package warden.core.model.auth;

import java.time.Duration;
import java.util.Optional;

/**
 * One inbound request as seen by the authentication strategies.
 *
 * <p>Gives read access to the credentials a request carries, the context the
 * strategies populate, and the two response side effects the pipeline needs:
 * writing the session cookie and registering hooks that run before the response
 * is written.
 */
public interface AuthExchange {

    /**
     * @param name header name, case-insensitive
     * @return the first value of the header, or empty if absent or blank
     */
    Optional<String> header(String name);

    /**
     * @param name cookie name
     * @return the cookie value, or empty if absent or blank
     */
    Optional<String> cookie(String name);

    /**
     * @return the IP address of the direct connection (may be null)
     */
    String remoteAddress();

    /**
     * @return the User-Agent header (may be null)
     */
    String userAgent();

    /**
     * @return the context for this request
     */
    RequestContext context();

    /**
     * Set the session cookie on the response.
     *
     * @param value  the raw token value
     * @param maxAge cookie lifetime
     */
    void writeSessionCookie(String value, Duration maxAge);

    /**
     * Set an already-expired session cookie so the client drops it.
     */
    void clearSessionCookie();

    /**
     * Register a hook to run when the response is finalized.
     *
     * @param hook the hook
     */
    void beforeWrite(FinalizeHook hook);
}
