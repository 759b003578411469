package warden.core.port.out;

/**
 * Port for recording authentication metrics.
 */
public interface AuthMetrics {

    boolean isEnabled();

    /**
     * Record the outcome of a dispatch.
     *
     * @param strategy the strategy that handled the request, or {@code none}
     * @param result   {@code authenticated}, {@code rejected} or {@code unauthenticated}
     */
    void recordAttempt(String strategy, String result);

    /**
     * Record an auth proxy cache lookup.
     *
     * @param hit true on a hit
     */
    void recordProxyCacheLookup(boolean hit);

    /**
     * Record a remote cache operation that timed out.
     */
    void recordCacheTimeout(String cache, String operation);

    /**
     * Record a remote cache operation that failed.
     */
    void recordCacheFailure(String cache, String operation);
}
