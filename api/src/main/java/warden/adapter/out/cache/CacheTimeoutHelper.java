package warden.adapter.out.cache;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.exception.CacheItemNotFoundException;
import warden.core.port.out.AuthMetrics;

/**
 * Applies a timeout to remote cache operations and records timeouts and failures.
 *
 * <p>Timeouts fail with {@link CacheTimeoutException}; other failures propagate
 * unchanged. Callers decide whether a failed cache operation is fatal.
 */
public class CacheTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(CacheTimeoutHelper.class);

    private final Duration timeout;
    private final AuthMetrics metrics;
    private final String cacheName;

    /**
     * @param timeout   the timeout for each operation
     * @param metrics   metrics for recording timeouts and failures (may be null)
     * @param cacheName cache name for logs and metric tags
     */
    public CacheTimeoutHelper(Duration timeout, AuthMetrics metrics, String cacheName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.cacheName = cacheName;
    }

    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Cache operation timeout: {0} in {1} after {2}", operationName, cacheName, timeout);
                    recordTimeout(operationName);
                    return new CacheTimeoutException(operationName, cacheName);
                })
                .onFailure(error -> !(error instanceof CacheTimeoutException) && isOperational(error))
                .invoke(error -> {
                    LOG.warnv("Cache operation failure: {0} in {1}: {2}", operationName, cacheName, error.getMessage());
                    recordFailure(operationName);
                });
    }

    /**
     * Domain failures (a missing key on delete) are not counted as cache failures.
     */
    private static boolean isOperational(Throwable error) {
        return !(error instanceof CacheItemNotFoundException);
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordCacheTimeout(cacheName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordCacheFailure(cacheName, operationName);
        }
    }

    /**
     * A remote cache operation exceeded the configured timeout.
     */
    public static class CacheTimeoutException extends RuntimeException {

        private final String operation;

        public CacheTimeoutException(String operation, String cache) {
            super("Cache operation timeout: " + operation + " in " + cache);
            this.operation = operation;
        }

        public String getOperation() {
            return operation;
        }
    }
}
