package warden.adapter.out.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.adapter.out.cache.CacheTimeoutHelper.CacheTimeoutException;
import warden.core.model.exception.CacheItemNotFoundException;
import warden.core.port.out.AuthMetrics;

@DisplayName("CacheTimeoutHelper")
class CacheTimeoutHelperTest {

    private AuthMetrics metrics;
    private CacheTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        metrics = mock(AuthMetrics.class);
        helper = new CacheTimeoutHelper(Duration.ofMillis(50), metrics, "redis");
    }

    @Test
    @DisplayName("should pass through completed operations")
    void shouldPassThrough() {
        assertEquals("ok", helper.withTimeout(Uni.createFrom().item("ok"), "get").await().indefinitely());
    }

    @Test
    @DisplayName("should fail slow operations with a timeout")
    void shouldTimeOut() {
        Uni<String> pending = Uni.createFrom().nothing();

        var error = assertThrows(
                CacheTimeoutException.class,
                () -> helper.withTimeout(pending, "get").await().atMost(Duration.ofSeconds(5)));

        assertEquals("get", error.getOperation());
        verify(metrics).recordCacheTimeout("redis", "get");
        verify(metrics, never()).recordCacheFailure(anyString(), anyString());
    }

    @Test
    @DisplayName("should record operational failures")
    void shouldRecordFailure() {
        Uni<String> failing = Uni.createFrom().failure(new IllegalStateException("connection reset"));

        assertThrows(IllegalStateException.class, () -> helper.withTimeout(failing, "set").await().indefinitely());

        verify(metrics).recordCacheFailure("redis", "set");
    }

    @Test
    @DisplayName("should not count a missing key as a failure")
    void shouldIgnoreMissingKey() {
        Uni<Void> missing = Uni.createFrom().failure(new CacheItemNotFoundException("k"));

        assertThrows(
                CacheItemNotFoundException.class, () -> helper.withTimeout(missing, "delete").await().indefinitely());

        verify(metrics, never()).recordCacheFailure(anyString(), anyString());
    }
}
