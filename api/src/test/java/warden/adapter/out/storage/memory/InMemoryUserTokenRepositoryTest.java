package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.session.UserToken;

@DisplayName("InMemoryUserTokenRepository")
class InMemoryUserTokenRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private InMemoryUserTokenRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryUserTokenRepository();
    }

    private UserToken insert(String hash) {
        return repository.insert(new UserToken(0L, 1L, hash, hash, "raw", false, null, NOW, NOW, NOW, null, null))
                .await()
                .indefinitely();
    }

    @Test
    @DisplayName("should assign ids and never store the raw value")
    void shouldStripRawValue() {
        var first = insert("a");
        var second = insert("b");

        assertTrue(second.id() > first.id());
        assertNull(first.unhashedToken());
    }

    @Test
    @DisplayName("should find tokens by current or previous hash")
    void shouldFindByEitherHash() {
        var token = insert("old");
        repository.updateIf(token.id(), current -> true, current -> current.rotate("new", "raw2", NOW, null, null))
                .await()
                .indefinitely();

        assertTrue(repository.findByHashedToken("new").await().indefinitely().isPresent());
        assertFalse(repository.findByHashedToken("missing").await().indefinitely().isPresent());
    }

    @Test
    @DisplayName("should apply an update only when the condition holds")
    void shouldApplyConditionally() {
        var token = insert("a");

        var skipped = repository.updateIf(token.id(), current -> false, current -> current.markSeen(NOW))
                .await()
                .indefinitely();
        var applied = repository.updateIf(token.id(), current -> true, current -> current.markSeen(NOW))
                .await()
                .indefinitely();

        assertTrue(skipped.isEmpty());
        assertTrue(applied.orElseThrow().authTokenSeen());
    }

    @Test
    @DisplayName("should report whether a delete removed anything")
    void shouldReportDelete() {
        var token = insert("a");

        assertTrue(repository.delete(token.id()).await().indefinitely());
        assertFalse(repository.delete(token.id()).await().indefinitely());
        assertEquals(0, repository.size());
    }
}
