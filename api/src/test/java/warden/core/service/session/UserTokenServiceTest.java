package warden.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryUserTokenRepository;
import warden.core.model.exception.UserTokenNotFoundException;
import warden.core.model.session.UserToken;
import warden.core.port.in.UserTokenManagement.RotationResult;
import warden.mock.MutableClock;
import warden.mock.TestSessionConfig;

@DisplayName("UserTokenService")
class UserTokenServiceTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private TestSessionConfig config;
    private InMemoryUserTokenRepository repository;
    private UserTokenService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        config = new TestSessionConfig();
        repository = new InMemoryUserTokenRepository();
        service = new UserTokenService(repository, config, clock);
    }

    private UserToken create() {
        return service.createToken(42L, "10.0.0.1", "browser").await().indefinitely();
    }

    private UserToken lookup(String raw) {
        return service.lookupToken(raw).await().indefinitely();
    }

    private RotationResult rotate(UserToken token) {
        return service.tryRotateToken(token, "10.0.0.1", "browser").await().indefinitely();
    }

    @Nested
    @DisplayName("createToken")
    class CreateTokenTests {

        @Test
        @DisplayName("should store only the salted hash of the raw value")
        void shouldStoreHashOnly() {
            var token = create();

            assertNotNull(token.unhashedToken());
            assertEquals(32, token.unhashedToken().length());
            assertEquals(service.hashToken(token.unhashedToken()), token.authToken());
            assertEquals(token.authToken(), token.prevAuthToken());
            assertNotEquals(token.unhashedToken(), token.authToken());
            assertFalse(token.authTokenSeen());
            assertEquals(START, token.rotatedAt());
            assertEquals(42L, token.userId());
        }

        @Test
        @DisplayName("should issue different values for each session")
        void shouldIssueDistinctValues() {
            assertNotEquals(create().unhashedToken(), create().unhashedToken());
        }
    }

    @Nested
    @DisplayName("lookupToken")
    class LookupTokenTests {

        @Test
        @DisplayName("should mark the current value seen on first presentation")
        void shouldMarkSeen() {
            var created = create();

            var found = lookup(created.unhashedToken());

            assertTrue(found.authTokenSeen());
            assertEquals(START, found.seenAt());
            assertEquals(created.unhashedToken(), found.unhashedToken());
        }

        @Test
        @DisplayName("should fail for an unknown value")
        void shouldFailForUnknownValue() {
            assertThrows(UserTokenNotFoundException.class, () -> lookup("not-a-token"));
        }

        @Test
        @DisplayName("should fail once the session has been idle too long")
        void shouldFailWhenInactive() {
            var created = create();
            clock.advance(Duration.ofDays(7).plusSeconds(1));

            assertThrows(UserTokenNotFoundException.class, () -> lookup(created.unhashedToken()));
        }

        @Test
        @DisplayName("should fail once the session is older than the max lifetime")
        void shouldFailWhenTooOld() {
            config.withLoginMaxInactiveLifetime(Duration.ofDays(60));
            var created = create();
            clock.advance(Duration.ofDays(30).plusSeconds(1));

            assertThrows(UserTokenNotFoundException.class, () -> lookup(created.unhashedToken()));
        }

        @Test
        @DisplayName("should still resolve the previous value after a rotation")
        void shouldResolvePreviousValue() {
            var created = create();
            lookup(created.unhashedToken());
            clock.advance(Duration.ofMinutes(11));
            var rotated = rotate(lookup(created.unhashedToken()));
            assertTrue(rotated.rotated());

            var found = lookup(created.unhashedToken());

            assertEquals(rotated.token().id(), found.id());
            assertEquals(rotated.token().authToken(), found.authToken());
        }

        @Test
        @DisplayName("should mark the current value unseen when a client keeps presenting the previous one")
        void shouldMarkUnseenWhenPreviousValuePresented() {
            var created = create();
            lookup(created.unhashedToken());
            clock.advance(Duration.ofMinutes(11));
            var rotated = rotate(lookup(created.unhashedToken())).token();
            lookup(rotated.unhashedToken());
            clock.advance(Duration.ofMinutes(2));

            var found = lookup(created.unhashedToken());

            assertFalse(found.authTokenSeen());
            assertTrue(rotate(found).rotated());
        }
    }

    @Nested
    @DisplayName("tryRotateToken")
    class TryRotateTokenTests {

        @Test
        @DisplayName("should not rotate a seen token within the rotation interval")
        void shouldNotRotateFreshToken() {
            var token = lookup(create().unhashedToken());
            clock.advance(Duration.ofMinutes(9));

            var result = rotate(token);

            assertFalse(result.rotated());
            assertSame(token, result.token());
        }

        @Test
        @DisplayName("should rotate a seen token after the rotation interval")
        void shouldRotateSeenToken() {
            var token = lookup(create().unhashedToken());
            clock.advance(Duration.ofMinutes(11));

            var result = rotate(token);

            assertTrue(result.rotated());
            var rotated = result.token();
            assertNotEquals(token.authToken(), rotated.authToken());
            assertEquals(token.authToken(), rotated.prevAuthToken());
            assertEquals(service.hashToken(rotated.unhashedToken()), rotated.authToken());
            assertFalse(rotated.authTokenSeen());
            assertNull(rotated.seenAt());
            assertEquals(clock.instant(), rotated.rotatedAt());
        }

        @Test
        @DisplayName("should re-send an unseen token only after the grace period")
        void shouldRotateUnseenTokenAfterGrace() {
            var token = create();
            clock.advance(Duration.ofSeconds(30));
            assertFalse(rotate(token).rotated());

            clock.advance(Duration.ofSeconds(31));
            var result = rotate(token);

            assertTrue(result.rotated());
            assertEquals(token.prevAuthToken(), result.token().prevAuthToken());
        }

        @Test
        @DisplayName("should rotate only once when the same stale token is rotated twice")
        void shouldRotateOnce() {
            var token = lookup(create().unhashedToken());
            clock.advance(Duration.ofMinutes(11));

            var first = rotate(token);
            var second = rotate(token);

            assertTrue(first.rotated());
            assertFalse(second.rotated());
        }

        @Test
        @DisplayName("should rotate only once under concurrent requests")
        void shouldRotateOnceConcurrently() throws Exception {
            var token = lookup(create().unhashedToken());
            clock.advance(Duration.ofMinutes(11));

            var executor = Executors.newFixedThreadPool(8);
            try {
                var tasks = new ArrayList<Callable<RotationResult>>();
                for (var i = 0; i < 16; i++) {
                    tasks.add(() -> rotate(token));
                }
                var rotations = 0;
                for (Future<RotationResult> future : executor.invokeAll(tasks)) {
                    if (future.get().rotated()) {
                        rotations++;
                    }
                }
                assertEquals(1, rotations);
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("should return not rotated for a missing token")
        void shouldHandleNullToken() {
            var result = rotate(null);

            assertFalse(result.rotated());
            assertNull(result.token());
        }
    }

    @Nested
    @DisplayName("revokeToken")
    class RevokeTokenTests {

        @Test
        @DisplayName("should delete the session")
        void shouldDeleteSession() {
            var token = create();

            service.revokeToken(token).await().indefinitely();

            assertEquals(0, repository.size());
            assertThrows(UserTokenNotFoundException.class, () -> lookup(token.unhashedToken()));
        }

        @Test
        @DisplayName("should fail for a session that no longer exists")
        void shouldFailForMissingSession() {
            var token = create();
            service.revokeToken(token).await().indefinitely();

            assertThrows(
                    UserTokenNotFoundException.class,
                    () -> service.revokeToken(token).await().indefinitely());
        }
    }
}
