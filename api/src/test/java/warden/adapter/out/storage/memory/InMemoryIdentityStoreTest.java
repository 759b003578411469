package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.auth.ExternalUserInfo;
import warden.core.model.auth.Org;
import warden.core.model.auth.OrgRole;
import warden.core.model.exception.ApiKeyNotFoundException;
import warden.core.model.exception.InvalidCredentialsException;
import warden.core.model.exception.OrgNotFoundException;
import warden.core.model.exception.UserNotFoundException;
import warden.core.util.ApiKeyCodec;
import warden.mock.MutableClock;

@DisplayName("InMemoryIdentityStore")
class InMemoryIdentityStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private InMemoryIdentityStore store;
    private Org mainOrg;

    @BeforeEach
    void setUp() {
        store = new InMemoryIdentityStore(new MutableClock(NOW));
        mainOrg = store.createOrg("Main Org.");
    }

    @Nested
    @DisplayName("login")
    class LoginTests {

        @Test
        @DisplayName("should accept the right password by login or email")
        void shouldAcceptPassword() {
            var created = store.createUser("jane", "jane@example.com", "Jane", "s3cret");

            assertEquals(created, store.login("jane", "s3cret").await().indefinitely());
            assertEquals(created, store.login("JANE@example.com", "s3cret").await().indefinitely());
        }

        @Test
        @DisplayName("should check the password off the calling thread")
        void shouldHashOnWorkerThread() {
            store.createUser("jane", null, null, "s3cret");
            var hashingThread = new AtomicReference<Thread>();

            store.login("jane", "s3cret")
                    .invoke(user -> hashingThread.set(Thread.currentThread()))
                    .await()
                    .indefinitely();

            assertNotSame(Thread.currentThread(), hashingThread.get());
        }

        @Test
        @DisplayName("should distinguish unknown users from wrong passwords")
        void shouldDistinguishFailures() {
            store.createUser("jane", null, null, "s3cret");

            assertThrows(UserNotFoundException.class, () -> store.login("ghost", "x").await().indefinitely());
            assertThrows(
                    InvalidCredentialsException.class, () -> store.login("jane", "wrong").await().indefinitely());
        }

        @Test
        @DisplayName("should reject password login for users without a password")
        void shouldRejectPasswordlessUser() {
            store.createUser("proxy-user", null, null, null);

            assertThrows(
                    InvalidCredentialsException.class,
                    () -> store.login("proxy-user", "").await().indefinitely());
        }

        @Test
        @DisplayName("should refuse duplicate logins")
        void shouldRefuseDuplicates() {
            store.createUser("jane", null, null, "a");

            assertThrows(IllegalArgumentException.class, () -> store.createUser("jane", null, null, "b"));
        }
    }

    @Nested
    @DisplayName("getSignedInUser")
    class SignedInUserTests {

        @Test
        @DisplayName("should use the current org when none is requested")
        void shouldUseCurrentOrg() {
            var user = store.createUser("jane", null, null, "x");

            var signedIn = store.getSignedInUser(user.id(), 0L).await().indefinitely();

            assertEquals(mainOrg.id(), signedIn.orgId());
            assertEquals("Main Org.", signedIn.orgName());
            assertEquals(OrgRole.VIEWER, signedIn.orgRole());
        }

        @Test
        @DisplayName("should use the role held in the requested org")
        void shouldUseRequestedOrg() {
            var ops = store.createOrg("Ops");
            var user = store.createUser("jane", null, null, "x");
            store.addOrgMember(user.id(), ops.id(), OrgRole.ADMIN);

            var signedIn = store.getSignedInUser(user.id(), ops.id()).await().indefinitely();

            assertEquals(ops.id(), signedIn.orgId());
            assertEquals(OrgRole.ADMIN, signedIn.orgRole());
        }

        @Test
        @DisplayName("should fail for an org the user is not a member of")
        void shouldFailWithoutMembership() {
            var ops = store.createOrg("Ops");
            var user = store.createUser("jane", null, null, "x");

            assertThrows(
                    UserNotFoundException.class,
                    () -> store.getSignedInUser(user.id(), ops.id()).await().indefinitely());
        }
    }

    @Test
    @DisplayName("should find orgs by name")
    void shouldFindOrgByName() {
        assertEquals(mainOrg, store.getOrgByName("Main Org.").await().indefinitely());
        assertThrows(OrgNotFoundException.class, () -> store.getOrgByName("Nope").await().indefinitely());
    }

    @Test
    @DisplayName("should store API keys by name and org")
    void shouldStoreApiKeys() {
        var clientKey = store.createApiKey("ci", mainOrg.id(), OrgRole.EDITOR, null);
        var decoded = ApiKeyCodec.decode(clientKey);

        var apiKey = store.lookupApiKey("ci", mainOrg.id()).await().indefinitely();

        assertTrue(ApiKeyCodec.isValid(decoded, apiKey.hashedKey()));
        assertThrows(ApiKeyNotFoundException.class, () -> store.lookupApiKey("ci", 99L).await().indefinitely());
    }

    @Test
    @DisplayName("should record last seen")
    void shouldRecordLastSeen() {
        var user = store.createUser("jane", null, null, "x");

        store.updateLastSeenAt(user.id()).await().indefinitely();

        assertEquals(NOW, store.lastSeenAt(user.id()).orElseThrow());
    }

    @Nested
    @DisplayName("upsertExternalUser")
    class UpsertTests {

        private ExternalUserInfo info(String login, String email, Map<Long, OrgRole> roles) {
            return new ExternalUserInfo("authproxy", login, login, email, "Jane", roles);
        }

        @Test
        @DisplayName("should create the user when sign-up is allowed")
        void shouldCreateUser() {
            var user = store.upsertExternalUser(info("jane", "jane@example.com", Map.of()), true)
                    .await()
                    .indefinitely();

            assertEquals("jane", user.login());
            assertEquals(
                    user, store.findUserByLoginOrEmail("jane@example.com").await().indefinitely().orElseThrow());
        }

        @Test
        @DisplayName("should refuse to create the user when sign-up is disabled")
        void shouldRefuseSignUp() {
            assertThrows(
                    UserNotFoundException.class,
                    () -> store.upsertExternalUser(info("jane", null, Map.of()), false).await().indefinitely());
        }

        @Test
        @DisplayName("should match existing users and sync their profile")
        void shouldSyncExistingUser() {
            var existing = store.createUser("jane", null, null, "x");

            var user = store.upsertExternalUser(info("jane", "new@example.com", Map.of()), false)
                    .await()
                    .indefinitely();

            assertEquals(existing.id(), user.id());
            assertEquals("new@example.com", user.email());
            assertEquals("Jane", user.name());
        }

        @Test
        @DisplayName("should apply roles for known orgs")
        void shouldApplyRoles() {
            var roles = Map.of(mainOrg.id(), OrgRole.EDITOR, 99L, OrgRole.ADMIN);

            var user = store.upsertExternalUser(info("jane", null, roles), true).await().indefinitely();

            var signedIn = store.getSignedInUser(user.id(), mainOrg.id()).await().indefinitely();

            assertEquals(OrgRole.EDITOR, signedIn.orgRole());
        }
    }
}
