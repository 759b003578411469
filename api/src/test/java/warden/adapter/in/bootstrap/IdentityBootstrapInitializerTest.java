package warden.adapter.in.bootstrap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryIdentityStore;
import warden.core.config.BootstrapConfig;
import warden.core.model.auth.OrgRole;
import warden.core.model.exception.OrgNotFoundException;
import warden.mock.MutableClock;

@DisplayName("IdentityBootstrapInitializer")
class IdentityBootstrapInitializerTest {

    private InMemoryIdentityStore store;
    private BootstrapConfig config;

    @BeforeEach
    void setUp() {
        store = new InMemoryIdentityStore(new MutableClock(Instant.parse("2024-03-01T10:00:00Z")));
        config = mock(BootstrapConfig.class);
        when(config.enabled()).thenReturn(true);
        when(config.orgName()).thenReturn("Main Org.");
        when(config.adminUser()).thenReturn("admin");
        when(config.adminEmail()).thenReturn(Optional.empty());
        when(config.adminPassword()).thenReturn(Optional.of("admin-pass"));
    }

    @Test
    @DisplayName("should create the main org with an admin who can log in")
    void shouldCreateAdmin() {
        new IdentityBootstrapInitializer(store, config).bootstrap();

        var admin = store.login("admin", "admin-pass").await().indefinitely();
        var signedIn = store.getSignedInUser(admin.id(), 0L).await().indefinitely();
        assertEquals("Main Org.", signedIn.orgName());
        assertEquals(OrgRole.ADMIN, signedIn.orgRole());
    }

    @Test
    @DisplayName("should refuse to start without an admin password")
    void shouldRequirePassword() {
        when(config.adminPassword()).thenReturn(Optional.of(" "));

        assertThrows(IllegalStateException.class, () -> new IdentityBootstrapInitializer(store, config).bootstrap());
    }

    @Test
    @DisplayName("should do nothing when disabled")
    void shouldSkipWhenDisabled() {
        when(config.enabled()).thenReturn(false);

        new IdentityBootstrapInitializer(store, config).bootstrap();

        assertThrows(OrgNotFoundException.class, () -> store.getOrgByName("Main Org.").await().indefinitely());
    }
}
