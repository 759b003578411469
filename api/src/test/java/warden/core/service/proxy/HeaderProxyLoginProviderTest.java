package warden.core.service.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import warden.core.config.AuthProxyConfig;
import warden.core.model.auth.ExternalUserInfo;
import warden.core.model.auth.OrgRole;
import warden.core.model.auth.User;
import warden.core.model.proxy.AuthProxyRequest;
import warden.core.port.out.IdentityStore;

@DisplayName("HeaderProxyLoginProvider")
class HeaderProxyLoginProviderTest {

    private AuthProxyConfig config;
    private IdentityStore identityStore;
    private HeaderProxyLoginProvider provider;

    @BeforeEach
    void setUp() {
        config = mock(AuthProxyConfig.class);
        when(config.headerProperty()).thenReturn("username");
        when(config.autoSignUp()).thenReturn(true);
        identityStore = mock(IdentityStore.class);
        when(identityStore.upsertExternalUser(any(), anyBoolean()))
                .thenReturn(Uni.createFrom().item(new User(8L, "jane", null, null)));
        provider = new HeaderProxyLoginProvider(config, identityStore);
    }

    private ExternalUserInfo login(String header, Map<String, String> attributes, long orgId) {
        var userId = provider.login(new AuthProxyRequest(header, attributes, orgId, "127.0.0.1", "key"))
                .await()
                .indefinitely();
        assertEquals(8L, userId);
        var captor = ArgumentCaptor.forClass(ExternalUserInfo.class);
        verify(identityStore).upsertExternalUser(captor.capture(), eq(true));
        return captor.getValue();
    }

    @Test
    @DisplayName("should use the header as login in username mode")
    void shouldUseHeaderAsLogin() {
        var info = login("jane", Map.of(), 0L);

        assertEquals("authproxy", info.authModule());
        assertEquals("jane", info.authId());
        assertEquals("jane", info.login());
        assertNull(info.email());
        assertTrue(info.orgRoles().isEmpty());
    }

    @Test
    @DisplayName("should also use an email-shaped username as email")
    void shouldDetectEmailInUsernameMode() {
        var info = login("jane@example.com", Map.of(), 0L);

        assertEquals("jane@example.com", info.login());
        assertEquals("jane@example.com", info.email());
    }

    @Test
    @DisplayName("should use the header as login and email in email mode")
    void shouldUseHeaderAsEmail() {
        when(config.headerProperty()).thenReturn("email");

        var info = login("jane@example.com", Map.of(), 0L);

        assertEquals("jane@example.com", info.login());
        assertEquals("jane@example.com", info.email());
    }

    @Test
    @DisplayName("should let attributes override the header")
    void shouldApplyAttributes() {
        var info = login(
                "jane",
                Map.of("Name", "Jane Doe", "Email", "jd@example.com", "Login", "jdoe", "Role", "Editor"),
                3L);

        assertEquals("Jane Doe", info.name());
        assertEquals("jd@example.com", info.email());
        assertEquals("jdoe", info.login());
        assertEquals(Map.of(3L, OrgRole.EDITOR), info.orgRoles());
    }

    @Test
    @DisplayName("should assign the role to the default org when none was requested")
    void shouldUseDefaultOrgForRole() {
        var info = login("jane", Map.of("Role", "Admin"), 0L);

        assertEquals(Map.of(1L, OrgRole.ADMIN), info.orgRoles());
    }

    @Test
    @DisplayName("should ignore an unknown role")
    void shouldIgnoreUnknownRole() {
        var info = login("jane", Map.of("Role", "Superuser"), 0L);

        assertTrue(info.orgRoles().isEmpty());
    }

    @Test
    @DisplayName("should fail for an unknown header property")
    void shouldFailForUnknownProperty() {
        when(config.headerProperty()).thenReturn("phone");

        assertThrows(
                IllegalStateException.class,
                () -> provider.login(new AuthProxyRequest("jane", Map.of(), 0L, "127.0.0.1", "key"))
                        .await()
                        .indefinitely());
    }
}
