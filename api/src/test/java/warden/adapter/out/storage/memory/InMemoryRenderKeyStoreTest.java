package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.auth.OrgRole;
import warden.core.model.auth.RenderUser;

@DisplayName("InMemoryRenderKeyStore")
class InMemoryRenderKeyStoreTest {

    private final InMemoryRenderKeyStore store = new InMemoryRenderKeyStore();
    private final RenderUser renderUser = new RenderUser(1L, 2L, OrgRole.VIEWER);

    @Test
    @DisplayName("should resolve issued keys")
    void shouldResolveIssuedKey() {
        var key = store.issue(renderUser, Duration.ofMinutes(5));

        assertEquals(renderUser, store.getRenderUser(key).orElseThrow());
        assertNotEquals(key, store.issue(renderUser, Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("should forget revoked keys")
    void shouldForgetRevokedKey() {
        var key = store.issue(renderUser, Duration.ofMinutes(5));

        store.revoke(key);

        assertTrue(store.getRenderUser(key).isEmpty());
    }

    @Test
    @DisplayName("should not resolve unknown keys")
    void shouldNotResolveUnknownKey() {
        assertTrue(store.getRenderUser("unknown").isEmpty());
    }
}
