package warden.core.port.out;

import java.time.Duration;
import java.util.Optional;

import warden.core.model.auth.RenderUser;

/**
 * Short-lived keys handed to the image renderer so it can call back as a user.
 */
public interface RenderKeyStore {

    /**
     * Issue a render key.
     *
     * @param user the user the render runs as
     * @param ttl  how long the key stays valid
     * @return the key
     */
    String issue(RenderUser user, Duration ttl);

    /**
     * Resolve a render key.
     *
     * @param key the key presented by the renderer
     * @return the render user, or empty if the key is unknown or expired
     */
    Optional<RenderUser> getRenderUser(String key);

    /**
     * Revoke a render key once the render is finished.
     *
     * @param key the key
     */
    void revoke(String key);
}
