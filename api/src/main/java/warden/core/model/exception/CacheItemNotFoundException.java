package warden.core.model.exception;

/**
 * Thrown by remote cache deletes when the key is absent.
 */
public class CacheItemNotFoundException extends RuntimeException {

    public CacheItemNotFoundException(String key) {
        super("Cache item not found: " + key);
    }
}
