package warden.adapter.out.cache;

/**
 * The configured remote cache provider is unknown or cannot be created.
 */
public class CacheProviderException extends RuntimeException {

    public CacheProviderException(String message) {
        super(message);
    }
}
