package warden.core.service.proxy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import warden.core.util.SecureHash;

/**
 * Builds the cache key that maps an auth proxy claim to a user id.
 *
 * <p>The key covers the main header value and every extra attribute the proxy sent,
 * so a change in any synced attribute (email, role) forces a fresh login.
 */
public final class AuthProxyCacheKey {

    public static final String PREFIX = "auth-proxy-sync-ttl:";

    /**
     * Attribute names that can be mapped from proxy headers, in key order.
     * {@code Groups} is read for the key only and never synced to the user.
     */
    public static final List<String> SUPPORTED_ATTRIBUTES = List.of("Name", "Email", "Login", "Groups", "Role");

    private static final int HASH_HEX_CHARS = 32;

    private AuthProxyCacheKey() {}

    /**
     * Compute the cache key.
     *
     * @param headerValue value of the main proxy header
     * @param attributes  extra attributes present on the request, keyed by attribute name
     * @return the cache key
     */
    public static String of(String headerValue, Map<String, String> attributes) {
        final var parts = new ArrayList<String>();
        parts.add(headerValue);
        for (final var attribute : SUPPORTED_ATTRIBUTES) {
            final var value = attributes.get(attribute);
            if (value != null && !value.isEmpty()) {
                parts.add(value);
            }
        }
        return PREFIX + SecureHash.truncatedSha256(String.join("-", parts), HASH_HEX_CHARS);
    }
}
