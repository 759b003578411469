package warden.core.model.proxy;

import java.util.Map;

/**
 * What an authenticating reverse proxy asserted about the caller.
 *
 * @param headerValue   value of the main proxy header (login or email)
 * @param attributes    extra attributes read from the configured headers, keyed by
 *                      attribute name ({@code Name}, {@code Email}, {@code Login},
 *                      {@code Groups}, {@code Role}); only attributes present on the request
 * @param orgId         organization requested by the caller, 0 if none
 * @param remoteAddress socket address of the proxy
 * @param cacheKey      key under which the resolved user id is cached
 */
public record AuthProxyRequest(
        String headerValue, Map<String, String> attributes, long orgId, String remoteAddress, String cacheKey) {

    public AuthProxyRequest {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public String attribute(String name) {
        return attributes.get(name);
    }
}
