package warden.adapter.in.http;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.NewCookie;

import io.vertx.core.http.Cookie;
import io.vertx.core.http.CookieSameSite;

import warden.core.config.SessionConfig;

/**
 * Builds session cookies from the session configuration.
 *
 * <p>Every method returns empty when no session cookie name is configured.
 */
@ApplicationScoped
public class SessionCookieWriter {

    private final SessionConfig config;

    @Inject
    public SessionCookieWriter(SessionConfig config) {
        this.config = config;
    }

    public Optional<String> cookieName() {
        return config.cookie().name().filter(name -> !name.isBlank());
    }

    /**
     * Creates a session cookie carrying the raw token value.
     */
    public Optional<Cookie> sessionCookie(String value, Duration maxAge) {
        return cookieName().map(name -> baseCookie(name, value).setMaxAge(maxAge.toSeconds()));
    }

    /**
     * Creates a cookie that makes the browser drop the session cookie.
     */
    public Optional<Cookie> expiredSessionCookie() {
        return cookieName().map(name -> baseCookie(name, "").setMaxAge(0));
    }

    /**
     * Converts a Vert.x cookie for use in a JAX-RS response.
     */
    public NewCookie toJaxRs(Cookie cookie) {
        final var builder = new NewCookie.Builder(cookie.getName())
                .value(cookie.getValue())
                .path(cookie.getPath())
                .httpOnly(cookie.isHttpOnly())
                .secure(cookie.isSecure())
                .maxAge((int) Math.min(Integer.MAX_VALUE, cookie.getMaxAge()))
                .sameSite(toJaxRs(cookie.getSameSite()));
        if (cookie.getDomain() != null) {
            builder.domain(cookie.getDomain());
        }
        return builder.build();
    }

    private Cookie baseCookie(String name, String value) {
        final var cookie = Cookie.cookie(name, value)
                .setPath(config.cookie().path())
                .setSecure(config.cookie().secure())
                .setHttpOnly(config.cookie().httpOnly())
                .setSameSite(parseSameSite(config.cookie().sameSite()));
        config.cookie().domain().ifPresent(cookie::setDomain);
        return cookie;
    }

    private static CookieSameSite parseSameSite(String sameSite) {
        return switch (sameSite.toUpperCase(Locale.ROOT)) {
            case "STRICT" -> CookieSameSite.STRICT;
            case "NONE" -> CookieSameSite.NONE;
            default -> CookieSameSite.LAX;
        };
    }

    private static NewCookie.SameSite toJaxRs(CookieSameSite sameSite) {
        if (sameSite == null) {
            return null;
        }
        return switch (sameSite) {
            case STRICT -> NewCookie.SameSite.STRICT;
            case NONE -> NewCookie.SameSite.NONE;
            default -> NewCookie.SameSite.LAX;
        };
    }
}
