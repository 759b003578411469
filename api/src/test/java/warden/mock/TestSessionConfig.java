package warden.mock;

import java.time.Duration;
import java.util.Optional;

import warden.core.config.SessionConfig;

public class TestSessionConfig implements SessionConfig {

    private String cookieName = "grafana_session";
    private Duration loginMaxLifetime = Duration.ofDays(30);
    private Duration loginMaxInactiveLifetime = Duration.ofDays(7);
    private Duration rotationInterval = Duration.ofMinutes(10);

    public TestSessionConfig withCookieName(String cookieName) {
        this.cookieName = cookieName;
        return this;
    }

    public TestSessionConfig withLoginMaxInactiveLifetime(Duration value) {
        this.loginMaxInactiveLifetime = value;
        return this;
    }

    @Override
    public CookieConfig cookie() {
        return new CookieConfig() {
            @Override
            public Optional<String> name() {
                return Optional.ofNullable(cookieName);
            }

            @Override
            public String path() {
                return "/";
            }

            @Override
            public Optional<String> domain() {
                return Optional.empty();
            }

            @Override
            public boolean secure() {
                return false;
            }

            @Override
            public boolean httpOnly() {
                return true;
            }

            @Override
            public String sameSite() {
                return "Lax";
            }
        };
    }

    @Override
    public Duration loginMaxLifetime() {
        return loginMaxLifetime;
    }

    @Override
    public Duration loginMaxInactiveLifetime() {
        return loginMaxInactiveLifetime;
    }

    @Override
    public Duration rotationInterval() {
        return rotationInterval;
    }

    @Override
    public String secretKey() {
        return "test-secret";
    }
}
