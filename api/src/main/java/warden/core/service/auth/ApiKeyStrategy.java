package warden.core.service.auth;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import warden.core.model.auth.ApiKey;
import warden.core.model.auth.AuthExchange;
import warden.core.model.auth.AuthRejection;
import warden.core.model.auth.DecodedApiKey;
import warden.core.model.auth.StrategyResult;
import warden.core.model.exception.IdentityNotFoundException;
import warden.core.port.out.IdentityStore;
import warden.core.util.ApiKeyCodec;
import warden.core.util.ApiKeyCodec.InvalidApiKeyException;
import warden.core.util.BasicAuthHeader;

/**
 * Authenticates organization API keys.
 *
 * <p>Accepts the key either as a bearer token or as the password of a basic auth
 * header whose username is {@code api_key}:
 *
 * <pre>
 * Authorization: Bearer eyJrIjoi...
 * Authorization: Basic base64(api_key:eyJrIjoi...)
 * </pre>
 */
@ApplicationScoped
public class ApiKeyStrategy implements AuthStrategy {

    private static final Logger LOG = Logger.getLogger(ApiKeyStrategy.class);

    static final String AUTHORIZATION_HEADER = "Authorization";
    static final String API_KEY_USERNAME = "api_key";
    static final String INVALID_API_KEY = "Invalid API key";
    static final String EXPIRED_API_KEY = "Expired API key";

    private final IdentityStore identityStore;
    private final Clock clock;

    @Inject
    public ApiKeyStrategy(IdentityStore identityStore, Clock clock) {
        this.identityStore = identityStore;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "api_key";
    }

    @Override
    public Uni<StrategyResult> tryHandle(AuthExchange exchange, long requestedOrgId) {
        final var keyString = extractKey(exchange.header(AUTHORIZATION_HEADER).orElse(null));
        if (keyString.isEmpty()) {
            return Uni.createFrom().item(StrategyResult.notHandled());
        }

        final DecodedApiKey decoded;
        try {
            decoded = ApiKeyCodec.decode(keyString.get());
        } catch (InvalidApiKeyException e) {
            LOG.debugf("Rejecting undecodable API key: %s", e.getMessage());
            return reject(AuthRejection.unauthorized(INVALID_API_KEY, e));
        }

        return identityStore
                .lookupApiKey(decoded.name(), decoded.orgId())
                .flatMap(apiKey -> Uni.createFrom()
                        .item(() -> validate(exchange, decoded, apiKey))
                        // PBKDF2 verification is slow, keep it off the event loop
                        .runSubscriptionOn(Infrastructure.getDefaultWorkerPool()))
                .onFailure()
                .recoverWithItem(error -> {
                    if (error instanceof IdentityNotFoundException) {
                        LOG.debugf("API key %s not found in org %d", decoded.name(), decoded.orgId());
                        return StrategyResult.rejected(AuthRejection.unauthorized(INVALID_API_KEY, error));
                    }
                    LOG.errorf(error, "Failed to look up API key %s in org %d", decoded.name(), decoded.orgId());
                    return StrategyResult.rejected(AuthRejection.internal("Failed to look up API key", error));
                });
    }

    private StrategyResult validate(AuthExchange exchange, DecodedApiKey decoded, ApiKey apiKey) {
        final boolean valid;
        try {
            valid = ApiKeyCodec.isValid(decoded, apiKey.hashedKey());
        } catch (IllegalStateException e) {
            LOG.errorf(e, "Validating API key %s failed", apiKey.name());
            return StrategyResult.rejected(AuthRejection.internal("Validating API key failed", e));
        }
        if (!valid) {
            LOG.debugf("API key %s secret mismatch", apiKey.name());
            return StrategyResult.rejected(AuthRejection.unauthorized(INVALID_API_KEY));
        }

        if (apiKey.isExpired(clock.instant())) {
            LOG.debugf("API key %s expired at %s", apiKey.name(), apiKey.expiresAt());
            return StrategyResult.rejected(AuthRejection.unauthorized(EXPIRED_API_KEY));
        }

        exchange.context().signInWithApiKey(apiKey);
        return StrategyResult.authenticated();
    }

    /**
     * Extract the API key from an Authorization header value.
     *
     * @param header the header value (may be null)
     * @return the key, or empty if the header carries no API key
     */
    static Optional<String> extractKey(String header) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        final var parts = header.split(" ", 2);
        if (parts.length == 2 && "Bearer".equals(parts[0])) {
            final var key = parts[1].trim();
            return key.isEmpty() ? Optional.empty() : Optional.of(key);
        }
        return BasicAuthHeader.decode(header)
                .filter(credentials -> API_KEY_USERNAME.equals(credentials.username()))
                .map(BasicAuthHeader.Credentials::password)
                .filter(password -> !password.isEmpty());
    }

    private static Uni<StrategyResult> reject(AuthRejection rejection) {
        return Uni.createFrom().item(StrategyResult.rejected(rejection));
    }
}
